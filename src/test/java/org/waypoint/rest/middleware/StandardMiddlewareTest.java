package org.waypoint.rest.middleware;

import io.undertow.server.HandlerWrapper;
import org.junit.jupiter.api.Test;
import org.waypoint.config.XmlConfiguration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StandardMiddlewareTest {

    @Test
    void access_log_is_outside_recovery() {
        List<HandlerWrapper> wrappers = StandardMiddleware.fromConfig(new XmlConfiguration.Middleware());

        assertThat(wrappers).hasSize(2);
        assertThat(wrappers.get(0)).isInstanceOf(AccessLogMiddleware.class);
        assertThat(wrappers.get(1)).isInstanceOf(RecoveryMiddleware.class);
    }

    @Test
    void missing_section_means_defaults() {
        assertThat(StandardMiddleware.fromConfig(null)).hasSize(2);
    }

    @Test
    void disabled_entries_are_left_out() {
        XmlConfiguration.Middleware cfg = new XmlConfiguration.Middleware();
        cfg.accessLog = false;

        assertThat(StandardMiddleware.fromConfig(cfg))
                .singleElement()
                .isInstanceOf(RecoveryMiddleware.class);

        cfg.recovery = false;
        assertThat(StandardMiddleware.fromConfig(cfg)).isEmpty();
    }
}
