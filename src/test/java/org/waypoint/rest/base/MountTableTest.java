package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;
import org.junit.jupiter.api.Test;
import org.waypoint.rest.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.waypoint.rest.TestExchanges.exchange;

class MountTableTest {

    private final List<String> relativePaths = new ArrayList<>();
    private final HttpHandler recording = exchange -> relativePaths.add(exchange.getRelativePath());

    private void dispatch(MountTable table, String path) throws Exception {
        HttpServerExchange exchange = exchange(Methods.GET, path);
        table.lookup(path).handleRequest(exchange);
    }

    @Test
    void strips_trailing_separator() {
        assertThat(MountTable.stripPrefix("/api/")).isEqualTo("/api");
        assertThat(MountTable.stripPrefix("/api")).isEqualTo("/api");
        assertThat(MountTable.stripPrefix("/")).isEmpty();
    }

    @Test
    void delegates_with_prefix_removed() throws Exception {
        MountTable table = new MountTable(Set.of()).register("/api/", recording);

        dispatch(table, "/api/ping");
        dispatch(table, "/api/a/b");
        dispatch(table, "/api");

        assertThat(relativePaths).containsExactly("/ping", "/a/b", "/");
    }

    @Test
    void longest_prefix_wins() throws Exception {
        List<String> hits = new ArrayList<>();
        MountTable table = new MountTable(Set.of())
                .register("/api", exchange -> hits.add("api " + exchange.getRelativePath()))
                .register("/api/admin/", exchange -> hits.add("admin " + exchange.getRelativePath()));

        dispatch(table, "/api/admin/users");
        dispatch(table, "/api/users");

        assertThat(hits).containsExactly("admin /users", "api /users");
    }

    @Test
    void root_mount_catches_everything_else_unchanged() throws Exception {
        MountTable table = new MountTable(Set.of())
                .register("/", recording);

        dispatch(table, "/anything/here");

        assertThat(relativePaths).containsExactly("/anything/here");
    }

    @Test
    void unmatched_path_has_no_handler() {
        MountTable table = new MountTable(Set.of()).register("/api", recording);

        assertThat(table.lookup("/other")).isNull();
        assertThat(table.lookup("/apis")).isNull();
    }

    @Test
    void malformed_prefixes() {
        MountTable table = new MountTable(Set.of());

        assertThatThrownBy(() -> table.register("", recording))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessage("Malformed mount prefix \"\": prefix is blank");
        assertThatThrownBy(() -> table.register("api/", recording))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("prefix must start with '/'");
        assertThatThrownBy(() -> table.register("/api//", recording))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("empty path segment");
        assertThatThrownBy(() -> table.register("/users/{id}/", recording))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("prefixes are literal and can not declare parameters");
    }

    @Test
    void prefix_reserved_by_a_pattern() {
        MountTable table = new MountTable(Set.of("/api/"));

        assertThatThrownBy(() -> table.register("/api/", recording))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessage("Mount prefix \"/api/\" collides with a pattern registered for the same path");
    }

    @Test
    void prefix_spelled_differently_from_a_pattern_is_fine() {
        MountTable table = new MountTable(Set.of("/api"));

        table.register("/api/", recording);

        assertThat(table.size()).isEqualTo(1);
    }
}
