package org.waypoint.rest.middleware;

import io.undertow.server.HandlerWrapper;
import org.waypoint.config.XmlConfiguration;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the {@code <middleware>} configuration section into wrappers ready for
 * {@code Router.addMiddleware}, access log first so that recovered requests are logged too.
 */
public class StandardMiddleware {

    private StandardMiddleware() {
    }

    public static List<HandlerWrapper> fromConfig(XmlConfiguration.Middleware cfg) {
        XmlConfiguration.Middleware section = cfg != null ? cfg : new XmlConfiguration.Middleware();

        List<HandlerWrapper> wrappers = new ArrayList<>(2);
        if (section.accessLog) {
            String loggerName = section.accessLogger == null || section.accessLogger.isBlank()
                    ? AccessLogMiddleware.DEFAULT_LOGGER
                    : section.accessLogger.trim();
            wrappers.add(new AccessLogMiddleware(AccessLogMiddleware.toLogger(loggerName)));
        }
        if (section.recovery) {
            wrappers.add(new RecoveryMiddleware());
        }
        return wrappers;
    }
}
