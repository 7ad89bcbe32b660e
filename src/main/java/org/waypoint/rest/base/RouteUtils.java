package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.PathTemplateMatch;

import java.util.Map;

public class RouteUtils {

    private RouteUtils() {
    }

    /**
     * Runs {@code handler} on a worker thread in blocking mode.
     * Middleware inside it observes the whole request synchronously, which is what
     * recovery and access logging rely on.
     */
    public static HttpHandler blockingRoute(HttpHandler handler) {
        return new BlockingHandler(handler);
    }

    /**
     * Parameters bound by the pattern that matched this exchange, e.g. {@code name -> "waypoint"}
     * for {@code /hello/{name}} and {@code /hello/waypoint}. Empty when no pattern matched.
     */
    public static Map<String, String> pathParameters(HttpServerExchange exchange) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match != null ? match.getParameters() : Map.of();
    }

    /** @return the bound value, or {@code null} if the matched pattern has no such parameter */
    public static String pathParameter(HttpServerExchange exchange, String name) {
        return pathParameters(exchange).get(name);
    }
}
