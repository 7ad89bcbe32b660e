package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.waypoint.utils.ResponseUtil;

/**
 * JSON 405 for a path that is routed under other methods only.
 * Keeps the {@code Allow} header the router has already set.
 */
public class InvalidMethod implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String allow = exchange.getResponseHeaders().getFirst(Headers.ALLOW);
        String message = "Method " + exchange.getRequestMethod() + " not allowed"
                + (allow != null ? "; allowed: " + allow : "");

        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED, message);
    }
}
