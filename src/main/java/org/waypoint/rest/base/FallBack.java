package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.waypoint.utils.ResponseUtil;

/**
 * JSON 404 for requests no pattern or mount claims.
 * Install with {@code Router.setFallbackHandler(new FallBack())}.
 */
public class FallBack implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String message = "URI " + exchange.getRequestURI() + " not found on server";

        ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, message);
    }
}
