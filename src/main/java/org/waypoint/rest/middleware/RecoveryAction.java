package org.waypoint.rest.middleware;

import io.undertow.server.HttpServerExchange;

/**
 * Invoked by {@link RecoveryMiddleware} when the wrapped handler fails.
 * Exceptions thrown from here are not caught again.
 */
@FunctionalInterface
public interface RecoveryAction {

    void recover(HttpServerExchange exchange, Throwable failure) throws Exception;
}
