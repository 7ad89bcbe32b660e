package org.waypoint.rest.middleware;

import io.undertow.server.HandlerWrapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waypoint.utils.ResponseUtil;

/**
 * Contains failures of the wrapped handler to the request that raised them.
 * <p>
 * Anything thrown while the inner handler runs is handed to the {@link RecoveryAction}.
 * The default action logs the failure with its stack trace and answers 500 with a JSON error
 * body, unless the response has already started, in which case only the log entry is written.
 * {@link VirtualMachineError}s are rethrown once the action has run.
 * <p>
 * Only the synchronous extent of the inner handler is covered. Work a handler hands to another
 * thread with {@code exchange.dispatch(..)} fails outside of it; install this middleware behind
 * a blocking route to cover such handlers.
 */
public class RecoveryMiddleware implements HandlerWrapper {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryMiddleware.class);

    private final RecoveryAction recoveryAction;

    public RecoveryMiddleware() {
        this(null);
    }

    /**
     * @param recoveryAction action to run on failure, {@code null} for the default
     */
    public RecoveryMiddleware(RecoveryAction recoveryAction) {
        this.recoveryAction = recoveryAction != null ? recoveryAction : RecoveryMiddleware::sendInternalServerError;
    }

    @Override
    public HttpHandler wrap(HttpHandler handler) {
        return new RecoveringHandler(handler, recoveryAction);
    }

    static void sendInternalServerError(HttpServerExchange exchange, Throwable failure) {
        logger.error("Caught failure while handling {} {}: {}",
                exchange.getRequestMethod(), exchange.getRequestPath(), failure.toString(), failure);

        if (exchange.isResponseStarted()) {
            logger.warn("Response to {} {} already started with status {}; it can not be replaced",
                    exchange.getRequestMethod(), exchange.getRequestPath(), exchange.getStatusCode());
            return;
        }

        exchange.getResponseHeaders().clear();
        ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static final class RecoveringHandler implements HttpHandler {

        private final HttpHandler next;
        private final RecoveryAction recoveryAction;

        private RecoveringHandler(HttpHandler next, RecoveryAction recoveryAction) {
            this.next = next;
            this.recoveryAction = recoveryAction;
        }

        @Override
        public void handleRequest(HttpServerExchange exchange) throws Exception {
            try {
                next.handleRequest(exchange);
            } catch (Throwable failure) {
                if (failure instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                recoveryAction.recover(exchange, failure);
                if (failure instanceof VirtualMachineError) {
                    throw (VirtualMachineError) failure;
                }
            }
        }
    }
}
