package org.waypoint.rest.middleware;

import io.undertow.server.HandlerWrapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Emits one record per request: status code, method, request path and elapsed time, in that
 * order, with {@link #FORMAT}.
 * <p>
 * The status is read from the exchange, so a handler that never sets one is logged as 200.
 * When the inner handler dispatches the exchange to another thread the record is written on
 * exchange completion instead, once the final status is known.
 * <p>
 * Failed requests are only logged when this middleware sits outside a {@link RecoveryMiddleware}.
 */
public class AccessLogMiddleware implements HandlerWrapper {

    public static final String DEFAULT_LOGGER = "org.waypoint.access";
    public static final String FORMAT = "{} {} {} {}";

    private final LogEmitter emitter;

    public AccessLogMiddleware() {
        this(null);
    }

    /**
     * @param emitter record sink, {@code null} for INFO records on {@value #DEFAULT_LOGGER}
     */
    public AccessLogMiddleware(LogEmitter emitter) {
        this.emitter = emitter != null ? emitter : toLogger(DEFAULT_LOGGER);
    }

    /** An emitter writing INFO records to the named SLF4J logger. */
    public static LogEmitter toLogger(String loggerName) {
        Logger logger = LoggerFactory.getLogger(loggerName);
        return (format, values) -> logger.info(format, values);
    }

    @Override
    public HttpHandler wrap(HttpHandler handler) {
        return new AccessLogHandler(handler);
    }

    private void emit(HttpServerExchange exchange, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        emitter.emit(FORMAT, exchange.getStatusCode(), exchange.getRequestMethod().toString(),
                exchange.getRequestPath(), elapsed);
    }

    private final class AccessLogHandler implements HttpHandler {

        private final HttpHandler next;

        private AccessLogHandler(HttpHandler next) {
            this.next = next;
        }

        @Override
        public void handleRequest(HttpServerExchange exchange) throws Exception {
            long start = System.nanoTime();
            next.handleRequest(exchange);

            if (exchange.isDispatched()) {
                exchange.addExchangeCompleteListener((completed, nextListener) -> {
                    try {
                        emit(completed, start);
                    } finally {
                        nextListener.proceed();
                    }
                });
                return;
            }
            emit(exchange, start);
        }
    }
}
