package org.waypoint.rest.base;

import io.undertow.server.HandlerWrapper;
import io.undertow.server.HttpHandler;

import java.util.List;
import java.util.Objects;

/**
 * An ordered list of middleware, first entry outermost.
 * For {@code [m1, m2]} a request sees m1 before, m2 before, the handler, m2 after, m1 after.
 */
public class MiddlewareStack {

    private final List<HandlerWrapper> wrappers;

    public MiddlewareStack(List<HandlerWrapper> wrappers) {
        this.wrappers = List.copyOf(wrappers);
    }

    /** Wraps {@code inner} starting from the last-added middleware. */
    public HttpHandler fold(HttpHandler inner) {
        HttpHandler next = inner;
        for (int i = wrappers.size() - 1; i >= 0; i--) {
            HandlerWrapper wrapper = wrappers.get(i);
            next = Objects.requireNonNull(wrapper.wrap(next),
                    () -> "Middleware " + wrapper + " returned no handler");
        }
        return next;
    }

    public int size() {
        return wrappers.size();
    }
}
