package org.waypoint.rest;

import io.undertow.server.HandlerWrapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.ResponseCodeHandler;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waypoint.rest.base.MiddlewareStack;
import org.waypoint.rest.base.MountTable;
import org.waypoint.rest.base.PatternTable;
import org.waypoint.rest.base.RouteDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects handlers, mounts and middleware, then combines them into a single
 * {@link HttpHandler}.
 *
 * <pre>{@code
 * HttpHandler api = new Router()
 *         .get("/ping", exchange -> exchange.getResponseSender().send("pong"))
 *         .build();
 *
 * HttpHandler root = new Router()
 *         .addMiddleware(new AccessLogMiddleware())
 *         .addMiddleware(new RecoveryMiddleware())
 *         .addHandler("GET /hello/{name}", new HelloHandler())
 *         .addMount("/api/", api)
 *         .build();
 * }</pre>
 *
 * Add operations only record their arguments; patterns and prefixes are validated by
 * {@link #build()}. A router is single use: after {@code build()} it rejects every further call.
 * Not thread-safe.
 */
public class Router {

    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private final List<Route> routes = new ArrayList<>();
    private final List<Mount> mounts = new ArrayList<>();
    private final List<HandlerWrapper> middlewares = new ArrayList<>();

    private HttpHandler fallbackHandler = ResponseCodeHandler.HANDLE_404;
    private HttpHandler invalidMethodHandler = ResponseCodeHandler.HANDLE_405;

    private boolean built;

    /**
     * Registers a handler for a pattern such as {@code "GET /users/{id}"} or {@code "/health"}.
     * A pattern without a method matches every method.
     */
    public Router addHandler(String pattern, HttpHandler handler) {
        ensureOpen();
        routes.add(new Route(Objects.requireNonNull(pattern, "pattern"), Objects.requireNonNull(handler, "handler")));
        return this;
    }

    public Router get(String template, HttpHandler handler) {
        return addHandler(Methods.GET_STRING + " " + template, handler);
    }

    public Router post(String template, HttpHandler handler) {
        return addHandler(Methods.POST_STRING + " " + template, handler);
    }

    public Router put(String template, HttpHandler handler) {
        return addHandler(Methods.PUT_STRING + " " + template, handler);
    }

    public Router delete(String template, HttpHandler handler) {
        return addHandler(Methods.DELETE_STRING + " " + template, handler);
    }

    /**
     * Mounts {@code handler} under {@code prefix}. The handler receives requests below the
     * prefix with the prefix removed from the relative path. Any {@code HttpHandler} can be
     * mounted, including the result of another router's {@link #build()}.
     */
    public Router addMount(String prefix, HttpHandler handler) {
        ensureOpen();
        mounts.add(new Mount(Objects.requireNonNull(prefix, "prefix"), Objects.requireNonNull(handler, "handler")));
        return this;
    }

    /**
     * Appends a middleware. Middleware added first runs outermost: its logic before the
     * delegate call runs first and its logic after the call runs last.
     */
    public Router addMiddleware(HandlerWrapper middleware) {
        ensureOpen();
        middlewares.add(Objects.requireNonNull(middleware, "middleware"));
        return this;
    }

    /** Handler for requests that match no pattern and no mount. Defaults to a bare 404. */
    public Router setFallbackHandler(HttpHandler fallbackHandler) {
        ensureOpen();
        this.fallbackHandler = Objects.requireNonNull(fallbackHandler, "fallbackHandler");
        return this;
    }

    /**
     * Handler for requests whose path matches a pattern registered for other methods only.
     * Defaults to a bare 405; the {@code Allow} header is set either way.
     */
    public Router setInvalidMethodHandler(HttpHandler invalidMethodHandler) {
        ensureOpen();
        this.invalidMethodHandler = Objects.requireNonNull(invalidMethodHandler, "invalidMethodHandler");
        return this;
    }

    /**
     * Registers every pattern, then every mount, then folds the middleware around the result.
     * The returned handler is immutable and safe to share between threads.
     *
     * @throws ConfigurationException if a pattern or prefix is malformed or collides with another
     * @throws IllegalStateException if this router has already been built
     */
    public HttpHandler build() {
        ensureOpen();
        built = true;

        List<Route> routeSnapshot = List.copyOf(routes);
        List<Mount> mountSnapshot = List.copyOf(mounts);
        MiddlewareStack stack = new MiddlewareStack(middlewares);

        PatternTable patternTable = new PatternTable();
        for (Route route : routeSnapshot) {
            patternTable.register(route.pattern(), route.handler());
        }

        MountTable mountTable = new MountTable(patternTable.anyMethodTemplates());
        for (Mount mount : mountSnapshot) {
            mountTable.register(mount.prefix(), mount.handler());
        }

        HttpHandler dispatcher = new RouteDispatcher(patternTable, mountTable, invalidMethodHandler, fallbackHandler);
        HttpHandler handler = stack.fold(dispatcher);

        logger.debug("Router built: {} pattern(s), {} mount(s), {} middleware",
                patternTable.size(), mountTable.size(), stack.size());
        return handler;
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Router has already been built; create a new Router instead");
        }
    }

    private record Route(String pattern, HttpHandler handler) {
    }

    private record Mount(String prefix, HttpHandler handler) {
    }
}
