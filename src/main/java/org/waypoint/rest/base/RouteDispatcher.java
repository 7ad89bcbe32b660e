package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.PathTemplateMatcher;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The combined pattern and mount substrate that the middleware stack is folded around.
 * <p>
 * Resolution order for the exchange's relative path:
 * <ol>
 *     <li>a pattern for the request method, then a method-less pattern</li>
 *     <li>the longest mount prefix</li>
 *     <li>the invalid method handler, if a pattern matches the path under another method</li>
 *     <li>the fallback handler</li>
 * </ol>
 */
public class RouteDispatcher implements HttpHandler {

    private final PatternTable patterns;
    private final MountTable mounts;
    private final HttpHandler invalidMethodHandler;
    private final HttpHandler fallbackHandler;

    public RouteDispatcher(PatternTable patterns, MountTable mounts,
                           HttpHandler invalidMethodHandler, HttpHandler fallbackHandler) {
        this.patterns = patterns;
        this.mounts = mounts;
        this.invalidMethodHandler = invalidMethodHandler;
        this.fallbackHandler = fallbackHandler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String path = exchange.getRelativePath();

        PathTemplateMatcher.PathMatchResult<HttpHandler> match = patterns.lookup(exchange.getRequestMethod(), path);
        if (match != null) {
            exchange.putAttachment(PathTemplateMatch.ATTACHMENT_KEY, match);
            for (Map.Entry<String, String> parameter : match.getParameters().entrySet()) {
                exchange.addQueryParam(parameter.getKey(), parameter.getValue());
            }
            match.getValue().handleRequest(exchange);
            return;
        }

        HttpHandler mounted = mounts.lookup(path);
        if (mounted != null) {
            mounted.handleRequest(exchange);
            return;
        }

        Set<HttpString> allowed = patterns.allowedMethods(path);
        if (!allowed.isEmpty()) {
            exchange.getResponseHeaders().put(Headers.ALLOW,
                    allowed.stream().map(HttpString::toString).collect(Collectors.joining(", ")));
            invalidMethodHandler.handleRequest(exchange);
            return;
        }

        fallbackHandler.handleRequest(exchange);
    }
}
