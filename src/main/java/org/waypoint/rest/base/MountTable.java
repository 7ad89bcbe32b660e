package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.PathMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waypoint.rest.ConfigurationException;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Prefix mounts backed by Undertow's {@link PathMatcher}. Each mounted handler is registered
 * behind a {@link MountedHandler} that strips the prefix before delegating.
 * Populated once while a router is built, read-only afterwards.
 */
public class MountTable {

    private static final Logger logger = LoggerFactory.getLogger(MountTable.class);

    private final PathMatcher<HttpHandler> matcher = new PathMatcher<>();
    private final Set<String> patternTemplates;

    // stripped prefix -> prefix as registered
    private final Map<String, String> prefixes = new HashMap<>();

    /**
     * @param patternTemplates templates of method-less patterns; a prefix written exactly like
     *                         one of them is rejected. Method patterns on the prefix path are
     *                         fine, they are tried before mounts.
     */
    public MountTable(Set<String> patternTemplates) {
        this.patternTemplates = patternTemplates;
    }

    public MountTable register(String prefix, HttpHandler handler) {
        String stripped = stripPrefix(prefix);

        String previous = prefixes.get(stripped);
        if (previous != null) {
            throw new ConfigurationException(
                    "Duplicate mount prefix \"" + prefix + "\": conflicts with \"" + previous + "\"");
        }
        if (patternTemplates.contains(prefix)) {
            throw new ConfigurationException(
                    "Mount prefix \"" + prefix + "\" collides with a pattern registered for the same path");
        }

        MountedHandler mounted = new MountedHandler(stripped, handler);
        if (stripped.isEmpty()) {
            // mounted at the root: catches whatever no other prefix claims
            matcher.addPrefixPath("/", mounted);
        } else {
            matcher.addPrefixPath(stripped, mounted);
        }

        prefixes.put(stripped, prefix);
        logger.debug("Mounted handler under {}", prefix);
        return this;
    }

    /**
     * @return the delegating adapter for the longest prefix that covers {@code path},
     * or {@code null} when no prefix does
     */
    public HttpHandler lookup(String path) {
        return matcher.match(path).getValue();
    }

    public int size() {
        return prefixes.size();
    }

    /** Validates a prefix and removes its trailing separator. {@code "/"} strips to {@code ""}. */
    static String stripPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw malformed(prefix, "prefix is blank");
        }
        if (!prefix.startsWith("/")) {
            throw malformed(prefix, "prefix must start with '/'");
        }
        if (prefix.contains("//")) {
            throw malformed(prefix, "empty path segment");
        }
        if (prefix.indexOf('{') >= 0 || prefix.indexOf('}') >= 0) {
            throw malformed(prefix, "prefixes are literal and can not declare parameters");
        }
        if (prefix.chars().anyMatch(Character::isWhitespace)) {
            throw malformed(prefix, "prefix contains whitespace");
        }
        return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }

    private static ConfigurationException malformed(String prefix, String reason) {
        return new ConfigurationException("Malformed mount prefix \"" + prefix + "\": " + reason);
    }

    /**
     * Rewrites the relative path of the exchange so the mounted handler never sees the prefix.
     * A path equal to the prefix itself becomes {@code "/"}.
     */
    static final class MountedHandler implements HttpHandler {

        private final String strippedPrefix;
        private final HttpHandler next;

        MountedHandler(String strippedPrefix, HttpHandler next) {
            this.strippedPrefix = strippedPrefix;
            this.next = next;
        }

        @Override
        public void handleRequest(HttpServerExchange exchange) throws Exception {
            String relative = exchange.getRelativePath();
            String remaining = relative.substring(strippedPrefix.length());
            if (remaining.isEmpty()) {
                remaining = "/";
            }

            exchange.setRelativePath(remaining);
            exchange.setResolvedPath(exchange.getResolvedPath() + strippedPrefix);
            next.handleRequest(exchange);
        }
    }
}
