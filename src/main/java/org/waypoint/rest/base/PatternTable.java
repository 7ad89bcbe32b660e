package org.waypoint.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.PathTemplateMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waypoint.rest.ConfigurationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Method + path-template registrations on top of Undertow's {@link PathTemplateMatcher}.
 * One matcher per method, plus one for patterns that carry no method.
 * Populated once while a router is built, read-only afterwards.
 */
public class PatternTable {

    private static final Logger logger = LoggerFactory.getLogger(PatternTable.class);

    private final Map<HttpString, PathTemplateMatcher<HttpHandler>> methodMatchers = new TreeMap<>();
    private final PathTemplateMatcher<HttpHandler> anyMethodMatcher = new PathTemplateMatcher<>();

    // "<method|*> <shape>" -> pattern that claimed it
    private final Map<String, String> claimed = new HashMap<>();
    private final Set<String> anyMethodTemplates = new LinkedHashSet<>();

    public PatternTable register(String pattern, HttpHandler handler) {
        RoutePattern parsed = RoutePattern.parse(pattern);

        String key = (parsed.isAnyMethod() ? "*" : parsed.getMethod().toString()) + " " + parsed.getShape();
        String previous = claimed.get(key);
        if (previous != null) {
            throw new ConfigurationException(
                    "Duplicate pattern \"" + pattern + "\": conflicts with \"" + previous + "\"");
        }

        PathTemplateMatcher<HttpHandler> matcher = parsed.isAnyMethod()
                ? anyMethodMatcher
                : methodMatchers.computeIfAbsent(parsed.getMethod(), m -> new PathTemplateMatcher<>());
        try {
            matcher.add(parsed.getTemplate(), handler);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ConfigurationException(
                    "Pattern \"" + pattern + "\" rejected by path matcher: " + e.getMessage(), e);
        }

        claimed.put(key, pattern);
        if (parsed.isAnyMethod()) {
            anyMethodTemplates.add(parsed.getTemplate());
        }
        logger.debug("Registered pattern {}", pattern);
        return this;
    }

    /**
     * Finds the handler for a request. Method-specific patterns win over method-less ones.
     * A {@code HEAD} request with no {@code HEAD} pattern is served by the {@code GET} one.
     *
     * @return the match, or {@code null} when no pattern applies
     */
    public PathTemplateMatcher.PathMatchResult<HttpHandler> lookup(HttpString method, String path) {
        PathTemplateMatcher<HttpHandler> matcher = methodMatchers.get(method);
        if (matcher != null) {
            PathTemplateMatcher.PathMatchResult<HttpHandler> result = matcher.match(path);
            if (result != null) {
                return result;
            }
        }
        if (Methods.HEAD.equals(method)) {
            PathTemplateMatcher<HttpHandler> getMatcher = methodMatchers.get(Methods.GET);
            if (getMatcher != null) {
                PathTemplateMatcher.PathMatchResult<HttpHandler> result = getMatcher.match(path);
                if (result != null) {
                    return result;
                }
            }
        }
        return anyMethodMatcher.match(path);
    }

    /** Methods that have a pattern matching {@code path}, in natural order. */
    public Set<HttpString> allowedMethods(String path) {
        Set<HttpString> allowed = new LinkedHashSet<>();
        for (Map.Entry<HttpString, PathTemplateMatcher<HttpHandler>> entry : methodMatchers.entrySet()) {
            if (entry.getValue().match(path) != null) {
                allowed.add(entry.getKey());
            }
        }
        if (allowed.contains(Methods.GET)) {
            allowed.add(Methods.HEAD);
        }
        return allowed;
    }

    /** Templates of the patterns that carry no method, as written. */
    public Set<String> anyMethodTemplates() {
        return Collections.unmodifiableSet(anyMethodTemplates);
    }

    public int size() {
        return claimed.size();
    }
}
