package org.waypoint.rest.base;

import io.undertow.util.HttpString;
import org.waypoint.rest.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A parsed route pattern of the form {@code "[METHOD ]/path/with/{param}/segments"}.
 * No method means the pattern matches every method.
 */
public final class RoutePattern {

    // RFC 9110 token characters
    private static final Pattern METHOD_TOKEN = Pattern.compile("[A-Za-z0-9!#$%&'*+.^_`|~-]+");
    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String pattern;
    private final HttpString method;
    private final String template;
    private final String shape;
    private final List<String> parameterNames;

    private RoutePattern(String pattern, HttpString method, String template, String shape, List<String> parameterNames) {
        this.pattern = pattern;
        this.method = method;
        this.template = template;
        this.shape = shape;
        this.parameterNames = parameterNames;
    }

    public static RoutePattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw malformed(pattern, "pattern is blank");
        }

        String trimmed = pattern.trim();
        HttpString method = null;
        String path = trimmed;

        int space = trimmed.indexOf(' ');
        if (space >= 0) {
            String token = trimmed.substring(0, space);
            if (!METHOD_TOKEN.matcher(token).matches()) {
                throw malformed(pattern, "invalid method \"" + token + "\"");
            }
            // HttpString compares without case; one canonical spelling per method
            method = new HttpString(token.toUpperCase(Locale.ROOT));
            path = trimmed.substring(space + 1).trim();
        }

        if (!path.startsWith("/")) {
            throw malformed(pattern, "path must start with '/'");
        }
        if (path.chars().anyMatch(Character::isWhitespace)) {
            throw malformed(pattern, "path contains whitespace");
        }

        String[] segments = path.split("/", -1);
        List<String> names = new ArrayList<>();
        StringBuilder shape = new StringBuilder();

        // segments[0] is the empty string before the leading '/'
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            boolean last = i == segments.length - 1;

            if (segment.isEmpty() && !last) {
                throw malformed(pattern, "empty path segment");
            }

            shape.append('/');
            if (segment.indexOf('{') < 0 && segment.indexOf('}') < 0) {
                shape.append(segment);
                continue;
            }

            if (!segment.startsWith("{") || !segment.endsWith("}")) {
                throw malformed(pattern, "parameter must span a whole segment, got \"" + segment + "\"");
            }
            String name = segment.substring(1, segment.length() - 1);
            if (!PARAMETER_NAME.matcher(name).matches()) {
                throw malformed(pattern, "invalid parameter name \"" + name + "\"");
            }
            if (names.contains(name)) {
                throw malformed(pattern, "parameter \"" + name + "\" appears more than once");
            }
            names.add(name);
            shape.append("{}");
        }

        return new RoutePattern(pattern, method, path, shape.toString(), Collections.unmodifiableList(names));
    }

    private static ConfigurationException malformed(String pattern, String reason) {
        return new ConfigurationException("Malformed pattern \"" + pattern + "\": " + reason);
    }

    /** The pattern exactly as it was registered. */
    public String getPattern() {
        return pattern;
    }

    /** The method this pattern is restricted to, or {@code null} for any method. */
    public HttpString getMethod() {
        return method;
    }

    public boolean isAnyMethod() {
        return method == null;
    }

    /** The path template handed to Undertow's matcher. */
    public String getTemplate() {
        return template;
    }

    /**
     * The template with parameter names erased, so that {@code /users/{id}} and
     * {@code /users/{name}} compare equal.
     */
    public String getShape() {
        return shape;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
