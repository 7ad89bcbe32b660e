package org.waypoint.rest.middleware;

/**
 * Sink for access log records. The format uses SLF4J {@code {}} placeholders.
 */
@FunctionalInterface
public interface LogEmitter {

    void emit(String format, Object... values);
}
