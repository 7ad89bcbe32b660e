package org.waypoint.rest;

/**
 * Raised by {@link Router#build()} when the accumulated routes can not be registered:
 * a malformed pattern or prefix, or two registrations that collide.
 * Always a programming error in route setup, never a request-time condition.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
