package com.eventalerts.alerter.domain.exceptions;

/**
 * Invalid or missing configuration. Only raised while the application context starts.
 */
public class ConfigException extends AlertingException {

    private ConfigException(String message) {
        super(message);
    }

    private ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigException invalid(String property, String reason) {
        return new ConfigException("Invalid configuration '" + property + "': " + reason);
    }

    public static ConfigException unreadable(String property, String location, Throwable cause) {
        return new ConfigException(
                "Invalid configuration '" + property + "': cannot read " + location, cause);
    }
}
