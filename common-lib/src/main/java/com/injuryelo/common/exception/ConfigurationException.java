package com.injuryelo.common.exception;

/**
 * Raised when injury-adjustment configuration is invalid. Always fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super("[" + property + "] " + message);
        this.property = property;
    }

    public ConfigurationException(String property, String message, Throwable cause) {
        super("[" + property + "] " + message, cause);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
