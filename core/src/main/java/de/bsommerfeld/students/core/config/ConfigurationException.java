package de.bsommerfeld.students.core.config;

/**
 * Thrown when the connection configuration cannot be assembled. Always fatal:
 * no command runs without a complete {@link DatabaseConfig}.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
