package de.bsommerfeld.students.core.config;

import java.util.List;

/**
 * Thrown when one or more required variables are absent or empty.
 */
public class MissingConfigurationException extends ConfigurationException {

    private final List<String> missing;

    public MissingConfigurationException(List<String> missing) {
        super("Missing environment variables: " + String.join(", ", missing)
                + ". Copy .env.example to .env and fill in your credentials.");
        this.missing = List.copyOf(missing);
    }

    /**
     * Names of the missing variables, in the order they are declared in
     * {@link DatabaseConfigLoader#REQUIRED}.
     */
    public List<String> getMissing() {
        return missing;
    }
}
