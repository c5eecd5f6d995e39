package de.bsommerfeld.students.cli;

/**
 * Thrown when the command line does not match any known command shape:
 * unknown command, unknown flag, missing required flag or missing value.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
