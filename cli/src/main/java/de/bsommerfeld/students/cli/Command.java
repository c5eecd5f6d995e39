package de.bsommerfeld.students.cli;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * A parsed invocation: the subcommand plus its flag values keyed by flag name
 * (without leading dashes).
 *
 * <p>
 * Typed accessors convert lazily. A malformed value surfaces as an
 * {@link IllegalArgumentException} at the time the command is executed, not
 * while parsing.
 */
public record Command(CommandType type, Map<String, String> options) {

    public Command {
        options = Map.copyOf(options);
    }

    /** Returns the raw value of {@code flag}, or {@code null} if it was not given. */
    public String option(String flag) {
        return options.get(flag);
    }

    public int intOption(String flag) {
        String raw = options.get(flag);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid int value for --" + flag + ": '" + raw + "'", e);
        }
    }

    /**
     * Parses {@code flag} as an ISO-8601 date ({@code YYYY-MM-DD}).
     *
     * @return the date, or {@code null} if the flag was not given
     */
    public LocalDate dateOption(String flag) {
        String raw = options.get(flag);
        if (raw == null)
            return null;
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "invalid date value for --" + flag + ": '" + raw + "' (expected YYYY-MM-DD)", e);
        }
    }
}
