package de.bsommerfeld.students.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a dotenv-style credentials file ({@code .env}).
 *
 * <p>
 * Accepted syntax, one entry per line:
 * <ul>
 * <li>{@code KEY=VALUE}, optionally prefixed with {@code export }</li>
 * <li>values may be wrapped in single or double quotes, which are stripped</li>
 * <li>unquoted values may carry a trailing {@code # comment}, separated by
 * whitespace</li>
 * <li>blank lines and lines starting with {@code #} are skipped</li>
 * </ul>
 * Lines without {@code =} are ignored with a warning. Variable expansion is
 * not supported.
 */
public final class EnvFile {

    private static final Logger LOG = LoggerFactory.getLogger(EnvFile.class);

    private EnvFile() {
    }

    /**
     * Reads {@code file} into an insertion-ordered map. A file that does not
     * exist yields an empty map.
     *
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public static Map<String, String> read(Path file) {
        if (!Files.isRegularFile(file))
            return Map.of();

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read credentials file: " + file, e);
        }
        LOG.debug("Loading credentials file {}", file.toAbsolutePath());
        return parse(lines);
    }

    static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#"))
                continue;
            if (line.startsWith("export "))
                line = line.substring("export ".length()).strip();

            int eq = line.indexOf('=');
            if (eq <= 0) {
                LOG.warn("Ignoring malformed line {} in credentials file", lineNo);
                continue;
            }
            String key = line.substring(0, eq).strip();
            String value = parseValue(line.substring(eq + 1).strip());
            values.put(key, value);
        }
        return values;
    }

    /**
     * Quoted values are taken verbatim between the quotes. Unquoted values end
     * at the first {@code #} preceded by whitespace.
     */
    private static String parseValue(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            int close = value.indexOf(first, 1);
            if ((first == '"' || first == '\'') && close > 0)
                return value.substring(1, close);
        }
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '#' && (i == 0 || Character.isWhitespace(value.charAt(i - 1))))
                return value.substring(0, i).strip();
        }
        return value;
    }
}
