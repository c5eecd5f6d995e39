package de.bsommerfeld.students.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link DatabaseConfig} from the five libpq-style variables
 * {@code PGHOST}, {@code PGPORT}, {@code PGUSER}, {@code PGPASSWORD} and
 * {@code PGDATABASE}.
 *
 * <p>
 * Values come from the process environment, backed by an optional
 * {@code .env} file (see {@link EnvFile}). Process variables win over file
 * entries. Only presence is validated, plus the port being numeric.
 */
public final class DatabaseConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConfigLoader.class);

    public static final String HOST = "PGHOST";
    public static final String PORT = "PGPORT";
    public static final String USER = "PGUSER";
    public static final String PASSWORD = "PGPASSWORD";
    public static final String DATABASE = "PGDATABASE";

    /** Required variables in reporting order. */
    public static final List<String> REQUIRED = List.of(HOST, PORT, USER, PASSWORD, DATABASE);

    private DatabaseConfigLoader() {
    }

    /**
     * Returns {@link System#getenv()} merged over {@code .env} in the working
     * directory.
     */
    public static Map<String, String> environment() {
        return merge(EnvFile.read(Path.of(".env")), System.getenv());
    }

    /**
     * Overlays {@code primary} on top of {@code fallback}. A key present in
     * {@code primary} always wins, even with an empty value.
     */
    public static Map<String, String> merge(Map<String, String> fallback, Map<String, String> primary) {
        Map<String, String> merged = new HashMap<>(fallback);
        merged.putAll(primary);
        return merged;
    }

    /**
     * Builds the configuration from {@code env}. Absent and empty values are
     * both reported as missing, all at once.
     *
     * @throws MissingConfigurationException if any required variable is missing
     * @throws ConfigurationException        if {@code PGPORT} is not an integer
     */
    public static DatabaseConfig load(Map<String, String> env) throws ConfigurationException {
        List<String> missing = new ArrayList<>();
        for (String name : REQUIRED) {
            String value = env.get(name);
            if (value == null || value.isEmpty())
                missing.add(name);
        }
        if (!missing.isEmpty())
            throw new MissingConfigurationException(missing);

        int port;
        try {
            port = Integer.parseInt(env.get(PORT).strip());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + PORT + ": '" + env.get(PORT) + "' is not an integer", e);
        }

        DatabaseConfig config = new DatabaseConfig(env.get(HOST), port, env.get(USER), env.get(PASSWORD),
                env.get(DATABASE));
        LOG.debug("Loaded {}", config);
        return config;
    }
}
