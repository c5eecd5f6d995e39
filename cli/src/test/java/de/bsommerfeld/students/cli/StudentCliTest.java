package de.bsommerfeld.students.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.students.core.config.DatabaseConfig;
import de.bsommerfeld.students.db.ConnectionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for StudentCli. The Guice wiring is kept, only the
 * connection manager is swapped for one pointing at a temporary SQLite file.
 */
class StudentCliTest {

    private static final String NL = System.lineSeparator();

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private PrintStream out;
    private PrintStream err;
    private ConnectionManager sqlite;
    private AtomicBoolean injectorCreated;

    @BeforeEach
    void setUp() throws Exception {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
        injectorCreated = new AtomicBoolean(false);

        String url = "jdbc:sqlite:" + tempDir.resolve("cli.db").toAbsolutePath();
        sqlite = new ConnectionManager(new DatabaseConfig("unused", 0, "unused", "unused", "unused")) {
            @Override
            public Connection open() throws SQLException {
                return DriverManager.getConnection(url);
            }
        };
        try (var in = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Connection conn = sqlite.open();
                Statement stmt = conn.createStatement()) {
            assertNotNull(in, "schema.sql missing from test resources");
            stmt.execute(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    // -- Startup failures --

    @Test
    void run_shouldAbortBeforeDatabaseWhenAnyVariableMissing() {
        for (String name : new String[] { "PGHOST", "PGPORT", "PGUSER", "PGPASSWORD", "PGDATABASE" }) {
            Map<String, String> env = env();
            env.remove(name);

            assertEquals(StudentCli.EXIT_CONFIG_ERROR, cli().run(new String[] { "list-all" }, env));
            assertTrue(err().contains("Missing environment variables: " + name));
        }
        assertFalse(injectorCreated.get(), "No database wiring may happen without configuration");
        assertEquals("", out());
    }

    @Test
    void run_shouldAbortOnNonNumericPort() {
        Map<String, String> env = env();
        env.put("PGPORT", "postgres");

        assertEquals(StudentCli.EXIT_CONFIG_ERROR, cli().run(new String[] { "list-all" }, env));
        assertTrue(err().contains("PGPORT"));
        assertFalse(injectorCreated.get());
    }

    @Test
    void run_shouldReturnUsageErrorForUnknownCommand() {
        assertEquals(StudentCli.EXIT_USAGE_ERROR, cli().run(new String[] { "drop-table" }, env()));
        assertTrue(err().contains("unknown command 'drop-table'"));
        assertFalse(injectorCreated.get());
    }

    @Test
    void run_shouldReportUsageErrorBeforeConfiguration() {
        assertEquals(StudentCli.EXIT_USAGE_ERROR, cli().run(new String[] { "add", "--first", "A" }, Map.of()));
        assertFalse(err().contains("Missing environment variables"));
    }

    @Test
    void run_shouldRejectFlagWithoutValueBeforeDatabase() {
        int status = cli().run(new String[] { "add", "--first", "A", "--last", "B", "--email", "--date" }, env());

        assertEquals(StudentCli.EXIT_USAGE_ERROR, status);
        assertTrue(err().contains("argument --email: expected a value"));
        assertFalse(injectorCreated.get());
    }

    @Test
    void run_shouldPrintHelp() {
        assertEquals(StudentCli.EXIT_OK, cli().run(new String[] { "--help" }, Map.of()));
        assertTrue(out().startsWith("usage: "));
    }

    // -- Commands against SQLite --

    @Test
    void run_shouldPrintPlaceholderForEmptyTable() {
        assertEquals(StudentCli.EXIT_OK, cli().run(new String[] { "list-all" }, env()));
        assertEquals("(no rows)" + NL, out());
    }

    @Test
    void run_roundTripAddUpdateDelete() {
        assertEquals(StudentCli.EXIT_OK,
                cli().run(new String[] { "add", "--first", "A", "--last", "B", "--email", "a@b.com" }, env()));
        assertEquals("Inserted student_id=1" + NL
                + "|   student_id | first_name   | last_name   | email   | enrollment_date   |" + NL
                + "|--------------|--------------|-------------|---------|-------------------|" + NL
                + "|            1 | A            | B           | a@b.com |                   |" + NL,
                takeOut());

        assertEquals(StudentCli.EXIT_OK,
                cli().run(new String[] { "update-email", "--id", "1", "--email", "c@d.com" }, env()));
        String updated = takeOut();
        assertTrue(updated.startsWith("Updated email for student_id=1" + NL));
        assertTrue(updated.contains("|            1 | A            | B           | c@d.com |"));

        assertEquals(StudentCli.EXIT_OK, cli().run(new String[] { "delete", "--id", "1" }, env()));
        assertEquals("Deleted student_id=1" + NL + "(no rows)" + NL, takeOut());
    }

    @Test
    void run_shouldReportDuplicateEmailAndExitNormally() {
        cli().run(new String[] { "add", "--first", "A", "--last", "B", "--email", "a@b.com", "--date", "2023-09-03" },
                env());
        takeOut();

        int status = cli().run(new String[] { "add", "--first", "C", "--last", "D", "--email", "a@b.com" }, env());

        assertEquals(StudentCli.EXIT_OK, status);
        assertEquals("Error: Email must be unique. Choose a different email." + NL, takeOut());

        cli().run(new String[] { "get-all" }, env());
        String listing = takeOut();
        assertTrue(listing.contains("2023-09-03"));
        assertFalse(listing.contains("| C "));
    }

    @Test
    void run_shouldReportMissingIdsAsNotFound() {
        assertEquals(StudentCli.EXIT_OK,
                cli().run(new String[] { "update-email", "--id", "5", "--email", "x@y.com" }, env()));
        assertEquals("No student found with id 5" + NL + "(no rows)" + NL, takeOut());

        assertEquals(StudentCli.EXIT_OK, cli().run(new String[] { "delete", "--id=5" }, env()));
        assertEquals("No student found with id 5" + NL + "(no rows)" + NL, takeOut());
    }

    @Test
    void run_shouldReportMalformedIdAsUnexpectedError() {
        assertEquals(StudentCli.EXIT_OK, cli().run(new String[] { "delete", "--id", "x" }, env()));
        assertTrue(out().startsWith("Unexpected error: "));
    }

    private StudentCli cli() {
        return new StudentCli(out, err) {
            @Override
            Injector createInjector(DatabaseConfig config) {
                injectorCreated.set(true);
                return Guice.createInjector(new StudentCliModule(config, out), new AbstractModule() {
                    @Override
                    protected void configure() {
                        bind(ConnectionManager.class).toInstance(sqlite);
                    }
                });
            }
        };
    }

    private static Map<String, String> env() {
        Map<String, String> env = new HashMap<>();
        env.put("PGHOST", "localhost");
        env.put("PGPORT", "5432");
        env.put("PGUSER", "postgres");
        env.put("PGPASSWORD", "postgres");
        env.put("PGDATABASE", "students");
        return env;
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String takeOut() {
        String text = out();
        outBuffer.reset();
        return text;
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }
}
