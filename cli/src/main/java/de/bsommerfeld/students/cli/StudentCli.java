package de.bsommerfeld.students.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.students.core.config.ConfigurationException;
import de.bsommerfeld.students.core.config.DatabaseConfig;
import de.bsommerfeld.students.core.config.DatabaseConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;

/**
 * Runs one CLI invocation: <strong>parse → configure → wire → dispatch</strong>.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_OK}: the command was handled, including "not found",
 * uniqueness violations and unexpected errors reported by the
 * dispatcher</li>
 * <li>{@value #EXIT_CONFIG_ERROR}: configuration is incomplete or invalid;
 * nothing touched the database</li>
 * <li>{@value #EXIT_USAGE_ERROR}: the command line could not be parsed</li>
 * </ul>
 */
public class StudentCli {

    private static final Logger LOG = LoggerFactory.getLogger(StudentCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_USAGE_ERROR = 2;

    private final PrintStream out;
    private final PrintStream err;

    public StudentCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * @param args command-line arguments
     * @param env  variables to build the {@link DatabaseConfig} from
     * @return the process exit code
     */
    public int run(String[] args, Map<String, String> env) {
        if (CommandParser.isHelpRequest(args)) {
            out.print(CommandParser.usage());
            return EXIT_OK;
        }

        Command command;
        try {
            command = CommandParser.parse(args);
        } catch (UsageException e) {
            err.print(CommandParser.usage());
            err.println("error: " + e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        DatabaseConfig config;
        try {
            config = DatabaseConfigLoader.load(env);
        } catch (ConfigurationException e) {
            LOG.debug("Configuration rejected", e);
            err.println(e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        createInjector(config).getInstance(CommandDispatcher.class).dispatch(command);
        return EXIT_OK;
    }

    Injector createInjector(DatabaseConfig config) {
        return Guice.createInjector(new StudentCliModule(config, out));
    }
}
