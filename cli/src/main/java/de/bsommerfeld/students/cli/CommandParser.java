package de.bsommerfeld.students.cli;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code <command> [--flag value | --flag=value]...} into a
 * {@link Command}. Only structure is checked here; values are converted by
 * {@link Command}'s typed accessors.
 */
public final class CommandParser {

    private static final String PROGRAM = "student-records";

    private CommandParser() {
    }

    /**
     * Returns {@code true} if any argument asks for help.
     */
    public static boolean isHelpRequest(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg))
                return true;
        }
        return false;
    }

    public static Command parse(String[] args) throws UsageException {
        if (args.length == 0)
            throw new UsageException("a command is required");

        CommandType type = CommandType.fromName(args[0])
                .orElseThrow(() -> new UsageException("unknown command '" + args[0] + "'"));

        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || arg.length() == 2)
                throw new UsageException("unexpected argument '" + arg + "'");

            String flag;
            String value;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                flag = arg.substring(2, eq);
                value = arg.substring(eq + 1);
            } else {
                flag = arg.substring(2);
                if (i + 1 >= args.length || args[i + 1].startsWith("--"))
                    throw new UsageException("argument --" + flag + ": expected a value");
                value = args[++i];
            }

            if (!type.accepts(flag))
                throw new UsageException(type.getCommandName() + ": unrecognized argument --" + flag);
            options.put(flag, value);
        }

        for (String required : type.getRequiredFlags()) {
            if (!options.containsKey(required))
                throw new UsageException(type.getCommandName() + ": the following argument is required: --"
                        + required);
        }
        return new Command(type, options);
    }

    /**
     * Multi-line usage summary listing every command and its flags.
     */
    public static String usage() {
        StringBuilder sb = new StringBuilder();
        sb.append("usage: ").append(PROGRAM).append(" <command> [flags]").append(System.lineSeparator());
        sb.append(System.lineSeparator());
        sb.append("PostgreSQL CRUD app for the students table.").append(System.lineSeparator());
        sb.append(System.lineSeparator());
        sb.append("commands:").append(System.lineSeparator());
        for (CommandType type : CommandType.values()) {
            StringBuilder line = new StringBuilder("  ").append(type.getCommandName());
            for (String flag : type.getRequiredFlags())
                line.append(" --").append(flag).append(" <").append(flag).append('>');
            for (String flag : type.getOptionalFlags())
                line.append(" [--").append(flag).append(" <").append(flag).append(">]");
            sb.append(String.format("%-60s %s", line, type.getDescription())).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
