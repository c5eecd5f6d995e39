package de.bsommerfeld.students.cli;

import java.util.List;
import java.util.Optional;

/**
 * The subcommands understood by the CLI, with the flags each one accepts.
 */
public enum CommandType {

    LIST_ALL("list-all", List.of("get-all"), "Retrieve and display all students.",
            List.of(), List.of()),
    ADD("add", List.of(), "Insert a new student.",
            List.of("first", "last", "email"), List.of("date")),
    UPDATE_EMAIL("update-email", List.of(), "Update a student's email by id.",
            List.of("id", "email"), List.of()),
    DELETE("delete", List.of(), "Delete a student by id.",
            List.of("id"), List.of());

    private final String commandName;
    private final List<String> aliases;
    private final String description;
    private final List<String> requiredFlags;
    private final List<String> optionalFlags;

    CommandType(String commandName, List<String> aliases, String description,
            List<String> requiredFlags, List<String> optionalFlags) {
        this.commandName = commandName;
        this.aliases = aliases;
        this.description = description;
        this.requiredFlags = requiredFlags;
        this.optionalFlags = optionalFlags;
    }

    /**
     * Resolves a command-line token to a command, by name or alias.
     */
    public static Optional<CommandType> fromName(String name) {
        for (CommandType type : values()) {
            if (type.commandName.equals(name) || type.aliases.contains(name))
                return Optional.of(type);
        }
        return Optional.empty();
    }

    public String getCommandName() {
        return commandName;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getRequiredFlags() {
        return requiredFlags;
    }

    public List<String> getOptionalFlags() {
        return optionalFlags;
    }

    public boolean accepts(String flag) {
        return requiredFlags.contains(flag) || optionalFlags.contains(flag);
    }
}
