package de.bsommerfeld.students.cli;

import de.bsommerfeld.students.core.config.DatabaseConfigLoader;

/**
 * Process entry point. Reads configuration from the environment (and
 * {@code .env}), runs the command and exits with its status.
 */
public final class StudentCliMain {

    private StudentCliMain() {
    }

    public static void main(String[] args) {
        int status = new StudentCli(System.out, System.err).run(args, DatabaseConfigLoader.environment());
        System.exit(status);
    }
}
