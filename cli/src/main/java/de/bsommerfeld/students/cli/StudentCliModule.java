package de.bsommerfeld.students.cli;

import com.google.inject.AbstractModule;
import de.bsommerfeld.students.core.config.DatabaseConfig;
import de.bsommerfeld.students.db.SqlStudentDatabase;
import de.bsommerfeld.students.db.StudentDatabase;

import java.io.PrintStream;

/**
 * Guice module for a single CLI invocation. The configuration is loaded
 * before the injector is created and bound as an instance.
 */
public class StudentCliModule extends AbstractModule {

    private final DatabaseConfig config;
    private final PrintStream out;

    public StudentCliModule(DatabaseConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    @Override
    protected void configure() {
        bind(DatabaseConfig.class).toInstance(config);
        bind(PrintStream.class).toInstance(out);
        bind(StudentDatabase.class).to(SqlStudentDatabase.class);
    }
}
