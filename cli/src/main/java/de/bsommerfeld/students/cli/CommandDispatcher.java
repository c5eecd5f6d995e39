package de.bsommerfeld.students.cli;

import com.google.inject.Inject;
import de.bsommerfeld.students.core.domain.Student;
import de.bsommerfeld.students.db.OperationResult;
import de.bsommerfeld.students.db.StudentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one parsed {@link Command} against the {@link StudentRepository}
 * and reports the outcome.
 *
 * <p>
 * Every command ends by re-listing all students, so the user sees the state
 * after the change. When the operation itself fails, only the error line is
 * printed.
 *
 * <h3>Outcome messages</h3>
 * <ul>
 * <li>uniqueness violation: {@value #UNIQUE_EMAIL_MESSAGE}</li>
 * <li>update/delete of an unknown id: {@code No student found with id <id>}</li>
 * <li>anything else, including malformed flag values:
 * {@code Unexpected error: <message>}</li>
 * </ul>
 */
public class CommandDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String UNIQUE_EMAIL_MESSAGE = "Error: Email must be unique. Choose a different email.";

    private final StudentRepository repository;
    private final TablePrinter tablePrinter;
    private final PrintStream out;

    @Inject
    public CommandDispatcher(StudentRepository repository, TablePrinter tablePrinter, PrintStream out) {
        this.repository = repository;
        this.tablePrinter = tablePrinter;
        this.out = out;
    }

    public void dispatch(Command command) {
        LOG.debug("Dispatching {}", command.type());
        try {
            switch (command.type()) {
                case LIST_ALL:
                    printAll();
                    break;
                case ADD:
                    add(command);
                    break;
                case UPDATE_EMAIL:
                    updateEmail(command);
                    break;
                case DELETE:
                    delete(command);
                    break;
                default:
                    throw new IllegalStateException("Unhandled command " + command.type());
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected flag value", e);
            out.println("Unexpected error: " + e.getMessage());
        }
    }

    private void add(Command command) {
        OperationResult<Integer> result = repository.add(
                command.option("first"),
                command.option("last"),
                command.option("email"),
                command.dateOption("date"));
        if (!report(result))
            return;

        out.println("Inserted student_id=" + result.value());
        printAll();
    }

    private void updateEmail(Command command) {
        int id = command.intOption("id");
        OperationResult<Integer> result = repository.updateEmail(id, command.option("email"));
        if (!report(result))
            return;

        out.println(result.value() == 0
                ? "No student found with id " + id
                : "Updated email for student_id=" + id);
        printAll();
    }

    private void delete(Command command) {
        int id = command.intOption("id");
        OperationResult<Integer> result = repository.delete(id);
        if (!report(result))
            return;

        out.println(result.value() == 0
                ? "No student found with id " + id
                : "Deleted student_id=" + id);
        printAll();
    }

    private void printAll() {
        OperationResult<List<Student>> result = repository.findAll();
        if (report(result))
            tablePrinter.print(toRows(result.value()));
    }

    /**
     * Prints the failure line for unsuccessful results.
     *
     * @return {@code true} if the result is a success
     */
    private boolean report(OperationResult<?> result) {
        switch (result.status()) {
            case SUCCESS:
                return true;
            case UNIQUE_VIOLATION:
                out.println(UNIQUE_EMAIL_MESSAGE);
                return false;
            case UNEXPECTED:
            default:
                out.println("Unexpected error: " + result.errorMessage());
                return false;
        }
    }

    /** Column order matches the {@code students} table. */
    static List<Map<String, Object>> toRows(List<Student> students) {
        List<Map<String, Object>> rows = new ArrayList<>(students.size());
        for (Student s : students) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("student_id", s.id());
            row.put("first_name", s.firstName());
            row.put("last_name", s.lastName());
            row.put("email", s.email());
            row.put("enrollment_date", s.enrollmentDate());
            rows.add(row);
        }
        return rows;
    }
}
