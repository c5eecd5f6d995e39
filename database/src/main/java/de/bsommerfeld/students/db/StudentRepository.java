package de.bsommerfeld.students.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.students.core.domain.Student;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Single entry point for student data. The CLI never talks to
 * {@link StudentDatabase} directly.
 *
 * <p>
 * Each method performs one database round trip and returns an
 * {@link OperationResult}; exceptions never escape. Failures are classified
 * into {@link OperationResult.Status#UNIQUE_VIOLATION} (duplicate email) and
 * {@link OperationResult.Status#UNEXPECTED}. Nothing is retried.
 */
@Singleton
public class StudentRepository {

    private static final Logger LOG = LoggerFactory.getLogger(StudentRepository.class);

    /** PostgreSQL {@code unique_violation}. */
    static final String UNIQUE_VIOLATION_STATE = "23505";

    private final StudentDatabase database;

    @Inject
    public StudentRepository(StudentDatabase database) {
        this.database = database;
    }

    /** All students, ordered by ascending id. */
    public OperationResult<List<Student>> findAll() {
        return execute("list students", database::findAll);
    }

    /**
     * Inserts a student.
     *
     * @param enrollmentDate optional, may be {@code null}
     * @return the generated id on success
     */
    public OperationResult<Integer> add(String firstName, String lastName, String email, LocalDate enrollmentDate) {
        return execute("add student", () -> database.insert(firstName, lastName, email, enrollmentDate));
    }

    /**
     * Updates the email of student {@code id}.
     *
     * @return the affected-row count on success, {@code 0} for an unknown id
     */
    public OperationResult<Integer> updateEmail(int id, String email) {
        return execute("update email of student " + id, () -> database.updateEmail(id, email));
    }

    /**
     * Deletes student {@code id}.
     *
     * @return the affected-row count on success, {@code 0} for an unknown id
     */
    public OperationResult<Integer> delete(int id) {
        return execute("delete student " + id, () -> database.delete(id));
    }

    private <T> OperationResult<T> execute(String description, SqlCall<T> call) {
        try {
            return OperationResult.success(call.run());
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                LOG.info("Failed to {}: unique constraint violated ({})", description, e.getMessage());
                return OperationResult.uniqueViolation(e);
            }
            LOG.warn("Failed to {}", description, e);
            return OperationResult.unexpected(e);
        } catch (RuntimeException e) {
            LOG.warn("Failed to {}", description, e);
            return OperationResult.unexpected(e);
        }
    }

    /**
     * Recognizes duplicate-key rejections across drivers: PostgreSQL reports
     * SQLState {@code 23505}, SQLite only names the constraint in its message.
     * Other integrity violations (not-null, foreign key, check) do not match.
     * The cause chain is searched as well.
     */
    static boolean isUniqueViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION_STATE.equals(sql.getSQLState()))
                return true;
            String message = t.getMessage();
            if (message != null && message.toUpperCase(Locale.ROOT).contains("UNIQUE CONSTRAINT"))
                return true;
        }
        return false;
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T run() throws SQLException;
    }
}
