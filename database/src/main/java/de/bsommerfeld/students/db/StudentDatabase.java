package de.bsommerfeld.students.db;

import de.bsommerfeld.students.core.domain.Student;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;

/**
 * Persistence contract for the {@code students} table. Each method executes
 * exactly one statement in its own connection and commits it immediately.
 *
 * <p>
 * Implementations propagate every {@link SQLException} unchanged; error
 * classification happens in {@link StudentRepository}.
 */
public interface StudentDatabase {

    /**
     * Returns every student ordered by ascending id.
     */
    List<Student> findAll() throws SQLException;

    /**
     * Inserts a student and returns the id assigned by the database.
     *
     * @param enrollmentDate may be {@code null}
     */
    int insert(String firstName, String lastName, String email, LocalDate enrollmentDate) throws SQLException;

    /**
     * Replaces the email of the student with {@code id}.
     *
     * @return number of affected rows, {@code 0} if no such student exists
     */
    int updateEmail(int id, String email) throws SQLException;

    /**
     * Deletes the student with {@code id}.
     *
     * @return number of affected rows, {@code 0} if no such student exists
     */
    int delete(int id) throws SQLException;
}
