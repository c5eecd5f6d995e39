package de.bsommerfeld.students.core.domain;

import java.time.LocalDate;

/**
 * One row of the {@code students} table.
 *
 * @param id             storage-generated identifier, never reassigned
 * @param firstName      first name
 * @param lastName       last name
 * @param email          email address, unique across all students
 * @param enrollmentDate date of enrollment, {@code null} when unknown
 */
public record Student(
        int id,
        String firstName,
        String lastName,
        String email,
        LocalDate enrollmentDate) {
}
