/**
 * Persistence layer for the {@code students} table.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [CLI]
 *     │
 *     ▼
 *   StudentRepository   ← classifies failures into OperationResult
 *     │
 *     ▼
 *   StudentDatabase     ← interface, one statement per method
 *     │
 *     ▼
 *   SqlStudentDatabase  ← JDBC, SQL from sql/*.sql
 *     │
 *     ▼
 *   ConnectionManager   ← one connection per operation
 * </pre>
 *
 * <h2>Table</h2>
 * The table is owned by the database administrator, not by this module:
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────┐
 * │ students                                                  │
 * ├──────────────────┬────────────────────────────────────────┤
 * │ student_id (PK)  │ SERIAL, assigned on insert             │
 * │ first_name       │ TEXT NOT NULL                          │
 * │ last_name        │ TEXT NOT NULL                          │
 * │ email            │ TEXT NOT NULL UNIQUE                   │
 * │ enrollment_date  │ DATE, nullable                         │
 * └──────────────────┴────────────────────────────────────────┘
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code select-all-students.sql}: all rows ordered by id</li>
 * <li>{@code insert-student.sql}: INSERT ... RETURNING student_id</li>
 * <li>{@code update-student-email.sql}: UPDATE email by id</li>
 * <li>{@code delete-student.sql}: DELETE by id</li>
 * </ul>
 */
package de.bsommerfeld.students.db;
