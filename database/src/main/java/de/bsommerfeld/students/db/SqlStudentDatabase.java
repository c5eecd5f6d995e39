package de.bsommerfeld.students.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.students.core.domain.Student;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-backed {@link StudentDatabase}.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} and is loaded through {@link SqlLoader}.
 * The schema is not managed here; the {@code students} table must already
 * exist.
 *
 * <h3>Connection strategy</h3>
 * One connection per operation, obtained from {@link ConnectionManager} and
 * closed before the method returns. Statements run in auto-commit mode.
 */
@Singleton
public class SqlStudentDatabase implements StudentDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqlStudentDatabase.class);

    private final ConnectionManager connections;

    @Inject
    public SqlStudentDatabase(ConnectionManager connections) {
        this.connections = connections;
    }

    @Override
    public List<Student> findAll() throws SQLException {
        String sql = SqlLoader.load("select-all-students");
        List<Student> students = new ArrayList<>();

        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                students.add(mapStudent(rs));
            }
        }
        LOG.debug("[DB] Loaded {} students.", students.size());
        return students;
    }

    /**
     * Inserts via {@code INSERT ... RETURNING student_id} so the generated key
     * comes back in the same round trip.
     */
    @Override
    public int insert(String firstName, String lastName, String email, LocalDate enrollmentDate)
            throws SQLException {
        String sql = SqlLoader.load("insert-student");

        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, firstName);
            ps.setString(2, lastName);
            ps.setString(3, email);
            if (enrollmentDate != null) {
                ps.setDate(4, Date.valueOf(enrollmentDate));
            } else {
                ps.setNull(4, Types.DATE);
            }

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert returned no generated student_id");
                }
                int id = rs.getInt(1);
                LOG.debug("[DB] Inserted student {}", id);
                return id;
            }
        }
    }

    @Override
    public int updateEmail(int id, String email) throws SQLException {
        String sql = SqlLoader.load("update-student-email");

        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, email);
            ps.setInt(2, id);
            int updated = ps.executeUpdate();
            LOG.debug("[DB] Updated email of student {} ({} rows)", id, updated);
            return updated;
        }
    }

    @Override
    public int delete(int id) throws SQLException {
        String sql = SqlLoader.load("delete-student");

        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, id);
            int deleted = ps.executeUpdate();
            LOG.debug("[DB] Deleted student {} ({} rows)", id, deleted);
            return deleted;
        }
    }

    private Student mapStudent(ResultSet rs) throws SQLException {
        Date enrolled = rs.getDate("enrollment_date");
        return new Student(
                rs.getInt("student_id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("email"),
                enrolled != null ? enrolled.toLocalDate() : null);
    }
}
