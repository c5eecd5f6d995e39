package de.bsommerfeld.students.core.config;

/**
 * Connection parameters for the PostgreSQL instance holding the
 * {@code students} table. Built once at startup by
 * {@link DatabaseConfigLoader} and handed to whatever opens connections.
 *
 * @param host     database host name
 * @param port     TCP port
 * @param user     login role
 * @param password password for {@code user}
 * @param database database name
 */
public record DatabaseConfig(String host, int port, String user, String password, String database) {

    /**
     * Returns the JDBC URL for this configuration, without credentials.
     */
    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "DatabaseConfig[" + user + "@" + host + ":" + port + "/" + database + "]";
    }
}
