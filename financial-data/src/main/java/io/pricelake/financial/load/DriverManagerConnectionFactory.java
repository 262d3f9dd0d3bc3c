package io.pricelake.financial.load;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * One fresh connection per call. Fine for a batch job; use a pooled DataSource for anything chattier.
 */
public class DriverManagerConnectionFactory implements ConnectionFactory {
    private final String jdbcUrl;
    private final String user;
    private final String password;

    public DriverManagerConnectionFactory(String jdbcUrl, String user, String password) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    @Override
    public Connection open() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
