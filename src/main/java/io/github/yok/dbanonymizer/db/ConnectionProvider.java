package io.github.yok.dbanonymizer.db;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.util.JdbcDriverLoader;
import io.github.yok.dbanonymizer.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens JDBC connections for configured connection entries.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ConnectionProvider {

    /**
     * Opens a connection and applies the dialect's session initialization.
     *
     * <p>
     * The caller owns the returned connection and must close it.
     * </p>
     *
     * @param entry connection entry
     * @param dialectHandler dialect used for session initialization
     * @return open connection
     * @throws SQLException if the connection cannot be opened or prepared
     * @throws ClassNotFoundException if the configured driver class is missing
     */
    public Connection open(ConnectionConfig.Entry entry, DbDialectHandler dialectHandler)
            throws SQLException, ClassNotFoundException {
        log.info("[{}] Connecting: {}", entry.getId(), MaskingLogUtil.maskConnection(entry));
        JdbcDriverLoader.loadIfConfigured(entry.getDriverClass());
        Connection connection =
                DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
        try {
            dialectHandler.prepareConnection(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }
}
