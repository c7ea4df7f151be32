package io.github.yok.dbanonymizer.db.oracle;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.db.AbstractDbDialectHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Oracle dialect handler (12c or later for {@code OFFSET ... FETCH NEXT} pagination).
 *
 * @author Yasuharu.Okawauchi
 */
public class OracleDialectHandler extends AbstractDbDialectHandler {

    /**
     * Fixes the session NLS settings so that textual renderings of numbers are stable.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("ALTER SESSION SET NLS_NUMERIC_CHARACTERS = '.,'");
        }
    }

    /**
     * Oracle schemas are the upper-cased user name.
     *
     * @param entry connection config entry
     * @return schema name
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return entry.getUser() == null ? null : entry.getUser().toUpperCase(Locale.ROOT);
    }
}
