package io.github.yok.dbanonymizer.config;

import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code connections} list of {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: db1
 *     url: jdbc:sqlserver://localhost:1433;databaseName=cms
 *     user: sa
 *     password: secret
 *     driverClass: com.microsoft.sqlserver.jdbc.SQLServerDriver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries. Each entry is anonymized with the same tables configuration.
     */
    private List<Entry> connections;

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "db1")
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;
    }
}
