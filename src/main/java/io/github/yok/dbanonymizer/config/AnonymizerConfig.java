package io.github.yok.dbanonymizer.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code anonymizer} section in {@code application.yml}.
 *
 * <pre>
 * anonymizer:
 *   dialect-mode: SQLSERVER
 *   batch-size: 500
 *   tables-file: tables.json
 *   protected-column: UserName
 *   protected-values:
 *     - administrator
 *     - kentico-system-service
 *     - public
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "anonymizer")
@Data
public class AnonymizerConfig {

    /**
     * Dialect used for pagination, identifier quoting and schema resolution.
     */
    private DialectMode dialectMode = DialectMode.SQLSERVER;

    /**
     * Number of rows fetched and updated per page.
     */
    private int batchSize = 500;

    /**
     * Path of the tables configuration file. Written from the bundled defaults when missing.
     */
    private String tablesFile = "tables.json";

    /**
     * Column holding account names. Rows whose value in this column is one of
     * {@link #protectedValues} are never modified in that column.
     */
    private String protectedColumn = "UserName";

    /**
     * Built-in account names protected from anonymization (compared ignoring case).
     */
    private List<String> protectedValues =
            new ArrayList<>(List.of("administrator", "kentico-system-service", "public"));
}
