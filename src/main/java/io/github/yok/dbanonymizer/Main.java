package io.github.yok.dbanonymizer;

import com.google.common.base.Splitter;
import io.github.yok.dbanonymizer.config.AnonymizerConfig;
import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.config.TablesConfigLoader;
import io.github.yok.dbanonymizer.core.Anonymizer;
import io.github.yok.dbanonymizer.core.LoggingAnonymizationListener;
import io.github.yok.dbanonymizer.db.ConnectionProvider;
import io.github.yok.dbanonymizer.db.DbDialectHandler;
import io.github.yok.dbanonymizer.db.DbDialectHandlerFactory;
import io.github.yok.dbanonymizer.model.AnonymizationSummary;
import io.github.yok.dbanonymizer.model.TablesConfiguration;
import io.github.yok.dbanonymizer.util.ErrorHandler;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --target [db1,db2,…]} or {@code -t [db1,db2,…]} specifies the target DB ID list. If
 * omitted, all configured connections are anonymized.</li>
 * <li>{@code --tables [path]} or {@code -f [path]} overrides {@code anonymizer.tables-file}.</li>
 * </ul>
 *
 * <p>
 * For each target connection the tables configuration is applied through {@link Anonymizer}. A
 * table that fails is reported and the remaining tables still run; the process then ends with exit
 * status 1.
 * </p>
 *
 * <p>
 * {@link AnonymizerConfig} and {@link ConnectionConfig} are bound from {@code application.yml} by
 * Spring Boot.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see AnonymizerConfig
 * @see ConnectionConfig
 * @see DbDialectHandlerFactory
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final AnonymizerConfig anonymizerConfig;
    private final ConnectionConfig connectionConfig;
    private final TablesConfigLoader tablesConfigLoader;
    private final DbDialectHandlerFactory dialectFactory;
    private final ConnectionProvider connectionProvider;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String tablesFile = anonymizerConfig.getTablesFile();
        List<String> targetDbIds = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--target":
                case "-t":
                    if (i + 1 < args.length) {
                        targetDbIds = Splitter.on(',').trimResults().omitEmptyStrings()
                                .splitToList(args[++i]);
                    }
                    break;
                case "--tables":
                case "-f":
                    if (i + 1 < args.length) {
                        tablesFile = args[++i];
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        List<ConnectionConfig.Entry> entries = connectionConfig.getConnections() == null
                ? List.of()
                : connectionConfig.getConnections();
        if (targetDbIds.isEmpty()) {
            targetDbIds = entries.stream().map(ConnectionConfig.Entry::getId)
                    .collect(Collectors.toList());
        }
        log.info("Tables file: {}, Target DBs: {}", tablesFile, targetDbIds);

        TablesConfiguration tables;
        try {
            tables = tablesConfigLoader.load(Path.of(tablesFile));
        } catch (Exception e) {
            fail("Failed to read tables configuration: " + tablesFile, e);
            return;
        }

        for (ConnectionConfig.Entry entry : entries) {
            if (!targetDbIds.contains(entry.getId())) {
                log.info("[{}] Skipped: not in target DB list", entry.getId());
                continue;
            }
            anonymizeDatabase(entry, tables);
        }
        log.info("=== All target DBs processed ===");
    }

    /**
     * Anonymizes one connection.
     *
     * @param entry connection entry
     * @param tables tables configuration
     */
    void anonymizeDatabase(ConnectionConfig.Entry entry, TablesConfiguration tables) {
        String dbId = entry.getId();
        DbDialectHandler dialectHandler = dialectFactory.create();
        AnonymizationSummary summary;
        try (Connection connection = connectionProvider.open(entry, dialectHandler)) {
            Anonymizer anonymizer = Anonymizer.create(dialectHandler, anonymizerConfig,
                    new LoggingAnonymizationListener(dbId));
            summary = anonymizer.anonymize(connection, dialectHandler.resolveSchema(entry),
                    tables);
        } catch (Exception e) {
            fail("Anonymization failed (DB=" + dbId + ")", e);
            return;
        }
        if (summary.hasFailures()) {
            fail("Anonymization finished with failed tables (DB=" + dbId + ")", null);
        }
    }

    private void fail(String message, Exception cause) {
        exitCode = 1;
        if (cause == null) {
            ErrorHandler.errorAndExit(message);
        } else {
            ErrorHandler.errorAndExit(message, cause);
        }
    }

    /**
     * Returns 1 when any connection or table failed, 0 otherwise.
     *
     * @return process exit code
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
