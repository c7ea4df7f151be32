package io.github.yok.dbanonymizer.db;

import io.github.yok.dbanonymizer.config.AnonymizerConfig;
import io.github.yok.dbanonymizer.config.DialectMode;
import io.github.yok.dbanonymizer.db.h2.H2DialectHandler;
import io.github.yok.dbanonymizer.db.mysql.MySqlDialectHandler;
import io.github.yok.dbanonymizer.db.oracle.OracleDialectHandler;
import io.github.yok.dbanonymizer.db.postgresql.PostgresqlDialectHandler;
import io.github.yok.dbanonymizer.db.sqlserver.SqlServerDialectHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to
 * {@link AnonymizerConfig#getDialectMode()}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbDialectHandlerFactory {

    private final AnonymizerConfig anonymizerConfig;

    /**
     * Creates the handler for the configured dialect mode.
     *
     * @return dialect handler
     * @throws IllegalArgumentException if no mode is configured
     */
    public DbDialectHandler create() {
        return create(anonymizerConfig.getDialectMode());
    }

    /**
     * Creates the handler for the given dialect mode.
     *
     * @param mode dialect mode
     * @return dialect handler
     * @throws IllegalArgumentException if {@code mode} is {@code null}
     */
    public DbDialectHandler create(DialectMode mode) {
        if (mode == null) {
            String msg = "Unsupported DialectMode: null";
            log.error(msg);
            throw new IllegalArgumentException(msg);
        }
        log.debug("Creating dialect handler for {}", mode);
        switch (mode) {
            case ORACLE:
                return new OracleDialectHandler();
            case POSTGRESQL:
                return new PostgresqlDialectHandler();
            case MYSQL:
                return new MySqlDialectHandler();
            case SQLSERVER:
                return new SqlServerDialectHandler();
            case H2:
            default:
                return new H2DialectHandler();
        }
    }
}
