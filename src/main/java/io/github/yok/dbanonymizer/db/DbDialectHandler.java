package io.github.yok.dbanonymizer.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * Composes focused contracts: connection/session control and SQL grammar. Metadata lookups go
 * through {@link TableIntrospector}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations, DbDialectSqlOperations {
}
