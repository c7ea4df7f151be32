package io.github.yok.dbanonymizer.config;

/**
 * Database products the anonymizer knows how to paginate, quote and introspect.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DialectMode {
    ORACLE, POSTGRESQL, MYSQL, SQLSERVER, H2
}
