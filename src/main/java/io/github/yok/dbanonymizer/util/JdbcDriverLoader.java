package io.github.yok.dbanonymizer.util;

import lombok.Generated;

/**
 * Utility for optional JDBC driver class loading.
 *
 * <p>
 * When a driver class name is configured for a connection entry, it is loaded explicitly via
 * {@link Class#forName(String)}. A {@code null} or blank value leaves driver discovery to JDBC 4
 * service loading.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcDriverLoader {

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    public static void loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        Class.forName(driverClass.trim());
    }
}
