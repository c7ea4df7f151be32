/**
 * Configuration model package.
 *
 * <p>
 * Holds the values bound from {@code application.yml} (connections and anonymizer settings) and
 * the loader for the tables configuration file. Execution logic lives in {@code core} and
 * {@code db}.
 * </p>
 */
package io.github.yok.dbanonymizer.config;
