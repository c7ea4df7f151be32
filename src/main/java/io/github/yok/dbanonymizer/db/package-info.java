/**
 * Database access package.
 *
 * <p>
 * Dialect handlers render pagination and identifier quoting per product; the introspector reads
 * table, column and primary-key names from JDBC metadata; the connection provider opens and
 * prepares sessions.
 * </p>
 */
package io.github.yok.dbanonymizer.db;
