/**
 * Small static helpers shared by the command-line runner and the engine: fatal error reporting,
 * credential masking for logs and optional JDBC driver loading.
 */
package io.github.yok.dbanonymizer.util;
