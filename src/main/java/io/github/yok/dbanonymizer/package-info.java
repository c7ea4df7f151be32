/**
 * Root package of the database anonymizer.
 *
 * <p>
 * Contains the Spring Boot entry point. Sub-packages:
 * </p>
 * <ul>
 * <li>{@code config}: {@code application.yml} bindings and the tables configuration loader</li>
 * <li>{@code core}: the anonymization engine</li>
 * <li>{@code db}: dialect handlers, metadata introspection and connections</li>
 * <li>{@code model}: value types</li>
 * <li>{@code util}: error reporting and log helpers</li>
 * </ul>
 */
package io.github.yok.dbanonymizer;
