/**
 * Anonymization engine.
 *
 * <p>
 * {@link io.github.yok.dbanonymizer.core.Anonymizer} drives each configured table through
 * validation and a page loop: {@link io.github.yok.dbanonymizer.core.RowPager} reads a page,
 * {@link io.github.yok.dbanonymizer.core.UpdateStatementBuilder} turns each row into a
 * parameterized UPDATE (consulting {@link io.github.yok.dbanonymizer.core.SkipPolicy} and
 * {@link io.github.yok.dbanonymizer.core.RandomValueGenerator}) and
 * {@link io.github.yok.dbanonymizer.core.UpdateBatchExecutor} executes the page in one batch.
 * </p>
 *
 * <p>
 * Database-specific differences (quoting, pagination) are delegated to handlers in {@code db}.
 * </p>
 */
package io.github.yok.dbanonymizer.core;
