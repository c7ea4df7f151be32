package io.github.yok.dbanonymizer.model;

/**
 * Final state of one table pass.
 *
 * @author Yasuharu.Okawauchi
 */
public enum TableStatus {
    DONE, SKIPPED, FAILED
}
