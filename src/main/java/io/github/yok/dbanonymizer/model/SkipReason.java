package io.github.yok.dbanonymizer.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reasons for leaving a configured table untouched.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum SkipReason {
    MISSING_TABLE("missing table"),
    NO_COLUMNS("no columns"),
    OVERLAPPING_COLUMNS("column listed as both anonymize and null column"),
    UNKNOWN_COLUMN("configured column does not exist"),
    NO_PRIMARY_KEY("no primary key");

    private final String description;
}
