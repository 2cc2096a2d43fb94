package io.github.twinview.api;

public enum CompareResult {
    /** Documents (or selections) are equal under the active options. */
    MATCH,
    MISMATCH,
    CANCELLED,
    ERROR
}
