package io.github.twinview.api;

/** Kind of low-level buffer modification an editor reports. */
public enum ModificationType {
    /** Sent before text is removed; the buffer still holds the text about to go. */
    BEFORE_DELETE,
    DELETE_TEXT,
    INSERT_TEXT
}
