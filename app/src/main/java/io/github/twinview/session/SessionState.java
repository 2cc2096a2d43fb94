package io.github.twinview.session;

/** Lifecycle of a compare pair. */
public enum SessionState {
    /** No file chosen yet. */
    UNPAIRED,
    /** First file chosen, waiting for the second one or for the first compare. */
    PAIRED,
    /** Compared; markers and alignment are trusted. */
    ACTIVE,
    /** Edited since the last compare in a way the incremental bookkeeping cannot follow. */
    DIRTY,
    CLOSED
}
