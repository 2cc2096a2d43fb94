package io.github.twinview.session;

/** What the session manager has to do after a session processed an edit notification. */
enum EditOutcome {
    NONE,
    /** Dirty state changed, the status line is outdated. */
    STATUS_CHANGED,
    /** Padding was dropped or hidden lines changed; both views need a full realignment. */
    REALIGN,
    /** Auto-recompare is on; the debounced recompare has to be (re)scheduled. */
    RECOMPARE,
    /** The compared selection collapsed; the pair cannot be maintained any more. */
    CLEAR_PAIR
}
