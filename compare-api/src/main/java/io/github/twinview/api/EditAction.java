package io.github.twinview.api;

/**
 * Origin of a text modification as reported by the editor. Undo and redo replays arrive as ordinary insert/delete
 * notifications tagged with the action that produced them.
 */
public enum EditAction {
    USER,
    UNDO,
    REDO;

    /** The action that would revert a deletion performed by this action. */
    public EditAction reverse() {
        return this == UNDO ? REDO : UNDO;
    }
}
