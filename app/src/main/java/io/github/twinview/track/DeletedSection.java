package io.github.twinview.track;

import io.github.twinview.api.EditAction;

/** Bookkeeping for one multi-line deletion, waiting for the insertion that reverts it. */
final class DeletedSection {
    final int startLine;
    final EditAction restoreAction;
    final UndoData undoData;

    int[] markers = new int[0];
    int nextLineMarker;
    boolean lineReplace;

    DeletedSection(EditAction action, int startLine, UndoData undoData) {
        this.startLine = startLine;
        this.restoreAction = action.reverse();
        this.undoData = undoData;
    }

    @Override
    public String toString() {
        return "DeletedSection{start=" + startLine + ", lines=" + markers.length + ", restore=" + restoreAction
                + (lineReplace ? ", replace" : "") + "}";
    }
}
