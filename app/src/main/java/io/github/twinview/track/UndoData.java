package io.github.twinview.track;

import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.LineRange;
import org.jetbrains.annotations.Nullable;

/**
 * Compare state captured right before a multi-line deletion so that undoing the deletion can put it back exactly:
 * the selection-compare range of the edited view, the alignment table, and markers an equalize moved away from the
 * other view.
 */
public final class UndoData {
    private final LineRange selection;
    @Nullable
    private final AlignmentTable alignment;
    private final int[] otherViewMarks;

    public UndoData(LineRange selection, @Nullable AlignmentTable alignment, int[] otherViewMarks) {
        this.selection = selection;
        this.alignment = alignment;
        this.otherViewMarks = otherViewMarks.clone();
    }

    public static UndoData empty() {
        return new UndoData(LineRange.NONE, null, new int[0]);
    }

    public LineRange selection() {
        return selection;
    }

    public @Nullable AlignmentTable alignment() {
        return alignment;
    }

    public int[] otherViewMarks() {
        return otherViewMarks.clone();
    }

    public boolean hasSelection() {
        return !selection.isNone();
    }

    public boolean hasOtherViewMarks() {
        return otherViewMarks.length > 0;
    }

    @Override
    public String toString() {
        return "UndoData{selection=" + selection
                + ", alignment=" + (alignment == null ? "none" : alignment.size() + " entries")
                + ", otherViewMarks=" + otherViewMarks.length + "}";
    }
}
