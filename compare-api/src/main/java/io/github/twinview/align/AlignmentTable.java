package io.github.twinview.align;

import io.github.twinview.api.ViewId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Ordered line correspondence between the two compared views.
 *
 * <p>Entries are strictly ascending by main line and non-decreasing by sub line. After the diff engine produced the
 * table it changes only through {@link #shift}, which keeps it consistent for edits that do not change the diff
 * classification, and through wholesale {@link #replaceAll replacement} on (re)compare or undo.
 */
public final class AlignmentTable {
    private static final Logger logger = LogManager.getLogger(AlignmentTable.class);

    private final List<AlignmentEntry> entries;

    public AlignmentTable() {
        this.entries = new ArrayList<>();
    }

    public AlignmentTable(List<AlignmentEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public AlignmentEntry get(int index) {
        return entries.get(index);
    }

    public List<AlignmentEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Independent snapshot of the current entries. */
    public AlignmentTable copy() {
        return new AlignmentTable(entries);
    }

    public void replaceAll(AlignmentTable other) {
        if (other == this) {
            return;
        }
        entries.clear();
        entries.addAll(other.entries);
    }

    /**
     * Index of the first entry whose {@code view} line is at or after {@code line}; {@link #size()} when there is
     * none. Gallops with halving steps from the middle of the table, then scans linearly to the exact boundary.
     */
    public int indexAtOrAfter(ViewId view, int line) {
        final int size = entries.size();
        int idx = 0;

        for (int step = size / 2; step > 0; step /= 2) {
            if (idx + step < size && entries.get(idx + step).line(view) < line) {
                idx += step;
            }
        }

        while (idx < size && entries.get(idx).line(view) < line) {
            ++idx;
        }

        return idx;
    }

    /**
     * The other view's line aligned with {@code line} of {@code view}, or -1 when {@code line} is not an alignment
     * boundary.
     */
    public int correspondingLine(ViewId view, int line) {
        if (line < 0) {
            return -1;
        }

        final int idx = indexAtOrAfter(view, line);
        if (idx >= entries.size() || entries.get(idx).line(view) != line) {
            return -1;
        }

        return entries.get(idx).line(view.other());
    }

    /**
     * Moves {@code view}'s lines at or after {@code fromLine} by {@code lineDelta}. For a deletion (negative delta)
     * the entries inside the deleted range {@code [fromLine, fromLine - lineDelta)} are erased first.
     */
    public void shift(ViewId view, int fromLine, int lineDelta) {
        if (lineDelta == 0) {
            return;
        }

        final int startIdx = indexAtOrAfter(view, fromLine);
        if (startIdx >= entries.size()) {
            return;
        }

        if (lineDelta < 0) {
            int endIdx = startIdx;

            while (endIdx < entries.size() && entries.get(endIdx).line(view) < fromLine - lineDelta) {
                ++endIdx;
            }

            if (endIdx > startIdx) {
                logger.debug("Erasing {} alignment entries of {} view in lines [{}, {})",
                        endIdx - startIdx, view, fromLine, fromLine - lineDelta);
                entries.subList(startIdx, endIdx).clear();
            }
        }

        for (int i = startIdx; i < entries.size(); ++i) {
            entries.set(i, entries.get(i).shifted(view, lineDelta));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlignmentTable other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "AlignmentTable" + entries;
    }
}
