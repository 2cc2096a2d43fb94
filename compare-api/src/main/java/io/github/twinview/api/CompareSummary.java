package io.github.twinview.api;

import io.github.twinview.align.AlignmentTable;

/**
 * Result of a {@link DiffEngine} run: line counts per classification and the alignment table. Counts are fixed at
 * compare time; the alignment table is maintained incrementally by the owning session afterwards.
 */
public final class CompareSummary {
    private final CompareResult result;
    private final int diffLines;
    private final int added;
    private final int removed;
    private final int changed;
    private final int moved;
    private final int match;
    private final AlignmentTable alignment;

    public CompareSummary(
            CompareResult result,
            int added,
            int removed,
            int changed,
            int moved,
            int match,
            AlignmentTable alignment) {
        this.result = result;
        this.added = added;
        this.removed = removed;
        this.changed = changed;
        this.moved = moved;
        this.match = match;
        this.diffLines = added + removed + changed + moved;
        this.alignment = alignment;
    }

    public static CompareSummary empty() {
        return new CompareSummary(CompareResult.CANCELLED, 0, 0, 0, 0, 0, new AlignmentTable());
    }

    public static CompareSummary failed() {
        return new CompareSummary(CompareResult.ERROR, 0, 0, 0, 0, 0, new AlignmentTable());
    }

    public CompareResult result() {
        return result;
    }

    public int diffLines() {
        return diffLines;
    }

    public int added() {
        return added;
    }

    public int removed() {
        return removed;
    }

    public int changed() {
        return changed;
    }

    public int moved() {
        return moved;
    }

    public int match() {
        return match;
    }

    public AlignmentTable alignment() {
        return alignment;
    }

    @Override
    public String toString() {
        return String.format(
                "CompareSummary{%s, diff=%d, added=%d, removed=%d, changed=%d, moved=%d, match=%d, alignment=%d}",
                result, diffLines, added, removed, changed, moved, match, alignment.size());
    }
}
