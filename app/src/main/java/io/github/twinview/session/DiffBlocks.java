package io.github.twinview.session;

import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.view.ViewOps;

/**
 * Locates the difference block under a line together with the block of the other view drawn on the same rows.
 * Used by equalize and by block selection.
 */
final class DiffBlocks {
    private DiffBlocks() {}

    /**
     * A block of one view and its counterpart in the other view. Either range is {@link LineRange#NONE} when that
     * side has no marked lines, e.g. the other view only shows padding opposite a removed block.
     */
    record BlockPair(LineRange lines, LineRange otherLines) {
        boolean isEmpty() {
            return lines.isNone() && otherLines.isNone();
        }
    }

    static BlockPair find(TextView view, TextView other, int line, boolean showOnlyDiffs) {
        LineRange marked = ViewOps.markedSection(view, line, Markers.MASK_LINE);
        if (marked.isNone()) {
            marked = ViewOps.markedSection(view, line + 1, Markers.MASK_LINE);
        }

        int otherFirst;
        int otherLast;

        if (marked.isNone()) {
            // padding right below the line: its rows face the block of the other view
            final int row = view.visibleFromDocLine(line);
            otherFirst = other.docLineFromVisible(row + 1);
            otherLast = other.docLineFromVisible(view.visibleFromDocLine(Math.min(line + 1, view.lastLine())) - 1);
        } else {
            int startLine = marked.first();
            int startOffset = 0;

            if (!showOnlyDiffs && startLine > 1 && ViewOps.isLineAnnotated(view, startLine - 1)) {
                --startLine;
                startOffset = 1;
            }

            final int endLine = marked.last();
            final int endOffset = showOnlyDiffs ? 0 : view.blankLinesBelow(endLine);

            final int startRow = view.visibleFromDocLine(startLine) + startOffset;
            otherFirst = other.docLineFromVisible(startRow);
            if (other.visibleFromDocLine(otherFirst) != startRow) {
                // row is padding in the other view, the block starts on the next real line
                ++otherFirst;
            }
            otherLast = other.docLineFromVisible(view.visibleFromDocLine(endLine) + endOffset);
        }

        if (!showOnlyDiffs) {
            while (otherFirst <= otherLast && !other.isLineMarked(otherFirst, Markers.MASK_LINE)) {
                ++otherFirst;
            }
        } else {
            int l = otherLast;
            while (l > otherFirst && other.isLineMarked(l, Markers.MASK_LINE)) {
                --l;
            }
            if (l > otherFirst) {
                otherFirst = l + 1;
            }
        }

        while (otherLast >= otherFirst && !other.isLineMarked(otherLast, Markers.MASK_LINE)) {
            --otherLast;
        }

        final LineRange otherLines = otherFirst <= otherLast && otherFirst >= 0
                ? new LineRange(otherFirst, otherLast)
                : LineRange.NONE;

        return new BlockPair(marked, otherLines);
    }
}
