package io.github.twinview.view;

import io.github.twinview.api.LineRange;
import io.github.twinview.api.TextView;

/** Row, padding and marker queries shared by alignment, navigation and sync. */
public final class ViewOps {
    private ViewOps() {}

    public static boolean isLineAnnotated(TextView view, int line) {
        return view.blankLinesBelow(line) > 0;
    }

    /** Blank padding right below {@code line} (down) or right above it (up). */
    public static boolean isAdjacentAnnotation(TextView view, int line, boolean down) {
        if (down) {
            return isLineAnnotated(view, line);
        }
        return isLineAnnotated(view, previousUnhiddenLine(view, line));
    }

    /** Like {@link #isAdjacentAnnotation} but only when at least one padding row is on screen. */
    public static boolean isVisibleAdjacentAnnotation(TextView view, int line, boolean down) {
        if (!isAdjacentAnnotation(view, line, down)) {
            return false;
        }
        final int row = view.visibleFromDocLine(line);
        final int paddingRow = down ? row + 1 : row - 1;
        return isRowOnScreen(view, paddingRow);
    }

    public static boolean isRowOnScreen(TextView view, int row) {
        final int first = view.firstVisibleRow();
        return row >= first && row < first + view.rowsOnScreen();
    }

    public static boolean isLineVisible(TextView view, int line) {
        if (line < 0 || line >= view.lineCount() || view.isLineHidden(line)) {
            return false;
        }
        return isRowOnScreen(view, view.visibleFromDocLine(line));
    }

    /** Document line shown in the top screen row. */
    public static int firstLine(TextView view) {
        return view.docLineFromVisible(view.firstVisibleRow());
    }

    /** Document line shown in the bottom screen row. */
    public static int lastLine(TextView view) {
        return view.docLineFromVisible(view.firstVisibleRow() + view.rowsOnScreen() - 1);
    }

    public static void centerAt(TextView view, int line) {
        view.setFirstVisibleRow(view.visibleFromDocLine(line) - view.rowsOnScreen() / 2);
    }

    /** The line of {@code other} drawn on the same row as {@code line} of {@code view}. */
    public static int otherViewMatchingLine(TextView view, int line, TextView other) {
        return other.docLineFromVisible(view.visibleFromDocLine(line));
    }

    /** First line at or after {@code line} without any of {@code mask}; the last line when all remaining are marked. */
    public static int nextUnmarkedLine(TextView view, int line, int mask) {
        final int last = view.lastLine();
        int l = Math.max(0, line);
        while (l < last && view.isLineMarked(l, mask)) {
            ++l;
        }
        return Math.min(l, last);
    }

    /** Last line at or before {@code line} without any of {@code mask}; line 0 when all preceding are marked. */
    public static int previousUnmarkedLine(TextView view, int line, int mask) {
        int l = Math.min(line, view.lastLine());
        while (l > 0 && view.isLineMarked(l, mask)) {
            --l;
        }
        return Math.max(l, 0);
    }

    /** Nearest line above {@code line} that is not hidden, -1 when there is none. */
    public static int previousUnhiddenLine(TextView view, int line) {
        int l = Math.min(line, view.lineCount()) - 1;
        while (l >= 0 && view.isLineHidden(l)) {
            --l;
        }
        return l;
    }

    /** The run of consecutive lines around {@code line} carrying any of {@code mask}. */
    public static LineRange markedSection(TextView view, int line, int mask) {
        if (!view.isLineMarked(line, mask)) {
            return LineRange.NONE;
        }
        int first = line;
        while (first > 0 && view.isLineMarked(first - 1, mask)) {
            --first;
        }
        int last = line;
        while (last < view.lastLine() && view.isLineMarked(last + 1, mask)) {
            ++last;
        }
        return new LineRange(first, last);
    }

    /** Draws {@code count} blank rows right above {@code line}. */
    public static void setBlankSection(TextView view, int line, int count) {
        final int anchor = previousUnhiddenLine(view, line);
        if (anchor >= 0) {
            view.setBlankLinesBelow(anchor, count);
        }
    }

    public static void hideUnmarked(TextView view, int mask) {
        view.showAllLines();
        int runStart = -1;
        for (int l = 0; l < view.lineCount(); l++) {
            if (!view.isLineMarked(l, mask)) {
                if (runStart < 0) runStart = l;
            } else if (runStart >= 0) {
                view.hideLines(runStart, l - 1);
                runStart = -1;
            }
        }
        if (runStart >= 0) {
            view.hideLines(runStart, view.lastLine());
        }
    }

    public static void hideOutsideRange(TextView view, LineRange range) {
        view.showAllLines();
        if (!range.isValid()) {
            return;
        }
        if (range.first() > 0) {
            view.hideLines(0, range.first() - 1);
        }
        if (range.last() < view.lastLine()) {
            view.hideLines(range.last() + 1, view.lastLine());
        }
    }
}
