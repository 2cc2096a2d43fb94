package io.github.twinview.api;

/**
 * Editor capability of one compared view: text buffer, per-line markers, blank padding rows, hidden lines,
 * scrolling and caret. Positions are character offsets; lines and rows are 0-based. A "row" is a visual line: every
 * unhidden document line occupies one row plus one row per blank padding line drawn below it.
 *
 * <p>Implementations report modifications to the host, which forwards them to the compare engine. Calls made by the
 * engine itself happen under its reentrancy guard; implementations need not protect against the resulting
 * notifications. Buffer failures are reported as {@link TextViewException}.
 */
public interface TextView {

    // --- content ---

    int lineCount();

    int length();

    /** Text of the line without its line terminator. */
    String lineText(int line);

    String getText(int startPos, int endPos);

    int lineFromPosition(int pos);

    /** Start position of the line; {@link #length()} for {@code line >= lineCount()}. */
    int lineStart(int line);

    /** Position right before the line terminator of the line. */
    int lineEnd(int line);

    void insertText(int pos, String text);

    void deleteRange(int pos, int length);

    void beginUndoAction();

    void endUndoAction();

    // --- markers ---

    int markers(int line);

    /** Replaces the full marker bitmap of the line. */
    void setMarkers(int line, int bitmap);

    void addMarkers(int line, int bitmap);

    void clearMarkers(int line, int mask);

    void clearAllMarkers(int mask);

    /** First line at or after {@code fromLine} carrying any of {@code mask}, or -1. */
    int nextMarkedLine(int fromLine, int mask);

    /** Last line at or before {@code fromLine} carrying any of {@code mask}, or -1. */
    int previousMarkedLine(int fromLine, int mask);

    // --- blank padding ---

    int blankLinesBelow(int line);

    void setBlankLinesBelow(int line, int count);

    void clearAllBlankLines();

    // --- hiding ---

    boolean isLineHidden(int line);

    /** Hides the inclusive line range. */
    void hideLines(int firstLine, int lastLine);

    void showAllLines();

    // --- rows and scrolling ---

    int visibleFromDocLine(int line);

    int docLineFromVisible(int row);

    int firstVisibleRow();

    void setFirstVisibleRow(int row);

    int rowsOnScreen();

    // --- caret and selection ---

    int caretPosition();

    void setEmptySelection(int pos);

    void setSelection(int startPos, int endPos);

    void clearSelection();

    boolean hasSelection();

    /** Lines covered by the selection, {@link LineRange#NONE} when nothing is selected. */
    LineRange selectionLines();

    /** Transient highlight of a line. */
    void blinkLine(int line);

    // --- conveniences ---

    default int caretLine() {
        return lineFromPosition(caretPosition());
    }

    default boolean isLineMarked(int line, int mask) {
        return line >= 0 && line < lineCount() && (markers(line) & mask) != 0;
    }

    /** Marker bitmaps of {@code count} lines starting at {@code startLine}, restricted to {@code mask}. */
    default int[] markers(int startLine, int count, int mask) {
        var result = new int[Math.max(0, count)];
        for (int i = 0; i < result.length; i++) {
            result[i] = markers(startLine + i) & mask;
        }
        return result;
    }

    /** Replaces the markers of consecutive lines starting at {@code startLine}. */
    default void setMarkers(int startLine, int[] bitmaps) {
        for (int i = 0; i < bitmaps.length && startLine + i < lineCount(); i++) {
            setMarkers(startLine + i, bitmaps[i]);
        }
    }

    default void clearMarkers(int startLine, int count, int mask) {
        for (int i = 0; i < count && startLine + i < lineCount(); i++) {
            clearMarkers(startLine + i, mask);
        }
    }

    default int lastLine() {
        return lineCount() - 1;
    }

    /** Number of rows the whole document occupies. */
    default int totalRows() {
        int last = lastLine();
        return visibleFromDocLine(last) + 1 + blankLinesBelow(last);
    }
}
