package io.github.twinview.doc;

import com.google.common.base.CharMatcher;
import io.github.twinview.api.EditAction;
import io.github.twinview.api.EditNotification;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.TextView;
import io.github.twinview.api.TextViewException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import javax.swing.text.BadLocationException;
import javax.swing.text.Element;
import javax.swing.text.PlainDocument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Headless {@link TextView} over a Swing {@link PlainDocument}. Keeps per-line markers, blank padding and hidden
 * flags in step with the text, maintains an undo history with grouping, and reports every modification the way an
 * editor component does: a pre-delete notification while the text is still there, then the delete or insert with
 * its line count and the action that caused it.
 *
 * <p>Line bookkeeping on edits: when lines are joined the surviving line carries the union of the joined lines'
 * markers; when text is inserted at the start of a line the line's state moves down with its content.
 */
public final class DocumentTextView implements TextView {
    private static final Logger logger = LogManager.getLogger(DocumentTextView.class);
    private static final CharMatcher LINE_BREAK = CharMatcher.is('\n');

    public static final int DEFAULT_ROWS_ON_SCREEN = 40;

    private final String name;
    private final PlainDocument document = new PlainDocument();
    private final List<LineState> lines = new ArrayList<>();
    private final int rowsOnScreen;

    private int firstVisibleRow;
    private int caret;
    private int anchor;
    private int lastBlinkedLine = -1;

    private final Deque<List<UndoOp>> undoStack = new ArrayDeque<>();
    private final Deque<List<UndoOp>> redoStack = new ArrayDeque<>();
    @Nullable
    private List<UndoOp> openGroup;
    private int undoDepth;

    @Nullable
    private Consumer<EditNotification> modificationListener;

    private static final class LineState {
        int markers;
        int blanks;
        boolean hidden;
    }

    private record UndoOp(boolean insert, int position, String text) {}

    public DocumentTextView(String name, String text) {
        this(name, text, DEFAULT_ROWS_ON_SCREEN);
    }

    public DocumentTextView(String name, String text, int rowsOnScreen) {
        if (rowsOnScreen < 1) {
            throw new IllegalArgumentException("rowsOnScreen must be positive: " + rowsOnScreen);
        }
        this.name = name;
        this.rowsOnScreen = rowsOnScreen;
        try {
            document.insertString(0, text, null);
        } catch (BadLocationException e) {
            throw new TextViewException("Cannot load text of " + name, e);
        }
        for (int i = 0; i < lineCount(); i++) {
            lines.add(new LineState());
        }
    }

    public String name() {
        return name;
    }

    public void setModificationListener(@Nullable Consumer<EditNotification> listener) {
        this.modificationListener = listener;
    }

    /** Full buffer content. */
    public String text() {
        return getText(0, length());
    }

    // --- content ---

    @Override
    public int lineCount() {
        return document.getDefaultRootElement().getElementCount();
    }

    @Override
    public int length() {
        return document.getLength();
    }

    @Override
    public String lineText(int line) {
        checkLine(line);
        return getText(lineStart(line), lineEnd(line));
    }

    @Override
    public String getText(int startPos, int endPos) {
        try {
            return document.getText(startPos, endPos - startPos);
        } catch (BadLocationException e) {
            throw new TextViewException("Invalid range [" + startPos + ", " + endPos + ") in " + name, e);
        }
    }

    @Override
    public int lineFromPosition(int pos) {
        int clamped = Math.max(0, Math.min(pos, length()));
        return document.getDefaultRootElement().getElementIndex(clamped);
    }

    @Override
    public int lineStart(int line) {
        if (line >= lineCount()) {
            return length();
        }
        return element(Math.max(0, line)).getStartOffset();
    }

    @Override
    public int lineEnd(int line) {
        if (line >= lineCount()) {
            return length();
        }
        return Math.min(element(Math.max(0, line)).getEndOffset() - 1, length());
    }

    @Override
    public void insertText(int pos, String text) {
        applyInsert(pos, text, EditAction.USER);
    }

    @Override
    public void deleteRange(int pos, int length) {
        applyDelete(pos, length, EditAction.USER);
    }

    @Override
    public void beginUndoAction() {
        if (undoDepth++ == 0) {
            openGroup = new ArrayList<>();
        }
    }

    @Override
    public void endUndoAction() {
        if (undoDepth == 0) {
            logger.warn("Unbalanced endUndoAction() on {}", name);
            return;
        }
        if (--undoDepth == 0) {
            var group = openGroup;
            openGroup = null;
            if (group != null && !group.isEmpty()) {
                undoStack.push(group);
            }
        }
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    /** Reverts the last user edit group; notifications carry {@link EditAction#UNDO}. */
    public boolean undo() {
        if (undoStack.isEmpty()) {
            return false;
        }
        var group = undoStack.pop();
        for (int i = group.size() - 1; i >= 0; i--) {
            var op = group.get(i);
            if (op.insert()) {
                applyDelete(op.position(), op.text().length(), EditAction.UNDO);
            } else {
                applyInsert(op.position(), op.text(), EditAction.UNDO);
            }
        }
        redoStack.push(group);
        return true;
    }

    /** Replays the last undone group; notifications carry {@link EditAction#REDO}. */
    public boolean redo() {
        if (redoStack.isEmpty()) {
            return false;
        }
        var group = redoStack.pop();
        for (var op : group) {
            if (op.insert()) {
                applyInsert(op.position(), op.text(), EditAction.REDO);
            } else {
                applyDelete(op.position(), op.text().length(), EditAction.REDO);
            }
        }
        undoStack.push(group);
        return true;
    }

    private void applyInsert(int pos, String text, EditAction action) {
        if (text.isEmpty()) {
            return;
        }
        if (pos < 0 || pos > length()) {
            throw new TextViewException("Insert position " + pos + " outside of " + name + " [0, " + length() + "]");
        }

        final int line = lineFromPosition(pos);
        final boolean atLineStart = pos == lineStart(line);

        try {
            document.insertString(pos, text, null);
        } catch (BadLocationException e) {
            throw new TextViewException("Cannot insert at " + pos + " in " + name, e);
        }

        final int added = LINE_BREAK.countIn(text);
        final int insertAt = atLineStart ? line : line + 1;
        for (int i = 0; i < added; i++) {
            lines.add(insertAt, new LineState());
        }

        if (caret > pos) caret += text.length();
        if (anchor > pos) anchor += text.length();

        record(new UndoOp(true, pos, text), action);
        fire(EditNotification.inserted(pos, text.length(), added, action));
    }

    private void applyDelete(int pos, int length, EditAction action) {
        if (length <= 0) {
            return;
        }
        if (pos < 0 || pos + length > length()) {
            throw new TextViewException(
                    "Delete range [" + pos + ", " + (pos + length) + ") outside of " + name + " [0, " + length() + "]");
        }

        fire(EditNotification.beforeDelete(pos, length, action));

        final String removed = getText(pos, pos + length);
        final int startLine = lineFromPosition(pos);
        final int endLine = lineFromPosition(pos + length);

        try {
            document.remove(pos, length);
        } catch (BadLocationException e) {
            throw new TextViewException("Cannot delete [" + pos + ", " + (pos + length) + ") in " + name, e);
        }

        if (endLine > startLine) {
            var joined = lines.get(startLine);
            for (int l = startLine + 1; l <= endLine; l++) {
                joined.markers |= lines.get(l).markers;
            }
            lines.subList(startLine + 1, endLine + 1).clear();
        }

        caret = positionAfterDelete(caret, pos, length);
        anchor = positionAfterDelete(anchor, pos, length);

        record(new UndoOp(false, pos, removed), action);
        fire(EditNotification.deleted(pos, length, endLine - startLine, action));
    }

    private static int positionAfterDelete(int position, int pos, int length) {
        if (position <= pos) {
            return position;
        }
        return position >= pos + length ? position - length : pos;
    }

    private void record(UndoOp op, EditAction action) {
        if (action != EditAction.USER) {
            return;
        }
        if (openGroup != null) {
            openGroup.add(op);
        } else {
            var group = new ArrayList<UndoOp>();
            group.add(op);
            undoStack.push(group);
        }
        redoStack.clear();
    }

    private void fire(EditNotification notification) {
        logger.trace("{}: {}", name, notification);
        var listener = modificationListener;
        if (listener != null) {
            listener.accept(notification);
        }
    }

    // --- markers ---

    @Override
    public int markers(int line) {
        return isValidLine(line) ? lines.get(line).markers : 0;
    }

    @Override
    public void setMarkers(int line, int bitmap) {
        if (isValidLine(line)) {
            lines.get(line).markers = bitmap;
        }
    }

    @Override
    public void addMarkers(int line, int bitmap) {
        if (isValidLine(line)) {
            lines.get(line).markers |= bitmap;
        }
    }

    @Override
    public void clearMarkers(int line, int mask) {
        if (isValidLine(line)) {
            lines.get(line).markers &= ~mask;
        }
    }

    @Override
    public void clearAllMarkers(int mask) {
        for (var state : lines) {
            state.markers &= ~mask;
        }
    }

    @Override
    public int nextMarkedLine(int fromLine, int mask) {
        for (int l = Math.max(0, fromLine); l < lines.size(); l++) {
            if ((lines.get(l).markers & mask) != 0) {
                return l;
            }
        }
        return -1;
    }

    @Override
    public int previousMarkedLine(int fromLine, int mask) {
        for (int l = Math.min(fromLine, lines.size() - 1); l >= 0; l--) {
            if ((lines.get(l).markers & mask) != 0) {
                return l;
            }
        }
        return -1;
    }

    // --- blank padding ---

    @Override
    public int blankLinesBelow(int line) {
        return isValidLine(line) ? lines.get(line).blanks : 0;
    }

    @Override
    public void setBlankLinesBelow(int line, int count) {
        if (isValidLine(line)) {
            lines.get(line).blanks = Math.max(0, count);
        }
    }

    @Override
    public void clearAllBlankLines() {
        for (var state : lines) {
            state.blanks = 0;
        }
    }

    // --- hiding ---

    @Override
    public boolean isLineHidden(int line) {
        return isValidLine(line) && lines.get(line).hidden;
    }

    @Override
    public void hideLines(int firstLine, int lastLine) {
        for (int l = Math.max(0, firstLine); l <= lastLine && l < lines.size(); l++) {
            lines.get(l).hidden = true;
        }
    }

    @Override
    public void showAllLines() {
        for (var state : lines) {
            state.hidden = false;
        }
    }

    // --- rows and scrolling ---

    @Override
    public int visibleFromDocLine(int line) {
        int end = Math.max(0, Math.min(line, lines.size()));
        int row = 0;
        for (int l = 0; l < end; l++) {
            var state = lines.get(l);
            if (!state.hidden) {
                row += 1 + state.blanks;
            }
        }
        return row;
    }

    @Override
    public int docLineFromVisible(int row) {
        if (row <= 0) {
            return firstUnhiddenLine();
        }
        int current = 0;
        int lastUnhidden = 0;
        for (int l = 0; l < lines.size(); l++) {
            var state = lines.get(l);
            if (state.hidden) {
                continue;
            }
            lastUnhidden = l;
            int span = 1 + state.blanks;
            if (row < current + span) {
                return l;
            }
            current += span;
        }
        return lastUnhidden;
    }

    private int firstUnhiddenLine() {
        for (int l = 0; l < lines.size(); l++) {
            if (!lines.get(l).hidden) {
                return l;
            }
        }
        return 0;
    }

    @Override
    public int firstVisibleRow() {
        return firstVisibleRow;
    }

    @Override
    public void setFirstVisibleRow(int row) {
        firstVisibleRow = Math.max(0, Math.min(row, totalRows() - 1));
    }

    @Override
    public int rowsOnScreen() {
        return rowsOnScreen;
    }

    // --- caret and selection ---

    @Override
    public int caretPosition() {
        return caret;
    }

    @Override
    public void setEmptySelection(int pos) {
        caret = clampPosition(pos);
        anchor = caret;
    }

    @Override
    public void setSelection(int startPos, int endPos) {
        anchor = clampPosition(startPos);
        caret = clampPosition(endPos);
    }

    @Override
    public void clearSelection() {
        anchor = caret;
    }

    @Override
    public boolean hasSelection() {
        return anchor != caret;
    }

    @Override
    public LineRange selectionLines() {
        if (!hasSelection()) {
            return LineRange.NONE;
        }
        int start = Math.min(anchor, caret);
        int end = Math.max(anchor, caret);
        int first = lineFromPosition(start);
        int last = lineFromPosition(end);
        if (last > first && end == lineStart(last)) {
            --last;
        }
        return new LineRange(first, last);
    }

    @Override
    public void blinkLine(int line) {
        logger.trace("{}: blink line {}", name, line);
        lastBlinkedLine = line;
    }

    /** Line most recently passed to {@link #blinkLine}, -1 if none. */
    public int lastBlinkedLine() {
        return lastBlinkedLine;
    }

    // --- helpers ---

    private Element element(int line) {
        return document.getDefaultRootElement().getElement(line);
    }

    private boolean isValidLine(int line) {
        return line >= 0 && line < lines.size();
    }

    private void checkLine(int line) {
        if (!isValidLine(line)) {
            throw new TextViewException("Line " + line + " outside of " + name + " [0, " + lines.size() + ")");
        }
    }

    private int clampPosition(int pos) {
        return Math.max(0, Math.min(pos, length()));
    }

    @Override
    public String toString() {
        return "DocumentTextView{" + name + ", lines=" + lines.size() + ", length=" + length() + "}";
    }
}
