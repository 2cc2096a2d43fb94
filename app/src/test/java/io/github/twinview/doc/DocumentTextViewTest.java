package io.github.twinview.doc;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.api.EditAction;
import io.github.twinview.api.EditNotification;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.api.ModificationType;
import io.github.twinview.api.TextViewException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DocumentTextViewTest {
    private DocumentTextView view;
    private List<EditNotification> notifications;

    @BeforeEach
    void setUp() {
        view = new DocumentTextView("test", "zero\none\ntwo\nthree\nfour", 3);
        notifications = new ArrayList<>();
        view.setModificationListener(notifications::add);
    }

    @Test
    void linesAndPositions() {
        assertEquals(5, view.lineCount());
        assertEquals("two", view.lineText(2));
        assertEquals(9, view.lineStart(2));
        assertEquals(12, view.lineEnd(2));
        assertEquals(2, view.lineFromPosition(10));
        assertEquals(view.length(), view.lineStart(99));
        assertThrows(TextViewException.class, () -> view.lineText(5));
    }

    @Test
    @DisplayName("delete reports the pre-delete while the text is still there")
    void deleteNotifications() {
        view.setModificationListener(n -> {
            notifications.add(n);
            if (n.type() == ModificationType.BEFORE_DELETE) {
                assertEquals(5, view.lineCount(), "text must not be deleted yet");
            }
        });

        view.deleteRange(view.lineStart(1), view.lineStart(3) - view.lineStart(1));

        assertEquals(2, notifications.size());
        assertEquals(ModificationType.BEFORE_DELETE, notifications.get(0).type());
        assertEquals(ModificationType.DELETE_TEXT, notifications.get(1).type());
        assertEquals(-2, notifications.get(1).linesAdded());
        assertEquals(EditAction.USER, notifications.get(1).action());
        assertEquals("zero\nthree\nfour", view.text());
    }

    @Test
    void joinedLinesKeepTheUnionOfTheirMarkers() {
        view.setMarkers(1, Markers.CHANGED_LINE);
        view.setMarkers(2, Markers.ADDED_LINE);

        // "one\ntw" -> lines 1 and 2 become one line
        view.deleteRange(view.lineEnd(1), 1);

        assertEquals("onetwo", view.lineText(1));
        assertEquals(Markers.CHANGED_LINE | Markers.ADDED_LINE, view.markers(1));
        assertEquals(0, view.markers(2));
    }

    @Test
    void lineStateMovesDownWithInsertAtLineStart() {
        view.setMarkers(2, Markers.REMOVED_LINE);
        view.setBlankLinesBelow(2, 3);

        view.insertText(view.lineStart(2), "new a\nnew b\n");

        assertEquals(7, view.lineCount());
        assertEquals("two", view.lineText(4));
        assertEquals(Markers.REMOVED_LINE, view.markers(4));
        assertEquals(3, view.blankLinesBelow(4));
        assertEquals(0, view.markers(2));

        var inserted = notifications.get(notifications.size() - 1);
        assertEquals(ModificationType.INSERT_TEXT, inserted.type());
        assertEquals(2, inserted.linesAdded());
    }

    @Test
    void insertInsideLineKeepsStateOnTheFirstHalf() {
        view.setMarkers(1, Markers.CHANGED_LINE);

        view.insertText(view.lineStart(1) + 1, "X\nY");

        assertEquals("oX", view.lineText(1));
        assertEquals("Yne", view.lineText(2));
        assertEquals(Markers.CHANGED_LINE, view.markers(1));
        assertEquals(0, view.markers(2));
    }

    @Test
    void undoAndRedoReplayWithTheirAction() {
        view.deleteRange(view.lineStart(1), view.lineStart(2) - view.lineStart(1));
        notifications.clear();

        assertTrue(view.undo());
        assertEquals("zero\none\ntwo\nthree\nfour", view.text());
        assertEquals(EditAction.UNDO, notifications.get(0).action());
        assertEquals(1, notifications.get(0).linesAdded());

        notifications.clear();
        assertTrue(view.redo());
        assertEquals("zero\ntwo\nthree\nfour", view.text());
        assertEquals(ModificationType.BEFORE_DELETE, notifications.get(0).type());
        assertEquals(EditAction.REDO, notifications.get(0).action());

        assertFalse(view.redo());
    }

    @Test
    void undoActionGroupsEdits() {
        view.beginUndoAction();
        view.deleteRange(0, 5);
        view.insertText(0, "ZERO\n");
        view.endUndoAction();

        assertEquals("ZERO\none\ntwo\nthree\nfour", view.text());

        assertTrue(view.undo());
        assertEquals("zero\none\ntwo\nthree\nfour", view.text());
        assertFalse(view.canUndo());
    }

    @Test
    void rowsAccountForBlanksAndHiddenLines() {
        view.setBlankLinesBelow(0, 2);
        view.hideLines(2, 3);

        assertEquals(0, view.visibleFromDocLine(0));
        assertEquals(3, view.visibleFromDocLine(1));
        assertEquals(4, view.visibleFromDocLine(4));
        assertEquals(0, view.docLineFromVisible(2), "padding rows belong to the line above");
        assertEquals(1, view.docLineFromVisible(3));
        assertEquals(4, view.docLineFromVisible(4));
        assertEquals(5, view.totalRows());

        view.setFirstVisibleRow(100);
        assertEquals(4, view.firstVisibleRow(), "scrolling is clamped to the last row");
    }

    @Test
    void selectionEndingAtLineStartExcludesThatLine() {
        view.setSelection(view.lineStart(1), view.lineStart(3));
        assertEquals(new LineRange(1, 2), view.selectionLines());

        view.setSelection(view.lineStart(3) + 2, view.lineStart(1));
        assertEquals(new LineRange(1, 3), view.selectionLines());

        view.clearSelection();
        assertFalse(view.hasSelection());
        assertEquals(LineRange.NONE, view.selectionLines());
    }

    @Test
    void caretFollowsEdits() {
        view.setEmptySelection(view.lineStart(3));
        view.deleteRange(0, view.lineStart(1));
        assertEquals(2, view.caretLine());

        view.insertText(0, "a\nb\n");
        assertEquals(4, view.caretLine());
    }

    @Test
    void invalidRangesThrow() {
        assertThrows(TextViewException.class, () -> view.deleteRange(view.length() - 1, 5));
        assertThrows(TextViewException.class, () -> view.insertText(-1, "x"));
        assertTrue(notifications.isEmpty());
    }
}
