package io.github.twinview.track;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.align.AlignmentEntry;
import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.EditAction;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.doc.DocumentTextView;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeTrackerTest {
    private CompareSettings settings;
    private AtomicLong clock;
    private ChangeTracker tracker;
    private DocumentTextView view;

    @BeforeEach
    void setUp() {
        settings = new CompareSettings();
        clock = new AtomicLong(10_000);
        tracker = new ChangeTracker(settings, clock::get);
        view = new DocumentTextView("tracked", "a\nb\nc\nd\ne\nf");

        view.setMarkers(1, Markers.CHANGED_LINE);
        view.setMarkers(2, Markers.ADDED_LINE);
        view.setMarkers(3, Markers.REMOVED_LINE);
    }

    @Test
    void popOfTheRevertingInsertRestoresMarkersAndUndoData() {
        var alignment = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(1, 1, 1, 1)));
        var undo = new UndoData(new LineRange(0, 4), alignment, new int[] {Markers.CHANGED_LINE});

        assertTrue(tracker.push(view, EditAction.USER, 1, 2, undo));
        assertEquals(0, view.markers(1), "deleted lines lose their markers");
        assertEquals(0, view.markers(2));
        assertEquals(Markers.REMOVED_LINE, view.markers(3), "the line after the range is left alone");

        clock.addAndGet(1000);
        UndoData popped = tracker.pop(view, EditAction.UNDO, 1);

        assertSame(undo, popped);
        assertEquals(Markers.CHANGED_LINE, view.markers(1));
        assertEquals(Markers.ADDED_LINE, view.markers(2));
        assertEquals(Markers.REMOVED_LINE, view.markers(3));
        assertTrue(tracker.isEmpty());
    }

    @Test
    void nextLineMarkerIsRestoredInPlaceOfJoinedState() {
        tracker.push(view, EditAction.USER, 1, 2, UndoData.empty());

        // what the editor leaves on the line after the join
        view.setMarkers(3, Markers.CHANGED_LINE | Markers.REMOVED_LINE);

        tracker.pop(view, EditAction.UNDO, 1);
        assertEquals(Markers.REMOVED_LINE, view.markers(3));
    }

    @Test
    void deletedMarkersDoNotLeakIntoTheJoinedLine() {
        tracker.push(view, EditAction.USER, 1, 2, UndoData.empty());
        view.deleteRange(view.lineStart(1), view.lineStart(3) - view.lineStart(1));

        assertEquals("d", view.lineText(1));
        assertEquals(Markers.REMOVED_LINE, view.markers(1));
    }

    @Test
    void insertAtAnotherLineDoesNotPop() {
        tracker.push(view, EditAction.USER, 1, 2, UndoData.empty());

        assertNull(tracker.pop(view, EditAction.UNDO, 2));
        assertEquals(1, tracker.size());
    }

    @Test
    void emptyRangeIsNotTracked() {
        assertFalse(tracker.push(view, EditAction.USER, 1, 0, UndoData.empty()));
        assertTrue(tracker.isEmpty());
    }

    @Test
    void insertOfWrongKindWithinWindowFlagsReplace() {
        tracker.push(view, EditAction.USER, 1, 2, UndoData.empty());

        clock.addAndGet(settings.getReplaceDetectionWindowMs() - 1);
        assertNull(tracker.pop(view, EditAction.USER, 1), "a replacing insert is not a revert");

        // undoing the replace first deletes the inserted half: not tracked
        assertFalse(tracker.push(view, EditAction.UNDO, 1, 2, UndoData.empty()));
        assertEquals(1, tracker.size());

        // then re-inserts the original lines, which pops
        assertNotNull(tracker.pop(view, EditAction.UNDO, 1));
        assertTrue(tracker.isEmpty());
    }

    @Test
    void insertOfWrongKindAfterWindowIsUnrelated() {
        tracker.push(view, EditAction.USER, 1, 2, UndoData.empty());

        clock.addAndGet(settings.getReplaceDetectionWindowMs());
        assertNull(tracker.pop(view, EditAction.USER, 1));

        assertTrue(tracker.push(view, EditAction.UNDO, 1, 2, UndoData.empty()));
        assertEquals(2, tracker.size());
    }

    @Test
    void redoOfUndoneDeletionIsRevertedByUndoAgain() {
        tracker.push(view, EditAction.REDO, 3, 1, UndoData.empty());
        assertNull(tracker.pop(view, EditAction.REDO, 3));
        assertNotNull(tracker.pop(view, EditAction.UNDO, 3));
    }

    @Test
    void autoRecompareOnlyClearsMarkers() {
        settings.setAutoRecompare(true);

        tracker.push(view, EditAction.USER, 1, 2, UndoData.empty());
        assertEquals(0, view.markers(1));

        view.setMarkers(1, Markers.MOVED_LINE);
        assertNotNull(tracker.pop(view, EditAction.UNDO, 1));
        assertEquals(Markers.MOVED_LINE, view.markers(1), "nothing was saved to restore");
    }
}
