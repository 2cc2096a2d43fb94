package io.github.twinview.session;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareResult;
import io.github.twinview.api.CompareSummary;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.config.StatusType;
import io.github.twinview.track.ChangeTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompareStatusTest {
    private CompareSettings settings;
    private CompareSession session;

    @BeforeEach
    void setUp() {
        settings = new CompareSettings();
        session = new CompareSession(settings, binding(1, "old.txt", false, ViewId.MAIN));
        session.pairWith(binding(2, "new.txt", true, ViewId.SUB));
    }

    private FileBinding binding(long id, String name, boolean isNew, ViewId view) {
        return new FileBinding(id, name, isNew, view, new ChangeTracker(settings, () -> 0L));
    }

    private void applySummary(int added, int removed, int changed, int moved, int match) {
        session.applyResult(
                new CompareSummary(CompareResult.MISMATCH, added, removed, changed, moved, match, new AlignmentTable()));
    }

    @Test
    void summaryListsOnlyNonZeroCounts() {
        applySummary(2, 0, 3, 1, 0);

        assertEquals("Compare *** 6 Diff Lines:  2 Added , 3 Changed , 1 Moved",
                CompareStatus.render(session, StatusType.COMPARE_SUMMARY));
    }

    @Test
    void matchCountClosesTheSentence() {
        applySummary(0, 4, 0, 0, 12);

        assertEquals("Compare *** 4 Diff Lines:  4 Removed.  12 Match",
                CompareStatus.render(session, StatusType.COMPARE_SUMMARY));
    }

    @Test
    void optionsMode() {
        session.options().setIgnoreSpaces(true);
        session.options().setIgnoreCase(true);
        session.options().setDetectMoves(false);
        applySummary(1, 0, 0, 0, 0);

        assertEquals("Compare *** Ignore Spaces , Ignore Case",
                CompareStatus.render(session, StatusType.COMPARE_OPTIONS));
    }

    @Test
    void selectionsAndFindUniqueHeader() {
        session.options().setFindUniqueMode(true);
        session.options().setSelectionCompare(true);
        session.options().setSelection(ViewId.MAIN, new LineRange(9, 19));
        session.options().setSelection(ViewId.SUB, new LineRange(0, 4));
        applySummary(3, 2, 0, 0, 0);

        assertEquals("Find Unique Selections - 10-20 vs. 1-5 *** 5 Diff Lines:  3 Added , 2 Removed",
                CompareStatus.render(session, StatusType.COMPARE_SUMMARY));
    }

    @Test
    void dirtyPairShowsWarning() {
        applySummary(1, 0, 0, 0, 5);

        session.setCompareDirty();

        var status = CompareStatus.of(session, StatusType.COMPARE_SUMMARY);
        assertEquals(CompareStatus.MANUALLY_CHANGED_TEXT, status.text());
        assertEquals(SessionState.DIRTY, status.state());
        assertTrue(status.dirty());
        assertTrue(status.manuallyChanged());
    }

    @Test
    void disabledStatusIsEmptyEvenWhenDirty() {
        applySummary(1, 0, 0, 0, 5);
        session.setCompareDirty();

        assertEquals("", CompareStatus.render(session, StatusType.STATUS_DISABLED));
    }

    @Test
    void freshResultClearsDirtyState() {
        applySummary(1, 0, 0, 0, 5);
        session.setCompareDirty();

        applySummary(1, 0, 0, 0, 5);

        assertFalse(session.isDirty());
        assertEquals(SessionState.ACTIVE, session.state());
    }
}
