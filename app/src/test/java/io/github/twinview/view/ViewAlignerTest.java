package io.github.twinview.view;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.align.AlignmentEntry;
import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.doc.DocumentTextView;
import io.github.twinview.testutil.TestCompareHost;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ViewAlignerTest {
    private static final int C = Markers.CHANGED_LINE;

    private CompareSettings settings;
    private ViewAligner aligner;
    private CompareOptions options;

    @BeforeEach
    void setUp() {
        settings = new CompareSettings();
        aligner = new ViewAligner(settings);
        options = new CompareOptions();
    }

    private static DocumentTextView lines(int count) {
        return new DocumentTextView("v" + count, TestCompareHost.numberedLines(count));
    }

    @Test
    void shorterSideGetsPaddingAboveTheNextAlignedLine() {
        var main = lines(10);
        var sub = lines(9);
        var table = new AlignmentTable(List.of(
                AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(3, C, 3, C), AlignmentEntry.of(6, 0, 5, 0)));

        assertTrue(aligner.isAlignmentNeeded(ViewId.MAIN, main, sub, table));

        aligner.alignDiffs(main, sub, table, options);

        assertEquals(1, sub.blankLinesBelow(4));
        assertEquals(main.visibleFromDocLine(6), sub.visibleFromDocLine(5));
        assertEquals(main.totalRows(), sub.totalRows());
        assertFalse(aligner.isAlignmentNeeded(ViewId.MAIN, main, sub, table));
    }

    @Test
    void realignReplacesOldPadding() {
        var main = lines(10);
        var sub = lines(9);
        sub.setBlankLinesBelow(1, 5);
        var table = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(2, 0, 2, 0)));

        aligner.alignDiffs(main, sub, table, options);

        assertEquals(0, sub.blankLinesBelow(1));
    }

    @Test
    void mismatchAtLineZeroIsCarriedToTheNextEntry() {
        var main = lines(10);
        var sub = lines(12);
        var table = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 2, 0), AlignmentEntry.of(3, 0, 5, 0)));

        aligner.alignDiffs(main, sub, table, options);

        assertEquals(3, main.blankLinesBelow(2));
        assertEquals(1, sub.blankLinesBelow(4));
        assertEquals(main.visibleFromDocLine(3), sub.visibleFromDocLine(5));
    }

    @Test
    void showOnlyDiffsHidesUnmarkedLines() {
        settings.setShowOnlyDiffs(true);
        var main = lines(6);
        var sub = lines(6);
        main.setMarkers(2, C);
        sub.setMarkers(2, C);
        var table = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(2, C, 2, C)));

        aligner.alignDiffs(main, sub, table, options);

        for (int line = 0; line < 6; line++) {
            assertEquals(line != 2, main.isLineHidden(line), "main line " + line);
        }

        settings.setShowOnlyDiffs(false);
        aligner.alignDiffs(main, sub, table, options);
        assertFalse(main.isLineHidden(0));
    }

    @Test
    void showOnlySelectionsHidesLinesOutsideComparedRanges() {
        var main = lines(8);
        var sub = lines(8);
        options.setSelectionCompare(true);
        options.setSelection(ViewId.MAIN, new LineRange(2, 4));
        options.setSelection(ViewId.SUB, new LineRange(3, 5));
        var table = new AlignmentTable(List.of(AlignmentEntry.of(2, 0, 3, 0)));

        aligner.alignDiffs(main, sub, table, options);

        assertTrue(main.isLineHidden(1));
        assertFalse(main.isLineHidden(2));
        assertTrue(main.isLineHidden(5));
        assertTrue(sub.isLineHidden(2));
        assertFalse(sub.isLineHidden(5));
        assertEquals(main.visibleFromDocLine(2), sub.visibleFromDocLine(3), "selections start on the same row");
    }
}
