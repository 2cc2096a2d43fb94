package io.github.twinview.align;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.api.ViewId;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AlignmentTableTest {

    private static AlignmentTable table(int[][] pairs) {
        var entries = new ArrayList<AlignmentEntry>();
        for (int[] p : pairs) {
            entries.add(AlignmentEntry.of(p[0], 0, p[1], 0));
        }
        return new AlignmentTable(entries);
    }

    private static AlignmentTable randomTable(Random random, int size) {
        var entries = new ArrayList<AlignmentEntry>(size);
        int main = 0;
        int sub = 0;
        for (int i = 0; i < size; i++) {
            main += 1 + random.nextInt(5);
            sub += random.nextInt(5);
            entries.add(AlignmentEntry.of(main, random.nextInt(3), sub, random.nextInt(3)));
        }
        return new AlignmentTable(entries);
    }

    private static int linearIndexAtOrAfter(AlignmentTable table, ViewId view, int line) {
        for (int i = 0; i < table.size(); i++) {
            if (table.get(i).line(view) >= line) {
                return i;
            }
        }
        return table.size();
    }

    @Test
    void indexAtOrAfterOnEmptyTable() {
        var table = new AlignmentTable();
        assertEquals(0, table.indexAtOrAfter(ViewId.MAIN, 0));
        assertEquals(0, table.indexAtOrAfter(ViewId.SUB, 42));
    }

    @Test
    @DisplayName("indexAtOrAfter returns the minimal qualifying index on random tables")
    void indexAtOrAfterMatchesLinearScan() {
        var random = new Random(20240611L);
        int[] sizes = {0, 1, 2, 3, 7, 8, 31, 64, 100, 1000, 4097, 10_000};

        for (int size : sizes) {
            var table = randomTable(random, size);
            int maxLine = size == 0 ? 10 : table.get(size - 1).line(ViewId.MAIN) + 3;

            for (int sample = 0; sample < 300; sample++) {
                int line = random.nextInt(maxLine + 1) - 1;
                for (ViewId view : ViewId.values()) {
                    assertEquals(
                            linearIndexAtOrAfter(table, view, line),
                            table.indexAtOrAfter(view, line),
                            "size=" + size + ", view=" + view + ", line=" + line);
                }
            }
        }
    }

    @Test
    void indexAtOrAfterWithDuplicateSubLines() {
        var table = table(new int[][] {{0, 0}, {3, 3}, {6, 3}, {8, 5}});
        assertEquals(1, table.indexAtOrAfter(ViewId.SUB, 3));
        assertEquals(3, table.indexAtOrAfter(ViewId.SUB, 4));
        assertEquals(2, table.indexAtOrAfter(ViewId.MAIN, 4));
    }

    @Test
    void correspondingLineOnlyForExactBoundaries() {
        var table = table(new int[][] {{0, 0}, {3, 3}, {6, 5}});

        assertEquals(5, table.correspondingLine(ViewId.MAIN, 6));
        assertEquals(6, table.correspondingLine(ViewId.SUB, 5));
        assertEquals(3, table.correspondingLine(ViewId.MAIN, 3));
        assertEquals(-1, table.correspondingLine(ViewId.MAIN, 4));
        assertEquals(-1, table.correspondingLine(ViewId.SUB, 9));
        assertEquals(-1, table.correspondingLine(ViewId.MAIN, -1));
    }

    @Test
    @DisplayName("Positive shift moves entries at/after the line and keeps earlier ones")
    void shiftInsertMovesTail() {
        var random = new Random(7L);
        for (int round = 0; round < 50; round++) {
            var table = randomTable(random, 1 + random.nextInt(200));
            var before = table.copy();
            var view = random.nextBoolean() ? ViewId.MAIN : ViewId.SUB;
            int from = random.nextInt(table.get(table.size() - 1).line(view) + 2);
            int delta = 1 + random.nextInt(10);

            table.shift(view, from, delta);

            assertEquals(before.size(), table.size());
            for (int i = 0; i < table.size(); i++) {
                var old = before.get(i);
                var now = table.get(i);
                int expected = old.line(view) >= from ? old.line(view) + delta : old.line(view);
                assertEquals(expected, now.line(view));
                assertEquals(old.side(view.other()), now.side(view.other()), "other view must stay untouched");
                if (i > 0) {
                    assertTrue(table.get(i - 1).line(view) <= now.line(view), "sortedness must be preserved");
                }
            }
        }
    }

    @Test
    @DisplayName("Negative shift erases entries inside the deleted range before shifting")
    void shiftDeleteErasesRange() {
        var table = table(new int[][] {{0, 0}, {3, 3}, {4, 4}, {6, 5}, {9, 8}});

        table.shift(ViewId.MAIN, 3, -3);

        assertEquals(
                List.of(
                        AlignmentEntry.of(0, 0, 0, 0),
                        AlignmentEntry.of(3, 0, 5, 0),
                        AlignmentEntry.of(6, 0, 8, 0)),
                table.entries());
    }

    @Test
    void shiftDeleteOnSubViewKeepsMainLines() {
        var table = table(new int[][] {{0, 0}, {3, 3}, {6, 5}});

        table.shift(ViewId.SUB, 2, -2);

        assertEquals(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(6, 0, 3, 0)), table.entries());
    }

    @Test
    void shiftPastEndIsNoOp() {
        var table = table(new int[][] {{0, 0}, {3, 3}});
        var before = table.copy();

        table.shift(ViewId.MAIN, 10, 4);
        table.shift(ViewId.MAIN, 10, -4);
        table.shift(ViewId.SUB, 0, 0);

        assertEquals(before, table);
    }

    @Test
    void copyIsIndependentSnapshot() {
        var table = table(new int[][] {{0, 0}, {3, 3}});
        var snapshot = table.copy();

        table.shift(ViewId.MAIN, 0, 2);
        assertNotEquals(snapshot, table);

        table.replaceAll(snapshot);
        assertEquals(snapshot, table);
    }
}
