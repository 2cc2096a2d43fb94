package io.github.twinview.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.DeltaType;
import com.github.difflib.patch.Patch;
import com.google.common.base.CharMatcher;
import io.github.twinview.align.AlignmentEntry;
import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.CompareResult;
import io.github.twinview.api.CompareSummary;
import io.github.twinview.api.DiffEngine;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Line-based {@link DiffEngine} on top of java-diff-utils (Myers). Marks the views and builds the alignment table:
 * one entry at the start of every difference block and one at the first matching line after it.
 *
 * <p>Classification: lines replaced on both sides are {@link Markers#CHANGED_LINE}; lines only in the old file are
 * {@link Markers#REMOVED_LINE}, lines only in the new file {@link Markers#ADDED_LINE}. With move detection, removed
 * and added lines of identical (normalised) text are re-classified as {@link Markers#MOVED_LINE}. Intra-line (char
 * precision) differences are not computed.
 */
public final class JavaDiffUtilsDiffEngine implements DiffEngine {
    private static final Logger logger = LogManager.getLogger(JavaDiffUtilsDiffEngine.class);

    private static final Pattern LEADING_LINE_NUMBER = Pattern.compile("^\\s*\\d+");

    @Override
    public CompareSummary compare(TextView main, TextView sub, CompareOptions options) {
        final ViewId oldView = options.getOldFileView();
        final ViewId newView = options.getNewFileView();

        final Side oldSide = Side.load(oldView == ViewId.MAIN ? main : sub, oldView, options);
        final Side newSide = Side.load(newView == ViewId.MAIN ? main : sub, newView, options);

        logger.debug("Comparing {} old lines ({}) with {} new lines ({}), {}",
                oldSide.lines.size(), oldView, newSide.lines.size(), newView, options);

        return options.isFindUniqueMode()
                ? findUnique(oldSide, newSide)
                : diff(main, sub, oldSide, newSide, options);
    }

    private CompareSummary findUnique(Side oldSide, Side newSide) {
        var oldSet = new HashSet<>(oldSide.lines);
        var newSet = new HashSet<>(newSide.lines);

        int removed = 0;
        for (int i = 0; i < oldSide.lines.size(); i++) {
            if (!newSet.contains(oldSide.lines.get(i))) {
                oldSide.view.addMarkers(oldSide.realLine(i), Markers.REMOVED_LINE);
                ++removed;
            }
        }

        int added = 0;
        for (int i = 0; i < newSide.lines.size(); i++) {
            if (!oldSet.contains(newSide.lines.get(i))) {
                newSide.view.addMarkers(newSide.realLine(i), Markers.ADDED_LINE);
                ++added;
            }
        }

        final int match = newSide.lines.size() - added;
        final CompareResult result = added + removed == 0 ? CompareResult.MATCH : CompareResult.MISMATCH;

        logger.debug("Find unique: {} added, {} removed", added, removed);
        return new CompareSummary(result, added, removed, 0, 0, match, new AlignmentTable());
    }

    private CompareSummary diff(TextView main, TextView sub, Side oldSide, Side newSide, CompareOptions options) {
        final Patch<String> patch = DiffUtils.diff(oldSide.lines, newSide.lines);
        final List<AbstractDelta<String>> deltas = patch.getDeltas();

        if (deltas.isEmpty()) {
            return new CompareSummary(CompareResult.MATCH, 0, 0, 0, 0, newSide.lines.size(), new AlignmentTable());
        }

        final boolean oldIsMain = oldSide.viewId == ViewId.MAIN;
        final List<AlignmentEntry> entries = new ArrayList<>();

        // removed/added line numbers by normalised text, for move detection
        final Map<String, List<Integer>> removedByText = new HashMap<>();
        final Map<String, List<Integer>> addedByText = new HashMap<>();

        int added = 0;
        int removed = 0;
        int changed = 0;
        int diffNewLines = 0;

        addEntry(entries, main, sub, oldIsMain,
                oldSide.range.first(), 0, newSide.range.first(), 0);

        for (var delta : deltas) {
            final Chunk<String> source = delta.getSource();
            final Chunk<String> target = delta.getTarget();

            final int oldStart = oldSide.blockStart(source.getPosition());
            final int oldEnd = oldSide.blockEnd(source.getPosition(), source.size());
            final int newStart = newSide.blockStart(target.getPosition());
            final int newEnd = newSide.blockEnd(target.getPosition(), target.size());

            final int oldMask;
            final int newMask;

            if (delta.getType() == DeltaType.CHANGE) {
                oldMask = Markers.CHANGED_LINE;
                newMask = Markers.CHANGED_LINE;
                changed += Math.max(source.size(), target.size());
            } else if (delta.getType() == DeltaType.DELETE) {
                oldMask = Markers.REMOVED_LINE;
                newMask = 0;
                removed += source.size();
            } else if (delta.getType() == DeltaType.INSERT) {
                oldMask = 0;
                newMask = Markers.ADDED_LINE;
                added += target.size();
            } else {
                continue;
            }

            for (int i = 0; i < source.size(); i++) {
                final int line = oldSide.realLine(source.getPosition() + i);
                oldSide.view.addMarkers(line, oldMask);
                if (oldMask == Markers.REMOVED_LINE) {
                    removedByText.computeIfAbsent(source.getLines().get(i), k -> new ArrayList<>()).add(line);
                }
            }
            for (int i = 0; i < target.size(); i++) {
                final int line = newSide.realLine(target.getPosition() + i);
                newSide.view.addMarkers(line, newMask);
                if (newMask == Markers.ADDED_LINE) {
                    addedByText.computeIfAbsent(target.getLines().get(i), k -> new ArrayList<>()).add(line);
                }
            }
            diffNewLines += target.size();

            addEntry(entries, main, sub, oldIsMain, oldStart, oldMask, newStart, newMask);
            addEntry(entries, main, sub, oldIsMain, oldEnd, 0, newEnd, 0);
        }

        int moved = 0;
        if (options.isDetectMoves()) {
            moved = markMoves(oldSide.view, removedByText, newSide.view, addedByText);
            removed -= moved;
            added -= moved;
        }

        final int match = newSide.lines.size() - diffNewLines;
        final var table = new AlignmentTable(entries);

        logger.debug("Compare done: {} deltas, {} alignment entries", deltas.size(), table.size());
        return new CompareSummary(CompareResult.MISMATCH, added, removed, changed, moved, match, table);
    }

    /**
     * Appends an entry unless it falls outside either document or goes backwards. An entry on the main line of the
     * previous one replaces it: a block starting at the compared range start takes over the initial entry, and a
     * block empty on the main side is aligned by its end.
     */
    private static void addEntry(
            List<AlignmentEntry> entries,
            TextView main,
            TextView sub,
            boolean oldIsMain,
            int oldLine,
            int oldMask,
            int newLine,
            int newMask) {
        final int mainLine = oldIsMain ? oldLine : newLine;
        final int subLine = oldIsMain ? newLine : oldLine;

        if (mainLine > main.lastLine() || subLine > sub.lastLine()) {
            return;
        }
        final AlignmentEntry entry = oldIsMain
                ? AlignmentEntry.of(mainLine, oldMask, subLine, newMask)
                : AlignmentEntry.of(mainLine, newMask, subLine, oldMask);

        if (!entries.isEmpty()) {
            final int lastIdx = entries.size() - 1;
            final AlignmentEntry last = entries.get(lastIdx);
            final int lastMain = last.line(ViewId.MAIN);
            final int lastSub = last.line(ViewId.SUB);

            if (mainLine < lastMain || subLine < lastSub) {
                return;
            }
            if (mainLine == lastMain) {
                entries.set(lastIdx, entry);
                return;
            }
        }

        entries.add(entry);
    }

    private static int markMoves(
            TextView oldView,
            Map<String, List<Integer>> removedByText,
            TextView newView,
            Map<String, List<Integer>> addedByText) {
        int moved = 0;
        for (var entry : removedByText.entrySet()) {
            var addedLines = addedByText.get(entry.getKey());
            if (addedLines == null) {
                continue;
            }
            var removedLines = entry.getValue();
            final int pairs = Math.min(removedLines.size(), addedLines.size());
            for (int i = 0; i < pairs; i++) {
                oldView.clearMarkers(removedLines.get(i), Markers.REMOVED_LINE);
                oldView.addMarkers(removedLines.get(i), Markers.MOVED_LINE);
                newView.clearMarkers(addedLines.get(i), Markers.ADDED_LINE);
                newView.addMarkers(addedLines.get(i), Markers.MOVED_LINE);
            }
            moved += pairs;
        }
        return moved;
    }

    static String normalize(String line, CompareOptions options) {
        String result = line;
        if (options.isIgnoreLineNumbers()) {
            result = LEADING_LINE_NUMBER.matcher(result).replaceFirst("");
        }
        if (options.isIgnoreSpaces()) {
            result = CharMatcher.whitespace().removeFrom(result);
        }
        if (options.isIgnoreCase()) {
            result = result.toLowerCase(Locale.ROOT);
        }
        return result;
    }

    /** The compared lines of one view after normalisation, with their document line numbers. */
    private static final class Side {
        final TextView view;
        final ViewId viewId;
        final LineRange range;
        final List<String> lines = new ArrayList<>();
        final List<Integer> realLines = new ArrayList<>();

        private Side(TextView view, ViewId viewId, LineRange range) {
            this.view = view;
            this.viewId = viewId;
            this.range = range;
        }

        static Side load(TextView view, ViewId viewId, CompareOptions options) {
            LineRange range = new LineRange(0, view.lastLine());
            if (options.isSelectionCompare() && options.getSelection(viewId).isValid()) {
                var selection = options.getSelection(viewId);
                range = new LineRange(selection.first(), Math.min(selection.last(), view.lastLine()));
            }

            var side = new Side(view, viewId, range);
            for (int line = range.first(); line <= range.last(); line++) {
                String text = normalize(view.lineText(line), options);
                if (options.isIgnoreEmptyLines() && CharMatcher.whitespace().matchesAllOf(text)) {
                    continue;
                }
                side.lines.add(text);
                side.realLines.add(line);
            }
            return side;
        }

        int realLine(int index) {
            return realLines.get(index);
        }

        /** Document line where a chunk starting at {@code index} begins. */
        int blockStart(int index) {
            if (index < realLines.size()) {
                return realLines.get(index);
            }
            return realLines.isEmpty() ? range.first() : realLines.get(realLines.size() - 1) + 1;
        }

        /** Document line right after a chunk of {@code size} lines starting at {@code index}. */
        int blockEnd(int index, int size) {
            if (size == 0) {
                return blockStart(index);
            }
            return realLines.get(index + size - 1) + 1;
        }
    }
}
