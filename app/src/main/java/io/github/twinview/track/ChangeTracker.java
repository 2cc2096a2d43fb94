package io.github.twinview.track;

import io.github.twinview.api.EditAction;
import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.config.CompareSettings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Remembers the diff markers of lines deleted from one compared view so that the insertion reverting the deletion
 * (undo, or redo of an undone deletion) gets them back, together with the {@link UndoData} captured at delete time.
 *
 * <p>A replace (delete immediately followed by an unrelated insert in one undoable step) is recognised by timing:
 * an insert of the wrong kind arriving within the replace-detection window after a push flags the pushed section.
 * When that replace is later undone, the deletion of the inserted half must not be tracked, which is what the flag
 * prevents. This is a heuristic; the window is configurable.
 */
public final class ChangeTracker {
    private static final Logger logger = LogManager.getLogger(ChangeTracker.class);

    private final CompareSettings settings;
    private final LongSupplier clock;
    private final Deque<DeletedSection> sections = new ArrayDeque<>();
    private long lastPushTime;

    public ChangeTracker(CompareSettings settings, LongSupplier clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Records that {@code length} lines starting at {@code startLine} are about to be deleted by {@code action}.
     *
     * @return false when nothing was recorded: an empty range, or the deletion of the inserted half of a replace
     *     that is being reverted
     */
    public boolean push(TextView view, EditAction action, int startLine, int length, UndoData undo) {
        if (length < 1) {
            return false;
        }

        var top = sections.peek();
        if (top != null && top.restoreAction == action && top.lineReplace) {
            logger.debug("Ignoring delete of replaced lines {}+{} ({})", startLine, length, action);
            return false;
        }

        var section = new DeletedSection(action, startLine, undo);

        if (!settings.isAutoRecompare()) {
            section.markers = view.markers(startLine, length, Markers.MASK_ALL);
            // the editor ORs joined lines' markers into the surviving line; the saved copy is what undo restores
            view.clearMarkers(startLine, length, Markers.MASK_ALL);

            if (startLine + length < view.lineCount()) {
                section.nextLineMarker = view.markers(startLine + length) & Markers.MASK_ALL;
            }
        } else {
            view.clearMarkers(startLine, length, Markers.MASK_ALL);
        }

        sections.push(section);
        lastPushTime = clock.getAsLong();

        logger.debug("Pushed {}", section);
        return true;
    }

    /**
     * Matches an insertion made by {@code action} at {@code startLine} against the last recorded deletion.
     *
     * @return the undo data pushed with the matching deletion, or null when the insertion does not revert it
     */
    public @Nullable UndoData pop(TextView view, EditAction action, int startLine) {
        var last = sections.peek();
        if (last == null || last.startLine != startLine) {
            return null;
        }

        if (last.restoreAction != action) {
            if (clock.getAsLong() < lastPushTime + settings.getReplaceDetectionWindowMs()) {
                logger.debug("Insert at {} follows delete within replace window, flagging {}", startLine, last);
                last.lineReplace = true;
            }
            return null;
        }

        if (last.markers.length > 0) {
            view.setMarkers(last.startLine, last.markers);

            if (last.nextLineMarker != 0) {
                final int nextLine = startLine + last.markers.length;
                view.clearMarkers(nextLine, Markers.MASK_ALL);
                view.addMarkers(nextLine, last.nextLineMarker);
            }
        }

        sections.pop();

        logger.debug("Popped {}", last);
        return last.undoData;
    }

    public int size() {
        return sections.size();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    public void clear() {
        sections.clear();
    }
}
