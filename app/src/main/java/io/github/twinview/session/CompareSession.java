package io.github.twinview.session;

import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.CompareResult;
import io.github.twinview.api.CompareSummary;
import io.github.twinview.api.EditNotification;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.api.ModificationType;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.config.TimingConstants;
import io.github.twinview.track.UndoData;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A compare pair and everything that keeps its comparison usable while both files are edited: the options it was
 * compared with, the summary with its alignment table, and the dirty state.
 *
 * <p>Edits are tracked incrementally. A multi-line delete pushes a snapshot on the edited file's
 * {@link io.github.twinview.track.ChangeTracker}; the insert that reverts it (undo or redo) pops the snapshot and
 * restores markers, alignment and compared selection exactly. Any other edit that adds or removes lines shifts the
 * alignment table and, when it cannot be followed exactly, marks the comparison dirty.
 */
public final class CompareSession {
    private static final Logger logger = LogManager.getLogger(CompareSession.class);

    private static final int[] NO_MARKS = new int[0];

    private final CompareSettings settings;
    private final FileBinding first;

    @Nullable
    private FileBinding second;

    private SessionState state = SessionState.PAIRED;
    private final CompareOptions options = new CompareOptions();
    private CompareSummary summary = CompareSummary.empty();

    private boolean dirty;
    private boolean manuallyChanged;
    private boolean stale;
    private int inEqualize;
    private int autoUpdateDelay;

    // result of the last pre-delete push; false while a replace is being reverted
    private boolean notReverting = true;

    private int[] copiedSectionMarks = NO_MARKS;

    public CompareSession(CompareSettings settings, FileBinding first) {
        this.settings = settings;
        this.first = first;
    }

    // --- pairing ---

    public FileBinding first() {
        return first;
    }

    public @Nullable FileBinding second() {
        return second;
    }

    public void pairWith(FileBinding file) {
        if (file.bufferId() == first.bufferId()) {
            throw new IllegalArgumentException("Cannot compare buffer " + file.bufferId() + " with itself");
        }
        if (file.view() == first.view()) {
            throw new IllegalArgumentException("Compared files must be shown in different views");
        }
        this.second = file;
    }

    public boolean isComplete() {
        return second != null;
    }

    public boolean contains(long bufferId) {
        return first.bufferId() == bufferId || (second != null && second.bufferId() == bufferId);
    }

    private FileBinding requireSecond() {
        return Objects.requireNonNull(second, "compare pair is not complete");
    }

    public FileBinding file(ViewId view) {
        return first.view() == view ? first : requireSecond();
    }

    public FileBinding fileByBuffer(long bufferId) {
        return first.bufferId() == bufferId ? first : requireSecond();
    }

    public FileBinding otherFile(long bufferId) {
        return first.bufferId() == bufferId ? requireSecond() : first;
    }

    public FileBinding newFile() {
        return first.isNew() ? first : requireSecond();
    }

    public FileBinding oldFile() {
        return first.isNew() ? requireSecond() : first;
    }

    // --- compare state ---

    public SessionState state() {
        return state;
    }

    public CompareOptions options() {
        return options;
    }

    public CompareSummary summary() {
        return summary;
    }

    public AlignmentTable alignment() {
        return summary.alignment();
    }

    /** Installs a fresh compare result; the comparison is trusted again. */
    public void applyResult(CompareSummary result) {
        this.summary = result;
        this.dirty = false;
        this.manuallyChanged = false;
        this.stale = false;
        this.autoUpdateDelay = 0;
        this.copiedSectionMarks = NO_MARKS;
        this.state = result.result() == CompareResult.MISMATCH ? SessionState.ACTIVE : SessionState.PAIRED;
    }

    public void close() {
        state = SessionState.CLOSED;
    }

    public boolean isDirty() {
        return dirty;
    }

    public boolean isManuallyChanged() {
        return manuallyChanged;
    }

    /**
     * Whether an equalize changed the compared text since the last compare. The alignment was kept up to date, so
     * the session stays trusted, but counts in the summary may be off.
     */
    public boolean isStale() {
        return stale;
    }

    void setCompareDirty() {
        dirty = true;
        manuallyChanged = true;
        if (state == SessionState.ACTIVE) {
            state = SessionState.DIRTY;
        }
    }

    /** Delay of the pending automatic recompare requested by the last edit, 0 when none. */
    public int autoUpdateDelay() {
        return autoUpdateDelay;
    }

    public void clearAutoUpdateDelay() {
        autoUpdateDelay = 0;
    }

    // --- edit tracking ---

    /**
     * Processes one modification of the buffer shown in {@code viewId}.
     *
     * @param textView the modified view
     * @param other the view of the other compared file
     */
    EditOutcome onModified(ViewId viewId, TextView textView, TextView other, EditNotification notification) {
        final FileBinding file = file(viewId);
        final boolean autoRecompare = settings.isAutoRecompare();

        if (notification.type() == ModificationType.BEFORE_DELETE) {
            final int startLine = textView.lineFromPosition(notification.position());
            final int endLine = textView.lineFromPosition(notification.position() + notification.length());

            if (endLine <= startLine) {
                return EditOutcome.NONE;
            }

            logger.debug("Before delete: {} view, lines {}-{}", viewId, startLine + 1, endLine);

            final LineRange selection = options.isSelectionCompare() ? options.getSelection(viewId) : LineRange.NONE;
            AlignmentTable alignment = null;
            int[] otherMarks = NO_MARKS;

            if (!autoRecompare) {
                alignment = summary.alignment().copy();
                if (inEqualize > 0 && copiedSectionMarks.length > 0) {
                    otherMarks = copiedSectionMarks;
                    copiedSectionMarks = NO_MARKS;
                }
            }

            notReverting = file.tracker().push(
                    textView, notification.action(), startLine, endLine - startLine,
                    new UndoData(selection, alignment, otherMarks));
            return EditOutcome.NONE;
        }

        final int linesAdded = notification.linesAdded();
        final int startLine = textView.lineFromPosition(notification.position());

        UndoData undo = null;
        boolean selectionsAdjusted = false;
        boolean realign = false;

        if (notification.type() == ModificationType.INSERT_TEXT && linesAdded != 0) {
            logger.debug("Insert: {} view, lines {}-{}", viewId, startLine + 1, startLine + linesAdded);

            notReverting = true;
            undo = file.tracker().pop(textView, notification.action(), startLine);

            if (undo != null) {
                final LineRange selection = undo.selection();
                if (selection.isValid() && !selection.equals(options.getSelection(viewId))) {
                    options.setSelection(viewId, selection);
                    selectionsAdjusted = true;
                    logger.debug("Selection restored: {}", selection);
                }

                final AlignmentTable alignment = undo.alignment();
                if (!autoRecompare && alignment != null) {
                    summary.alignment().replaceAll(alignment);
                    logger.debug("Alignment restored");

                    if (undo.hasOtherViewMarks()) {
                        final int alignLine = summary.alignment().correspondingLine(viewId, startLine);
                        if (alignLine >= 0) {
                            other.setMarkers(alignLine, undo.otherViewMarks());
                            realign = settings.isShowOnlyDiffs();
                            logger.debug("Other view markers restored at {}", alignLine);
                        }
                    }
                }
            }
        }

        if (!notification.isTextChange()) {
            return EditOutcome.NONE;
        }

        if (linesAdded == 0) {
            notReverting = true;
        }

        boolean statusChanged = false;

        if (!autoRecompare && notReverting && undo == null && !dirty
                && touchesComparedText(viewId, notification, startLine)) {
            if (inEqualize > 0) {
                if (!stale) {
                    stale = true;
                    statusChanged = true;
                }
            } else {
                setCompareDirty();
                statusChanged = true;
            }
        }

        if (options.isSelectionCompare() && linesAdded != 0 && undo == null && !selectionsAdjusted) {
            final LineRange selection = options.getSelection(viewId);
            final int endLine = startLine + Math.abs(linesAdded) - 1;

            int selFirst = selection.first();
            int selLast = selection.last();
            int boundary = startLine;

            if (selFirst > startLine) {
                if (linesAdded > 0 || selFirst > endLine) {
                    selFirst += linesAdded;
                } else {
                    selFirst = startLine;
                }
                selectionsAdjusted = true;
            }

            // Equalizing the block right after the selection end: the inserted block belongs to the selection
            if (inEqualize > 0 && selLast == startLine - 1 && linesAdded > 0) {
                --boundary;
            }

            if (selLast >= boundary) {
                if (linesAdded > 0 || selLast >= endLine) {
                    selLast += linesAdded;
                } else {
                    selLast = startLine - 1;
                }
                selectionsAdjusted = true;
            }

            options.setSelection(viewId, new LineRange(selFirst, selLast));

            if (inEqualize == 0 && selLast < selFirst) {
                logger.debug("Compared selection in {} view collapsed", viewId);
                return EditOutcome.CLEAR_PAIR;
            }

            if (selectionsAdjusted) {
                logger.debug("Selection adjusted: {}", options.getSelection(viewId));
            }
        }

        if (autoRecompare) {
            // a single-line change gets the longer delay: the user is probably still typing
            autoUpdateDelay = linesAdded != 0
                    ? TimingConstants.MULTI_LINE_RECOMPARE_DELAY_MS
                    : TimingConstants.SINGLE_LINE_RECOMPARE_DELAY_MS;
            return EditOutcome.RECOMPARE;
        }

        if (linesAdded != 0) {
            if (undo == null && (!options.isSelectionCompare() || selectionsAdjusted)) {
                summary.alignment().shift(viewId, startLine, linesAdded);
                logger.debug("Alignment shifted: {} view from line {} by {}", viewId, startLine, linesAdded);
            }

            if (selectionsAdjusted) {
                textView.clearAllBlankLines();
                other.clearAllBlankLines();
                realign = true;
            }
        }

        if (realign) {
            return EditOutcome.REALIGN;
        }
        return statusChanged ? EditOutcome.STATUS_CHANGED : EditOutcome.NONE;
    }

    // --- equalize ---

    /**
     * Replaces the difference block at {@code line} of {@code viewId} with the facing block of the other view, as
     * one undoable action. Edit notifications fired meanwhile are tracked with the in-equalize counter raised, so
     * they shift the alignment and carry the other view's markers instead of flagging a manual change.
     *
     * @return true when text was changed
     */
    boolean equalize(ViewId viewId, TextView textView, TextView other, int line) {
        if (options.isFindUniqueMode()) {
            return false;
        }

        final boolean showOnlyDiffs = settings.isShowOnlyDiffs();
        final DiffBlocks.BlockPair blocks = DiffBlocks.find(textView, other, line, showOnlyDiffs);

        if (blocks.isEmpty()) {
            logger.debug("Nothing to equalize at {} view line {}", viewId, line);
            return false;
        }

        final LineRange marked = blocks.lines();
        final LineRange otherMarked = blocks.otherLines();

        logger.debug("Equalizing {} view block {} with {}", viewId, marked, otherMarked);

        ++inEqualize;
        textView.beginUndoAction();
        final int firstVisibleRow = textView.firstVisibleRow();

        try {
            textView.clearSelection();

            if (!otherMarked.isNone()) {
                if (!settings.isAutoRecompare()) {
                    // the markers go with the copied block and undo puts them back
                    copiedSectionMarks = other.markers(otherMarked.first(), otherMarked.length(), Markers.MASK_ALL);
                    for (int l = otherMarked.first(); l <= otherMarked.last(); l++) {
                        other.setBlankLinesBelow(l, 0);
                    }
                }
                other.clearMarkers(otherMarked.first(), otherMarked.length(), Markers.MASK_ALL);
            }

            if (!marked.isNone()) {
                if (!otherMarked.isNone() && marked.first() > 0) {
                    textView.setBlankLinesBelow(marked.first() - 1, 0);
                }

                final int startPos = textView.lineStart(marked.first());
                final int endPos = textView.lineStart(marked.last() + 1);
                final boolean lastMarked = endPos == textView.length();

                textView.deleteRange(startPos, endPos - startPos);

                if (lastMarked) {
                    textView.clearMarkers(textView.lineFromPosition(startPos), Markers.MASK_ALL);
                }
            }

            if (!otherMarked.isNone()) {
                insertOtherBlock(viewId, textView, other, line, marked, otherMarked, showOnlyDiffs);
            }
        } finally {
            textView.setFirstVisibleRow(firstVisibleRow);
            textView.endUndoAction();
            --inEqualize;
            copiedSectionMarks = NO_MARKS;
        }

        return true;
    }

    private boolean touchesComparedText(ViewId viewId, EditNotification notification, int startLine) {
        if (!options.isSelectionCompare()) {
            return true;
        }
        final LineRange selection = options.getSelection(viewId);
        final int linesAdded = notification.linesAdded();
        return selection.contains(startLine)
                || (linesAdded != 0 && notification.type() == ModificationType.DELETE_TEXT
                        && selection.contains(startLine + linesAdded + 1));
    }

    private void insertOtherBlock(
            ViewId viewId,
            TextView textView,
            TextView other,
            int line,
            LineRange marked,
            LineRange otherMarked,
            boolean showOnlyDiffs) {
        final int lastLine = textView.lastLine();

        boolean copyOtherTillEnd = false;
        int otherStartPos = other.lineStart(otherMarked.first());
        int startPos;

        if (marked.isNone()) {
            if (line < lastLine) {
                int insertLine = line + 1;

                if (showOnlyDiffs) {
                    insertLine = summary.alignment().correspondingLine(viewId.other(), otherMarked.first());
                    if (insertLine < 0) {
                        return;
                    }
                }

                startPos = textView.lineStart(insertLine);
            } else {
                startPos = textView.lineEnd(line);
                if (otherMarked.first() > 0) {
                    otherStartPos = other.lineEnd(otherMarked.first() - 1);
                }
                copyOtherTillEnd = true;
            }

            textView.setBlankLinesBelow(line, 0);
        } else {
            startPos = textView.lineStart(marked.first());
            copyOtherTillEnd = marked.first() == lastLine;
        }

        final int otherEndPos = copyOtherTillEnd
                ? other.lineEnd(other.lastLine())
                : other.lineStart(otherMarked.last() + 1);

        final String text = other.getText(otherStartPos, otherEndPos);

        if (otherMarked.first() > 0) {
            other.setBlankLinesBelow(otherMarked.first() - 1, 0);
        }

        textView.insertText(startPos, text);
    }

    @Override
    public String toString() {
        return "CompareSession{" + first + " vs " + second + ", " + state
                + (dirty ? ", manually changed" : stale ? ", stale" : "") + "}";
    }
}
