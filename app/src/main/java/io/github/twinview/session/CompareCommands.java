package io.github.twinview.session;

import io.github.twinview.api.CompareHost;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.nav.DiffLocation;
import io.github.twinview.nav.Navigator;
import io.github.twinview.view.ViewLocation;
import io.github.twinview.view.ViewOps;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * User commands of the compare engine, as bound to menu items, toolbar buttons or key strokes by the host.
 * Navigation and view commands act on the pair shown in the focused view and do nothing when it is not compared.
 */
public final class CompareCommands {
    private static final Logger logger = LogManager.getLogger(CompareCommands.class);

    private final SessionManager manager;
    private final CompareHost host;
    private final CompareSettings settings;

    public CompareCommands(SessionManager manager) {
        this.manager = manager;
        this.host = manager.host();
        this.settings = manager.settings();
    }

    // --- compare ---

    public boolean setAsFirst() {
        return manager.setAsFirst();
    }

    public void compare() {
        manager.compare(false, false, false);
    }

    public void compareSelections() {
        manager.compare(true, false, false);
    }

    public void findUnique() {
        manager.compare(false, true, false);
    }

    public void findUniqueInSelections() {
        manager.compare(true, true, false);
    }

    public void clearActive() {
        manager.clearActive();
    }

    public void clearAll() {
        manager.clearAll();
    }

    // --- navigation ---

    public DiffLocation next() {
        return navigate(Navigator::jumpToNext);
    }

    public DiffLocation previous() {
        return navigate(Navigator::jumpToPrevious);
    }

    public DiffLocation first() {
        return navigate(Navigator::jumpToFirst);
    }

    public DiffLocation last() {
        return navigate(Navigator::jumpToLast);
    }

    private interface Jump {
        DiffLocation apply(Navigator navigator, CompareOptions options);
    }

    private DiffLocation navigate(Jump jump) {
        final CompareSession session = activeComparedSession();
        if (session == null) {
            return DiffLocation.NONE;
        }

        try (var ignored = manager.guard().enter()) {
            final DiffLocation location = jump.apply(manager.navigator(), session.options());
            if (!location.isNone()) {
                manager.sync().syncViews(location.view());
            }
            return location;
        }
    }

    // --- block operations ---

    /** Copies the other view's difference block over the block at the caret of the focused view. */
    public boolean equalize() {
        final ViewId view = host.currentView();
        return equalize(view, host.view(view).caretLine());
    }

    public boolean equalize(ViewId view, int line) {
        final CompareSession session = activeComparedSession();
        if (session == null) {
            return false;
        }

        final boolean changed;
        try (var ignored = manager.guard().enter()) {
            manager.temporaryRangeSelect(null, 0, 0);
            changed = session.equalize(view, host.view(view), host.view(view.other()), line);

            if (changed && !settings.isAutoRecompare() && settings.isShowOnlyDiffs()) {
                manager.aligner().alignDiffs(
                        host.view(ViewId.MAIN), host.view(ViewId.SUB), session.alignment(), session.options());
            }
        }

        if (changed) {
            manager.refreshStatus(session);
        }
        return changed;
    }

    /**
     * Selects the difference block at {@code line} of {@code view}; the facing block of the other view is
     * selected for a short while.
     */
    public void selectDiffBlock(ViewId view, int line) {
        final CompareSession session = activeComparedSession();
        if (session == null) {
            return;
        }

        final TextView textView = host.view(view);
        final TextView other = host.view(view.other());

        try (var ignored = manager.guard().enter()) {
            final DiffBlocks.BlockPair blocks = DiffBlocks.find(textView, other, line, settings.isShowOnlyDiffs());

            if (blocks.lines().isNone()) {
                textView.clearSelection();
            } else {
                textView.setSelection(
                        textView.lineStart(blocks.lines().first()), textView.lineStart(blocks.lines().last() + 1));
            }

            if (session.options().isFindUniqueMode() || blocks.otherLines().isNone()) {
                manager.temporaryRangeSelect(null, 0, 0);
            } else {
                manager.temporaryRangeSelect(view.other(),
                        other.lineStart(blocks.otherLines().first()),
                        other.lineStart(blocks.otherLines().last() + 1));
            }
        }
    }

    // --- view toggles ---

    public void toggleShowOnlyDiffs() {
        settings.setShowOnlyDiffs(!settings.isShowOnlyDiffs());
        logger.debug("Show only diffs: {}", settings.isShowOnlyDiffs());

        rerender(textView -> {
            if (!settings.isShowOnlyDiffs()) {
                return false;
            }
            final int caretLine = textView.caretLine();
            return !textView.isLineMarked(caretLine, Markers.MASK_LINE)
                    && textView.nextMarkedLine(caretLine, Markers.MASK_LINE) >= 0;
        }, (textView, caretLine) -> {
            final int line = textView.nextMarkedLine(caretLine, Markers.MASK_LINE);
            if (!ViewOps.isLineVisible(textView, line)) {
                ViewOps.centerAt(textView, line);
            }
            textView.setEmptySelection(textView.lineStart(line));
        });
    }

    public void toggleShowOnlySelections() {
        settings.setShowOnlySelections(!settings.isShowOnlySelections());
        logger.debug("Show only selections: {}", settings.isShowOnlySelections());

        rerender(textView -> settings.isShowOnlySelections(), (textView, caretLine) -> {
            if (!ViewOps.isLineVisible(textView, caretLine)) {
                ViewOps.centerAt(textView, caretLine);
            }
            textView.setEmptySelection(textView.lineStart(caretLine));
        });
    }

    /**
     * Rebuilds hidden lines and padding after a filter toggle. The caret is moved first when {@code moveCaret}
     * says so; the view then keeps the caret line on its screen row, or the top line when the caret is off screen.
     */
    private void rerender(Predicate<TextView> moveCaret, BiConsumer<TextView, Integer> caretMover) {
        final CompareSession session = activeComparedSession();
        if (session == null) {
            return;
        }

        try (var ignored = manager.guard().enter()) {
            final ViewId view = host.currentView();
            final TextView textView = host.view(view);

            if (moveCaret.test(textView)) {
                caretMover.accept(textView, textView.caretLine());
            }

            final int currentLine = textView.caretLine();
            final boolean caretVisible = ViewOps.isLineVisible(textView, currentLine);
            final int firstLine = caretVisible ? -1 : ViewOps.firstLine(textView);
            final ViewLocation location = caretVisible ? ViewLocation.save(view, textView) : null;

            host.view(ViewId.MAIN).clearAllBlankLines();
            host.view(ViewId.SUB).clearAllBlankLines();

            manager.aligner().alignDiffs(
                    host.view(ViewId.MAIN), host.view(ViewId.SUB), session.alignment(), session.options());

            if (location != null) {
                location.restore(textView);
            } else {
                textView.setFirstVisibleRow(textView.visibleFromDocLine(firstLine));
            }

            manager.sync().syncViews(view);
        }
    }

    public void toggleAutoRecompare() {
        settings.setAutoRecompare(!settings.isAutoRecompare());
        logger.debug("Auto recompare: {}", settings.isAutoRecompare());

        if (settings.isAutoRecompare()) {
            final CompareSession session = activeComparedSession();
            if (session != null && (session.isDirty() || session.isStale())) {
                manager.flushUpdate();
            }
        }
    }

    // Compare options take effect with the next manual compare.

    public void toggleIgnoreSpaces() {
        settings.setIgnoreSpaces(!settings.isIgnoreSpaces());
    }

    public void toggleIgnoreCase() {
        settings.setIgnoreCase(!settings.isIgnoreCase());
    }

    public void toggleIgnoreEmptyLines() {
        settings.setIgnoreEmptyLines(!settings.isIgnoreEmptyLines());
    }

    public void toggleIgnoreLineNumbers() {
        settings.setIgnoreLineNumbers(!settings.isIgnoreLineNumbers());
    }

    public void toggleDetectMoves() {
        settings.setDetectMoves(!settings.isDetectMoves());
    }

    public void toggleCharPrecision() {
        settings.setCharPrecision(!settings.isCharPrecision());
    }

    public void toggleFollowCaret() {
        settings.setFollowCaret(!settings.isFollowCaret());
    }

    public void toggleWrapAround() {
        settings.setWrapAround(!settings.isWrapAround());
    }

    public void toggleGotoFirstDiff() {
        settings.setGotoFirstDiff(!settings.isGotoFirstDiff());
    }

    /** Switches the status line between summary counts, compare options and nothing. */
    public void cycleStatusType() {
        settings.setStatusType(settings.getStatusType().next());

        final CompareSession session = manager.activeSession();
        if (session != null && session.isComplete()) {
            manager.refreshStatus(session);
        }
    }

    public CompareStatus status() {
        return manager.status();
    }

    private @Nullable CompareSession activeComparedSession() {
        final CompareSession session = manager.activeSession();
        if (session == null || !session.isComplete()) {
            return null;
        }
        return session;
    }
}
