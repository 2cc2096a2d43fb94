package io.github.twinview.scroll;

import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareHost;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.config.TimingConstants;
import io.github.twinview.nav.Navigator;
import io.github.twinview.util.DelayedTask;
import io.github.twinview.util.ReentrancyGuard;
import io.github.twinview.util.TaskScheduler;
import io.github.twinview.view.ViewAligner;
import io.github.twinview.view.ViewLocation;
import io.github.twinview.view.ViewOps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps the two compared views scrolled together and their padding up to date.
 *
 * <p>Realignment is debounced: every paint request (re)posts the alignment task, so a burst of paints results in
 * a single pass. A pass that had to realign stores the user's view location and, to let the editor settle (line
 * number margins may change width), is repeated once more before the location is finally restored.
 */
public final class SyncCoordinator {
    private static final Logger logger = LogManager.getLogger(SyncCoordinator.class);

    /** Source of the data an alignment pass works on; the session manager's active pair. */
    public interface AlignmentSource {
        /** Alignment of the active, compared pair, or null when nothing is compared. */
        @Nullable
        AlignmentTable alignment();

        CompareOptions options();

        /** Delay of a recompare requested by edits, 0 when the pair does not need one. */
        int autoUpdateDelay();

        /** Called when a pass finished and the pair's status line should be refreshed. */
        void refreshStatus();
    }

    private final CompareHost host;
    private final ReentrancyGuard guard;
    private final CompareSettings settings;
    private final ViewAligner aligner;
    private final Navigator navigator;
    private final DelayedTask update;
    private final DelayedTask alignmentTask;

    @Nullable
    private AlignmentSource source;

    @Nullable
    private ViewLocation storedLocation;

    private int consecutiveAligns;
    private boolean goToFirst;
    private boolean forceRealign;

    public SyncCoordinator(
            CompareHost host,
            CompareSettings settings,
            ReentrancyGuard guard,
            TaskScheduler scheduler,
            ViewAligner aligner,
            Navigator navigator,
            DelayedTask update) {
        this.host = host;
        this.settings = settings;
        this.guard = guard;
        this.aligner = aligner;
        this.navigator = navigator;
        this.update = update;
        this.alignmentTask = new DelayedTask("alignment", scheduler, this::runAlignmentPass);
    }

    public void setSource(@Nullable AlignmentSource source) {
        this.source = source;
    }

    /**
     * Scrolls the other view so that its top row matches the top row of {@code biasView}, clamped so the other
     * view is not scrolled past its last line. With caret following, the caret line is mirrored too.
     */
    public void syncViews(ViewId biasView) {
        final ViewId otherView = biasView.other();
        final TextView bias = host.view(biasView);
        final TextView other = host.view(otherView);

        final int firstVisible = bias.firstVisibleRow();
        final int otherFirstVisible = other.firstVisibleRow();
        final int firstLine = bias.docLineFromVisible(firstVisible);

        int otherRow = -1;

        if (firstLine < bias.lastLine()) {
            if (firstVisible != otherFirstVisible) {
                final int otherLastVisible = other.visibleFromDocLine(other.lastLine());
                otherRow = Math.min(firstVisible, otherLastVisible);
            }
        } else if (firstVisible > otherFirstVisible) {
            otherRow = firstVisible;
        }

        if (otherRow >= 0) {
            logger.trace("Syncing {} view to row {}", otherView, otherRow);
            try (var ignored = guard.enter()) {
                other.setFirstVisibleRow(otherRow);
            }
        }

        if (settings.isFollowCaret() && biasView == host.currentView()) {
            final int otherLine = ViewOps.otherViewMatchingLine(bias, bias.caretLine(), other);

            if (otherLine != other.caretLine() && !other.hasSelection()) {
                try (var ignored = guard.enter()) {
                    other.setEmptySelection(other.lineStart(otherLine));
                }
            }
        }
    }

    /** Scroll or caret movement in {@code view}: remember where the user is and bring the other view along. */
    public void onUpdateUI(ViewId view) {
        try (var ignored = guard.enter()) {
            storedLocation = ViewLocation.save(view, host.view(view));
            syncViews(view);
        }
    }

    public void requestAlignment() {
        alignmentTask.post(TimingConstants.ALIGNMENT_DELAY_MS);
    }

    public void cancelAlignment() {
        alignmentTask.cancel();
    }

    public boolean isAlignmentPending() {
        return alignmentTask.isPending();
    }

    /** The next alignment pass jumps to the first difference instead of restoring a location. */
    public void setGoToFirst(boolean goToFirst) {
        this.goToFirst = goToFirst;
    }

    public boolean isGoToFirst() {
        return goToFirst;
    }

    /** The next alignment pass realigns even when all aligned pairs on screen already match up. */
    public void forceRealign() {
        this.forceRealign = true;
    }

    public void storeLocation(ViewId view) {
        storedLocation = ViewLocation.save(view, host.view(view));
    }

    public boolean hasStoredLocation() {
        return storedLocation != null;
    }

    /** Drops pending alignment state; used when a compare starts or the pair goes away. */
    public void reset() {
        alignmentTask.cancel();
        storedLocation = null;
        goToFirst = false;
        forceRealign = false;
        consecutiveAligns = 0;
    }

    void runAlignmentPass() {
        final AlignmentSource current = source;
        if (current == null) {
            return;
        }

        if (current.autoUpdateDelay() > 0) {
            if (!update.isPending()) {
                update.post(current.autoUpdateDelay());
            }
            return;
        }

        final AlignmentTable alignment = current.alignment();
        if (alignment == null || alignment.isEmpty()) {
            return;
        }

        final TextView main = host.view(ViewId.MAIN);
        final TextView sub = host.view(ViewId.SUB);
        final CompareOptions options = current.options();

        boolean realign = goToFirst || forceRealign;

        try (var ignored = guard.enter()) {
            if (!realign) {
                final ViewId view = storedLocation != null ? storedLocation.view() : host.currentView();
                realign = aligner.isAlignmentNeeded(view, main, sub, alignment);
            }

            if (realign) {
                logger.debug("Aligning diffs");

                if (storedLocation == null && !goToFirst) {
                    storedLocation = ViewLocation.save(host.currentView(), host.view(host.currentView()));
                }

                forceRealign = false;
                aligner.alignDiffs(main, sub, alignment, options);
            }

            if (goToFirst) {
                logger.debug("Go to first diff");
                goToFirst = false;

                var location = navigator.jumpToFirst(options, true);
                if (!location.isNone()) {
                    syncViews(location.view());
                }

                current.refreshStatus();
                host.focusView(host.currentView());
            } else if (storedLocation != null) {
                final ViewLocation location = storedLocation;
                final TextView locationView = host.view(location.view());

                if (!realign || ++consecutiveAligns > TimingConstants.MAX_CONSECUTIVE_ALIGNS) {
                    consecutiveAligns = 0;
                } else if (location.restore(locationView)) {
                    syncViews(location.view());
                }

                if (consecutiveAligns > 0) {
                    // settle pass
                    alignmentTask.post(TimingConstants.ALIGNMENT_DELAY_MS);
                } else {
                    if (realign) {
                        location.restore(locationView);
                    }
                    syncViews(location.view());

                    storedLocation = null;
                    current.refreshStatus();
                }
            } else if (options.isFindUniqueMode()) {
                syncViews(host.currentView());
            }
        }
    }
}
