package io.github.twinview.session;

import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareHost;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.CompareSummary;
import io.github.twinview.api.DiffEngine;
import io.github.twinview.api.EditNotification;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.TextView;
import io.github.twinview.api.TextViewException;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.config.TimingConstants;
import io.github.twinview.nav.Navigator;
import io.github.twinview.scroll.SyncCoordinator;
import io.github.twinview.track.ChangeTracker;
import io.github.twinview.util.DelayedTask;
import io.github.twinview.util.ReentrancyGuard;
import io.github.twinview.util.TaskScheduler;
import io.github.twinview.view.ViewAligner;
import io.github.twinview.view.ViewOps;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the compare engine. Owns all compare pairs and the deferred tasks, and dispatches the host's
 * editor notifications to the pair they concern.
 *
 * <p>All methods must be called on the host's UI thread; deferred tasks run there too.
 */
public final class SessionManager {
    private static final Logger logger = LogManager.getLogger(SessionManager.class);

    private static final boolean DEBUG_MODE = Boolean.getBoolean("twinview.compare.debug");

    private final CompareHost host;
    private final CompareSettings settings;
    private final DiffEngine engine;
    private final TaskScheduler scheduler;
    private final ReentrancyGuard guard = new ReentrancyGuard();

    private final ViewAligner aligner;
    private final Navigator navigator;
    private final SyncCoordinator sync;

    private final DelayedTask update;
    private final DelayedTask activation;
    private final DelayedTask closure;
    private final DelayedTask rangeSelectReset;

    private final List<CompareSession> sessions = new ArrayList<>();
    private final List<Long> closedBuffers = new ArrayList<>();

    @Nullable
    private CompareSession pending;

    private long currentlyActiveBufferId = -1;
    private long activationBufferId = -1;

    @Nullable
    private ViewId rangeSelectView;

    public SessionManager(CompareHost host, CompareSettings settings, DiffEngine engine, TaskScheduler scheduler) {
        this.host = host;
        this.settings = settings;
        this.engine = engine;
        this.scheduler = scheduler;

        this.aligner = new ViewAligner(settings);
        this.navigator = new Navigator(host, settings, scheduler);

        this.update = new DelayedTask("update", scheduler, () -> compare(false, false, true));
        this.activation = new DelayedTask("activation", scheduler, this::activateDelayed);
        this.closure = new DelayedTask("close", scheduler, this::closeDelayed);
        this.rangeSelectReset = new DelayedTask("range-select-reset", scheduler, this::clearRangeSelect);

        this.sync = new SyncCoordinator(host, settings, guard, scheduler, aligner, navigator, update);
        this.sync.setSource(new ActivePairSource());
    }

    // --- accessors ---

    public CompareHost host() {
        return host;
    }

    public CompareSettings settings() {
        return settings;
    }

    public ReentrancyGuard guard() {
        return guard;
    }

    public Navigator navigator() {
        return navigator;
    }

    public SyncCoordinator sync() {
        return sync;
    }

    ViewAligner aligner() {
        return aligner;
    }

    public List<CompareSession> sessions() {
        return List.copyOf(sessions);
    }

    public @Nullable CompareSession pendingSession() {
        return pending;
    }

    /** The compared pair containing {@code bufferId}, or null. */
    public @Nullable CompareSession findSession(long bufferId) {
        for (var session : sessions) {
            if (session.contains(bufferId)) {
                return session;
            }
        }
        return null;
    }

    /** The compared pair shown in the focused view, or null. */
    public @Nullable CompareSession activeSession() {
        return findSession(host.bufferId(host.currentView()));
    }

    public boolean isUpdatePending() {
        return update.isPending();
    }

    public CompareStatus status() {
        var session = activeSession();
        return session == null ? CompareStatus.NONE : CompareStatus.of(session, settings.getStatusType());
    }

    // --- pairing and comparing ---

    /** Marks the file of the focused view as the first file of the next compare. */
    public boolean setAsFirst() {
        final ViewId view = host.currentView();
        if (host.bufferId(view) < 0 || isCompared(view)) {
            return false;
        }

        pending = new CompareSession(settings, bind(view, settings.isFirstFileIsNew()));
        logger.debug("First file set: {}", pending.first());
        return true;
    }

    /**
     * Compares the file of the focused view with the one set as first or, without one, with the file of the other
     * view. When the focused file is compared already, re-compares its pair.
     *
     * @param selectionCompare compare the selected lines only
     * @param findUniqueMode mark lines without any equal line in the other file instead of diffing
     * @param autoUpdating the recompare was triggered by edits; options and view location are kept
     */
    public void compare(boolean selectionCompare, boolean findUniqueMode, boolean autoUpdating) {
        update.cancel();

        try (var ignored = guard.enter()) {
            sync.reset();
            navigator.clearArrowMark();
            clearRangeSelect();

            final ViewId currentView = host.currentView();
            final long currentBufferId = host.bufferId(currentView);

            CompareSession session = findSession(currentBufferId);
            boolean recompareSameSelections = false;

            if (session != null) {
                pending = null;
                session.clearAutoUpdateDelay();

                if (!autoUpdating && selectionCompare) {
                    final SelectionCheck check = checkRecompareSelections(session.options());
                    if (check.mustValidate() && !areSelectionsValid()) {
                        return;
                    }
                    recompareSameSelections = check.sameSelections();
                }

                if ((!settings.isGotoFirstDiff() && !selectionCompare) || autoUpdating) {
                    sync.storeLocation(currentView);
                }

                clearFile(session.oldFile(), autoUpdating);
                clearFile(session.newFile(), autoUpdating);
            } else {
                session = initNewCompare(currentView, currentBufferId);
                if (session == null) {
                    return;
                }
                if (selectionCompare && !areSelectionsValid()) {
                    return;
                }
                sessions.add(session);
            }

            final CompareOptions options = session.options();

            if (!autoUpdating) {
                settings.applyTo(options);
                options.setNewFileView(session.newFile().view());
                options.setFindUniqueMode(findUniqueMode);
                options.setSelectionCompare(selectionCompare);

                if (selectionCompare && !recompareSameSelections) {
                    options.setSelection(ViewId.MAIN, host.view(ViewId.MAIN).selectionLines());
                    options.setSelection(ViewId.SUB, host.view(ViewId.SUB).selectionLines());
                }
            }

            if (autoUpdating && options.isSelectionCompare()) {
                sync.forceRealign();
            }

            final CompareSummary summary = runCompare(session);
            session.applyResult(summary);

            logger.debug("Compare of {} done: {}", session, summary);

            switch (summary.result()) {
                case MISMATCH -> onMismatch(session, selectionCompare, currentBufferId);
                case MATCH -> {
                    host.showMessage(
                            options.isFindUniqueMode() ? "Find Unique" : "Compare",
                            String.format("%s \"%s\" and \"%s\" %s.",
                                    options.isSelectionCompare() ? "Selections in files" : "Files",
                                    session.newFile().name(),
                                    session.oldFile().name(),
                                    options.isFindUniqueMode() ? "do not contain unique lines" : "match"));
                    clearComparePair(currentBufferId);
                }
                default -> clearComparePair(currentBufferId);
            }
        }
    }

    private void onMismatch(CompareSession session, boolean selectionCompare, long currentBufferId) {
        if (!sync.hasStoredLocation()) {
            if (selectionCompare) {
                host.view(ViewId.MAIN).clearSelection();
                host.view(ViewId.SUB).clearSelection();
            }

            sync.setGoToFirst(true);

            // bring the first difference into view now, the alignment pass then has less to move
            for (var entry : session.alignment().entries()) {
                if (entry.main().isDiff()) {
                    centerIfHidden(host.view(ViewId.MAIN), entry.line(ViewId.MAIN));
                    centerIfHidden(host.view(ViewId.SUB), entry.line(ViewId.SUB));
                    break;
                }
            }
        }

        currentlyActiveBufferId = currentBufferId;
        sync.requestAlignment();
        refreshStatus(session);
    }

    private static void centerIfHidden(TextView view, int line) {
        if (!ViewOps.isLineVisible(view, line)) {
            ViewOps.centerAt(view, line);
        }
    }

    private CompareSummary runCompare(CompareSession session) {
        final CompareOptions options = session.options();

        logger.debug(options.isSelectionCompare()
                        ? "Comparing selected lines in \"{}\" vs. selected lines in \"{}\""
                        : "Comparing \"{}\" vs. \"{}\"",
                session.newFile().name(), session.oldFile().name());

        try {
            return engine.compare(host.view(ViewId.MAIN), host.view(ViewId.SUB), options);
        } catch (RuntimeException e) {
            logger.error("Compare of {} failed", session, e);
            return CompareSummary.failed();
        }
    }

    private @Nullable CompareSession initNewCompare(ViewId currentView, long currentBufferId) {
        CompareSession session = pending;
        pending = null;

        // compare to self
        if (session != null && session.first().bufferId() == currentBufferId) {
            session = null;
        }

        if (session == null) {
            if (isCompared(currentView)) {
                return null;
            }

            final ViewId otherView = currentView.other();
            final long otherBufferId = host.bufferId(otherView);

            if (otherBufferId < 0) {
                host.showMessage("Compare", "Only one file opened - operation ignored.");
                return null;
            }
            if (isCompared(otherView)) {
                return null;
            }
            if (otherBufferId == currentBufferId) {
                host.showMessage("Compare", "Trying to compare file to its clone - operation ignored.");
                return null;
            }

            final boolean isNew = currentView == settings.getNewFileView();
            session = new CompareSession(settings, bind(currentView, isNew));
            session.pairWith(bind(otherView, !isNew));
            return session;
        }

        final ViewId firstView = viewOf(session.first().bufferId());
        if (firstView == null || firstView == currentView) {
            host.showMessage("Compare", "The first file must be shown in the other view - operation ignored.");
            return null;
        }
        if (isCompared(currentView)) {
            return null;
        }

        final var paired = new CompareSession(settings, session.first().inView(firstView));
        paired.pairWith(bind(currentView, !session.first().isNew()));
        return paired;
    }

    private record SelectionCheck(boolean mustValidate, boolean sameSelections) {}

    // A recompare of selections takes a new selection from one view and keeps the other view's old one.
    private SelectionCheck checkRecompareSelections(CompareOptions options) {
        final TextView main = host.view(ViewId.MAIN);
        final TextView sub = host.view(ViewId.SUB);

        if (main.hasSelection() && sub.hasSelection()) {
            return new SelectionCheck(true, false);
        }
        if (main.hasSelection() && !options.getSelection(ViewId.SUB).isNone()) {
            return takeNewSelection(options, ViewId.MAIN);
        }
        if (sub.hasSelection() && !options.getSelection(ViewId.MAIN).isNone()) {
            return takeNewSelection(options, ViewId.SUB);
        }

        final boolean missing = options.getSelection(ViewId.MAIN).isNone()
                || options.getSelection(ViewId.SUB).isNone();
        return new SelectionCheck(missing, true);
    }

    private SelectionCheck takeNewSelection(CompareOptions options, ViewId view) {
        final LineRange selection = host.view(view).selectionLines();
        if (selection.isNone()) {
            return new SelectionCheck(true, true);
        }
        options.setSelection(view, selection);
        return new SelectionCheck(false, true);
    }

    private boolean areSelectionsValid() {
        final boolean valid = !host.view(ViewId.MAIN).selectionLines().isNone()
                && !host.view(ViewId.SUB).selectionLines().isNone();
        if (!valid) {
            host.showMessage("Compare", "No selected lines to compare - operation ignored.");
        }
        return valid;
    }

    private boolean isCompared(ViewId view) {
        final long bufferId = host.bufferId(view);
        final CompareSession session = findSession(bufferId);
        if (session == null) {
            return false;
        }
        host.showMessage("Compare", String.format(
                "File \"%s\" is already compared - operation ignored.", session.fileByBuffer(bufferId).name()));
        return true;
    }

    private FileBinding bind(ViewId view, boolean isNew) {
        final long bufferId = host.bufferId(view);
        return new FileBinding(
                bufferId, host.bufferName(bufferId), isNew, view,
                new ChangeTracker(settings, scheduler::currentTimeMillis));
    }

    private @Nullable ViewId viewOf(long bufferId) {
        if (host.bufferId(ViewId.MAIN) == bufferId) {
            return ViewId.MAIN;
        }
        if (host.bufferId(ViewId.SUB) == bufferId) {
            return ViewId.SUB;
        }
        return null;
    }

    private void clearFile(FileBinding file, boolean keepDeleteHistory) {
        if (host.bufferId(file.view()) == file.bufferId()) {
            file.clear(host.view(file.view()), keepDeleteHistory);
        } else if (!keepDeleteHistory) {
            file.tracker().clear();
        }
    }

    // --- clearing ---

    /** Ends the compare of the pair containing {@code bufferId} and restores both views to normal. */
    public void clearComparePair(long bufferId) {
        final CompareSession session = findSession(bufferId);
        if (session == null) {
            return;
        }

        try (var ignored = guard.enter()) {
            restoreFiles(session);
            sessions.remove(session);
            onBufferActivated(host.bufferId(host.currentView()));
        }
    }

    /** Clears the focused pair, or forgets the file set as first. */
    public void clearActive() {
        pending = null;
        clearComparePair(host.bufferId(host.currentView()));
    }

    public void clearAll() {
        pending = null;
        if (sessions.isEmpty()) {
            return;
        }

        try (var ignored = guard.enter()) {
            for (int i = sessions.size() - 1; i >= 0; --i) {
                restoreFiles(sessions.get(i));
            }
            sessions.clear();
            onBufferActivated(host.bufferId(host.currentView()));
        }
    }

    private void restoreFiles(CompareSession session) {
        sync.reset();
        update.cancel();
        navigator.clearArrowMark();
        clearRangeSelect();

        clearFile(session.first(), false);
        final FileBinding second = session.second();
        if (second != null) {
            clearFile(second, false);
        }
        session.close();

        logger.debug("Compare cleared: {}", session);
    }

    // --- editor notifications ---

    /** Buffer modification in {@code view}; call for pre-delete, delete and insert notifications. */
    public void onModified(ViewId view, EditNotification notification) {
        final long bufferId = host.bufferId(view);
        final CompareSession session = findSession(bufferId);
        if (session == null || !session.isComplete()) {
            return;
        }

        if (DEBUG_MODE) {
            logger.debug("Modified {} view: {}", view, notification);
        }

        if (notification.isTextChange()) {
            sync.cancelAlignment();
            update.cancel();
        }

        try {
            final EditOutcome outcome =
                    session.onModified(view, host.view(view), host.view(view.other()), notification);

            switch (outcome) {
                case CLEAR_PAIR -> clearComparePair(bufferId);
                case RECOMPARE -> update.post(session.autoUpdateDelay());
                case REALIGN -> {
                    sync.forceRealign();
                    sync.requestAlignment();
                    refreshStatus(session);
                }
                case STATUS_CHANGED -> refreshStatus(session);
                case NONE -> {}
            }
        } catch (TextViewException e) {
            logger.error("Tracking an edit of {} view failed, clearing compare of {}", view, session, e);
            clearComparePair(bufferId);
        }
    }

    /** The host repainted a compared view. */
    public void onPaint() {
        if (!sessions.isEmpty()) {
            sync.requestAlignment();
        }
    }

    /** Scroll or caret change in {@code view}. Ignored while the engine itself changes the views. */
    public void onUpdateUI(ViewId view) {
        if (guard.isActive() || findSession(host.bufferId(view)) == null) {
            return;
        }
        if (DEBUG_MODE) {
            logger.debug("Update UI of {} view", view);
        }
        sync.onUpdateUI(view);
    }

    /** A buffer became the shown one in its view. */
    public void onBufferActivated(long bufferId) {
        sync.cancelAlignment();
        update.cancel();
        activation.cancel();

        try (var ignored = guard.enter()) {
            if (findSession(bufferId) == null) {
                currentlyActiveBufferId = bufferId;
                host.showStatus("");
            } else {
                activationBufferId = bufferId;
                activation.post(TimingConstants.ACTIVATION_DELAY_MS);
            }
        }
    }

    private void activateDelayed() {
        final long bufferId = activationBufferId;
        final CompareSession session = findSession(bufferId);
        if (session == null) {
            return;
        }

        if (bufferId != currentlyActiveBufferId) {
            final ViewId view = viewOf(bufferId);
            if (view == null) {
                return;
            }

            logger.debug("Activating compared buffer {} in {} view", bufferId, view);

            try (var ignored = guard.enter()) {
                sync.onUpdateUI(view);
                currentlyActiveBufferId = bufferId;
                comparedFileActivated(session);
            }
        } else {
            // the same buffer again: reloaded from disk
            logger.debug("Compared buffer {} reactivated, re-comparing", bufferId);
            sync.cancelAlignment();
            update.post(TimingConstants.FLUSH_UPDATE_DELAY_MS);
        }
    }

    private void comparedFileActivated(CompareSession session) {
        navigator.clearArrowMark();
        clearRangeSelect();

        if (settings.isShowOnlyDiffs()
                || (session.options().isSelectionCompare() && settings.isShowOnlySelections())) {
            try (var ignored = guard.enter()) {
                aligner.alignDiffs(host.view(ViewId.MAIN), host.view(ViewId.SUB), session.alignment(),
                        session.options());
            }
        }

        refreshStatus(session);
    }

    /** A compared file is about to be closed: its pair is torn down shortly after. */
    public void onFileBeforeClose(long bufferId) {
        final CompareSession session = findSession(bufferId);
        if (session == null) {
            return;
        }

        sync.cancelAlignment();
        update.cancel();
        activation.cancel();
        closure.cancel();

        closedBuffers.add(bufferId);

        try (var ignored = guard.enter()) {
            clearFile(session.fileByBuffer(bufferId), false);
        }

        closure.post(TimingConstants.CLOSE_DELAY_MS);
    }

    private void closeDelayed() {
        try (var ignored = guard.enter()) {
            for (int i = closedBuffers.size() - 1; i >= 0; --i) {
                final CompareSession session = findSession(closedBuffers.get(i));
                if (session == null) {
                    continue;
                }
                restoreFiles(session);
                sessions.remove(session);
            }
            closedBuffers.clear();

            onBufferActivated(host.bufferId(host.currentView()));
        }
    }

    /** A compared file was saved: a pending automatic recompare runs right away. */
    public void onFileSaved(long bufferId) {
        final CompareSession session = findSession(bufferId);
        if (session == null || !session.isComplete()) {
            return;
        }

        final long currentBufferId = host.bufferId(host.currentView());
        final boolean pairIsActive = currentBufferId == bufferId
                || currentBufferId == session.otherFile(bufferId).bufferId();

        if (pairIsActive && settings.isAutoRecompare() && session.autoUpdateDelay() > 0) {
            sync.cancelAlignment();
            update.post(TimingConstants.FLUSH_UPDATE_DELAY_MS);
        }
    }

    // --- helpers for commands ---

    /** Schedules an automatic recompare right away, e.g. after auto-recompare was switched on for a dirty pair. */
    void flushUpdate() {
        update.post(TimingConstants.FLUSH_UPDATE_DELAY_MS);
    }

    /** Selects a range of {@code view} for a short while; a null view just clears such a selection. */
    void temporaryRangeSelect(@Nullable ViewId view, int startPos, int endPos) {
        clearRangeSelect();

        if (view != null && endPos > startPos) {
            host.view(view).setSelection(startPos, endPos);
            rangeSelectView = view;
            rangeSelectReset.post(TimingConstants.TEMPORARY_MARK_MS);
        }
    }

    private void clearRangeSelect() {
        rangeSelectReset.cancel();
        if (rangeSelectView != null) {
            host.view(rangeSelectView).clearSelection();
            rangeSelectView = null;
        }
    }

    void refreshStatus(CompareSession session) {
        host.showStatus(CompareStatus.render(session, settings.getStatusType()));
    }

    /** Feeds the alignment pass with the pair of the focused view. */
    private final class ActivePairSource implements SyncCoordinator.AlignmentSource {
        @Override
        public @Nullable AlignmentTable alignment() {
            var session = activeSession();
            if (session == null || !session.isComplete()) {
                return null;
            }
            return session.alignment();
        }

        @Override
        public CompareOptions options() {
            var session = activeSession();
            return session == null ? new CompareOptions() : session.options();
        }

        @Override
        public int autoUpdateDelay() {
            var session = activeSession();
            return session == null ? 0 : session.autoUpdateDelay();
        }

        @Override
        public void refreshStatus() {
            var session = activeSession();
            if (session != null) {
                SessionManager.this.refreshStatus(session);
            }
        }
    }
}
