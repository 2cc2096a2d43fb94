package io.github.twinview.scroll;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.align.AlignmentEntry;
import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.Markers;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.doc.DocumentTextView;
import io.github.twinview.nav.Navigator;
import io.github.twinview.testutil.ManualTaskScheduler;
import io.github.twinview.testutil.TestCompareHost;
import io.github.twinview.util.DelayedTask;
import io.github.twinview.util.ReentrancyGuard;
import io.github.twinview.view.ViewAligner;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncCoordinatorTest {
    private static final int C = Markers.CHANGED_LINE;

    private TestCompareHost host;
    private CompareSettings settings;
    private ManualTaskScheduler scheduler;
    private ReentrancyGuard guard;
    private AtomicInteger updates;
    private DelayedTask update;
    private FakeSource source;
    private SyncCoordinator sync;

    private static final class FakeSource implements SyncCoordinator.AlignmentSource {
        @Nullable
        AlignmentTable alignment;
        final CompareOptions options = new CompareOptions();
        int autoUpdateDelay;
        int statusRefreshes;

        @Override
        public @Nullable AlignmentTable alignment() {
            return alignment;
        }

        @Override
        public CompareOptions options() {
            return options;
        }

        @Override
        public int autoUpdateDelay() {
            return autoUpdateDelay;
        }

        @Override
        public void refreshStatus() {
            ++statusRefreshes;
        }
    }

    @BeforeEach
    void setUp() {
        host = new TestCompareHost(TestCompareHost.numberedLines(30), TestCompareHost.numberedLines(22), 5);
        settings = new CompareSettings();
        scheduler = new ManualTaskScheduler();
        guard = new ReentrancyGuard();
        updates = new AtomicInteger();
        update = new DelayedTask("update", scheduler, updates::incrementAndGet);

        sync = new SyncCoordinator(host, settings, guard, scheduler, new ViewAligner(settings),
                new Navigator(host, settings, scheduler), update);
        source = new FakeSource();
        sync.setSource(source);
    }

    private DocumentTextView main() {
        return host.document(ViewId.MAIN);
    }

    private DocumentTextView sub() {
        return host.document(ViewId.SUB);
    }

    @Test
    void otherViewFollowsTopRow() {
        main().setFirstVisibleRow(10);

        sync.syncViews(ViewId.MAIN);

        assertEquals(10, sub().firstVisibleRow());
        assertFalse(guard.isActive());
    }

    @Test
    void otherViewIsNotScrolledPastItsLastLine() {
        main().setFirstVisibleRow(25);

        sync.syncViews(ViewId.MAIN);

        assertEquals(21, sub().firstVisibleRow());
    }

    @Test
    void caretIsMirroredWhenFollowingCaret() {
        main().setEmptySelection(main().lineStart(7));

        sync.syncViews(ViewId.MAIN);
        assertEquals(7, sub().caretLine());

        settings.setFollowCaret(false);
        main().setEmptySelection(main().lineStart(9));
        sync.syncViews(ViewId.MAIN);
        assertEquals(7, sub().caretLine());
    }

    @Test
    void burstOfRequestsRunsOnePass() {
        source.alignment = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(6, 0, 5, 0)));
        sync.setGoToFirst(true);

        sync.requestAlignment();
        scheduler.advance(20);
        sync.requestAlignment();
        scheduler.advance(20);
        assertEquals(0, source.statusRefreshes, "second request postponed the pass");

        scheduler.advance(10);
        assertEquals(1, source.statusRefreshes);
        assertFalse(sync.isGoToFirst());
        assertEquals(1, sub().blankLinesBelow(4));
    }

    @Test
    void goToFirstLandsOnFirstDifference() {
        main().setMarkers(3, C);
        sub().setMarkers(3, C);
        source.alignment = new AlignmentTable(List.of(
                AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(3, C, 3, C), AlignmentEntry.of(4, 0, 4, 0)));
        sync.setGoToFirst(true);

        sync.runAlignmentPass();

        assertEquals(3, main().caretLine());
    }

    @Test
    void pendingRecompareIsScheduledInsteadOfAligning() {
        source.alignment = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(6, 0, 5, 0)));
        source.autoUpdateDelay = 500;

        sync.runAlignmentPass();

        assertTrue(update.isPending());
        assertEquals(0, sub().blankLinesBelow(4), "no alignment while a recompare is due");
        scheduler.advance(500);
        assertEquals(1, updates.get());
    }

    @Test
    void restoringAStoredLocationTakesASettlePass() {
        source.alignment = new AlignmentTable(List.of(AlignmentEntry.of(0, 0, 0, 0), AlignmentEntry.of(6, 0, 5, 0)));
        main().setEmptySelection(main().lineStart(8));
        main().setFirstVisibleRow(6);
        sync.storeLocation(ViewId.MAIN);
        sync.forceRealign();

        sync.runAlignmentPass();
        assertTrue(sync.isAlignmentPending(), "settle pass");
        assertEquals(0, source.statusRefreshes);

        scheduler.runUntilIdle(1000);

        assertEquals(1, source.statusRefreshes);
        assertFalse(sync.hasStoredLocation());
        assertEquals(6, main().firstVisibleRow());
        assertEquals(main().visibleFromDocLine(6), sub().visibleFromDocLine(5));
    }

    @Test
    void nothingToDoWithoutAlignment() {
        sync.runAlignmentPass();
        assertEquals(0, source.statusRefreshes);
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void updateUiStoresLocationAndSyncs() {
        main().setFirstVisibleRow(4);

        sync.onUpdateUI(ViewId.MAIN);

        assertTrue(sync.hasStoredLocation());
        assertEquals(4, sub().firstVisibleRow());

        sync.reset();
        assertFalse(sync.hasStoredLocation());
    }
}
