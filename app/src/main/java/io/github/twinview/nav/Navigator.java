package io.github.twinview.nav;

import io.github.twinview.api.CompareHost;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import io.github.twinview.config.TimingConstants;
import io.github.twinview.util.DelayedTask;
import io.github.twinview.util.TaskScheduler;
import io.github.twinview.view.ViewOps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Moves between difference blocks of the two compared views.
 *
 * <p>Both views are searched for their nearest marked line in the requested direction; the candidate appearing first
 * on screen wins. A candidate found only in the other view is translated into the focused view through the screen
 * row it is drawn on, except in find-unique mode where focus moves to the other view instead. Blank padding next to
 * the destination is stepped over so the destination is always a real document line.
 */
public final class Navigator {
    private static final Logger logger = LogManager.getLogger(Navigator.class);

    private final CompareHost host;
    private final CompareSettings settings;
    private final DelayedTask arrowReset;

    @Nullable
    private ViewId arrowView;

    public Navigator(CompareHost host, CompareSettings settings, TaskScheduler scheduler) {
        this.host = host;
        this.settings = settings;
        this.arrowReset = new DelayedTask("arrow-reset", scheduler, this::clearArrowMark);
    }

    public DiffLocation jumpToNext(CompareOptions options) {
        return jumpToChange(options, true, settings.isWrapAround());
    }

    public DiffLocation jumpToPrevious(CompareOptions options) {
        return jumpToChange(options, false, settings.isWrapAround());
    }

    public DiffLocation jumpToFirst(CompareOptions options) {
        return jumpToFirst(options, false);
    }

    public DiffLocation jumpToLast(CompareOptions options) {
        return jumpToLast(options, false);
    }

    /** First difference of the pair; {@code doNotBlink} leaves an on-screen destination unhighlighted. */
    public DiffLocation jumpToFirst(CompareOptions options, boolean doNotBlink) {
        var location = jumpToNextChange(options, -1, -1, true, doNotBlink);
        showBlankAdjacentArrowMark(location, true);
        return location;
    }

    public DiffLocation jumpToLast(CompareOptions options, boolean doNotBlink) {
        var location = jumpToNextChange(options, -1, -1, false, doNotBlink);
        showBlankAdjacentArrowMark(location, false);
        return location;
    }

    private DiffLocation jumpToChange(CompareOptions options, boolean down, boolean wrapAround) {
        final ViewId currentView = host.currentView();
        final TextView current = host.view(currentView);
        final TextView other = host.view(currentView.other());
        final boolean followCaret = settings.isFollowCaret();

        final int[] startLines = new int[2];
        DiffLocation location;

        int currentLine;
        if (down) {
            currentLine = followCaret ? current.caretLine() : ViewOps.lastLine(current);

            if (followCaret && current.isLineMarked(currentLine, Markers.MASK_LINE)
                    && currentLine > ViewOps.lastLine(current)) {
                // marked caret line below the screen
                ViewOps.centerAt(current, currentLine);
                location = DiffLocation.of(currentView, currentLine);
            } else {
                final boolean currentLineNotAnnotated = !ViewOps.isLineAnnotated(current, currentLine);

                if (!currentLineNotAnnotated && ViewOps.isVisibleAdjacentAnnotation(current, currentLine, true)) {
                    ++currentLine;
                }

                int otherLine = followCaret
                        ? ViewOps.otherViewMatchingLine(current, currentLine, other)
                        : ViewOps.lastLine(other);

                if (currentLineNotAnnotated && ViewOps.isLineAnnotated(other, otherLine)) {
                    ++otherLine;
                }

                startLines[currentView.index()] = currentLine;
                startLines[currentView.other().index()] = otherLine;

                location = searchFromBias(options, startLines, true);
            }
        } else {
            currentLine = followCaret ? current.caretLine() : ViewOps.firstLine(current);

            if (followCaret && current.isLineMarked(currentLine, Markers.MASK_LINE)
                    && currentLine < ViewOps.firstLine(current)) {
                // marked caret line above the screen
                ViewOps.centerAt(current, currentLine);
                location = DiffLocation.of(currentView, currentLine);
            } else {
                if (ViewOps.isVisibleAdjacentAnnotation(current, currentLine, false)) {
                    --currentLine;
                }

                final int otherLine = followCaret
                        ? ViewOps.otherViewMatchingLine(current, currentLine, other)
                        : ViewOps.firstLine(other);

                startLines[currentView.index()] = currentLine;
                startLines[currentView.other().index()] = otherLine;

                location = searchFromBias(options, startLines, false);
            }
        }

        if (location.isNone()) {
            if (wrapAround) {
                logger.debug("No {} difference, wrapping around", down ? "next" : "previous");
                location = down ? jumpToFirst(options, true) : jumpToLast(options, true);
                host.flashWindow();
            } else {
                location = down ? jumpToLast(options) : jumpToFirst(options);
            }
        } else {
            showBlankAdjacentArrowMark(location, down);
        }

        return location;
    }

    private DiffLocation searchFromBias(CompareOptions options, int[] startLines, boolean down) {
        final ViewId view = host.currentView();
        final TextView current = host.view(view);
        final TextView other = host.view(view.other());

        if (!options.isFindUniqueMode()) {
            final int edgeLine = down ? ViewOps.lastLine(current) : ViewOps.firstLine(current);
            final int currentLine = settings.isFollowCaret() ? current.caretLine() : edgeLine;

            // The bias line sits on a screen edge next to padding that is scrolled out of sight and stands for
            // lines of the other view: that padding is the next difference.
            if (!current.isLineMarked(currentLine, Markers.MASK_LINE)
                    && ViewOps.isAdjacentAnnotation(current, currentLine, down)
                    && !ViewOps.isVisibleAdjacentAnnotation(current, currentLine, down)
                    && other.isLineMarked(
                            ViewOps.otherViewMatchingLine(current, currentLine, other) + 1, Markers.MASK_LINE)) {
                ViewOps.centerAt(current, currentLine);
                return DiffLocation.of(view, currentLine);
            }
        }

        final TextView main = host.view(ViewId.MAIN);
        final TextView sub = host.view(ViewId.SUB);

        final int mainStart = down
                ? ViewOps.nextUnmarkedLine(main, startLines[ViewId.MAIN.index()], Markers.MASK_LINE)
                : ViewOps.previousUnmarkedLine(main, startLines[ViewId.MAIN.index()], Markers.MASK_LINE);
        final int subStart = down
                ? ViewOps.nextUnmarkedLine(sub, startLines[ViewId.SUB.index()], Markers.MASK_LINE)
                : ViewOps.previousUnmarkedLine(sub, startLines[ViewId.SUB.index()], Markers.MASK_LINE);

        return jumpToNextChange(options, mainStart, subStart, down, false);
    }

    /**
     * Core search. Negative start lines select corner mode: the search starts at the document boundary and a
     * difference on the boundary line itself counts.
     */
    private DiffLocation jumpToNextChange(
            CompareOptions options, int mainStartLine, int subStartLine, boolean down, boolean doNotBlink) {
        final TextView main = host.view(ViewId.MAIN);
        final TextView sub = host.view(ViewId.SUB);

        final boolean isCornerDiff = mainStartLine < 0 && subStartLine < 0;

        if (isCornerDiff) {
            mainStartLine = down ? 0 : main.lastLine();
            subStartLine = down ? 0 : sub.lastLine();
        }

        int mainNextLine = down
                ? main.nextMarkedLine(mainStartLine, Markers.MASK_LINE)
                : main.previousMarkedLine(mainStartLine, Markers.MASK_LINE);
        int subNextLine = down
                ? sub.nextMarkedLine(subStartLine, Markers.MASK_LINE)
                : sub.previousMarkedLine(subStartLine, Markers.MASK_LINE);

        if (mainNextLine == mainStartLine && !isCornerDiff) {
            mainNextLine = -1;
        }
        if (subNextLine == subStartLine && !isCornerDiff) {
            subNextLine = -1;
        }

        ViewId view = host.currentView();
        final ViewId otherView = view.other();

        int line = view == ViewId.MAIN ? mainNextLine : subNextLine;
        final int otherLine = view == ViewId.MAIN ? subNextLine : mainNextLine;

        if (line < 0) {
            if (otherLine < 0) {
                return DiffLocation.NONE;
            }
            if (options.isFindUniqueMode()) {
                view = otherView;
                line = otherLine;
            } else {
                line = ViewOps.otherViewMatchingLine(host.view(otherView), otherLine, host.view(view));
            }
        } else if (otherLine >= 0) {
            final int visibleLine = host.view(view).visibleFromDocLine(line);
            final int otherVisibleLine = host.view(otherView).visibleFromDocLine(otherLine);

            final boolean switchViews = down ? otherVisibleLine < visibleLine : otherVisibleLine > visibleLine;

            if (switchViews) {
                if (options.isFindUniqueMode()) {
                    view = otherView;
                    line = otherLine;
                } else {
                    line = ViewOps.otherViewMatchingLine(host.view(otherView), otherLine, host.view(view));
                }
            }
        }

        final TextView target = host.view(view);

        if (options.isFindUniqueMode() && settings.isFollowCaret()) {
            host.focusView(view);
        }

        // Moving up onto a line followed by padding: the difference is the padding, land below it.
        if (!down && !settings.isShowOnlyDiffs() && ViewOps.isLineAnnotated(target, line)) {
            line = Math.min(line + 1, target.lastLine());
        }

        logger.debug("Jump to {} view, doc line {}", view, line);

        if (!ViewOps.isLineVisible(target, line)
                || (!target.isLineMarked(line, Markers.MASK_LINE)
                        && ViewOps.isAdjacentAnnotation(target, line, down)
                        && !ViewOps.isVisibleAdjacentAnnotation(target, line, down))) {
            ViewOps.centerAt(target, line);
            doNotBlink = true;
        }

        if (settings.isFollowCaret() && line != target.caretLine()) {
            target.setEmptySelection(target.lineStart(line));
            doNotBlink = true;
        }

        if (!doNotBlink) {
            target.blinkLine(line);
        }

        return DiffLocation.of(view, line);
    }

    /** Points an arrow at a destination that is an unmarked line next to visible padding, for a short while. */
    private void showBlankAdjacentArrowMark(DiffLocation location, boolean down) {
        if (location.isNone()) {
            clearArrowMark();
            return;
        }

        final ViewId view = location.view();
        final TextView textView = host.view(view);
        final int line = location.line();

        if (!textView.isLineMarked(line, Markers.MASK_LINE)
                && ViewOps.isVisibleAdjacentAnnotation(textView, line, down)) {
            setArrowMark(view, line);
        } else {
            clearArrowMark();
        }
    }

    private void setArrowMark(ViewId view, int line) {
        clearArrowMark();
        host.view(view).addMarkers(line, Markers.ARROW_SYMBOL);
        arrowView = view;
        arrowReset.post(TimingConstants.TEMPORARY_MARK_MS);
    }

    /** Removes the navigation arrow, if one is shown. */
    public void clearArrowMark() {
        arrowReset.cancel();
        if (arrowView != null) {
            host.view(arrowView).clearAllMarkers(Markers.ARROW_SYMBOL);
            arrowView = null;
        }
    }
}
