package io.github.twinview.view;

import io.github.twinview.align.AlignmentEntry;
import io.github.twinview.align.AlignmentTable;
import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.LineRange;
import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.CompareSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Draws blank padding rows so that aligned lines of both views land on the same screen row, and applies the
 * show-only-diffs / show-only-selections line filters.
 *
 * <p>Padding is never drawn above line 0, so a mismatch at an entry touching line 0 is carried to the next entry:
 * that entry then gets one extra padding row on each side, which keeps the rows below aligned.
 */
public final class ViewAligner {
    private static final Logger logger = LogManager.getLogger(ViewAligner.class);

    private final CompareSettings settings;

    public ViewAligner(CompareSettings settings) {
        this.settings = settings;
    }

    public void alignDiffs(TextView main, TextView sub, AlignmentTable alignment, CompareOptions options) {
        applyFilters(main, sub, options);

        final int maxSize = alignment.size();
        final int mainEndLine = main.lastLine();
        final int subEndLine = sub.lastLine();

        boolean lineZeroAlignmentSkipped = false;

        for (int i = 0; i < maxSize; ++i) {
            final AlignmentEntry entry = alignment.get(i);
            final int mainLine = entry.line(ViewId.MAIN);
            final int subLine = entry.line(ViewId.SUB);

            if (mainLine > mainEndLine || subLine > subEndLine) {
                break;
            }

            ViewOps.setBlankSection(main, mainLine, 0);
            ViewOps.setBlankSection(sub, subLine, 0);

            final int mismatchLen = main.visibleFromDocLine(mainLine) - sub.visibleFromDocLine(subLine);

            if (mismatchLen != 0 && (mainLine == 0 || subLine == 0)) {
                lineZeroAlignmentSkipped = true;
                continue;
            }

            if (mismatchLen > 0) {
                if (i + 1 < maxSize && subLine == alignment.get(i + 1).line(ViewId.SUB)) {
                    continue;
                }
                if (lineZeroAlignmentSkipped) {
                    ViewOps.setBlankSection(main, mainLine, 1);
                    ViewOps.setBlankSection(sub, subLine, mismatchLen + 1);
                    lineZeroAlignmentSkipped = false;
                } else {
                    ViewOps.setBlankSection(sub, subLine, mismatchLen);
                }
            } else if (mismatchLen < 0) {
                if (i + 1 < maxSize && mainLine == alignment.get(i + 1).line(ViewId.MAIN)) {
                    continue;
                }
                if (lineZeroAlignmentSkipped) {
                    ViewOps.setBlankSection(main, mainLine, -mismatchLen + 1);
                    ViewOps.setBlankSection(sub, subLine, 1);
                    lineZeroAlignmentSkipped = false;
                } else {
                    ViewOps.setBlankSection(main, mainLine, -mismatchLen);
                }
            }
        }

        if (options.isSelectionCompare()) {
            markSelectionBounds(main, sub, options);
        }

        logger.debug("Aligned {} entries ({} / {} rows)", maxSize, main.totalRows(), sub.totalRows());
    }

    private void applyFilters(TextView main, TextView sub, CompareOptions options) {
        if (settings.isShowOnlyDiffs()) {
            ViewOps.hideUnmarked(main, Markers.MASK_LINE);
            ViewOps.hideUnmarked(sub, Markers.MASK_LINE);
        } else if (options.isSelectionCompare() && settings.isShowOnlySelections()) {
            ViewOps.hideOutsideRange(main, options.getSelection(ViewId.MAIN));
            ViewOps.hideOutsideRange(sub, options.getSelection(ViewId.SUB));
        } else {
            main.showAllLines();
            sub.showAllLines();
        }
    }

    // One separator row above and below each compared selection.
    private void markSelectionBounds(TextView main, TextView sub, CompareOptions options) {
        final LineRange mainSel = options.getSelection(ViewId.MAIN);
        final LineRange subSel = options.getSelection(ViewId.SUB);

        if (mainSel.first() > 0 && subSel.first() > 0) {
            separate(main, mainSel.first(), sub, subSel.first());
        }
        if (mainSel.isValid() && subSel.isValid()) {
            separate(main, mainSel.last() + 1, sub, subSel.last() + 1);
        }
    }

    private static void separate(TextView main, int mainLine, TextView sub, int subLine) {
        int mainBlanks = main.blankLinesBelow(ViewOps.previousUnhiddenLine(main, mainLine));
        int subBlanks = sub.blankLinesBelow(ViewOps.previousUnhiddenLine(sub, subLine));

        if (mainBlanks == 0 || subBlanks == 0) {
            ++mainBlanks;
            ++subBlanks;
        }

        ViewOps.setBlankSection(main, mainLine, mainBlanks);
        ViewOps.setBlankSection(sub, subLine, subBlanks);
    }

    /**
     * Whether an aligned pair on or right around the screen of {@code view} currently sits on different rows.
     * With show-only-diffs only pairs differing on both sides count, otherwise pairs classified alike.
     */
    public boolean isAlignmentNeeded(ViewId view, TextView main, TextView sub, AlignmentTable alignment) {
        final TextView textView = view == ViewId.MAIN ? main : sub;
        final int firstLine = ViewOps.firstLine(textView);
        final int lastLine = ViewOps.lastLine(textView);
        final int maxSize = alignment.size();

        int i = alignment.indexAtOrAfter(view, firstLine);
        if (i >= maxSize) {
            return false;
        }
        if (i > 0) {
            --i;
        }

        while (i < maxSize && (alignment.get(i).line(ViewId.MAIN) == 0 || alignment.get(i).line(ViewId.SUB) == 0)) {
            ++i;
        }

        for (; i < maxSize; ++i) {
            final AlignmentEntry entry = alignment.get(i);
            final boolean rowsDiffer = main.visibleFromDocLine(entry.line(ViewId.MAIN))
                    != sub.visibleFromDocLine(entry.line(ViewId.SUB));

            if (settings.isShowOnlyDiffs()) {
                if (entry.main().isDiff() && entry.sub().isDiff() && rowsDiffer) {
                    return true;
                }
            } else if (entry.isSymmetric() && rowsDiffer) {
                return true;
            }

            if (entry.line(view) > lastLine) {
                break;
            }
        }

        return false;
    }
}
