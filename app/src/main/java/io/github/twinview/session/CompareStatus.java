package io.github.twinview.session;

import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.CompareSummary;
import io.github.twinview.api.ViewId;
import io.github.twinview.config.StatusType;

/**
 * Status line of the active compare pair.
 *
 * @param text the rendered status line, empty when status display is disabled
 * @param state the pair's lifecycle state
 * @param dirty whether the comparison can no longer be trusted
 * @param manuallyChanged whether a compared file was edited by the user since the comparison
 */
public record CompareStatus(String text, SessionState state, boolean dirty, boolean manuallyChanged) {

    public static final String MANUALLY_CHANGED_TEXT = "FILE MANUALLY CHANGED, PLEASE RE-COMPARE!";
    public static final String CHANGED_TEXT = "FILE CHANGED, COMPARE RESULTS MIGHT BE INACCURATE!";

    public static final CompareStatus NONE = new CompareStatus("", SessionState.UNPAIRED, false, false);

    public static CompareStatus of(CompareSession session, StatusType statusType) {
        return new CompareStatus(
                render(session, statusType), session.state(), session.isDirty(), session.isManuallyChanged());
    }

    static String render(CompareSession session, StatusType statusType) {
        if (statusType == StatusType.STATUS_DISABLED) {
            return "";
        }
        if (session.isDirty()) {
            return MANUALLY_CHANGED_TEXT;
        }
        if (session.isStale()) {
            return CHANGED_TEXT;
        }

        final CompareOptions options = session.options();
        final var info = new StringBuilder(options.isFindUniqueMode() ? "Find Unique" : "Compare");

        if (options.isSelectionCompare()) {
            var main = options.getSelection(ViewId.MAIN);
            var sub = options.getSelection(ViewId.SUB);
            info.append(String.format(" Selections - %d-%d vs. %d-%d ***",
                    main.first() + 1, main.last() + 1, sub.first() + 1, sub.last() + 1));
        } else {
            info.append(" ***");
        }

        if (statusType == StatusType.COMPARE_OPTIONS) {
            appendIf(info, options.isIgnoreSpaces(), " Ignore Spaces ,");
            appendIf(info, options.isIgnoreEmptyLines(), " Ignore Empty Lines ,");
            appendIf(info, options.isIgnoreCase(), " Ignore Case ,");
            appendIf(info, options.isDetectMoves(), " Detect Moves ,");
            appendIf(info, options.isIgnoreLineNumbers(), " Ignore Line Numbers ,");
        } else {
            final CompareSummary summary = session.summary();

            appendIf(info, summary.diffLines() > 0, " " + summary.diffLines() + " Diff Lines: ");
            appendIf(info, summary.added() > 0, " " + summary.added() + " Added ,");
            appendIf(info, summary.removed() > 0, " " + summary.removed() + " Removed ,");
            appendIf(info, summary.changed() > 0, " " + summary.changed() + " Changed ,");
            appendIf(info, summary.moved() > 0, " " + summary.moved() + " Moved ,");

            if (summary.match() > 0) {
                // the match count closes the sentence: replace the trailing " ," by "."
                trimTrailingComma(info);
                info.append(".  ").append(summary.match()).append(" Match ,");
            }
        }

        trimTrailingComma(info);
        return info.toString();
    }

    private static void appendIf(StringBuilder info, boolean condition, String text) {
        if (condition) {
            info.append(text);
        }
    }

    private static void trimTrailingComma(StringBuilder info) {
        final int len = info.length();
        if (len >= 2 && info.charAt(len - 2) == ' ' && info.charAt(len - 1) == ',') {
            info.setLength(len - 2);
        }
    }
}
