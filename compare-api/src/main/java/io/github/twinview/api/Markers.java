package io.github.twinview.api;

/**
 * Per-line marker bits set by the diff engine on compared views. A line's marker bitmap is the OR of these
 * values; the {@code MASK_*} constants group them.
 */
public final class Markers {
    public static final int CHANGED_LINE = 1;
    public static final int ADDED_LINE = 1 << 1;
    public static final int REMOVED_LINE = 1 << 2;
    public static final int MOVED_LINE = 1 << 3;

    /** Transient navigation arrow; not part of the diff classification. */
    public static final int ARROW_SYMBOL = 1 << 8;

    /** Any bit that classifies the line itself as a difference. */
    public static final int MASK_LINE = CHANGED_LINE | ADDED_LINE | REMOVED_LINE | MOVED_LINE;

    /** Every bit the compare engine owns, including symbols. */
    public static final int MASK_ALL = MASK_LINE | ARROW_SYMBOL;

    private Markers() {}

    public static boolean isMarked(int bitmap, int mask) {
        return (bitmap & mask) != 0;
    }

    public static String describe(int bitmap) {
        if ((bitmap & MASK_ALL) == 0) {
            return "none";
        }
        var sb = new StringBuilder();
        if ((bitmap & CHANGED_LINE) != 0) sb.append("changed,");
        if ((bitmap & ADDED_LINE) != 0) sb.append("added,");
        if ((bitmap & REMOVED_LINE) != 0) sb.append("removed,");
        if ((bitmap & MOVED_LINE) != 0) sb.append("moved,");
        if ((bitmap & ARROW_SYMBOL) != 0) sb.append("arrow,");
        return sb.substring(0, sb.length() - 1);
    }
}
