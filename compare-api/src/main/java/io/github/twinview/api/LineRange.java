package io.github.twinview.api;

/**
 * Inclusive range of document lines. {@link #NONE} ({@code -1, -1}) stands for "no range"; a range whose
 * {@code last} is below {@code first} is collapsed and therefore invalid.
 */
public record LineRange(int first, int last) {
    public static final LineRange NONE = new LineRange(-1, -1);

    public boolean isNone() {
        return first < 0;
    }

    public boolean isValid() {
        return first >= 0 && last >= first;
    }

    public boolean contains(int line) {
        return line >= first && line <= last;
    }

    public int length() {
        return isValid() ? last - first + 1 : 0;
    }

    @Override
    public String toString() {
        return isNone() ? "[none]" : "[" + first + "-" + last + "]";
    }
}
