package io.github.twinview.api;

/** The two side-by-side views of a compare. Used as the index into per-view two-element arrays. */
public enum ViewId {
    MAIN,
    SUB;

    public ViewId other() {
        return this == MAIN ? SUB : MAIN;
    }

    public int index() {
        return ordinal();
    }

    public static ViewId fromIndex(int index) {
        return switch (index) {
            case 0 -> MAIN;
            case 1 -> SUB;
            default -> throw new IllegalArgumentException("No view with index " + index);
        };
    }
}
