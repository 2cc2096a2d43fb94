package io.github.twinview.config;

/** What the status bar shows after the compare mode header. */
public enum StatusType {
    COMPARE_SUMMARY,
    COMPARE_OPTIONS,
    STATUS_DISABLED;

    public StatusType next() {
        var values = values();
        return values[(ordinal() + 1) % values.length];
    }
}
