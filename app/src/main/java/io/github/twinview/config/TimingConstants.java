package io.github.twinview.config;

/**
 * Delays used by the deferred work of the compare engine. Centralizes the timing magic numbers.
 */
public final class TimingConstants {

    // Deferred work (milliseconds)
    public static final int ALIGNMENT_DELAY_MS = 30; // realignment after paint bursts
    public static final int ACTIVATION_DELAY_MS = 30; // buffer activation handling
    public static final int CLOSE_DELAY_MS = 30; // pair teardown after a compared file closes
    public static final int FLUSH_UPDATE_DELAY_MS = 30; // pending re-compare flushed by save / reload / toggle

    // Auto re-compare
    public static final int SINGLE_LINE_RECOMPARE_DELAY_MS = 1000; // user is probably typing
    public static final int MULTI_LINE_RECOMPARE_DELAY_MS = 500;

    // Delete/insert pairing
    public static final int REPLACE_DETECTION_WINDOW_MS = 40;

    // Transient highlights
    public static final int TEMPORARY_MARK_MS = 2000;

    // Oscillation filter: realignment passes allowed in a row before forcing the settle pass
    public static final int MAX_CONSECUTIVE_ALIGNS = 1;

    private TimingConstants() {} // Prevent instantiation
}
