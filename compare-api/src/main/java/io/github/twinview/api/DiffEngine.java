package io.github.twinview.api;

/**
 * Computes the initial comparison of two views. Implementations classify lines by setting {@link Markers} on the
 * views and describe the line correspondence in the returned summary's alignment table.
 *
 * <p>May be slow; the engine calls it synchronously, and only on explicit or debounced (re)compare.
 */
public interface DiffEngine {
    CompareSummary compare(TextView main, TextView sub, CompareOptions options);
}
