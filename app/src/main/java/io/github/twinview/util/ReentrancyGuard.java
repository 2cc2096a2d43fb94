package io.github.twinview.util;

/**
 * Nesting counter. While raised, notification handlers treat incoming editor notifications as caused by the engine
 * itself. Use with try-with-resources:
 *
 * <pre>{@code
 * try (var ignored = guard.enter()) {
 *     view.insertText(pos, text);
 * }
 * }</pre>
 */
public final class ReentrancyGuard {
    private int depth;

    public Scope enter() {
        ++depth;
        return new Scope();
    }

    public boolean isActive() {
        return depth > 0;
    }

    public int depth() {
        return depth;
    }

    /** Leaves one nesting level; closing a scope twice has no further effect. */
    public final class Scope implements AutoCloseable {
        private boolean closed;

        private Scope() {}

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                --depth;
            }
        }
    }
}
