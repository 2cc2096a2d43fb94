package io.github.twinview.nav;

import io.github.twinview.api.ViewId;
import org.jetbrains.annotations.Nullable;

/** Destination of a navigation command: a document line of one view, or {@link #NONE}. */
public record DiffLocation(@Nullable ViewId view, int line) {
    public static final DiffLocation NONE = new DiffLocation(null, -1);

    public static DiffLocation of(ViewId view, int line) {
        return new DiffLocation(view, line);
    }

    public boolean isNone() {
        return view == null || line < 0;
    }

    @Override
    public String toString() {
        return isNone() ? "(none)" : "(" + view + ", " + line + ")";
    }
}
