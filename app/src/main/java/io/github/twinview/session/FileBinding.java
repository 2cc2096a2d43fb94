package io.github.twinview.session;

import io.github.twinview.api.Markers;
import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;
import io.github.twinview.track.ChangeTracker;

/** One side of a compare pair: the buffer, the view it is compared in and its delete history. */
public final class FileBinding {
    private final long bufferId;
    private final String name;
    private final boolean isNew;
    private final ViewId view;
    private final ChangeTracker tracker;

    public FileBinding(long bufferId, String name, boolean isNew, ViewId view, ChangeTracker tracker) {
        this.bufferId = bufferId;
        this.name = name;
        this.isNew = isNew;
        this.view = view;
        this.tracker = tracker;
    }

    public long bufferId() {
        return bufferId;
    }

    public String name() {
        return name;
    }

    public boolean isNew() {
        return isNew;
    }

    public ViewId view() {
        return view;
    }

    public ChangeTracker tracker() {
        return tracker;
    }

    /** The same file, now shown in {@code otherView}; the delete history is shared. */
    public FileBinding inView(ViewId otherView) {
        return otherView == view ? this : new FileBinding(bufferId, name, isNew, otherView, tracker);
    }

    /**
     * Drops all compare decoration from the view. Automatic recompares keep the delete history so that undoing
     * edits made before the recompare still restores markers.
     */
    public void clear(TextView textView, boolean keepDeleteHistory) {
        textView.clearAllMarkers(Markers.MASK_ALL);
        textView.clearAllBlankLines();
        textView.showAllLines();

        if (!keepDeleteHistory) {
            tracker.clear();
        }
    }

    @Override
    public String toString() {
        return "FileBinding{" + name + " #" + bufferId + ", " + (isNew ? "new" : "old") + ", " + view + "}";
    }
}
