package io.github.twinview.api;

/**
 * Window-level services of the application hosting the two compared views.
 */
public interface CompareHost {
    TextView view(ViewId view);

    /** Identifier of the buffer currently shown in the view, or -1 when the view is empty. */
    long bufferId(ViewId view);

    String bufferName(long bufferId);

    /** The view that has the keyboard focus. */
    ViewId currentView();

    void focusView(ViewId view);

    /** Briefly flashes the application window; used to signal navigation wrap-around. */
    void flashWindow();

    void showStatus(String text);

    void showMessage(String title, String message);
}
