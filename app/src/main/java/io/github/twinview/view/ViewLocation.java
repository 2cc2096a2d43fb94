package io.github.twinview.view;

import io.github.twinview.api.TextView;
import io.github.twinview.api.ViewId;

/**
 * Screen position of a view, anchored to a document line so that it survives padding changes: the caret line
 * when it is on screen, otherwise the top line, together with that line's distance from the top screen row.
 */
public final class ViewLocation {
    private final ViewId view;
    private final int line;
    private final int screenOffset;

    private ViewLocation(ViewId view, int line, int screenOffset) {
        this.view = view;
        this.line = line;
        this.screenOffset = screenOffset;
    }

    public static ViewLocation save(ViewId id, TextView view) {
        final int caretLine = view.caretLine();
        final int anchor = ViewOps.isLineVisible(view, caretLine) ? caretLine : ViewOps.firstLine(view);
        return new ViewLocation(id, anchor, view.visibleFromDocLine(anchor) - view.firstVisibleRow());
    }

    public ViewId view() {
        return view;
    }

    public int line() {
        return line;
    }

    /**
     * Scrolls the view back so the anchor line sits on its saved screen row.
     *
     * @return true when the view had to be scrolled
     */
    public boolean restore(TextView textView) {
        final int before = textView.firstVisibleRow();
        textView.setFirstVisibleRow(textView.visibleFromDocLine(line) - screenOffset);
        return textView.firstVisibleRow() != before;
    }

    @Override
    public String toString() {
        return "ViewLocation{" + view + ", line=" + line + ", offset=" + screenOffset + "}";
    }
}
