package io.github.twinview.api;

/**
 * Options a comparison was computed with. Set when a compare is triggered manually; the selection ranges are
 * adjusted incrementally afterwards as edits move them.
 */
public final class CompareOptions {
    private ViewId newFileView = ViewId.SUB;

    private boolean ignoreSpaces;
    private boolean ignoreCase;
    private boolean ignoreEmptyLines;
    private boolean ignoreLineNumbers;
    private boolean detectMoves = true;
    private boolean charPrecision;
    private boolean findUniqueMode;

    private boolean selectionCompare;
    private final LineRange[] selections = {LineRange.NONE, LineRange.NONE};

    public ViewId getNewFileView() {
        return newFileView;
    }

    public void setNewFileView(ViewId newFileView) {
        this.newFileView = newFileView;
    }

    public ViewId getOldFileView() {
        return newFileView.other();
    }

    public boolean isIgnoreSpaces() {
        return ignoreSpaces;
    }

    public void setIgnoreSpaces(boolean ignoreSpaces) {
        this.ignoreSpaces = ignoreSpaces;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public void setIgnoreCase(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    public boolean isIgnoreEmptyLines() {
        return ignoreEmptyLines;
    }

    public void setIgnoreEmptyLines(boolean ignoreEmptyLines) {
        this.ignoreEmptyLines = ignoreEmptyLines;
    }

    public boolean isIgnoreLineNumbers() {
        return ignoreLineNumbers;
    }

    public void setIgnoreLineNumbers(boolean ignoreLineNumbers) {
        this.ignoreLineNumbers = ignoreLineNumbers;
    }

    public boolean isDetectMoves() {
        return detectMoves;
    }

    public void setDetectMoves(boolean detectMoves) {
        this.detectMoves = detectMoves;
    }

    public boolean isCharPrecision() {
        return charPrecision;
    }

    public void setCharPrecision(boolean charPrecision) {
        this.charPrecision = charPrecision;
    }

    public boolean isFindUniqueMode() {
        return findUniqueMode;
    }

    public void setFindUniqueMode(boolean findUniqueMode) {
        this.findUniqueMode = findUniqueMode;
    }

    public boolean isSelectionCompare() {
        return selectionCompare;
    }

    public void setSelectionCompare(boolean selectionCompare) {
        this.selectionCompare = selectionCompare;
    }

    public LineRange getSelection(ViewId view) {
        return selections[view.index()];
    }

    public void setSelection(ViewId view, LineRange range) {
        selections[view.index()] = range;
    }

    @Override
    public String toString() {
        return "CompareOptions{newFileView=" + newFileView
                + ", ignoreSpaces=" + ignoreSpaces
                + ", ignoreCase=" + ignoreCase
                + ", ignoreEmptyLines=" + ignoreEmptyLines
                + ", ignoreLineNumbers=" + ignoreLineNumbers
                + ", detectMoves=" + detectMoves
                + ", charPrecision=" + charPrecision
                + ", findUniqueMode=" + findUniqueMode
                + ", selectionCompare=" + selectionCompare
                + ", selections=" + selections[0] + "/" + selections[1] + "}";
    }
}
