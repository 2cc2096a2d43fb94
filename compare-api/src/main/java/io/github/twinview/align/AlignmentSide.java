package io.github.twinview.align;

/** One view's half of an alignment entry: the document line and the diff classification bits at that line. */
public record AlignmentSide(int line, int diffMask) {
    public AlignmentSide shifted(int delta) {
        return new AlignmentSide(line + delta, diffMask);
    }

    public boolean isDiff() {
        return diffMask != 0;
    }
}
