package io.github.twinview.align;

import io.github.twinview.api.ViewId;

/**
 * "This main line corresponds to this sub line": the start of an aligned block in both views. Blank padding is
 * inserted in front of whichever line lands on an earlier visual row.
 */
public record AlignmentEntry(AlignmentSide main, AlignmentSide sub) {

    public static AlignmentEntry of(int mainLine, int mainMask, int subLine, int subMask) {
        return new AlignmentEntry(new AlignmentSide(mainLine, mainMask), new AlignmentSide(subLine, subMask));
    }

    public AlignmentSide side(ViewId view) {
        return view == ViewId.MAIN ? main : sub;
    }

    public int line(ViewId view) {
        return side(view).line();
    }

    public AlignmentEntry shifted(ViewId view, int delta) {
        return view == ViewId.MAIN
                ? new AlignmentEntry(main.shifted(delta), sub)
                : new AlignmentEntry(main, sub.shifted(delta));
    }

    /** Both halves classified the same way, i.e. a matching block or a block differing on both sides. */
    public boolean isSymmetric() {
        return main.diffMask() == sub.diffMask();
    }

    @Override
    public String toString() {
        return "(" + main.line() + ":" + main.diffMask() + " <-> " + sub.line() + ":" + sub.diffMask() + ")";
    }
}
