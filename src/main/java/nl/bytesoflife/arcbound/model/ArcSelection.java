package nl.bytesoflife.arcbound.model;

/**
 * The four arcs that connect two points on an ellipse of given radii and rotation,
 * named after the SVG large-arc and sweep flags that pick them.
 */
public enum ArcSelection {
    SMALL_NEGATIVE(false, false),
    SMALL_POSITIVE(false, true),
    LARGE_NEGATIVE(true, false),
    LARGE_POSITIVE(true, true);

    private final boolean largeArc;
    private final boolean sweep;

    ArcSelection(boolean largeArc, boolean sweep) {
        this.largeArc = largeArc;
        this.sweep = sweep;
    }

    public static ArcSelection fromFlags(boolean largeArc, boolean sweep) {
        if (largeArc) {
            return sweep ? LARGE_POSITIVE : LARGE_NEGATIVE;
        }
        return sweep ? SMALL_POSITIVE : SMALL_NEGATIVE;
    }

    public boolean isLargeArc() {
        return largeArc;
    }

    /**
     * True when the arc is traversed in the direction of increasing angle.
     */
    public boolean isSweep() {
        return sweep;
    }

    /**
     * Sign of the root used for the ellipse center: negative when both flags agree.
     */
    public int centerSign() {
        return largeArc == sweep ? -1 : 1;
    }
}
