package nl.bytesoflife.arcbound.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Elliptical arc in endpoint form, carrying the parameters of the SVG path {@code A} command.
 *
 * @param start    current point before the arc
 * @param end      point the arc ends at
 * @param rx       x radius, expected non-negative
 * @param ry       y radius, expected non-negative
 * @param rotation rotation of the ellipse x axis, in degrees
 * @param largeArc SVG large-arc-flag
 * @param sweep    SVG sweep-flag
 */
public record Arc(Point start, Point end, double rx, double ry, double rotation,
                  boolean largeArc, boolean sweep) {

    public Arc {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public Arc(Point start, Point end, double rx, double ry, double rotation, ArcSelection selection) {
        this(start, end, rx, ry, rotation, selection.isLargeArc(), selection.isSweep());
    }

    public ArcSelection selection() {
        return ArcSelection.fromFlags(largeArc, sweep);
    }

    /**
     * SVG path data drawing this arc from its start point.
     */
    public String toPathData() {
        return String.format(Locale.US, "M %s %s A %s %s %s %d %d %s %s",
                fmt(start.x()), fmt(start.y()),
                fmt(rx), fmt(ry), fmt(rotation),
                largeArc ? 1 : 0, sweep ? 1 : 0,
                fmt(end.x()), fmt(end.y()));
    }

    private static String fmt(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.format(Locale.US, "%d", (long) value);
        }
        return String.format(Locale.US, "%s", value);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Arc[(%.4f,%.4f) -> (%.4f,%.4f), r=%.4f/%.4f, rot=%.1f, %s]",
                start.x(), start.y(), end.x(), end.y(), rx, ry, rotation, selection());
    }
}
