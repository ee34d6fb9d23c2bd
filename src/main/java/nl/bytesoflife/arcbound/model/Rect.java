package nl.bytesoflife.arcbound.model;

import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned bounding box. {@code top} is the minimum y, {@code bottom} the maximum y.
 *
 * @param left   minimum x
 * @param right  maximum x
 * @param top    minimum y
 * @param bottom maximum y
 */
public record Rect(double left, double right, double top, double bottom) {

    /**
     * Bounding box of two points.
     */
    public static Rect of(Point a, Point b) {
        return new Rect(
                Math.min(a.x(), b.x()),
                Math.max(a.x(), b.x()),
                Math.min(a.y(), b.y()),
                Math.max(a.y(), b.y()));
    }

    public double width() {
        return right - left;
    }

    public double height() {
        return bottom - top;
    }

    public boolean contains(Point p) {
        return p.x() >= left && p.x() <= right && p.y() >= top && p.y() <= bottom;
    }

    public Envelope toEnvelope() {
        return new Envelope(left, right, top, bottom);
    }
}
