package nl.bytesoflife.arcbound.geometry;

import nl.bytesoflife.arcbound.model.Arc;

/**
 * Shape an endpoint arc actually describes: a proper elliptical arc, or a
 * straight segment when a radius is zero, both endpoints coincide, or the
 * chord is too short to register against the radii.
 */
public sealed interface ArcForm permits ArcForm.Ellipse, ArcForm.Line {

    Arc arc();

    /**
     * Rotation of the ellipse x axis in radians, reduced modulo PI.
     */
    double phi();

    record Line(Arc arc, double phi) implements ArcForm {
    }

    /**
     * @param x1p x of the half chord {@code (start - end) / 2} in the unrotated ellipse frame
     * @param y1p y of the half chord in the unrotated ellipse frame
     */
    record Ellipse(Arc arc, double phi, double x1p, double y1p) implements ArcForm {
    }

    static ArcForm of(Arc arc) {
        // Ellipses repeat every 180 degrees
        double phi = arc.rotation() % 180 / 180 * Math.PI;

        boolean samePoint = arc.start().x() == arc.end().x() && arc.start().y() == arc.end().y();
        if (arc.rx() == 0 || arc.ry() == 0 || samePoint) {
            return new Line(arc, phi);
        }

        double sinPhi = Math.sin(phi);
        double cosPhi = Math.cos(phi);
        double dx2 = (arc.start().x() - arc.end().x()) / 2;
        double dy2 = (arc.start().y() - arc.end().y()) / 2;
        double x1p = cosPhi * dx2 + sinPhi * dy2;
        double y1p = -sinPhi * dx2 + cosPhi * dy2;
        if (x1p / Math.abs(arc.rx()) == 0 && y1p / Math.abs(arc.ry()) == 0) {
            return new Line(arc, phi);
        }
        return new Ellipse(arc, phi, x1p, y1p);
    }
}
