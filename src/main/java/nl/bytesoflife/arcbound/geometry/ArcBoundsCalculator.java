package nl.bytesoflife.arcbound.geometry;

import nl.bytesoflife.arcbound.model.Arc;
import nl.bytesoflife.arcbound.model.CenterArc;
import nl.bytesoflife.arcbound.model.Point;
import nl.bytesoflife.arcbound.model.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tight axis-aligned bounds of an elliptical arc, including the parts of the
 * curve that bulge past its endpoints.
 */
public class ArcBoundsCalculator {

    private static final Logger log = LoggerFactory.getLogger(ArcBoundsCalculator.class);

    // theta1 in [-PI, PI] and |dtheta| <= 2PI keep the arc inside [-3PI, 3PI]
    private static final double[] PERIOD_OFFSETS = {
            -3 * Math.PI, -2 * Math.PI, -Math.PI, 0, Math.PI, 2 * Math.PI, 3 * Math.PI};

    private final ArcParameterConverter converter;

    public ArcBoundsCalculator() {
        this(new ArcParameterConverter());
    }

    public ArcBoundsCalculator(ArcParameterConverter converter) {
        this.converter = converter;
    }

    public Rect arcBound(Arc arc) {
        Point start = arc.start();
        Point end = arc.end();
        if (ArcForm.of(arc) instanceof ArcForm.Line) {
            log.trace("Degenerate arc {}, bounding its endpoints", arc);
            return Rect.of(start, end);
        }

        // With the point of CenterArc.pointAt:
        // dx/dtheta = 0  <=>  tan(theta) = -ry / rx * tan(phi)
        // dy/dtheta = 0  <=>  tan(theta) = ry / rx / tan(phi)
        // A zero tan(phi) or cos(phi) gives an infinite argument and atan returns +-PI/2.
        CenterArc center = converter.convertArcParams(arc);
        double rx = center.rx();
        double ry = center.ry();
        double sinPhi = Math.sin(center.phi());
        double cosPhi = Math.cos(center.phi());
        double tanPhi = sinPhi / cosPhi;
        double thetaExtremaX = Math.atan(-ry / rx * tanPhi);
        double thetaExtremaY = Math.atan(ry / rx / tanPhi);

        double left = Math.min(start.x(), end.x());
        double right = Math.max(start.x(), end.x());
        double top = Math.min(start.y(), end.y());
        double bottom = Math.max(start.y(), end.y());

        for (double offset : PERIOD_OFFSETS) {
            double thetaX = thetaExtremaX + offset;
            if (isInside(center, thetaX)) {
                double x = center.pointAt(thetaX).x();
                left = Math.min(left, x);
                right = Math.max(right, x);
            }
            double thetaY = thetaExtremaY + offset;
            if (isInside(center, thetaY)) {
                double y = center.pointAt(thetaY).y();
                top = Math.min(top, y);
                bottom = Math.max(bottom, y);
            }
        }

        return new Rect(left, right, top, bottom);
    }

    /**
     * True when {@code theta} lies strictly between the start and end angles of the arc.
     */
    private static boolean isInside(CenterArc arc, double theta) {
        double ratio = (theta - arc.theta1()) / arc.dtheta();
        return ratio > 0 && ratio < 1;
    }
}
