package nl.bytesoflife.arcbound.geometry;

import nl.bytesoflife.arcbound.model.Arc;
import nl.bytesoflife.arcbound.model.CenterArc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts SVG endpoint arcs to center form, following sections B.2.4 and B.2.5
 * of the SVG implementation notes (https://www.w3.org/TR/SVG/implnote.html).
 *
 * <p>The center is computed from the half chord divided by the radii, which keeps
 * every intermediate value finite for finite input of any magnitude.
 */
public class ArcParameterConverter {

    private static final Logger log = LoggerFactory.getLogger(ArcParameterConverter.class);

    public CenterArc convertArcParams(Arc arc) {
        double x1 = arc.start().x();
        double y1 = arc.start().y();
        double x2 = arc.end().x();
        double y2 = arc.end().y();
        double midX = (x1 + x2) / 2;
        double midY = (y1 + y2) / 2;

        ArcForm form = ArcForm.of(arc);
        double phi = form.phi();
        if (!(form instanceof ArcForm.Ellipse ellipse)) {
            log.trace("Degenerate arc {}, reporting it as a segment", arc);
            return new CenterArc(phi, arc.rx(), arc.ry(), midX, midY, 0, Math.PI);
        }

        double sinPhi = Math.sin(phi);
        double cosPhi = Math.cos(phi);
        double x1p = ellipse.x1p();
        double y1p = ellipse.y1p();

        // Out-of-range radii (B.2.5)
        double rx = Math.abs(arc.rx());
        double ry = Math.abs(arc.ry());
        double sqrtLambda = Math.hypot(x1p / rx, y1p / ry);
        if (sqrtLambda > 1) {
            log.debug("Radii ({}, {}) cannot reach both endpoints, scaling by {}", rx, ry, sqrtLambda);
            rx = sqrtLambda * rx;
            ry = sqrtLambda * ry;
        }

        // Center (B.2.4), divided through by rx^2 ry^2:
        // cFactor = sign * sqrt((1 - s^2) / s^2) with s the half chord measured in radii
        double xr = x1p / rx;
        double yr = y1p / ry;
        double s = Math.hypot(xr, yr);
        double ux = xr / s;
        double uy = yr / s;
        // The radius correction keeps this >= 0 in exact arithmetic only
        double c = Math.sqrt(Math.max(0, (1 - s) * (1 + s))) * arc.selection().centerSign();
        double cxp = c * rx * uy;
        double cyp = -c * ry * ux;
        double cx = cosPhi * cxp - sinPhi * cyp + midX;
        double cy = sinPhi * cxp + cosPhi * cyp + midY;

        // Start angle (B.2.4), on the unit circle of the normalized ellipse
        Vector vec1 = new Vector(xr - c * uy, yr + c * ux);
        double theta1 = Angles.signedAngle(Vector.UNIT_X, vec1);

        // The chord subtends 2 * atan2(s, c) counter-clockwise from vec1 to vec2.
        // The clockwise extent is taken from the mirrored center so a sliver next to a full turn keeps its size.
        double dtheta = arc.sweep()
                ? 2 * Math.atan2(s, c)
                : -2 * Math.atan2(s, -c);

        return new CenterArc(phi, rx, ry, cx, cy, theta1, dtheta);
    }
}
