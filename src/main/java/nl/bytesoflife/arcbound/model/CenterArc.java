package nl.bytesoflife.arcbound.model;

/**
 * Elliptical arc in center form.
 *
 * <p>A straight segment (zero radius) is reported with {@code theta1 = 0} and
 * {@code dtheta = PI} and its center at the segment midpoint.
 *
 * @param phi    rotation of the ellipse x axis, in radians
 * @param rx     x radius, enlarged when the given one could not reach both endpoints
 * @param ry     y radius, enlarged together with {@code rx}
 * @param cx     center x
 * @param cy     center y
 * @param theta1 angle of the start point, in radians
 * @param dtheta signed angular extent, in (-2PI, 2PI)
 */
public record CenterArc(double phi, double rx, double ry, double cx, double cy,
                        double theta1, double dtheta) {

    public Point center() {
        return new Point(cx, cy);
    }

    public double endAngle() {
        return theta1 + dtheta;
    }

    /**
     * Point of the ellipse at parameter angle {@code theta}.
     */
    public Point pointAt(double theta) {
        double sinPhi = Math.sin(phi);
        double cosPhi = Math.cos(phi);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        return new Point(
                rx * cosPhi * cos - ry * sinPhi * sin + cx,
                rx * sinPhi * cos + ry * cosPhi * sin + cy);
    }
}
