package nl.bytesoflife.arcbound.geometry;

final class Angles {

    static final double TWO_PI = 2 * Math.PI;

    private Angles() {
    }

    /**
     * Angle from {@code u} to {@code v} in radians, in [-PI, PI]. A zero cross
     * product counts as positive, so opposite vectors give +PI.
     */
    static double signedAngle(Vector u, Vector v) {
        double dot = u.x() * v.x() + u.y() * v.y();
        double cross = u.x() * v.y() - u.y() * v.x();
        // atan2 keeps full precision for nearly (anti)parallel vectors, where acos of the cosine does not
        double angle = Math.atan2(Math.abs(cross), dot);
        return cross < 0 ? -angle : angle;
    }
}
