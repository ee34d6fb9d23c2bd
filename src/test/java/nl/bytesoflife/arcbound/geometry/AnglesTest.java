package nl.bytesoflife.arcbound.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnglesTest {

    private static final double EPS = 1e-12;

    @Test
    void counterClockwiseIsPositive() {
        assertEquals(Math.PI / 2, Angles.signedAngle(Vector.UNIT_X, new Vector(0, 1)), EPS);
        assertEquals(-Math.PI / 2, Angles.signedAngle(Vector.UNIT_X, new Vector(0, -1)), EPS);
    }

    @Test
    void oppositeVectorsGivePositivePi() {
        assertEquals(Math.PI, Angles.signedAngle(Vector.UNIT_X, new Vector(-3, 0)), EPS);
        assertEquals(Math.PI, Angles.signedAngle(new Vector(0, 2), new Vector(0, -5)), EPS);
    }

    @Test
    void magnitudeIgnoresLength() {
        assertEquals(Math.PI / 4, Angles.signedAngle(new Vector(10, 0), new Vector(0.5, 0.5)), EPS);
    }

    @Test
    void nearlyParallelVectorsStayFinite() {
        Vector u = new Vector(Math.sqrt(2), Math.sqrt(2));
        Vector v = new Vector(Math.sqrt(2) * 3, Math.sqrt(2) * 3);

        double angle = Angles.signedAngle(u, v);

        assertFalse(Double.isNaN(angle));
        assertEquals(0, angle, 1e-7);
    }

    @Test
    void tinyAnglesKeepTheirSign() {
        Vector u = new Vector(-5e-201, -1);
        Vector v = new Vector(5e-201, -1);

        assertEquals(1e-200, Angles.signedAngle(u, v), 1e-210);
        assertEquals(-1e-200, Angles.signedAngle(v, u), 1e-210);
    }
}
