package nl.bytesoflife.arcbound.model;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.jupiter.api.Assertions.*;

class RectTest {

    @Test
    void ofOrdersCorners() {
        Rect rect = Rect.of(new Point(4, -1), new Point(-2, 3));

        assertEquals(new Rect(-2, 4, -1, 3), rect);
        assertEquals(6, rect.width());
        assertEquals(4, rect.height());
    }

    @Test
    void containsIncludesEdges() {
        Rect rect = new Rect(-1, 1, -2, 2);

        assertTrue(rect.contains(new Point(0, 0)));
        assertTrue(rect.contains(new Point(-1, 2)));
        assertFalse(rect.contains(new Point(1.0001, 0)));
        assertFalse(rect.contains(new Point(0, -2.5)));
    }

    @Test
    void envelopeMatchesExtents() {
        Envelope env = new Rect(-1, 3, 2, 5).toEnvelope();

        assertEquals(-1, env.getMinX());
        assertEquals(3, env.getMaxX());
        assertEquals(2, env.getMinY());
        assertEquals(5, env.getMaxY());
    }
}
