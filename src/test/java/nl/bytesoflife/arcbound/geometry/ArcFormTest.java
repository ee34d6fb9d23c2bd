package nl.bytesoflife.arcbound.geometry;

import nl.bytesoflife.arcbound.model.Arc;
import nl.bytesoflife.arcbound.model.Point;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArcFormTest {

    private final Point a = new Point(0, 0);
    private final Point b = new Point(1, 1);

    @Test
    void properArcIsEllipse() {
        assertInstanceOf(ArcForm.Ellipse.class, ArcForm.of(new Arc(a, b, 1, 2, 0, false, false)));
    }

    @Test
    void zeroRadiusIsLine() {
        assertInstanceOf(ArcForm.Line.class, ArcForm.of(new Arc(a, b, 0, 2, 0, false, false)));
        assertInstanceOf(ArcForm.Line.class, ArcForm.of(new Arc(a, b, 1, 0, 0, false, false)));
    }

    @Test
    void coincidentEndpointsAreLine() {
        ArcForm form = ArcForm.of(new Arc(b, new Point(1, 1), 1, 1, 0, true, true));

        assertInstanceOf(ArcForm.Line.class, form);
        assertSame(b, form.arc().start());
    }

    @Test
    void signedZeroCountsAsSamePoint() {
        assertInstanceOf(ArcForm.Line.class, ArcForm.of(new Arc(a, new Point(-0.0, -0.0), 1, 1, 0, false, false)));
    }

    @Test
    void chordLostAgainstHugeRadiiIsLine() {
        assertInstanceOf(ArcForm.Line.class, ArcForm.of(new Arc(a, new Point(1e-300, 0), 1e30, 1e30, 0, true, true)));
        assertInstanceOf(ArcForm.Ellipse.class, ArcForm.of(new Arc(a, new Point(1e-200, 0), 1, 1, 0, true, true)));
    }
}
