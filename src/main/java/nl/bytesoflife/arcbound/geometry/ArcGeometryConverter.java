package nl.bytesoflife.arcbound.geometry;

import nl.bytesoflife.arcbound.model.Arc;
import nl.bytesoflife.arcbound.model.CenterArc;
import nl.bytesoflife.arcbound.model.Point;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens endpoint arcs into JTS line strings.
 */
public class ArcGeometryConverter {

    private static final Logger log = LoggerFactory.getLogger(ArcGeometryConverter.class);

    public static final int ARC_SEGMENTS = 32;
    private static final int MIN_SEGMENTS = 8;

    private final GeometryFactory factory = new GeometryFactory();
    private final ArcParameterConverter converter = new ArcParameterConverter();
    private final int segmentsPerTurn;

    public ArcGeometryConverter() {
        this(ARC_SEGMENTS);
    }

    public ArcGeometryConverter(int segmentsPerTurn) {
        if (segmentsPerTurn <= 0) {
            throw new IllegalArgumentException("segmentsPerTurn must be positive, got " + segmentsPerTurn);
        }
        this.segmentsPerTurn = segmentsPerTurn;
    }

    public int getSegmentsPerTurn() {
        return segmentsPerTurn;
    }

    public LineString toLineString(Arc arc) {
        return factory.createLineString(toCoordinates(arc).toArray(new Coordinate[0]));
    }

    List<Coordinate> toCoordinates(Arc arc) {
        List<Coordinate> coords = new ArrayList<>();
        coords.add(toCoordinate(arc.start()));

        if (ArcForm.of(arc) instanceof ArcForm.Ellipse) {
            CenterArc center = converter.convertArcParams(arc);
            int segments = segmentCount(center.dtheta());
            log.debug("Flattening {} into {} segments", arc, segments);
            // Interior samples only, the endpoints are pinned to the exact input points
            for (int i = 1; i < segments; i++) {
                double t = (double) i / segments;
                coords.add(toCoordinate(center.pointAt(center.theta1() + center.dtheta() * t)));
            }
        }

        coords.add(toCoordinate(arc.end()));
        return coords;
    }

    int segmentCount(double dtheta) {
        int segments = (int) Math.ceil(Math.abs(dtheta) / Angles.TWO_PI * segmentsPerTurn);
        return Math.max(MIN_SEGMENTS, segments);
    }

    private static Coordinate toCoordinate(Point p) {
        return new Coordinate(p.x(), p.y());
    }
}
