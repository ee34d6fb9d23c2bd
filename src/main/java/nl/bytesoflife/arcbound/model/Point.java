package nl.bytesoflife.arcbound.model;

/**
 * A coordinate in the plane, in the caller's units.
 */
public record Point(double x, double y) {
}
