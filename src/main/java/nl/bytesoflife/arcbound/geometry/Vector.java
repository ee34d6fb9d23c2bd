package nl.bytesoflife.arcbound.geometry;

record Vector(double x, double y) {

    static final Vector UNIT_X = new Vector(1, 0);
}
