package com.example.burialviewer;

/**
 * One raw survey sample: distance from the BMH and burial depth.
 * The depth is already truncated to whole centimetres when the point is read.
 */
public class MeasurementPoint {
    private final double x;
    private final int y;

    public MeasurementPoint(double x, int y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public int getY() { return y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasurementPoint)) return false;
        MeasurementPoint other = (MeasurementPoint) o;
        return Double.compare(x, other.x) == 0 && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + y;
    }

    @Override
    public String toString() {
        return "MeasurementPoint{" +
                "x=" + x +
                ", y=" + y +
                '}';
    }
}
