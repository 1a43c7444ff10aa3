package com.example.burialviewer;

/**
 * One row of a dense series: a whole-metre distance and the depth shown for it.
 */
public class DepthStep {
    private final int x;
    private final int y;

    public DepthStep(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() { return x; }
    public int getY() { return y; }

    /** Text shown in the distance column, and what search matches against. */
    public String getXLabel() { return Integer.toString(x); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DepthStep)) return false;
        DepthStep other = (DepthStep) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "DepthStep{" +
                "x=" + x +
                ", y=" + y +
                '}';
    }
}
