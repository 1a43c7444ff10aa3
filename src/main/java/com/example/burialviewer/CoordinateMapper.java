package com.example.burialviewer;

import java.util.Locale;

import javafx.geometry.Point2D;

/**
 * Formats the cursor read-out of the plot overlay. Depth is shown flipped against the top of
 * the plot: {@code shown y = 225 - logical y}.
 */
public final class CoordinateMapper {
    public static final double DOMAIN_X_MAX = 1000.0;
    public static final double DOMAIN_Y_MAX = 225.0;

    private CoordinateMapper() {
    }

    public static Point2D toDisplay(Point2D logical) {
        return new Point2D(logical.getX(), DOMAIN_Y_MAX - logical.getY());
    }

    /**
     * @param logical cursor position in plot units, or null when the pointer is off the plot
     * @return label text, blank when there is no position
     */
    public static String readout(Point2D logical) {
        if (logical == null) return "";
        Point2D shown = toDisplay(logical);
        return String.format(Locale.US, "X: %.2f, Y: %.2f", shown.getX(), shown.getY());
    }
}
