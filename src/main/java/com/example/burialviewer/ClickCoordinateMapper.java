package com.example.burialviewer;

import java.util.Locale;

import javafx.geometry.Point2D;

/**
 * Maps a click on a thumbnail centred in its container to survey units: x spans 0..10000 and y
 * spans 0..225 across the image. Clicks off the image are not clamped.
 */
public final class ClickCoordinateMapper {
    public static final double X_SCALE = 10000.0;
    public static final double Y_SCALE = 225.0;

    private ClickCoordinateMapper() {
    }

    public static Point2D map(double clickX, double clickY,
                              int imageWidth, int imageHeight,
                              int containerWidth, int containerHeight) {
        int xOffset = Math.floorDiv(containerWidth - imageWidth, 2);
        int yOffset = Math.floorDiv(containerHeight - imageHeight, 2);

        double x = (clickX - xOffset) / imageWidth * X_SCALE;
        double y = (clickY - yOffset) / imageHeight * Y_SCALE;
        return new Point2D(x, y);
    }

    public static String readout(Point2D coords) {
        return String.format(Locale.US, "Coordinates: X=%.2f, Y=%.2f", coords.getX(), coords.getY());
    }
}
