package com.example.burialviewer;

import javafx.geometry.Point2D;

/**
 * Linear transform between a pixel rectangle on screen and a rectangle in survey units.
 *
 * <p>Pixel y always grows downward. With {@code flipY} set the domain y grows upward, so the
 * bottom pixel row maps to the domain minimum; without it the top row does.
 */
public class CoordinateSpace {
    private final double domainXMin, domainXMax;
    private final double domainYMin, domainYMax;
    private final double pixelXMin, pixelXMax;
    private final double pixelYMin, pixelYMax;
    private final boolean flipY;

    public CoordinateSpace(double domainXMin, double domainXMax,
                           double domainYMin, double domainYMax,
                           double pixelXMin, double pixelXMax,
                           double pixelYMin, double pixelYMax,
                           boolean flipY) {
        this.domainXMin = domainXMin;
        this.domainXMax = domainXMax;
        this.domainYMin = domainYMin;
        this.domainYMax = domainYMax;
        this.pixelXMin = pixelXMin;
        this.pixelXMax = pixelXMax;
        this.pixelYMin = pixelYMin;
        this.pixelYMax = pixelYMax;
        this.flipY = flipY;
    }

    public boolean containsPixel(double px, double py) {
        return px >= pixelXMin && px <= pixelXMax && py >= pixelYMin && py <= pixelYMax;
    }

    /**
     * Converts a pixel position to domain coordinates.
     * @return the domain point, or null when the pixel lies outside the mapped rectangle
     */
    public Point2D toDomain(double px, double py) {
        if (!containsPixel(px, py) || pixelXMax == pixelXMin || pixelYMax == pixelYMin) {
            return null;
        }
        double fx = (px - pixelXMin) / (pixelXMax - pixelXMin);
        double fy = (py - pixelYMin) / (pixelYMax - pixelYMin);
        if (flipY) fy = 1.0 - fy;
        return new Point2D(
                domainXMin + fx * (domainXMax - domainXMin),
                domainYMin + fy * (domainYMax - domainYMin));
    }

    /** Inverse of {@link #toDomain}; no range check. */
    public Point2D toPixel(double dx, double dy) {
        double fx = (dx - domainXMin) / (domainXMax - domainXMin);
        double fy = (dy - domainYMin) / (domainYMax - domainYMin);
        if (flipY) fy = 1.0 - fy;
        return new Point2D(
                pixelXMin + fx * (pixelXMax - pixelXMin),
                pixelYMin + fy * (pixelYMax - pixelYMin));
    }

    public boolean isFlipY() { return flipY; }
    public double getDomainXMin() { return domainXMin; }
    public double getDomainXMax() { return domainXMax; }
    public double getDomainYMin() { return domainYMin; }
    public double getDomainYMax() { return domainYMax; }
}
