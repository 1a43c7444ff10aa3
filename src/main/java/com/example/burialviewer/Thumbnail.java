package com.example.burialviewer;

/**
 * Aspect-preserving fit of an image into a box. Images are only ever shrunk.
 */
public final class Thumbnail {
    private final int width;
    private final int height;

    private Thumbnail(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public static Thumbnail fit(int naturalWidth, int naturalHeight, int boxWidth, int boxHeight) {
        if (naturalWidth <= boxWidth && naturalHeight <= boxHeight) {
            return new Thumbnail(naturalWidth, naturalHeight);
        }
        double scale = Math.min((double) boxWidth / naturalWidth, (double) boxHeight / naturalHeight);
        int w = Math.max(1, (int) Math.round(naturalWidth * scale));
        int h = Math.max(1, (int) Math.round(naturalHeight * scale));
        return new Thumbnail(w, h);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    @Override
    public String toString() {
        return "Thumbnail{" + width + "x" + height + '}';
    }
}
