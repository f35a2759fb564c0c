package com.glyphlate.backend.services.ocr;

/**
 * Integer pixel rectangle, {@code (x0,y0)} top-left and {@code (x1,y1)} bottom-right.
 */
public record BoundingBox(int x0, int y0, int x1, int y1) {

    public int width() {
        return x1 - x0;
    }

    public int height() {
        return y1 - y0;
    }

    /**
     * Maps a box from a downsampled image back to the source image: every coordinate divided by
     * {@code scale} and rounded half-up. Tiny boxes may collapse to zero width/height.
     */
    public BoundingBox unscale(double scale) {
        return new BoundingBox(
                unscale(x0, scale),
                unscale(y0, scale),
                unscale(x1, scale),
                unscale(y1, scale)
        );
    }

    public static int unscale(int value, double scale) {
        return (int) Math.round(value / scale);
    }
}
