package com.williamcallahan.photo_mosaic_engine.util;

import com.williamcallahan.photo_mosaic_engine.model.ColorDescriptor;

import java.awt.image.BufferedImage;

/**
 * Color summaries and distance metrics for pixel regions.
 * <p>
 * Distances are computed in a luma/chroma (YCbCr, JFIF coefficients) space held in 16.16 fixed point.
 * The projection skips the final rounding step, which keeps it injective: two colors are at
 * distance zero only when every channel matches. Values are meant for ranking only.
 */
public final class ColorProfiler {

    private ColorProfiler() {}

    private static final int FIXED_ONE = 1 << 16;

    /**
     * Arithmetic mean of each ARGB channel over every pixel in the image bounds.
     * Works on sub-image views without copying.
     *
     * @throws IllegalArgumentException if the region has no pixels
     */
    public static ColorDescriptor averageColor(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        long pixelCount = (long) width * height;
        if (pixelCount == 0) {
            throw new IllegalArgumentException("Cannot average a region without pixels");
        }

        long redSum = 0;
        long greenSum = 0;
        long blueSum = 0;
        long alphaSum = 0;
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int argb : row) {
                alphaSum += (argb >>> 24) & 0xFF;
                redSum += (argb >>> 16) & 0xFF;
                greenSum += (argb >>> 8) & 0xFF;
                blueSum += argb & 0xFF;
            }
        }

        return new ColorDescriptor(
            (int) (redSum / pixelCount),
            (int) (greenSum / pixelCount),
            (int) (blueSum / pixelCount),
            (int) (alphaSum / pixelCount));
    }

    /**
     * Sum of squared per-channel differences after projecting both colors to luma/chroma.
     * Symmetric, and zero iff the descriptors are identical.
     */
    public static long colorDistance(ColorDescriptor a, ColorDescriptor b) {
        return projectedDistance(a.red(), a.green(), a.blue(), a.alpha(),
                                 b.red(), b.green(), b.blue(), b.alpha());
    }

    /**
     * Mean squared luma/chroma difference between two equally sized regions, i.e. the variance
     * (about zero) of their per-pixel difference image. More discriminating than comparing
     * averages, at O(pixels) cost.
     *
     * @throws IllegalArgumentException if the regions differ in size or are empty
     */
    public static double differenceVariance(BufferedImage a, BufferedImage b) {
        int width = a.getWidth();
        int height = a.getHeight();
        if (width != b.getWidth() || height != b.getHeight()) {
            throw new IllegalArgumentException(String.format("Region sizes differ: %dx%d vs %dx%d",
                width, height, b.getWidth(), b.getHeight()));
        }
        long pixelCount = (long) width * height;
        if (pixelCount == 0) {
            throw new IllegalArgumentException("Cannot compare regions without pixels");
        }

        double sum = 0;
        int[] rowA = new int[width];
        int[] rowB = new int[width];
        for (int y = 0; y < height; y++) {
            a.getRGB(0, y, width, 1, rowA, 0, width);
            b.getRGB(0, y, width, 1, rowB, 0, width);
            for (int x = 0; x < width; x++) {
                int pa = rowA[x];
                int pb = rowB[x];
                sum += projectedDistance(
                    (pa >>> 16) & 0xFF, (pa >>> 8) & 0xFF, pa & 0xFF, (pa >>> 24) & 0xFF,
                    (pb >>> 16) & 0xFF, (pb >>> 8) & 0xFF, pb & 0xFF, (pb >>> 24) & 0xFF);
            }
        }
        return sum / pixelCount;
    }

    private static long projectedDistance(int r1, int g1, int b1, int a1,
                                          int r2, int g2, int b2, int a2) {
        // The projection is linear, so projecting the channel differences is equivalent.
        long dr = r1 - r2;
        long dg = g1 - g2;
        long db = b1 - b2;
        long dy = luma(dr, dg, db);
        long dcb = blueChroma(dr, dg, db);
        long dcr = redChroma(dr, dg, db);
        long da = (long) (a1 - a2) * FIXED_ONE;
        return dy * dy + dcb * dcb + dcr * dcr + da * da;
    }

    static long luma(long r, long g, long b) {
        return 19595 * r + 38470 * g + 7471 * b;
    }

    static long blueChroma(long r, long g, long b) {
        return -11056 * r - 21712 * g + 32768 * b;
    }

    static long redChroma(long r, long g, long b) {
        return 32768 * r - 27440 * g - 5328 * b;
    }
}
