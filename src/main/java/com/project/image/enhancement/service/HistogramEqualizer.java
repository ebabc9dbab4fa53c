package com.project.image.enhancement.service;

/**
 * Global histogram equalization of a single 8-bit plane.
 * <p>
 * The lookup table is built from the cumulative histogram: for each level {@code i},
 * {@code round((H[i] - Hmin) / (N - Hmin) * 255)}, where {@code Hmin} is the first non-zero
 * cumulative count. Levels below the first occupied one land on 0. A plane with a single
 * occupied level gets the identity table.
 */
public final class HistogramEqualizer {
    public static final int LEVELS = 256;

    private HistogramEqualizer() {
    }

    public static int[] histogram(int[] plane) {
        int[] hist = new int[LEVELS];
        for (int v : plane) hist[v & 0xFF]++;
        return hist;
    }

    public static int[] equalizationMap(int[] histogram) {
        if (histogram.length != LEVELS) {
            throw new IllegalArgumentException("Histogram must have " + LEVELS + " bins");
        }
        long[] cdf = new long[LEVELS];
        long running = 0;
        for (int i = 0; i < LEVELS; i++) {
            running += histogram[i];
            cdf[i] = running;
        }
        long total = running;

        long cdfMin = 0;
        for (long c : cdf) {
            if (c > 0) {
                cdfMin = c;
                break;
            }
        }

        int[] map = new int[LEVELS];
        if (total == cdfMin) {
            for (int i = 0; i < LEVELS; i++) map[i] = i;
            return map;
        }

        double scale = 255.0 / (total - cdfMin);
        for (int i = 0; i < LEVELS; i++) {
            map[i] = RasterImage.clamp((int) Math.round((cdf[i] - cdfMin) * scale));
        }
        return map;
    }

    public static int[] apply(int[] plane, int[] map) {
        int[] out = new int[plane.length];
        for (int i = 0; i < plane.length; i++) {
            out[i] = map[plane[i] & 0xFF];
        }
        return out;
    }

    public static int[] equalize(int[] plane) {
        return apply(plane, equalizationMap(histogram(plane)));
    }
}
