package com.project.image.enhancement.service;

/** Mixes an original plane with its equalized version. */
public final class IntensityBlender {

    private IntensityBlender() {
    }

    /**
     * {@code round(original * (1 - intensity) + equalized * intensity)}, clamped to [0, 255].
     */
    public static int[] blend(int[] original, int[] equalized, double intensity) {
        checkIntensity(intensity);
        if (original.length != equalized.length) {
            throw new IllegalArgumentException("Planes differ in size: "
                    + original.length + " vs " + equalized.length);
        }
        double keep = 1.0 - intensity;
        int[] out = new int[original.length];
        for (int i = 0; i < original.length; i++) {
            out[i] = RasterImage.clamp((int) Math.round(original[i] * keep + equalized[i] * intensity));
        }
        return out;
    }

    public static void checkIntensity(double intensity) {
        if (Double.isNaN(intensity) || intensity < 0.0 || intensity > 1.0) {
            throw new IllegalArgumentException("Intensity must be within [0.0, 1.0], got " + intensity);
        }
    }
}
