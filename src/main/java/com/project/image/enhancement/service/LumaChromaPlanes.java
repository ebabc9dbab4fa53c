package com.project.image.enhancement.service;

/**
 * Luma/chroma split of a raster (BT.601 luma weights).
 * <p>
 * Chroma is held as the exact color differences {@code R - Y}, {@code G - Y}, {@code B - Y}
 * against the rounded luma. Those are the YCrCb chroma planes before scaling and quantization
 * ({@code Cr = 0.713 (R - Y) + 128}, {@code Cb = 0.564 (B - Y) + 128}), so recomposing with
 * untouched chroma amounts to shifting every channel by the change in luma. An unchanged
 * luma plane gives back the source pixels exactly.
 */
public final class LumaChromaPlanes {
    private static final double KR = 0.299, KG = 0.587, KB = 0.114;

    private final int width;
    private final int height;
    private final int[] luma;
    private final int[] redDiff;
    private final int[] greenDiff;
    private final int[] blueDiff;

    private LumaChromaPlanes(int width, int height, int[] luma, int[] redDiff, int[] greenDiff, int[] blueDiff) {
        this.width = width;
        this.height = height;
        this.luma = luma;
        this.redDiff = redDiff;
        this.greenDiff = greenDiff;
        this.blueDiff = blueDiff;
    }

    public static LumaChromaPlanes decompose(RasterImage image) {
        int n = image.pixelCount();
        int[] r = image.plane(0), g = image.plane(1), b = image.plane(2);
        int[] y = new int[n];
        for (int i = 0; i < n; i++) {
            y[i] = RasterImage.clamp((int) Math.round(KR * r[i] + KG * g[i] + KB * b[i]));
            r[i] -= y[i];
            g[i] -= y[i];
            b[i] -= y[i];
        }
        return new LumaChromaPlanes(image.width(), image.height(), y, r, g, b);
    }

    /** Rebuilds an RGB raster from the given luma and this decomposition's chroma. */
    public RasterImage recompose(int[] newLuma) {
        int n = width * height;
        if (newLuma.length != n) {
            throw new IllegalArgumentException("Luma plane must hold " + n + " samples");
        }
        int[] r = new int[n], g = new int[n], b = new int[n];
        for (int i = 0; i < n; i++) {
            int y = newLuma[i];
            r[i] = y + redDiff[i];
            g[i] = y + greenDiff[i];
            b[i] = y + blueDiff[i];
        }
        // RasterImage.rgb clamps
        return RasterImage.rgb(width, height, r, g, b);
    }

    RasterImage recompose() {
        return recompose(luma);
    }

    public int[] luma() {
        return luma.clone();
    }
}
