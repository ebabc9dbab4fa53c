package com.project.image.enhancement.service;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Decoded pixels: either one 8-bit gray sample per pixel or three interleaved 8-bit samples
 * in R, G, B order. Width, height and channel count are fixed at construction.
 */
public final class RasterImage {
    public static final int GRAY = 1;
    public static final int RGB = 3;

    private final int width;
    private final int height;
    private final int channels;
    private final int[] samples;

    private RasterImage(int width, int height, int channels, int[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (channels != GRAY && channels != RGB) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (samples.length != width * height * channels) {
            throw new IllegalArgumentException("Expected " + (width * height * channels)
                    + " samples, got " + samples.length);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples;
    }

    static RasterImage gray(int width, int height, int[] plane) {
        return new RasterImage(width, height, GRAY, clampAll(plane));
    }

    public static RasterImage rgb(int width, int height, int[] red, int[] green, int[] blue) {
        int n = width * height;
        if (red.length != n || green.length != n || blue.length != n) {
            throw new IllegalArgumentException("Channel planes must hold " + n + " samples");
        }
        int[] interleaved = new int[n * RGB];
        for (int i = 0; i < n; i++) {
            interleaved[RGB * i]     = clamp(red[i]);
            interleaved[RGB * i + 1] = clamp(green[i]);
            interleaved[RGB * i + 2] = clamp(blue[i]);
        }
        return new RasterImage(width, height, RGB, interleaved);
    }

    /**
     * Reads 8-bit gray images band-wise so no color-space conversion touches the samples;
     * everything else (palette, 16-bit, alpha) goes through sRGB and loses alpha.
     */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            int[] plane = image.getRaster().getSamples(0, 0, w, h, 0, (int[]) null);
            return new RasterImage(w, h, GRAY, plane);
        }
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        int[] interleaved = new int[w * h * RGB];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            interleaved[RGB * i]     = (p >> 16) & 0xFF;
            interleaved[RGB * i + 1] = (p >> 8) & 0xFF;
            interleaved[RGB * i + 2] = p & 0xFF;
        }
        return new RasterImage(w, h, RGB, interleaved);
    }

    /** Always an 8-bit RGB image; gray samples are replicated into all three channels. */
    public BufferedImage toBufferedImage() {
        int n = width * height;
        int[] rgb = new int[n];
        for (int i = 0; i < n; i++) {
            int r, g, b;
            if (channels == GRAY) {
                r = g = b = samples[i];
            } else {
                r = samples[RGB * i];
                g = samples[RGB * i + 1];
                b = samples[RGB * i + 2];
            }
            rgb[i] = (r << 16) | (g << 8) | b;
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, width, height, rgb, 0, width);
        return out;
    }

    /** Copy of one channel as a plane; a gray image answers the same plane for any channel. */
    public int[] plane(int channel) {
        if (channel < 0 || channel >= RGB) {
            throw new IllegalArgumentException("Channel out of range: " + channel);
        }
        if (channels == GRAY) {
            return samples.clone();
        }
        int n = width * height;
        int[] plane = new int[n];
        for (int i = 0; i < n; i++) {
            plane[i] = samples[RGB * i + channel];
        }
        return plane;
    }

    int sample(int x, int y, int channel) {
        int c = channels == GRAY ? 0 : channel;
        return samples[(y * width + x) * channels + c];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    int channels() {
        return channels;
    }

    public int pixelCount() {
        return width * height;
    }

    public boolean isGray() {
        return channels == GRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterImage other)) return false;
        return width == other.width && height == other.height
                && channels == other.channels && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + ", channels=" + channels + "]";
    }

    static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }

    private static int[] clampAll(int[] plane) {
        int[] out = new int[plane.length];
        for (int i = 0; i < plane.length; i++) out[i] = clamp(plane[i]);
        return out;
    }
}
