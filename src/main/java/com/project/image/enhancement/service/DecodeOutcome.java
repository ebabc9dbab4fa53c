package com.project.image.enhancement.service;

/**
 * Result of turning uploaded bytes into pixels: either the decoded raster together with the
 * format it was stored in, or the reason the bytes could not be read.
 */
public sealed interface DecodeOutcome {

    record Decoded(RasterImage image, String formatName) implements DecodeOutcome {
    }

    record Fallback(String reason) implements DecodeOutcome {
    }
}
