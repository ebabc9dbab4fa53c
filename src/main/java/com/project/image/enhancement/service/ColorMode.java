package com.project.image.enhancement.service;

/** Which plane the enhancement equalizes. */
public enum ColorMode {
    /** Collapse to one gray plane and equalize it at full strength. */
    GRAYSCALE,
    /** Equalize the luma plane only and keep chroma untouched. */
    COLOR;

    /**
     * Maps the upload form's "convert to grayscale" option. Only "yes" selects grayscale.
     */
    public static ColorMode fromGrayscaleOption(String option) {
        return "yes".equals(option) ? GRAYSCALE : COLOR;
    }
}
