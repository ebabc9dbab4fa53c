package com.project.image.enhancement.service;

import com.project.image.enhancement.DTOs.EnhancementResult;
import com.project.image.enhancement.config.EnhancementProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Contrast enhancement by histogram equalization.
 * <p>
 * Grayscale mode equalizes the gray plane at full strength and ignores the intensity.
 * Color mode equalizes the luma plane only and blends it with the original luma by the
 * given intensity. Bytes that cannot be decoded come back unchanged.
 * <p>
 * Stateless; safe to call from any number of threads.
 */
@Service
public class EnhancementService {
    private static final Logger log = LoggerFactory.getLogger(EnhancementService.class);

    private static final String DEFAULT_FORMAT = "png";
    private static final double GRAY_R = 0.299, GRAY_G = 0.587, GRAY_B = 0.114;

    static {
        // keep ImageIO off the temp directory
        ImageIO.setUseCache(false);
    }

    private final int maxDimension;

    public EnhancementService(EnhancementProperties properties) {
        if (properties.maxDimension() <= 0) {
            throw new IllegalArgumentException("app.enhancement.max-dimension must be positive");
        }
        this.maxDimension = properties.maxDimension();
    }

    public byte[] enhance(byte[] inputBytes, ColorMode colorMode, double intensity) {
        return process(inputBytes, colorMode, intensity).imageBytes();
    }

    public EnhancementResult process(byte[] inputBytes, ColorMode colorMode, double intensity) {
        return process(inputBytes, colorMode, intensity, null);
    }

    /**
     * @param outputFormat ImageIO format name for the result, or null to keep the input's format
     */
    public EnhancementResult process(byte[] inputBytes, ColorMode colorMode, double intensity, String outputFormat) {
        Objects.requireNonNull(colorMode, "colorMode");
        IntensityBlender.checkIntensity(intensity);
        byte[] input = inputBytes == null ? new byte[0] : inputBytes;

        DecodeOutcome outcome = decode(input);
        if (outcome instanceof DecodeOutcome.Fallback fallback) {
            return fallback(input, fallback.reason());
        }
        DecodeOutcome.Decoded decoded = (DecodeOutcome.Decoded) outcome;
        RasterImage source = decoded.image();

        log.info("Enhancing {}x{} {} image, mode={}, intensity={}",
                source.width(), source.height(), decoded.formatName(), colorMode, intensity);

        RasterImage enhanced = transform(source, colorMode, intensity);

        String format = outputFormat != null ? outputFormat : decoded.formatName();
        try {
            EncodedImage encoded = encode(enhanced, format);
            log.debug("Encoded result as {} ({} bytes)", encoded.formatName(), encoded.bytes().length);
            return EnhancementResult.enhanced(encoded.bytes(), encoded.formatName(),
                    enhanced.width(), enhanced.height());
        } catch (IOException e) {
            return fallback(input, "Failed to encode image: " + e.getMessage());
        }
    }

    /**
     * The pixel work alone: equalize, blend and recompose. Output has the dimensions of the
     * input and always three channels.
     */
    public RasterImage transform(RasterImage source, ColorMode colorMode, double intensity) {
        IntensityBlender.checkIntensity(intensity);
        if (colorMode == ColorMode.GRAYSCALE) {
            int[] gray = toGrayPlane(source);
            int[] equalized = HistogramEqualizer.equalize(gray);
            return RasterImage.rgb(source.width(), source.height(), equalized, equalized, equalized);
        }

        LumaChromaPlanes planes = LumaChromaPlanes.decompose(source);
        int[] luma = planes.luma();
        int[] equalized = HistogramEqualizer.equalize(luma);
        int[] blended = IntensityBlender.blend(luma, equalized, intensity);
        return planes.recompose(blended);
    }

    DecodeOutcome decode(byte[] input) {
        if (input.length == 0) {
            return new DecodeOutcome.Fallback("Empty image buffer");
        }
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(input))) {
            if (iis == null) {
                return new DecodeOutcome.Fallback("No image input stream available");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                return new DecodeOutcome.Fallback("Unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                // header only; pixels are allocated by read(0)
                int width = reader.getWidth(0), height = reader.getHeight(0);
                if (width > maxDimension || height > maxDimension) {
                    return new DecodeOutcome.Fallback("Image too large: " + width + "x" + height
                            + " (limit " + maxDimension + "x" + maxDimension + ")");
                }
                BufferedImage image = reader.read(0);
                if (image.getWidth() <= 0 || image.getHeight() <= 0) {
                    return new DecodeOutcome.Fallback("Image has no pixels");
                }
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                return new DecodeOutcome.Decoded(RasterImage.fromBufferedImage(image), format);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            return new DecodeOutcome.Fallback("Corrupt image data: " + e.getMessage());
        }
    }

    private EncodedImage encode(RasterImage image, String requestedFormat) throws IOException {
        BufferedImage out = image.toBufferedImage();
        String format = requestedFormat.toLowerCase(Locale.ROOT);
        if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
            log.debug("No writer for {}, using {}", format, DEFAULT_FORMAT);
            format = DEFAULT_FORMAT;
        }
        byte[] bytes = write(out, format);
        if (bytes == null && !DEFAULT_FORMAT.equals(format)) {
            log.debug("Writer for {} cannot encode RGB images, using {}", format, DEFAULT_FORMAT);
            format = DEFAULT_FORMAT;
            bytes = write(out, format);
        }
        if (bytes == null) {
            throw new IOException("No writer could encode the image as " + format);
        }
        return new EncodedImage(bytes, format);
    }

    private static byte[] write(BufferedImage image, String format) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, format, baos)) {
                return null;
            }
            return baos.toByteArray();
        }
    }

    private static int[] toGrayPlane(RasterImage image) {
        if (image.isGray()) {
            return image.plane(0);
        }
        int n = image.pixelCount();
        int[] r = image.plane(0), g = image.plane(1), b = image.plane(2);
        int[] gray = new int[n];
        for (int i = 0; i < n; i++) {
            gray[i] = RasterImage.clamp((int) Math.round(GRAY_R * r[i] + GRAY_G * g[i] + GRAY_B * b[i]));
        }
        return gray;
    }

    private static EnhancementResult fallback(byte[] input, String reason) {
        log.warn("Returning original bytes unchanged ({} bytes): {}", input.length, reason);
        return EnhancementResult.fallback(input.clone(), reason);
    }

    private record EncodedImage(byte[] bytes, String formatName) {
    }
}
