package com.project.image.enhancement.DTOs;

public record EnhancementResult(
        byte[] imageBytes,
        String formatName,    // формат на изхода; при fallback - null
        int width,
        int height,
        boolean fallback,     // true когато входът не е декодиран и е върнат непроменен
        String fallbackReason
) {
    public static EnhancementResult enhanced(byte[] imageBytes, String formatName, int width, int height) {
        return new EnhancementResult(imageBytes, formatName, width, height, false, null);
    }

    public static EnhancementResult fallback(byte[] originalBytes, String reason) {
        return new EnhancementResult(originalBytes, null, 0, 0, true, reason);
    }
}
