package com.project.image.enhancement.controller;

import com.project.image.enhancement.DTOs.EnhancementResult;
import com.project.image.enhancement.service.ColorMode;
import com.project.image.enhancement.service.EnhancementService;
import com.project.image.enhancement.service.StorageService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Controller
@Validated
public class EnhancementController {
    private static final Logger log = LoggerFactory.getLogger(EnhancementController.class);

    private final EnhancementService enhancementService;
    private final StorageService storageService;

    public EnhancementController(EnhancementService enhancementService, StorageService storageService) {
        this.enhancementService = enhancementService;
        this.storageService = storageService;
    }

    @PostMapping(value = "/", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String enhance(
            @RequestParam(name = "image", required = false) MultipartFile image,
            @RequestParam(name = "grayscale", defaultValue = "no") String grayscale,
            @RequestParam(name = "intensity", defaultValue = "100")
            @Min(value = 1, message = "Intensity must be at least 1%")
            @Max(value = 100, message = "Intensity cannot exceed 100%")
            int intensity,
            Model model
    ) throws IOException {

        if (image == null || !StringUtils.hasText(image.getOriginalFilename())) {
            log.debug("No file selected, back to the form");
            return "redirect:/";
        }

        ColorMode mode = ColorMode.fromGrayscaleOption(grayscale);
        log.info("Processing file: {} ({}KB), mode: {}, intensity: {}%",
                image.getOriginalFilename(), image.getSize() / 1024, mode, intensity);

        var storedOriginal = storageService.storeOriginal(image);
        log.debug("File stored as: {}", storedOriginal.filename());

        EnhancementResult result = enhancementService.process(image.getBytes(), mode, intensity / 100.0);
        var storedProcessed = storageService.storeProcessed(
                storedOriginal.filename(), result.imageBytes(), result.formatName());

        populateResultModel(model, storedOriginal, storedProcessed, result, mode, intensity);

        if (result.fallback()) {
            log.warn("Enhancement fell back to the original for {}: {}",
                    storedOriginal.filename(), result.fallbackReason());
        } else {
            log.info("Enhancement completed for {}, stored as {}",
                    storedOriginal.filename(), storedProcessed.filename());
        }
        return "result";
    }

    @GetMapping("/download/{filename:.+}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        Resource resource = storageService.loadProcessed(filename);
        MediaType type = MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);
        log.debug("Download of {} as {}", filename, type);
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(resource);
    }

    private void populateResultModel(Model model, StorageService.StoredFile original,
                                     StorageService.StoredFile processed, EnhancementResult result,
                                     ColorMode mode, int intensity) {
        model.addAttribute("originalFilename", original.filename());
        model.addAttribute("filename", processed.filename());
        model.addAttribute("originalPath", "/" + original.relativeWebPath());
        model.addAttribute("processedPath", "/" + processed.relativeWebPath());
        model.addAttribute("downloadPath", "/download/" + processed.filename());

        model.addAttribute("mode", mode);
        model.addAttribute("intensity", intensity);
        // grayscale always equalizes fully; the page tells the operator the slider had no effect
        model.addAttribute("intensityIgnored", mode == ColorMode.GRAYSCALE);

        model.addAttribute("fallback", result.fallback());
        model.addAttribute("fallbackReason", result.fallbackReason());
        model.addAttribute("width", result.width());
        model.addAttribute("height", result.height());
    }
}
