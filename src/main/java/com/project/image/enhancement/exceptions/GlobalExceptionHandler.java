package com.project.image.enhancement.exceptions;

import com.project.image.enhancement.config.EnhancementProperties;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final EnhancementProperties enhancementProperties;

    public GlobalExceptionHandler(EnhancementProperties enhancementProperties) {
        this.enhancementProperties = enhancementProperties;
    }

    @ExceptionHandler({StoredFileNotFoundException.class, NoResourceFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public String handleNotFound(Exception ex, Model model) {
        log.warn("Not found: {}", ex.getMessage());
        return form(model, "The requested file does not exist.");
    }

    @ExceptionHandler(StorageException.class)
    public String handleStorage(StorageException ex, Model model) {
        log.warn("Storage error: {}", ex.getMessage());
        return form(model, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return form(model, "The file is too large. Maximum size: 10MB");
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public String handleValidationErrors(Exception ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        return form(model, "Invalid parameters. Intensity must be between 1 and 100.");
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        return form(model, "Could not read the uploaded file. Please try another image.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return form(model, "Invalid parameters: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        return form(model, "An unexpected error occurred. Please try again.");
    }

    private String form(Model model, String error) {
        model.addAttribute("error", error);
        model.addAttribute("defaultIntensity", enhancementProperties.defaultIntensity());
        return "index";
    }
}
