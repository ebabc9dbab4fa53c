package com.project.image.enhancement.service;

import com.project.image.enhancement.config.StorageProperties;
import com.project.image.enhancement.exceptions.StorageException;
import com.project.image.enhancement.exceptions.StoredFileNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.spi.ImageWriterSpi;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path uploadDir;
    private final Path processedDir;

    public StorageService(StorageProperties properties) {
        this.uploadDir = createDirectory(properties.uploadDir());
        this.processedDir = createDirectory(properties.processedDir());
        log.info("Using upload directory: {}, processed directory: {}", uploadDir, processedDir);
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile storeOriginal(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String filename = TIMESTAMP.format(LocalDateTime.now()) + "_" + sanitize(file.getOriginalFilename());
        Path target = uploadDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /**
     * Writes an enhancement result under the original's stored name in the processed directory.
     * When {@code formatName} is given and the name's extension is not one of that format's
     * suffixes, the extension is replaced so the name matches the bytes.
     */
    public StoredFile storeProcessed(String filename, byte[] imageBytes, String formatName) {
        String name = processedName(filename, formatName);
        Path target = resolveInside(processedDir, name);
        try {
            Files.write(target, imageBytes);
            return new StoredFile(target, name, "processed/" + name);
        } catch (IOException e) {
            throw new StorageException("Failed to store processed image", e);
        }
    }

    static String processedName(String filename, String formatName) {
        if (formatName == null || filename == null) {
            return filename;
        }
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            return filename;
        }
        ImageWriterSpi provider = writers.next().getOriginatingProvider();
        String[] suffixes = provider == null ? null : provider.getFileSuffixes();
        if (suffixes == null || suffixes.length == 0) {
            return filename;
        }
        String extension = StringUtils.getFilenameExtension(filename);
        if (extension != null) {
            for (String suffix : suffixes) {
                if (suffix.equalsIgnoreCase(extension)) {
                    return filename;
                }
            }
        }
        String base = extension == null ? filename : StringUtils.stripFilenameExtension(filename);
        return base + "." + suffixes[0].toLowerCase(Locale.ROOT);
    }

    public Resource loadProcessed(String filename) {
        Path file = resolveInside(processedDir, filename);
        try {
            Resource resource = new UrlResource(file.toUri());
            if (!resource.exists() || !resource.isReadable()) {
                throw new StoredFileNotFoundException("Processed file not found: " + filename);
            }
            return resource;
        } catch (MalformedURLException e) {
            throw new StoredFileNotFoundException("Processed file not found: " + filename);
        }
    }

    /**
     * Keeps the last path segment, replaces anything outside [a-zA-Z0-9._-] and strips leading
     * dots and underscores, so the name can never address another directory.
     */
    public static String sanitize(String originalFilename) {
        String name = StringUtils.getFilename(StringUtils.cleanPath(
                originalFilename == null ? "" : originalFilename.replace('\\', '/')));
        if (name == null) {
            name = "";
        }
        String safe = name.replaceAll("[^a-zA-Z0-9._-]", "_").replaceAll("^[._]+", "");
        return safe.isEmpty() ? "upload" : safe;
    }

    private static Path resolveInside(Path dir, String filename) {
        if (!StringUtils.hasText(filename)) {
            throw new StoredFileNotFoundException("No filename given");
        }
        Path target = dir.resolve(filename).normalize();
        if (!dir.equals(target.getParent())) {
            throw new StoredFileNotFoundException("Refusing path outside storage: " + filename);
        }
        return target;
    }

    private static Path createDirectory(String dir) {
        Path path = Paths.get(dir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(path);
            return path;
        } catch (IOException e) {
            throw new StorageException("Cannot create directory: " + path, e);
        }
    }
}
