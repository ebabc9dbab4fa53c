package com.project.image.enhancement;

import com.project.image.enhancement.config.StorageProperties;
import com.project.image.enhancement.exceptions.StorageException;
import com.project.image.enhancement.exceptions.StoredFileNotFoundException;
import com.project.image.enhancement.service.StorageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StorageServiceTest {

    @TempDir
    Path tmp;

    private StorageService storage() {
        return new StorageService(new StorageProperties(
                tmp.resolve("uploads").toString(), tmp.resolve("processed").toString()));
    }

    @Test
    void constructor_createsBothDirectories() {
        storage();
        assertThat(tmp.resolve("uploads")).isDirectory();
        assertThat(tmp.resolve("processed")).isDirectory();
    }

    @Test
    void storeOriginal_and_storeProcessed_useSameName() throws Exception {
        StorageService storage = storage();
        MockMultipartFile file = new MockMultipartFile(
                "image", "test.png", "image/png", new byte[]{1, 2, 3, 4}
        );

        var original = storage.storeOriginal(file);
        var processed = storage.storeProcessed(original.filename(), new byte[]{8, 9, 10}, "png");

        assertThat(original.filename()).endsWith("_test.png");
        assertThat(original.relativeWebPath()).isEqualTo("uploads/" + original.filename());
        assertThat(Files.readAllBytes(original.path())).containsExactly(1, 2, 3, 4);

        assertThat(processed.filename()).isEqualTo(original.filename());
        assertThat(processed.relativeWebPath()).isEqualTo("processed/" + original.filename());
        assertThat(processed.path().getParent()).isEqualTo(tmp.resolve("processed").toAbsolutePath().normalize());

        Resource loaded = storage.loadProcessed(processed.filename());
        assertThat(loaded.getContentAsByteArray()).containsExactly(8, 9, 10);
    }

    @Test
    void storeOriginal_rejectsEmptyUpload() {
        StorageService storage = storage();
        MockMultipartFile empty = new MockMultipartFile("image", "x.png", "image/png", new byte[0]);

        assertThatThrownBy(() -> storage.storeOriginal(empty)).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.storeOriginal(null)).isInstanceOf(StorageException.class);
    }

    @Test
    void storeOriginal_acceptsNonImageContent() {
        StorageService storage = storage();
        MockMultipartFile notImage = new MockMultipartFile("image", "x.txt", "text/plain", "hi".getBytes());

        assertThat(storage.storeOriginal(notImage).path()).exists();
    }

    @Test
    void loadProcessed_unknownOrEscapingName_isNotFound() {
        StorageService storage = storage();

        assertThatThrownBy(() -> storage.loadProcessed("missing.png"))
                .isInstanceOf(StoredFileNotFoundException.class);
        assertThatThrownBy(() -> storage.loadProcessed("../uploads/anything.png"))
                .isInstanceOf(StoredFileNotFoundException.class);
        assertThatThrownBy(() -> storage.storeProcessed("../escape.png", new byte[]{1}, null))
                .isInstanceOf(StoredFileNotFoundException.class);
    }

    @Test
    void storeProcessed_renamesExtensionToMatchWrittenFormat() {
        StorageService storage = storage();

        var converted = storage.storeProcessed("20260101_scan.wbmp", new byte[]{1}, "png");
        assertThat(converted.filename()).isEqualTo("20260101_scan.png");
        assertThat(converted.relativeWebPath()).isEqualTo("processed/20260101_scan.png");
        assertThat(converted.path()).exists();

        assertThat(storage.storeProcessed("photo.JPG", new byte[]{1}, "jpeg").filename()).isEqualTo("photo.JPG");
        assertThat(storage.storeProcessed("noext", new byte[]{1}, "bmp").filename()).isEqualTo("noext.bmp");
        assertThat(storage.storeProcessed("notes.txt", new byte[]{1}, null).filename()).isEqualTo("notes.txt");
    }

    @Test
    void sanitize_stripsPathsAndOddCharacters() {
        assertThat(StorageService.sanitize("../../etc/passwd")).isEqualTo("passwd");
        assertThat(StorageService.sanitize("C:\\Users\\me\\pic.jpg")).isEqualTo("pic.jpg");
        assertThat(StorageService.sanitize("my photo (1).png")).isEqualTo("my_photo__1_.png");
        assertThat(StorageService.sanitize(".hidden.png")).isEqualTo("hidden.png");
        assertThat(StorageService.sanitize("...")).isEqualTo("upload");
        assertThat(StorageService.sanitize(null)).isEqualTo("upload");
    }
}
