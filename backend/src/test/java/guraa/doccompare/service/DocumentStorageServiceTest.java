package guraa.doccompare.service;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.exception.PathNotFoundException;
import guraa.doccompare.exception.UnsupportedFormatException;
import guraa.doccompare.model.DeletionResult;
import guraa.doccompare.model.StoredFileInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStorageServiceTest {

    @TempDir
    Path workDir;

    private Path inputDir;
    private DocumentStorageService storageService;

    @BeforeEach
    void setUp() {
        inputDir = workDir.resolve("input_files");
        AppProperties appProperties = new AppProperties();
        appProperties.getStorage().setInputDirectory(inputDir.toString());
        appProperties.getStorage().setResultsDirectory(workDir.resolve("results").toString());
        storageService = new DocumentStorageService(appProperties);
    }

    @Test
    void storesAllowedUpload() throws IOException {
        Path stored = storageService.store(upload("notes.txt", "hello"));

        assertEquals(inputDir.toAbsolutePath().normalize().resolve("notes.txt"), stored);
        assertEquals("hello", Files.readString(stored));
        assertTrue(Files.isDirectory(workDir.resolve("results")));
    }

    @Test
    void stripsDirectoriesFromUploadName() throws IOException {
        Path stored = storageService.store(upload("../../escape.txt", "hello"));

        assertEquals(inputDir.toAbsolutePath().normalize(), stored.getParent());
        assertEquals("escape.txt", stored.getFileName().toString());
    }

    @Test
    void rejectsDisallowedExtension() {
        assertThrows(UnsupportedFormatException.class, () -> storageService.store(upload("tool.exe", "MZ")));
        assertFalse(Files.exists(inputDir.resolve("tool.exe")));
    }

    @Test
    void listsFilesSortedWithSerialNumbers() throws IOException {
        storageService.store(upload("b.pdf", "12345"));
        storageService.store(upload("a.txt", "hello world"));

        List<StoredFileInfo> files = storageService.listFiles();

        assertEquals(2, files.size());
        assertEquals(1, files.get(0).getId());
        assertEquals("a.txt", files.get(0).getFileName());
        assertEquals("TXT", files.get(0).getFileExtension());
        assertEquals("11.00 B", files.get(0).getFileSize());
        assertEquals(2, files.get(1).getId());
        assertEquals("PDF", files.get(1).getFileExtension());
    }

    @Test
    void emptyDirectoryIsCreatedOnListing() throws IOException {
        assertTrue(storageService.listFiles().isEmpty());
        assertTrue(Files.isDirectory(inputDir));
    }

    @Test
    void deletesBySerialNumberAndCountsMisses() throws IOException {
        storageService.store(upload("a.txt", "a"));
        storageService.store(upload("b.txt", "b"));
        storageService.store(upload("c.txt", "c"));

        DeletionResult result = storageService.deleteBySerialNumbers(List.of(1, 3, 9));

        assertEquals(2, result.getDeleted());
        assertEquals(1, result.getNotFound());
        assertEquals("2 files successfully deleted, 1 file not found", result.toMessage());
        assertEquals(List.of(inputDir.toAbsolutePath().normalize().resolve("b.txt")), storageService.listStoredFiles());
    }

    @Test
    void deletionNeedsTheInputDirectory() {
        assertThrows(PathNotFoundException.class, () -> storageService.deleteBySerialNumbers(List.of(1)));
    }

    private static MockMultipartFile upload(String name, String content) {
        return new MockMultipartFile("file", name, "application/octet-stream", content.getBytes(StandardCharsets.UTF_8));
    }
}
