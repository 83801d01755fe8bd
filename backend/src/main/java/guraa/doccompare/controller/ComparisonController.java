package guraa.doccompare.controller;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.model.ComparisonRunResult;
import guraa.doccompare.service.DocumentComparisonService;
import guraa.doccompare.service.DocumentStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Triggers comparison runs over the stored documents.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ComparisonController {

    private final DocumentComparisonService comparisonService;
    private final DocumentStorageService storageService;
    private final AppProperties appProperties;

    /**
     * Compare one stored document against all others.
     *
     * @param inputFile Name of a stored file, relative to the input directory
     * @return A confirmation with the summary location
     * @throws IOException If the reports cannot be written
     */
    @GetMapping("/calculate")
    public ResponseEntity<?> calculate(@RequestParam("input_file") String inputFile) throws IOException {
        log.info("Calculation requested for input file: {}", inputFile);
        Path inputDirectory = storageService.getInputDirectory();
        if (!Files.isDirectory(inputDirectory)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Input directory does not exist"));
        }
        if (storageService.listStoredFiles().size() < 2) {
            return ResponseEntity.badRequest().body(Map.of("error", "Not enough files for comparison"));
        }

        Path target = resolveStoredFile(inputDirectory, inputFile);
        if (target == null) {
            log.warn("Rejected input file outside the stored documents: {}", inputFile);
            return ResponseEntity.badRequest().body(Map.of("error", "The specified input file is not a stored document"));
        }

        ComparisonRunResult result = comparisonService.compareFileAgainstDirectory(
                target, inputDirectory, null, appProperties.getComparison().getBlockSize());

        Map<String, Object> response = new HashMap<>();
        response.put("message", "Calculation successful");
        response.put("results", result.getSummaryPath().toString());
        response.put("warnings", result.getWarnings());
        return ResponseEntity.ok(response);
    }

    /**
     * Compare all stored documents with each other.
     *
     * @return The complete run result
     * @throws IOException If the reports cannot be written
     */
    @PostMapping("/compare")
    public ResponseEntity<ComparisonRunResult> compareAll() throws IOException {
        ComparisonRunResult result = comparisonService.compareDirectory(
                storageService.getInputDirectory(), null, appProperties.getComparison().getBlockSize());
        return ResponseEntity.ok(result);
    }

    /**
     * The stored file named by {@code inputFile}, or null if it resolves outside the input directory
     * or names no stored file.
     */
    private Path resolveStoredFile(Path inputDirectory, String inputFile) throws IOException {
        Path root = inputDirectory.toAbsolutePath().normalize();
        Path target;
        try {
            target = root.resolve(inputFile).normalize();
        } catch (InvalidPathException e) {
            log.debug("Invalid input file name {}: {}", inputFile, e.getMessage());
            return null;
        }
        if (!target.startsWith(root) || target.equals(root)) {
            return null;
        }
        for (Path stored : storageService.listStoredFiles()) {
            if (stored.toAbsolutePath().normalize().equals(target)) {
                return target;
            }
        }
        return null;
    }
}
