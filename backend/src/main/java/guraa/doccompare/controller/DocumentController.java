package guraa.doccompare.controller;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.model.ComparisonRunResult;
import guraa.doccompare.model.DeleteFilesRequest;
import guraa.doccompare.model.DeletionResult;
import guraa.doccompare.model.StoredFileInfo;
import guraa.doccompare.service.DocumentComparisonService;
import guraa.doccompare.service.DocumentStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Upload, listing and deletion of the source documents.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentStorageService storageService;
    private final DocumentComparisonService comparisonService;
    private final AppProperties appProperties;

    @GetMapping("/get-file-list")
    public ResponseEntity<?> getFileList() throws IOException {
        List<StoredFileInfo> files = storageService.listFiles();
        if (files.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Not enough files for comparison"));
        }
        return ResponseEntity.ok(files);
    }

    /**
     * Store an uploaded document and compare it against the documents already stored.
     *
     * @param file The uploaded file
     * @return A confirmation, plus the summary location when a comparison was run
     * @throws IOException If the file cannot be stored or the reports cannot be written
     */
    @PostMapping("/store-files")
    public ResponseEntity<?> storeFile(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No selected file"));
        }

        Path stored = storageService.store(file);

        Map<String, Object> response = new HashMap<>();
        response.put("message", "File '" + stored.getFileName() + "' successfully stored.");

        if (storageService.listStoredFiles().size() >= 2) {
            ComparisonRunResult result = comparisonService.compareFileAgainstDirectory(
                    stored, storageService.getInputDirectory(), null, appProperties.getComparison().getBlockSize());
            response.put("results", result.getSummaryPath().toString());
            response.put("warnings", result.getWarnings());
        } else {
            log.info("Stored {} but there is nothing to compare it with yet", stored.getFileName());
        }
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/delete-files")
    public ResponseEntity<?> deleteFiles(@RequestBody(required = false) DeleteFilesRequest request) throws IOException {
        if (request == null || request.getSerialNumbers() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "No serial numbers provided"));
        }
        List<Integer> serialNumbers = request.toIntegers();
        if (serialNumbers == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid serial numbers format"));
        }
        if (!Files.isDirectory(storageService.getInputDirectory())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Input directory does not exist"));
        }

        DeletionResult result = storageService.deleteBySerialNumbers(serialNumbers);
        return ResponseEntity.ok(Map.of("message", result.toMessage()));
    }
}
