package guraa.doccompare.controller;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.exception.UnsupportedFormatException;
import guraa.doccompare.model.ComparisonMode;
import guraa.doccompare.model.ComparisonRunResult;
import guraa.doccompare.model.DeletionResult;
import guraa.doccompare.model.ScoreMatrix;
import guraa.doccompare.model.StoredFileInfo;
import guraa.doccompare.service.DocumentComparisonService;
import guraa.doccompare.service.DocumentStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest {

    @TempDir
    Path inputDir;

    private DocumentStorageService storageService;
    private DocumentComparisonService comparisonService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        storageService = mock(DocumentStorageService.class);
        comparisonService = mock(DocumentComparisonService.class);
        DocumentController controller = new DocumentController(storageService, comparisonService, new AppProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void emptyListingIsABadRequest() throws Exception {
        when(storageService.listFiles()).thenReturn(List.of());

        mockMvc.perform(get("/get-file-list"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Not enough files for comparison"));
    }

    @Test
    void listingUsesSnakeCaseFields() throws Exception {
        when(storageService.listFiles()).thenReturn(List.of(StoredFileInfo.builder()
                .id(1).fileName("a.txt").fileExtension("TXT").fileSize("5.00 B").build()));

        mockMvc.perform(get("/get-file-list"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].file_name").value("a.txt"))
                .andExpect(jsonPath("$[0].file_extension").value("TXT"))
                .andExpect(jsonPath("$[0].file_size").value("5.00 B"));
    }

    @Test
    void storingSecondFileRunsTargetedComparison() throws Exception {
        Path stored = inputDir.resolve("b.txt");
        when(storageService.store(any())).thenReturn(stored);
        when(storageService.listStoredFiles()).thenReturn(List.of(inputDir.resolve("a.txt"), stored));
        when(storageService.getInputDirectory()).thenReturn(inputDir);
        when(comparisonService.compareFileAgainstDirectory(eq(stored), eq(inputDir), isNull(), anyInt()))
                .thenReturn(runResult(inputDir.resolve("_results.html")));

        mockMvc.perform(multipart("/store-files").file(new MockMultipartFile("file", "b.txt", "text/plain", "b c".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("File 'b.txt' successfully stored."))
                .andExpect(jsonPath("$.results").value(inputDir.resolve("_results.html").toString()));
    }

    @Test
    void storingFirstFileSkipsComparison() throws Exception {
        Path stored = inputDir.resolve("a.txt");
        when(storageService.store(any())).thenReturn(stored);
        when(storageService.listStoredFiles()).thenReturn(List.of(stored));

        mockMvc.perform(multipart("/store-files").file(new MockMultipartFile("file", "a.txt", "text/plain", "a".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results").doesNotExist());

        verifyNoInteractions(comparisonService);
    }

    @Test
    void unsupportedUploadIsABadRequest() throws Exception {
        when(storageService.store(any())).thenThrow(new UnsupportedFormatException("Unsupported file type: x.exe"));

        mockMvc.perform(multipart("/store-files").file(new MockMultipartFile("file", "x.exe", "application/octet-stream", "MZ".getBytes())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported file type: x.exe"));
    }

    @Test
    void deleteWithoutBodyIsABadRequest() throws Exception {
        mockMvc.perform(delete("/delete-files").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No serial numbers provided"));
    }

    @Test
    void deleteWithMalformedSerialNumbersIsABadRequest() throws Exception {
        mockMvc.perform(delete("/delete-files")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serial_numbers\": [\"first\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid serial numbers format"));
    }

    @Test
    void fractionalSerialNumbersAreNotTruncated() throws Exception {
        when(storageService.getInputDirectory()).thenReturn(inputDir);

        mockMvc.perform(delete("/delete-files")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serial_numbers\": [1.5]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid serial numbers format"));

        verify(storageService, never()).deleteBySerialNumbers(any());
    }

    @Test
    void nullSerialNumberIsRejected() throws Exception {
        mockMvc.perform(delete("/delete-files")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serial_numbers\": [1, null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid serial numbers format"));

        verify(storageService, never()).deleteBySerialNumbers(any());
    }

    @Test
    void deleteReportsCounts() throws Exception {
        when(storageService.getInputDirectory()).thenReturn(inputDir);
        when(storageService.deleteBySerialNumbers(List.of(1, 4))).thenReturn(new DeletionResult(1, 1));

        mockMvc.perform(delete("/delete-files")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serial_numbers\": [1, 4]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("1 file successfully deleted, 1 file not found"));
    }

    private static ComparisonRunResult runResult(Path summaryPath) {
        ScoreMatrix matrix = new ScoreMatrix(List.of("b"), List.of("a"), new double[][]{{0.5}});
        return ComparisonRunResult.builder()
                .mode(ComparisonMode.TARGETED)
                .outputDirectory(summaryPath.getParent())
                .summaryPath(summaryPath)
                .matrix(matrix)
                .reports(List.of())
                .warnings(List.of())
                .build();
    }
}
