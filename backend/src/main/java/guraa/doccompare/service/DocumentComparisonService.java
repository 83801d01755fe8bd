package guraa.doccompare.service;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.exception.ComparisonException;
import guraa.doccompare.exception.MinimumDocumentsException;
import guraa.doccompare.exception.NoCandidatesException;
import guraa.doccompare.exception.PathNotFoundException;
import guraa.doccompare.exception.UnsupportedFormatException;
import guraa.doccompare.extraction.TextExtractionService;
import guraa.doccompare.model.ComparisonMode;
import guraa.doccompare.model.ComparisonRunResult;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.MatrixBuildResult;
import guraa.doccompare.report.PairwiseReportRenderer;
import guraa.doccompare.report.SummaryReportAssembler;
import guraa.doccompare.util.FileUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry points of a comparison run: extracts documents, drives the matrix builder and writes the
 * summary report.
 *
 * <p>Structural problems (missing paths, too few documents, invalid block size) are reported before
 * anything is written. Extraction is strict for full runs and for the target of a targeted run, and
 * lenient for the candidates of a targeted run.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentComparisonService {

    private static final DateTimeFormatter RUN_DIRECTORY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TextExtractionService extractionService;
    private final ComparisonMatrixBuilder matrixBuilder;
    private final SummaryReportAssembler summaryAssembler;
    private final AppProperties appProperties;

    /**
     * Compare every document with every other one.
     *
     * @param documents At least two extracted documents, in iteration order
     * @param outputDir Existing directory for the run, or null for a new timestamped one
     * @param blockSize Maximum tokens per highlighted span
     * @return The run result
     * @throws IOException If the run directory or the summary cannot be written
     */
    public ComparisonRunResult runFullComparison(List<Document> documents, Path outputDir, int blockSize) throws IOException {
        PairwiseReportRenderer.validateBlockSize(blockSize);
        if (documents.size() < 2) {
            throw new MinimumDocumentsException(documents.size());
        }

        Instant start = Instant.now();
        Path runDirectory = resolveOutputDirectory(outputDir);
        MatrixBuildResult built = matrixBuilder.buildFull(documents, runDirectory, blockSize);
        return finish(ComparisonMode.FULL, runDirectory, built, new ArrayList<>(), start);
    }

    /**
     * Compare one document against a set of candidates.
     *
     * @param target The document to compare
     * @param candidates Candidate documents; one named like the target is ignored
     * @param outputDir Existing directory for the run, or null for a new timestamped one
     * @param blockSize Maximum tokens per highlighted span
     * @return The run result with a single-row matrix
     * @throws IOException If the run directory or the summary cannot be written
     */
    public ComparisonRunResult runTargetedComparison(Document target, List<Document> candidates, Path outputDir,
                                                     int blockSize) throws IOException {
        return runTargeted(target, candidates, outputDir, blockSize, new ArrayList<>());
    }

    /**
     * Full comparison of the supported files in a directory. Any file whose text cannot be extracted
     * aborts the run.
     *
     * @param inputDir Directory holding the source files
     * @param outputDir Existing directory for the run, or null for a new timestamped one
     * @param blockSize Maximum tokens per highlighted span
     * @return The run result
     * @throws IOException If the directory cannot be listed or the reports cannot be written
     */
    public ComparisonRunResult compareDirectory(Path inputDir, Path outputDir, int blockSize) throws IOException {
        PairwiseReportRenderer.validateBlockSize(blockSize);
        List<Path> files = listComparableFiles(inputDir);
        if (files.size() < 2) {
            throw new MinimumDocumentsException(files.size());
        }

        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            documents.add(extractionService.extract(file));
        }
        return runFullComparison(documents, outputDir, blockSize);
    }

    /**
     * Compare one file against the other supported files of a directory. Candidates whose text
     * cannot be extracted are skipped and reported as warnings.
     *
     * @param targetFile The file to compare
     * @param inputDir Directory holding the candidate files
     * @param outputDir Existing directory for the run, or null for a new timestamped one
     * @param blockSize Maximum tokens per highlighted span
     * @return The run result with a single-row matrix
     * @throws IOException If the directory cannot be listed or the reports cannot be written
     */
    public ComparisonRunResult compareFileAgainstDirectory(Path targetFile, Path inputDir, Path outputDir,
                                                           int blockSize) throws IOException {
        PairwiseReportRenderer.validateBlockSize(blockSize);
        if (!Files.isRegularFile(targetFile)) {
            throw new PathNotFoundException("The specified input file does not exist", targetFile);
        }
        if (!extractionService.isSupported(targetFile)) {
            throw new UnsupportedFormatException("Input file must be one of " + extractionService.supportedExtensions()
                    + ": " + targetFile.getFileName());
        }

        String targetFileName = targetFile.getFileName().toString();
        List<Path> candidateFiles = listComparableFiles(inputDir).stream()
                .filter(file -> !file.getFileName().toString().equals(targetFileName))
                .collect(Collectors.toList());

        Document target = extractionService.extract(targetFile);
        if (candidateFiles.isEmpty()) {
            throw new NoCandidatesException(target.getName());
        }

        List<String> warnings = new ArrayList<>();
        List<Document> candidates = new ArrayList<>(candidateFiles.size());
        for (Path file : candidateFiles) {
            try {
                candidates.add(extractionService.extract(file));
            } catch (ComparisonException e) {
                log.warn("Skipping file {} due to error: {}", file.getFileName(), e.getMessage());
                warnings.add("Skipped " + file.getFileName() + ": " + e.getMessage());
            }
        }

        return runTargeted(target, candidates, outputDir, blockSize, warnings);
    }

    /**
     * Supported files of a directory, sorted by file name.
     *
     * @throws PathNotFoundException If the directory does not exist
     */
    public List<Path> listComparableFiles(Path inputDir) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new PathNotFoundException("The specified directory does not exist", inputDir);
        }
        try (Stream<Path> entries = Files.list(inputDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(extractionService::isSupported)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private ComparisonRunResult runTargeted(Document target, List<Document> candidates, Path outputDir,
                                            int blockSize, List<String> warnings) throws IOException {
        PairwiseReportRenderer.validateBlockSize(blockSize);
        if (matrixBuilder.excludeTarget(target, candidates).isEmpty()) {
            throw new NoCandidatesException(target.getName());
        }

        Instant start = Instant.now();
        Path runDirectory = resolveOutputDirectory(outputDir);
        MatrixBuildResult built = matrixBuilder.buildTargeted(target, candidates, runDirectory, blockSize);
        return finish(ComparisonMode.TARGETED, runDirectory, built, warnings, start);
    }

    private ComparisonRunResult finish(ComparisonMode mode, Path runDirectory, MatrixBuildResult built,
                                       List<String> warnings, Instant start) throws IOException {
        Path summaryPath = summaryAssembler.assemble(built.getMatrix(), built.getReports(), runDirectory);

        warnings.addAll(built.getWarnings());
        log.info("{} comparison finished in {} ms: {} report(s), {} warning(s)", mode,
                Duration.between(start, Instant.now()).toMillis(), built.getReports().size(), warnings.size());

        return ComparisonRunResult.builder()
                .mode(mode)
                .outputDirectory(runDirectory)
                .summaryPath(summaryPath)
                .matrix(built.getMatrix())
                .reports(built.getReports())
                .warnings(List.copyOf(warnings))
                .build();
    }

    /**
     * Use the requested directory when it exists, otherwise create a timestamped one under the
     * configured results directory.
     */
    Path resolveOutputDirectory(Path requested) throws IOException {
        if (requested != null && Files.isDirectory(requested)) {
            return requested.toAbsolutePath().normalize();
        }
        Path resultsRoot = Paths.get(appProperties.getStorage().getResultsDirectory()).toAbsolutePath().normalize();
        Path runDirectory = FileUtils.createUniqueDirectory(resultsRoot, LocalDateTime.now().format(RUN_DIRECTORY_FORMAT));
        log.debug("Created run directory {}", runDirectory);
        return runDirectory;
    }
}
