package guraa.doccompare.service;

import guraa.doccompare.core.SimilarityScorer;
import guraa.doccompare.exception.ComparisonException;
import guraa.doccompare.exception.MinimumDocumentsException;
import guraa.doccompare.exception.NoCandidatesException;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.MatrixBuildResult;
import guraa.doccompare.model.PairReport;
import guraa.doccompare.model.ScoreMatrix;
import guraa.doccompare.model.SimilarityResult;
import guraa.doccompare.report.PairwiseReportRenderer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Scores and renders document pairs and assembles the score matrix.
 *
 * <p>Every ordered pair is an independent unit of work on the comparison executor: it reads the two
 * documents and writes only its own report file. Units report back a {@link PairOutcome}; the
 * matrix is merged once all of them have completed, and only then is the failure policy applied.
 * Full mode fails the run on any failed pair, targeted mode logs and skips it.</p>
 */
@Slf4j
@Service
public class ComparisonMatrixBuilder {

    private final SimilarityScorer scorer;
    private final PairwiseReportRenderer renderer;
    private final ExecutorService executorService;

    public ComparisonMatrixBuilder(SimilarityScorer scorer,
                                   PairwiseReportRenderer renderer,
                                   @Qualifier("comparisonExecutor") ExecutorService executorService) {
        this.scorer = scorer;
        this.renderer = renderer;
        this.executorService = executorService;
    }

    /**
     * Compare every document with every other document.
     *
     * @param documents Documents in iteration order; at least two
     * @param outputDir Directory receiving the pair reports
     * @param blockSize Maximum tokens per highlighted span
     * @return An N x N matrix with {@link ScoreMatrix#NOT_APPLICABLE} on the diagonal, and N x (N - 1) reports
     * @throws MinimumDocumentsException If fewer than two documents are given
     * @throws ComparisonException If any pair could not be scored or rendered
     */
    public MatrixBuildResult buildFull(List<Document> documents, Path outputDir, int blockSize) {
        PairwiseReportRenderer.validateBlockSize(blockSize);
        if (documents.size() < 2) {
            throw new MinimumDocumentsException(documents.size());
        }

        int n = documents.size();
        List<PairTask> tasks = new ArrayList<>(n * (n - 1));
        int reportIndex = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    tasks.add(new PairTask(i, j, reportIndex++, documents.get(i), documents.get(j)));
                }
            }
        }

        log.info("Comparing {} documents ({} ordered pairs)", n, tasks.size());
        List<PairOutcome> outcomes = runAll(tasks, outputDir, blockSize);

        List<Exception> failures = outcomes.stream()
                .filter(PairOutcome::isFailed)
                .map(PairOutcome::getFailure)
                .collect(Collectors.toList());
        if (!failures.isEmpty()) {
            ComparisonException failure = new ComparisonException(
                    failures.size() + " of " + tasks.size() + " document pairs failed: " + failures.get(0).getMessage(),
                    failures.get(0));
            failures.subList(1, failures.size()).forEach(failure::addSuppressed);
            throw failure;
        }

        double[][] values = new double[n][n];
        for (int i = 0; i < n; i++) {
            values[i][i] = ScoreMatrix.NOT_APPLICABLE;
        }
        List<PairReport> reports = new ArrayList<>(outcomes.size());
        for (PairOutcome outcome : outcomes) {
            PairTask task = outcome.getTask();
            values[task.row][task.column] = outcome.getOverlap();
            reports.add(toReport(task, task.column, outcome));
        }

        List<String> names = documents.stream().map(Document::getName).collect(Collectors.toList());
        return new MatrixBuildResult(new ScoreMatrix(names, names, values), reports, List.of());
    }

    /**
     * Compare one document against a set of candidates.
     * Candidates named like the target are dropped, as are pairs that cannot be scored; a pair whose
     * report cannot be written keeps its score but gets no report.
     *
     * @param target The document shown on the left of every report
     * @param candidates Candidates in iteration order
     * @param outputDir Directory receiving the pair reports
     * @param blockSize Maximum tokens per highlighted span
     * @return A single-row matrix with one column per compared candidate
     * @throws NoCandidatesException If no candidate remains
     */
    public MatrixBuildResult buildTargeted(Document target, List<Document> candidates, Path outputDir, int blockSize) {
        PairwiseReportRenderer.validateBlockSize(blockSize);
        List<Document> remaining = excludeTarget(target, candidates);
        if (remaining.isEmpty()) {
            throw new NoCandidatesException(target.getName());
        }

        List<PairTask> tasks = new ArrayList<>(remaining.size());
        for (int j = 0; j < remaining.size(); j++) {
            tasks.add(new PairTask(0, j, j, target, remaining.get(j)));
        }

        log.info("Comparing {} against {} candidate(s)", target.getName(), tasks.size());
        List<PairOutcome> outcomes = runAll(tasks, outputDir, blockSize);

        List<String> columnNames = new ArrayList<>();
        List<Double> scores = new ArrayList<>();
        List<PairReport> reports = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (PairOutcome outcome : outcomes) {
            PairTask task = outcome.getTask();
            if (!outcome.isScored()) {
                log.warn("Skipping {}: {}", task.right.getName(), outcome.getFailure().getMessage());
                warnings.add("Skipped " + task.right.getName() + ": " + outcome.getFailure().getMessage());
                continue;
            }

            int column = columnNames.size();
            columnNames.add(task.right.getName());
            scores.add(outcome.getOverlap());
            if (outcome.isFailed()) {
                log.warn("No report for {} vs {}: {}", target.getName(), task.right.getName(), outcome.getFailure().getMessage());
                warnings.add("No report for " + task.right.getName() + ": " + outcome.getFailure().getMessage());
            } else {
                reports.add(toReport(task, column, outcome));
            }
        }

        if (columnNames.isEmpty()) {
            throw new NoCandidatesException(target.getName());
        }

        double[][] values = {scores.stream().mapToDouble(Double::doubleValue).toArray()};
        ScoreMatrix matrix = new ScoreMatrix(List.of(target.getName()), columnNames, values);
        return new MatrixBuildResult(matrix, reports, warnings);
    }

    /**
     * Candidates whose name differs from the target's.
     */
    public List<Document> excludeTarget(Document target, List<Document> candidates) {
        return candidates.stream()
                .filter(candidate -> !candidate.getName().equals(target.getName()))
                .collect(Collectors.toList());
    }

    private List<PairOutcome> runAll(List<PairTask> tasks, Path outputDir, int blockSize) {
        List<CompletableFuture<PairOutcome>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(() -> execute(task, outputDir, blockSize), executorService))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private PairOutcome execute(PairTask task, Path outputDir, int blockSize) {
        SimilarityResult similarity;
        try {
            similarity = scorer.score(task.left.getTokens(), task.right.getTokens());
        } catch (RuntimeException e) {
            log.error("Failed to score {} vs {}: {}", task.left.getName(), task.right.getName(), e.getMessage(), e);
            return new PairOutcome(task, null, null, e);
        }

        try {
            String fileName = renderer.render(task.left, task.right, similarity, blockSize, outputDir, task.reportIndex);
            log.debug("Compared {} vs {}: {}", task.left.getName(), task.right.getName(), similarity.getOverlap());
            return new PairOutcome(task, similarity.getOverlap(), fileName, null);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to render report {} for {} vs {}: {}",
                    task.reportIndex, task.left.getName(), task.right.getName(), e.getMessage());
            return new PairOutcome(task, similarity.getOverlap(), null, e);
        }
    }

    private static PairReport toReport(PairTask task, int column, PairOutcome outcome) {
        return PairReport.builder()
                .reportIndex(task.reportIndex)
                .row(task.row)
                .column(column)
                .leftName(task.left.getName())
                .rightName(task.right.getName())
                .overlap(outcome.getOverlap())
                .fileName(outcome.getFileName())
                .build();
    }

    private static final class PairTask {
        final int row;
        final int column;
        final int reportIndex;
        final Document left;
        final Document right;

        PairTask(int row, int column, int reportIndex, Document left, Document right) {
            this.row = row;
            this.column = column;
            this.reportIndex = reportIndex;
            this.left = left;
            this.right = right;
        }
    }

    /**
     * What one unit of work produced. A missing overlap means the pair could not be scored; a
     * failure with an overlap means only the report is missing.
     */
    @Value
    private static class PairOutcome {
        PairTask task;
        Double overlap;
        String fileName;
        Exception failure;

        boolean isScored() {
            return overlap != null;
        }

        boolean isFailed() {
            return failure != null;
        }
    }
}
