package guraa.doccompare.report;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.exception.ReportNotPersistedException;
import guraa.doccompare.model.PairReport;
import guraa.doccompare.model.ScoreMatrix;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the summary table of a run and links its cells to the pair reports.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryReportAssembler {

    public static final String SUMMARY_FILE_NAME = "_results.html";
    static final String TEMPLATE = "summary-report";

    private final TemplateEngine templateEngine;
    private final ReportLinkPatcher linkPatcher;
    private final ReportFileWatcher fileWatcher;
    private final AppProperties appProperties;

    /**
     * Write {@code _results.html}, wait until it is visible, then link its cells.
     *
     * @param matrix The scores of the run
     * @param reports The pair reports to link to
     * @param outputDir Directory of the run
     * @return Path of the summary file
     * @throws IOException If the summary cannot be written or patched
     * @throws ReportNotPersistedException If the summary does not appear within the configured timeout
     */
    public Path assemble(ScoreMatrix matrix, List<PairReport> reports, Path outputDir) throws IOException {
        Path summaryPath = outputDir.resolve(SUMMARY_FILE_NAME);
        Files.writeString(summaryPath, renderHtml(matrix), StandardCharsets.UTF_8);

        Duration timeout = appProperties.getComparison().getReportWaitTimeout();
        Duration pollInterval = appProperties.getComparison().getReportPollInterval();
        if (!fileWatcher.awaitFile(summaryPath, timeout, pollInterval)) {
            throw new ReportNotPersistedException(summaryPath, timeout, matrix);
        }

        Map<String, String> links = new HashMap<>();
        for (PairReport report : reports) {
            links.put(ReportLinkPatcher.cellKey(report.getRow(), report.getColumn()), report.getFileName());
        }
        int linked = linkPatcher.patch(summaryPath, links);

        log.info("Results saved at: {} ({} linked report(s))", summaryPath, linked);
        return summaryPath;
    }

    String renderHtml(ScoreMatrix matrix) {
        List<SummaryRow> rows = new ArrayList<>();
        for (int row = 0; row < matrix.getRowCount(); row++) {
            List<SummaryCell> cells = new ArrayList<>();
            for (int column = 0; column < matrix.getColumnCount(); column++) {
                cells.add(toCell(row, column, matrix.get(row, column)));
            }
            rows.add(new SummaryRow(matrix.getRowNames().get(row), cells));
        }

        Context context = new Context(Locale.ROOT);
        context.setVariable("title", matrix.isSquare() ? "Similarity results" : "Similarity results for " + matrix.getRowNames().get(0));
        context.setVariable("columnNames", matrix.getColumnNames());
        context.setVariable("rows", rows);
        return templateEngine.process(TEMPLATE, context);
    }

    private static SummaryCell toCell(int row, int column, double value) {
        if (value == ScoreMatrix.NOT_APPLICABLE) {
            return new SummaryCell(row, column, "-", null, true);
        }
        String style = String.format(Locale.ROOT, "background-color: rgba(220, 53, 69, %.2f)", value);
        return new SummaryCell(row, column, PairwiseReportRenderer.formatPercent(value), style, false);
    }

    @Value
    public static class SummaryRow {
        String name;
        List<SummaryCell> cells;
    }

    @Value
    public static class SummaryCell {
        int row;
        int column;
        String text;
        String style;
        boolean diagonal;
    }
}
