package guraa.doccompare.report;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.exception.ReportNotPersistedException;
import guraa.doccompare.model.PairReport;
import guraa.doccompare.model.ScoreMatrix;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SummaryReportAssemblerTest {

    @TempDir
    Path outputDir;

    private final AppProperties appProperties = new AppProperties();

    private final ScoreMatrix matrix = new ScoreMatrix(List.of("a", "b"), List.of("a", "b"),
            new double[][]{{ScoreMatrix.NOT_APPLICABLE, 0.5}, {0.5, ScoreMatrix.NOT_APPLICABLE}});

    private final List<PairReport> reports = List.of(
            report(0, 0, 1, "a", "b"),
            report(1, 1, 0, "b", "a"));

    @Test
    void writesSummaryWithLinkedCells() throws IOException {
        SummaryReportAssembler assembler = new SummaryReportAssembler(
                TestTemplates.engine(), new ReportLinkPatcher(), new ReportFileWatcher(), appProperties);

        Path summary = assembler.assemble(matrix, reports, outputDir);

        assertEquals(outputDir.resolve("_results.html"), summary);
        assertTrue(Files.exists(summary));

        org.jsoup.nodes.Document html = Jsoup.parse(summary.toFile(), "UTF-8");
        assertEquals(List.of("a", "b"), html.select("table#results thead th").eachText());

        Element diagonal = html.selectFirst("td[data-row=0][data-col=0]");
        assertEquals("-", diagonal.text());
        assertTrue(diagonal.hasClass("diagonal"));
        assertNull(diagonal.selectFirst("a"));

        Element link = html.selectFirst("td[data-row=0][data-col=1] a.report-link");
        assertEquals("0.html", link.attr("href"));
        assertEquals("50.0%", link.text());
        assertEquals("1.html", html.selectFirst("td[data-row=1][data-col=0] a").attr("href"));
    }

    @Test
    void cellWithoutReportStaysPlain() throws IOException {
        SummaryReportAssembler assembler = new SummaryReportAssembler(
                TestTemplates.engine(), new ReportLinkPatcher(), new ReportFileWatcher(), appProperties);

        Path summary = assembler.assemble(matrix, reports.subList(0, 1), outputDir);

        org.jsoup.nodes.Document html = Jsoup.parse(summary.toFile(), "UTF-8");
        assertNull(html.selectFirst("td[data-row=1][data-col=0] a"));
        assertEquals("50.0%", html.selectFirst("td[data-row=1][data-col=0]").text());
    }

    @Test
    void missingSummaryFailsWithTheMatrixAttached() {
        ReportFileWatcher watcher = mock(ReportFileWatcher.class);
        when(watcher.awaitFile(any(), any(), any())).thenReturn(false);
        ReportLinkPatcher patcher = mock(ReportLinkPatcher.class);
        appProperties.getComparison().setReportWaitTimeout(Duration.ofMillis(10));
        SummaryReportAssembler assembler = new SummaryReportAssembler(
                TestTemplates.engine(), patcher, watcher, appProperties);

        ReportNotPersistedException failure = assertThrows(ReportNotPersistedException.class,
                () -> assembler.assemble(matrix, reports, outputDir));

        assertEquals(matrix, failure.getMatrix());
        verifyNoInteractions(patcher);
    }

    private static PairReport report(int index, int row, int column, String left, String right) {
        return PairReport.builder()
                .reportIndex(index)
                .row(row)
                .column(column)
                .leftName(left)
                .rightName(right)
                .overlap(0.5)
                .fileName(PairwiseReportRenderer.reportFileName(index))
                .build();
    }
}
