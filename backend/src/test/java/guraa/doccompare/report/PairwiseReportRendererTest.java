package guraa.doccompare.report;

import guraa.doccompare.core.SimilarityScorer;
import guraa.doccompare.exception.ConfigurationException;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.SimilarityResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PairwiseReportRendererTest {

    @TempDir
    Path outputDir;

    private final SimilarityScorer scorer = new SimilarityScorer();
    private final PairwiseReportRenderer renderer = new PairwiseReportRenderer(TestTemplates.engine());

    private final Document left = document("left", "a b c d e");
    private final Document right = document("right", "a b c x e");

    @Test
    void nonPositiveBlockSizeFailsBeforeWriting() throws IOException {
        SimilarityResult similarity = scorer.score(left.getTokens(), right.getTokens());

        assertThrows(ConfigurationException.class,
                () -> renderer.render(left, right, similarity, 0, outputDir, 0));
        assertThrows(ConfigurationException.class,
                () -> renderer.render(left, right, similarity, -3, outputDir, 0));

        try (Stream<Path> files = Files.list(outputDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void chunksFollowTokenOrderAndRespectBlockSize() {
        SimilarityResult similarity = scorer.score(left.getTokens(), right.getTokens());

        List<ReportChunk> leftChunks = PairwiseReportRenderer.chunk(left.getTokens(), similarity.getBlocks(), true, 2);
        List<ReportChunk> rightChunks = PairwiseReportRenderer.chunk(right.getTokens(), similarity.getBlocks(), false, 2);

        assertEquals(List.of(
                new ReportChunk("a b", "match match-0"),
                new ReportChunk("c", "match match-0"),
                new ReportChunk("d", "diff"),
                new ReportChunk("e", "match match-1")), leftChunks);
        assertEquals("x", rightChunks.get(2).getText());
        assertFalse(rightChunks.get(2).isMatched());
        assertTrue(rightChunks.get(3).isMatched());
    }

    @Test
    void unmatchedDocumentIsOneRunOfDiffChunks() {
        SimilarityResult similarity = scorer.score(words("p q r"), words("s t"));

        List<ReportChunk> chunks = PairwiseReportRenderer.chunk(words("p q r"), similarity.getBlocks(), true, 5);

        assertEquals(List.of(new ReportChunk("p q r", "diff")), chunks);
    }

    @Test
    void writesReportNamedAfterPairIndex() throws IOException {
        SimilarityResult similarity = scorer.score(left.getTokens(), right.getTokens());

        String fileName = renderer.render(left, right, similarity, 2, outputDir, 7);

        assertEquals("7.html", fileName);
        String html = Files.readString(outputDir.resolve(fileName), StandardCharsets.UTF_8);
        org.jsoup.nodes.Document parsed = Jsoup.parse(html);
        assertTrue(parsed.title().contains("left vs right"));
        assertEquals("80.0%", parsed.selectFirst("p.overlap strong").text());

        Elements leftSpans = parsed.select("div.left span");
        assertEquals(List.of("a b", "c", "d", "e"), leftSpans.stream().map(Element::text).collect(Collectors.toList()));
        assertTrue(leftSpans.get(0).hasClass("match-0"));
        assertTrue(leftSpans.get(2).hasClass("diff"));
        assertTrue(parsed.select("div.right span.diff").text().contains("x"));
    }

    @Test
    void missingOutputDirectoryFailsWithIOException() {
        SimilarityResult similarity = scorer.score(left.getTokens(), right.getTokens());

        assertThrows(IOException.class,
                () -> renderer.render(left, right, similarity, 2, outputDir.resolve("missing"), 0));
    }

    private static Document document(String name, String text) {
        return new Document(name, words(text));
    }

    private static List<String> words(String text) {
        return Arrays.asList(text.split(" "));
    }
}
