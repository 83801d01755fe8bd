package guraa.doccompare.report;

import guraa.doccompare.exception.ConfigurationException;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.MatchingBlock;
import guraa.doccompare.model.SimilarityResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the side-by-side view of one ordered document pair. The left column shows the first
 * document and the right column the second, each in token order, with text belonging to the same
 * matching block highlighted in the same colour on both sides.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PairwiseReportRenderer {

    static final String TEMPLATE = "pair-report";
    static final String UNMATCHED_CLASS = "diff";
    static final int PALETTE_SIZE = 6;

    private final TemplateEngine templateEngine;

    /**
     * Fail unless the block size is usable for chunking.
     *
     * @param blockSize Maximum number of tokens per highlighted span
     * @throws ConfigurationException If the block size is not positive
     */
    public static void validateBlockSize(int blockSize) {
        if (blockSize <= 0) {
            throw new ConfigurationException("Block size must be a positive number of tokens, got " + blockSize);
        }
    }

    /**
     * File name of the report with the given running index.
     */
    public static String reportFileName(int reportIndex) {
        return reportIndex + ".html";
    }

    /**
     * Render the pair and write it to {@code <outputDir>/<reportIndex>.html}.
     *
     * @param left The document shown on the left
     * @param right The document shown on the right
     * @param similarity The score and matching blocks of {@code (left, right)}
     * @param blockSize Maximum number of tokens per highlighted span
     * @param outputDir Directory of the current run
     * @param reportIndex Running pair index, unique within the run
     * @return The name of the written file, relative to {@code outputDir}
     * @throws IOException If the report cannot be written
     */
    public String render(Document left, Document right, SimilarityResult similarity, int blockSize,
                         Path outputDir, int reportIndex) throws IOException {
        String html = renderHtml(left, right, similarity, blockSize);

        String fileName = reportFileName(reportIndex);
        Files.writeString(outputDir.resolve(fileName), html, StandardCharsets.UTF_8);
        log.debug("Wrote pair report {} ({} vs {})", fileName, left.getName(), right.getName());
        return fileName;
    }

    /**
     * Render the pair without writing it anywhere.
     */
    public String renderHtml(Document left, Document right, SimilarityResult similarity, int blockSize) {
        validateBlockSize(blockSize);

        Context context = new Context(Locale.ROOT);
        context.setVariable("leftName", left.getName());
        context.setVariable("rightName", right.getName());
        context.setVariable("overlapText", formatPercent(similarity.getOverlap()));
        context.setVariable("matchedTokens", similarity.getMatchedTokens());
        context.setVariable("leftChunks", chunk(left.getTokens(), similarity.getBlocks(), true, blockSize));
        context.setVariable("rightChunks", chunk(right.getTokens(), similarity.getBlocks(), false, blockSize));
        return templateEngine.process(TEMPLATE, context);
    }

    /**
     * Split one side of the pair into highlighted chunks of at most {@code blockSize} tokens.
     *
     * @param tokens Tokens of this side
     * @param blocks Matching blocks of the pair
     * @param leftSide Whether to read the first or the second offset of each block
     * @param blockSize Maximum tokens per chunk
     */
    static List<ReportChunk> chunk(List<String> tokens, List<MatchingBlock> blocks, boolean leftSide, int blockSize) {
        validateBlockSize(blockSize);

        List<ReportChunk> chunks = new ArrayList<>();
        int position = 0;
        int blockNumber = 0;
        for (MatchingBlock block : blocks) {
            int start = leftSide ? block.getOffsetA() : block.getOffsetB();
            if (start > position) {
                addChunks(tokens, position, start, blockSize, UNMATCHED_CLASS, chunks);
            }
            if (block.getLength() > 0) {
                String cssClass = "match match-" + (blockNumber % PALETTE_SIZE);
                addChunks(tokens, start, start + block.getLength(), blockSize, cssClass, chunks);
                blockNumber++;
            }
            position = Math.max(position, start + block.getLength());
        }
        if (position < tokens.size()) {
            addChunks(tokens, position, tokens.size(), blockSize, UNMATCHED_CLASS, chunks);
        }
        return chunks;
    }

    private static void addChunks(List<String> tokens, int from, int to, int blockSize, String cssClass,
                                  List<ReportChunk> chunks) {
        for (int start = from; start < to; start += blockSize) {
            int end = Math.min(to, start + blockSize);
            chunks.add(new ReportChunk(String.join(" ", tokens.subList(start, end)), cssClass));
        }
    }

    static String formatPercent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100);
    }
}
