package guraa.doccompare.report;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Turns the score cells of a written summary table into links to their pair reports.
 * Cells are addressed by their {@code data-row} and {@code data-col} attributes. Patching an
 * already patched file leaves it unchanged.
 */
@Slf4j
@Component
public class ReportLinkPatcher {

    static final String LINK_CLASS = "report-link";

    public static String cellKey(int row, int column) {
        return row + ":" + column;
    }

    /**
     * Rewrite the summary so every cell listed in {@code links} points at its report.
     *
     * @param summaryPath The written summary file
     * @param links Report file name by {@link #cellKey(int, int)}
     * @return The number of linked cells
     * @throws IOException If the summary cannot be read or written
     */
    public int patch(Path summaryPath, Map<String, String> links) throws IOException {
        Document html = Jsoup.parse(summaryPath.toFile(), StandardCharsets.UTF_8.name());
        html.outputSettings().prettyPrint(false);

        int linked = 0;
        for (Element cell : html.select("td[data-row][data-col]")) {
            String href = links.get(cellKey(Integer.parseInt(cell.attr("data-row")), Integer.parseInt(cell.attr("data-col"))));
            if (href == null) {
                continue;
            }

            Element link = cell.selectFirst("a." + LINK_CLASS);
            if (link == null) {
                String label = cell.text();
                cell.empty();
                link = cell.appendElement("a").addClass(LINK_CLASS).text(label);
            }
            link.attr("href", href);
            linked++;
        }

        Files.writeString(summaryPath, html.outerHtml(), StandardCharsets.UTF_8);
        log.debug("Linked {} cell(s) in {}", linked, summaryPath.getFileName());
        return linked;
    }
}
