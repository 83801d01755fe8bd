package guraa.doccompare.extraction;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Extracts the text of all pages of a PDF document with PDFBox.
 */
@Slf4j
@Component
public class PdfTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("pdf");
    }

    @Override
    public String extractText(Path file) throws IOException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setAddMoreFormatting(false);

            String text = stripper.getText(document);
            log.debug("Extracted {} characters from {} page(s) of {}",
                    text.length(), document.getNumberOfPages(), file.getFileName());
            return text;
        }
    }
}
