package guraa.doccompare.extraction;

import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Extracts the body text of Office Open XML word-processor documents.
 */
@Component
public class DocxTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("docx");
    }

    @Override
    public String extractText(Path file) throws IOException {
        // closing the extractor also closes the document
        try (InputStream input = Files.newInputStream(file);
             XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(input))) {
            return extractor.getText();
        }
    }
}
