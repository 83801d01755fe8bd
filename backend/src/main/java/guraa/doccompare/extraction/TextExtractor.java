package guraa.doccompare.extraction;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Extracts the plain text of one file format.
 */
public interface TextExtractor {

    /**
     * Lower-case file extensions (without dot) handled by this extractor.
     */
    Set<String> supportedExtensions();

    /**
     * Extract all text of the file.
     *
     * @param file The file to read
     * @return The extracted text, possibly empty
     * @throws IOException If the file cannot be read or parsed
     */
    String extractText(Path file) throws IOException;
}
