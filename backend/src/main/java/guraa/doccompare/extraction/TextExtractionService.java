package guraa.doccompare.extraction;

import guraa.doccompare.exception.PathNotFoundException;
import guraa.doccompare.exception.UnsupportedFormatException;
import guraa.doccompare.model.Document;
import guraa.doccompare.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns source files into {@link Document}s, dispatching on the file extension to the registered
 * {@link TextExtractor}s.
 */
@Slf4j
@Service
public class TextExtractionService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, TextExtractor> extractorsByExtension = new HashMap<>();

    public TextExtractionService(List<TextExtractor> extractors) {
        for (TextExtractor extractor : extractors) {
            for (String extension : extractor.supportedExtensions()) {
                TextExtractor previous = extractorsByExtension.putIfAbsent(extension, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Extension " + extension + " is handled by both "
                            + previous.getClass().getSimpleName() + " and " + extractor.getClass().getSimpleName());
                }
            }
        }
        log.info("Registered text extractors for extensions {}", supportedExtensions());
    }

    public Set<String> supportedExtensions() {
        return Collections.unmodifiableSet(new TreeSet<>(extractorsByExtension.keySet()));
    }

    public boolean isSupported(Path file) {
        return extractorsByExtension.containsKey(FileUtils.extension(file.getFileName().toString()));
    }

    /**
     * Extract a file into a named document.
     *
     * @param file The source file
     * @return The document, named after the file without its extension
     * @throws PathNotFoundException If the file does not exist
     * @throws UnsupportedFormatException If the format is unknown or no words could be extracted
     */
    public Document extract(Path file) {
        return new Document(FileUtils.baseName(file), extractTokens(file));
    }

    /**
     * Extract the whitespace-separated words of a file.
     */
    public List<String> extractTokens(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new PathNotFoundException("File does not exist", file);
        }

        String extension = FileUtils.extension(file.getFileName().toString());
        TextExtractor extractor = extractorsByExtension.get(extension);
        if (extractor == null) {
            throw new UnsupportedFormatException("Unsupported file type '" + extension + "' for "
                    + file.getFileName() + "; supported types are " + supportedExtensions());
        }

        String text;
        try {
            text = extractor.extractText(file);
        } catch (IOException | RuntimeException e) {
            throw new UnsupportedFormatException("Could not extract text from " + file.getFileName()
                    + ": " + e.getMessage(), e);
        }

        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            throw new UnsupportedFormatException("No text could be extracted from " + file.getFileName());
        }
        log.debug("Extracted {} tokens from {}", tokens.size(), file.getFileName());
        return tokens;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
