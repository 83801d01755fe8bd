package guraa.doccompare.extraction;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

@Component
public class PlainTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("txt");
    }

    @Override
    public String extractText(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
