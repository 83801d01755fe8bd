package guraa.doccompare.exception;

import java.nio.file.Path;

/**
 * A required input file or directory does not exist.
 */
public class PathNotFoundException extends ComparisonException {

    private final Path path;

    public PathNotFoundException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
