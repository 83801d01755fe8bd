package guraa.doccompare.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Utility class for file operations used around report generation and storage.
 */
@Slf4j
public class FileUtils {

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final int MAX_DIRECTORY_SUFFIX = 1000;

    /**
     * Private constructor to prevent instantiation.
     */
    private FileUtils() {
        // Utility class, no instances allowed
    }

    /**
     * Wait until a file exists, checking at a fixed interval.
     *
     * @param path The file to wait for
     * @param timeout How long to wait in total
     * @param pollInterval Delay between checks
     * @return true if the file appeared before the deadline
     */
    public static boolean waitForFile(Path path, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long sleepMillis = Math.max(1L, pollInterval.toMillis());

        while (true) {
            if (Files.exists(path)) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Gave up waiting for {} after {} ms", path, timeout.toMillis());
                return false;
            }
            try {
                Thread.sleep(Math.min(sleepMillis, Math.max(1L, remaining / 1_000_000L)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {}", path);
                return Files.exists(path);
            }
        }
    }

    /**
     * Create a new directory named {@code baseName} under {@code parent}, appending {@code _1}, {@code _2}, ...
     * when that name is already taken.
     *
     * @param parent The parent directory, created if missing
     * @param baseName The preferred directory name
     * @return The created directory
     * @throws IOException If no directory could be created
     */
    public static Path createUniqueDirectory(Path parent, String baseName) throws IOException {
        Files.createDirectories(parent);
        for (int attempt = 0; attempt < MAX_DIRECTORY_SUFFIX; attempt++) {
            String name = attempt == 0 ? baseName : baseName + "_" + attempt;
            try {
                return Files.createDirectory(parent.resolve(name));
            } catch (FileAlreadyExistsException e) {
                log.debug("Directory {} already exists, trying next suffix", name);
            }
        }
        throw new IOException("Could not create a unique directory for " + baseName + " in " + parent);
    }

    /**
     * Format a byte count, e.g. {@code 1536 -> "1.50 KB"}.
     *
     * @param bytes The size in bytes
     * @return A human readable size
     */
    public static String humanReadableSize(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < SIZE_UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, SIZE_UNITS[unit]);
    }

    /**
     * File name without its extension.
     */
    public static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Lower-cased extension without the dot, or an empty string.
     */
    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && dot < fileName.length() - 1
                ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT)
                : "";
    }
}
