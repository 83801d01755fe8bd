package guraa.doccompare.service;

import guraa.doccompare.config.AppProperties;
import guraa.doccompare.exception.PathNotFoundException;
import guraa.doccompare.exception.UnsupportedFormatException;
import guraa.doccompare.model.DeletionResult;
import guraa.doccompare.model.StoredFileInfo;
import guraa.doccompare.util.FileUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service for the source documents kept in the input directory
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentStorageService {

    private final AppProperties appProperties;

    public Path getInputDirectory() {
        return Paths.get(appProperties.getStorage().getInputDirectory()).toAbsolutePath().normalize();
    }

    public Path getResultsDirectory() {
        return Paths.get(appProperties.getStorage().getResultsDirectory()).toAbsolutePath().normalize();
    }

    /**
     * Stored files sorted by name. Creates the input directory if it is missing.
     *
     * @return The stored files
     * @throws IOException If the directory cannot be created or listed
     */
    public List<Path> listStoredFiles() throws IOException {
        Path inputDirectory = getInputDirectory();
        Files.createDirectories(inputDirectory);
        try (Stream<Path> entries = Files.list(inputDirectory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Listing of the stored files with 1-based serial numbers.
     *
     * @return One entry per stored file
     * @throws IOException If the directory cannot be listed
     */
    public List<StoredFileInfo> listFiles() throws IOException {
        List<Path> files = listStoredFiles();
        List<StoredFileInfo> result = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            result.add(StoredFileInfo.builder()
                    .id(i + 1)
                    .fileName(file.getFileName().toString())
                    .fileExtension(FileUtils.extension(file.getFileName().toString()).toUpperCase(Locale.ROOT))
                    .fileSize(FileUtils.humanReadableSize(Files.size(file)))
                    .build());
        }
        return result;
    }

    /**
     * Store an uploaded file under its original name, replacing any file of the same name.
     *
     * @param file The uploaded file
     * @return Path of the stored file
     * @throws UnsupportedFormatException If the file type is not allowed
     * @throws IOException If the file cannot be written
     */
    public Path store(MultipartFile file) throws IOException {
        String originalName = file.getOriginalFilename();
        if (!StringUtils.hasText(originalName)) {
            throw new IllegalArgumentException("No selected file");
        }

        // keep only the last path segment of whatever the client sent
        String fileName = Paths.get(StringUtils.cleanPath(originalName)).getFileName().toString();
        String extension = FileUtils.extension(fileName);
        if (!appProperties.getStorage().getAllowedExtensions().contains(extension)) {
            throw new UnsupportedFormatException("Unsupported file type: " + fileName);
        }

        Files.createDirectories(getInputDirectory());
        Files.createDirectories(getResultsDirectory());

        Path target = getInputDirectory().resolve(fileName);
        try (InputStream input = file.getInputStream()) {
            Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("File saved to {}", target);
        return target;
    }

    /**
     * Delete stored files by their 1-based serial number in the sorted listing.
     *
     * @param serialNumbers Serial numbers as returned by {@link #listFiles()}
     * @return How many files were deleted and how many serial numbers matched nothing
     * @throws PathNotFoundException If the input directory does not exist
     * @throws IOException If a file cannot be deleted
     */
    public DeletionResult deleteBySerialNumbers(List<Integer> serialNumbers) throws IOException {
        Path inputDirectory = getInputDirectory();
        if (!Files.isDirectory(inputDirectory)) {
            throw new PathNotFoundException("Input directory does not exist", inputDirectory);
        }

        List<Path> files = listStoredFiles();
        int deleted = 0;
        int notFound = 0;
        for (Integer serialNumber : serialNumbers) {
            int index = serialNumber - 1;
            if (index < 0 || index >= files.size()) {
                notFound++;
                continue;
            }
            if (Files.deleteIfExists(files.get(index))) {
                log.info("Deleted {}", files.get(index).getFileName());
                deleted++;
            } else {
                notFound++;
            }
        }
        return new DeletionResult(deleted, notFound);
    }
}
