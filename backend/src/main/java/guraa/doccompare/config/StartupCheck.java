package guraa.doccompare.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Creates the storage directories and verifies they are usable before the first request arrives.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StartupCheck {

    private final AppProperties appProperties;

    @Bean
    public CommandLineRunner checkEnvironment() {
        return args -> {
            log.info("Performing startup environment check...");

            List<String> directories = List.of(
                    appProperties.getStorage().getInputDirectory(),
                    appProperties.getStorage().getResultsDirectory());
            for (String directory : directories) {
                Path path = Paths.get(directory).toAbsolutePath().normalize();
                try {
                    Files.createDirectories(path);
                    if (!Files.isWritable(path)) {
                        log.error("Directory is not writable: {}", path);
                    } else {
                        log.info("Using directory {}", path);
                    }
                } catch (Exception e) {
                    log.error("Failed to create directory {}: {}", path, e.getMessage(), e);
                }
            }

            if (appProperties.getComparison().getBlockSize() <= 0) {
                log.error("app.comparison.block-size must be positive, got {}; every run will be rejected",
                        appProperties.getComparison().getBlockSize());
            }

            log.info("Startup environment check completed.");
        };
    }
}
