package guraa.doccompare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the document similarity report service.
 */
@Slf4j
@SpringBootApplication
public class DocCompareApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        SpringApplication.run(DocCompareApplication.class, args);

        logStartupInfo(Duration.between(startTime, Instant.now()));
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("Doc Compare application started in {}.{}s", startupTime.toSecondsPart(),
                String.format("%03d", startupTime.toMillisPart()));
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("  JVM Max memory: {} MB", Runtime.getRuntime().maxMemory() / (1024 * 1024));
        log.info("==========================================================");
    }
}
