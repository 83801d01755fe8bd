package guraa.doccompare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Storage storage = new Storage();
    private final Comparison comparison = new Comparison();
    private final Concurrency concurrency = new Concurrency();

    public Storage getStorage() {
        return storage;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public Concurrency getConcurrency() {
        return concurrency;
    }

    /**
     * Storage configuration properties
     */
    public static class Storage {
        private String inputDirectory = "input_files";
        private String resultsDirectory = "results";
        private List<String> allowedExtensions = new ArrayList<>(List.of("pdf", "txt", "docx", "odt"));

        public String getInputDirectory() {
            return inputDirectory;
        }

        public void setInputDirectory(String inputDirectory) {
            this.inputDirectory = inputDirectory;
        }

        public String getResultsDirectory() {
            return resultsDirectory;
        }

        public void setResultsDirectory(String resultsDirectory) {
            this.resultsDirectory = resultsDirectory;
        }

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }
    }

    /**
     * Comparison configuration properties
     */
    public static class Comparison {
        private int blockSize = 2;
        private Duration reportWaitTimeout = Duration.ofSeconds(60);
        private Duration reportPollInterval = Duration.ofMillis(200);

        public int getBlockSize() {
            return blockSize;
        }

        public void setBlockSize(int blockSize) {
            this.blockSize = blockSize;
        }

        public Duration getReportWaitTimeout() {
            return reportWaitTimeout;
        }

        public void setReportWaitTimeout(Duration reportWaitTimeout) {
            this.reportWaitTimeout = reportWaitTimeout;
        }

        public Duration getReportPollInterval() {
            return reportPollInterval;
        }

        public void setReportPollInterval(Duration reportPollInterval) {
            this.reportPollInterval = reportPollInterval;
        }
    }

    /**
     * Thread pool sizing
     */
    public static class Concurrency {
        private int comparisonThreads = Runtime.getRuntime().availableProcessors();

        public int getComparisonThreads() {
            return comparisonThreads;
        }

        public void setComparisonThreads(int comparisonThreads) {
            this.comparisonThreads = comparisonThreads;
        }
    }
}
