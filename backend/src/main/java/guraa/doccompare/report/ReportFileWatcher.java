package guraa.doccompare.report;

import guraa.doccompare.util.FileUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Waits for written report files to become visible on the file system.
 */
@Component
public class ReportFileWatcher {

    public boolean awaitFile(Path path, Duration timeout, Duration pollInterval) {
        return FileUtils.waitForFile(path, timeout, pollInterval);
    }
}
