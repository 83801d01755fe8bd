package guraa.doccompare.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a complete comparison run, as returned to callers of the request surface.
 */
@Value
@Builder
public class ComparisonRunResult {

    ComparisonMode mode;
    Path outputDirectory;
    Path summaryPath;
    ScoreMatrix matrix;
    List<PairReport> reports;
    List<String> warnings;
}
