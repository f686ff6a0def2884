package guraa.wiringdoc.service;

import guraa.wiringdoc.model.BlockSummary;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of a successful pack build.
 */
@Value
public class PackBuildResult {
    Path output;
    Instant timestamp;
    List<BlockSummary> blocks;
    int pageCount;
    Duration elapsed;
}
