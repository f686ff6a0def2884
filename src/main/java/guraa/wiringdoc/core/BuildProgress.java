package guraa.wiringdoc.core;

import guraa.wiringdoc.model.BuildStage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Tracks the stage of one pack build and enforces that it only moves forward,
 * one stage at a time.
 */
@Slf4j
public class BuildProgress {

    private final String title;
    private final Instant started = Instant.now();
    private BuildStage stage;

    public BuildProgress(String title) {
        this.title = title;
    }

    /**
     * Move to the next stage.
     *
     * @param next The stage just reached
     * @throws IllegalStateException If {@code next} is not the stage directly after the current one
     */
    public void advance(BuildStage next) {
        int expected = stage == null ? 0 : stage.ordinal() + 1;
        if (next.ordinal() != expected) {
            throw new IllegalStateException("Build '" + title + "' cannot move from " + stage + " to " + next);
        }
        stage = next;
        log.info("Build '{}' reached {} after {} ms", title, next, elapsed().toMillis());
    }

    public BuildStage getStage() {
        return stage;
    }

    public Duration elapsed() {
        return Duration.between(started, Instant.now());
    }
}
