package guraa.wiringdoc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the wiring documentation pack builder.
 * Runs the requested command and exits with its exit code.
 */
@Slf4j
@SpringBootApplication
public class WiringDocApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        // PDFBox touches AWT for fonts and colour spaces
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        ConfigurableApplicationContext context = SpringApplication.run(WiringDocApplication.class, args);
        int exitCode = SpringApplication.exit(context);

        log.debug("Finished in {} with exit code {}", formatDuration(Duration.between(startTime, Instant.now())), exitCode);
        System.exit(exitCode);
    }

    /**
     * Format a duration to a readable string.
     *
     * @param duration The duration
     * @return A formatted string (e.g., "2m 30.000s")
     */
    public static String formatDuration(Duration duration) {
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        long seconds = duration.toSecondsPart();
        long millis = duration.toMillisPart();

        if (hours > 0) {
            return String.format("%dh %dm %d.%03ds", hours, minutes, seconds, millis);
        } else if (minutes > 0) {
            return String.format("%dm %d.%03ds", minutes, seconds, millis);
        } else {
            return String.format("%d.%03ds", seconds, millis);
        }
    }
}
