package guraa.wiringdoc.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.model.TrackLengthPolicy;
import guraa.wiringdoc.util.Names;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The per-pack YAML configuration: where the tables and PDFs live and which
 * rooms go into the pack, in order.
 */
@Data
@NoArgsConstructor
public class PackConfiguration {

    private String title;
    private String cropsFile;
    private String tabsFile;
    private String planPdfsDirectory;
    private String pdfFilenamePattern = "*{tab}*.pdf";
    private String dataPagesDirectory;
    private String dataPagesPattern = "{room}.pdf";
    private String csvDataDirectory;
    private TrackLengthPolicy trackLengthPolicy = TrackLengthPolicy.SHRINK;
    private List<RoomConfig> rooms = new ArrayList<>();
    private Output output = new Output();

    /**
     * The file this configuration was read from. Relative paths resolve against its directory.
     */
    @JsonIgnore
    private Path configFile;

    /**
     * Resolve a configured path against the configuration file's directory.
     *
     * @param path The configured path, absolute or relative
     * @return The absolute, normalised path, or null if none was configured
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            return candidate.normalize();
        }
        return configFile.toAbsolutePath().getParent().resolve(candidate).normalize();
    }

    /**
     * Get the pack title, falling back to the configuration file's base name.
     */
    @JsonIgnore
    public String getEffectiveTitle() {
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        String fileName = configFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Convert the configured rooms into immutable room specs with normalised names.
     */
    @JsonIgnore
    public List<RoomSpec> getRoomSpecs() {
        return rooms.stream()
                .map(room -> new RoomSpec(Names.normalise(room.getName()),
                        room.getZones().stream().map(Names::normalise).collect(Collectors.toList())))
                .collect(Collectors.toList());
    }

    /**
     * A room entry of the configuration.
     */
    @Data
    @NoArgsConstructor
    public static class RoomConfig {
        private String name;
        private List<String> zones;
    }

    /**
     * Output options.
     */
    @Data
    @NoArgsConstructor
    public static class Output {
        private String workingDirectory;
    }
}
