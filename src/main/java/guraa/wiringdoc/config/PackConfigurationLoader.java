package guraa.wiringdoc.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.util.Names;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads and validates the YAML pack configuration.
 */
@Slf4j
@Component
public class PackConfigurationLoader {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    /**
     * Load a pack configuration file.
     *
     * @param file The YAML file
     * @return The validated configuration
     * @throws ConfigurationException If the file is missing, unparsable or incomplete
     */
    public PackConfiguration load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw ConfigurationException.of("configuration file not found: " + file);
        }

        PackConfiguration configuration;
        try {
            configuration = yaml.readValue(file.toFile(), PackConfiguration.class);
        } catch (JsonProcessingException e) {
            throw ConfigurationException.of("error parsing YAML configuration " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw ConfigurationException.of("cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
        if (configuration == null) {
            throw ConfigurationException.of("configuration file is empty: " + file);
        }
        configuration.setConfigFile(file.toAbsolutePath().normalize());

        List<String> problems = validate(configuration);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        log.info("Loaded configuration {} with {} room(s)", file.getFileName(), configuration.getRooms().size());
        return configuration;
    }

    private List<String> validate(PackConfiguration configuration) {
        List<String> problems = new ArrayList<>();
        requireField(problems, "crops_file", configuration.getCropsFile());
        requireField(problems, "tabs_file", configuration.getTabsFile());
        requireField(problems, "plan_pdfs_directory", configuration.getPlanPdfsDirectory());
        requireField(problems, "data_pages_directory", configuration.getDataPagesDirectory());

        if (configuration.getPdfFilenamePattern() == null || !configuration.getPdfFilenamePattern().contains("{tab}")) {
            problems.add("pdf_filename_pattern must contain the {tab} placeholder");
        }
        if (configuration.getDataPagesPattern() == null || !configuration.getDataPagesPattern().contains("{room}")) {
            problems.add("data_pages_pattern must contain the {room} placeholder");
        }

        if (configuration.getRooms() == null || configuration.getRooms().isEmpty()) {
            problems.add("no rooms configured");
            return problems;
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < configuration.getRooms().size(); i++) {
            PackConfiguration.RoomConfig room = configuration.getRooms().get(i);
            if (room == null || room.getName() == null || room.getName().isBlank()) {
                problems.add("room #" + (i + 1) + " is missing the 'name' field");
                continue;
            }
            String name = Names.normalise(room.getName());
            if (room.getZones() == null) {
                problems.add("room '" + name + "' is missing the 'zones' field");
            } else if (room.getZones().stream().anyMatch(zone -> zone == null || zone.isBlank())) {
                problems.add("room '" + name + "' has a blank zone name");
            }
            if (!seen.add(name)) {
                problems.add("room '" + name + "' is configured more than once");
            }
        }
        return problems;
    }

    private static void requireField(List<String> problems, String field, String value) {
        if (value == null || value.isBlank()) {
            problems.add("required configuration field missing: " + field);
        }
    }
}
