package guraa.wiringdoc.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.util.Names;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The set of zones that have records in the per-tab CSV exports.
 * <p>
 * Each tab has one export whose file name starts with the tab name. The second
 * column holds the zone ("Location"); the first row is a header.
 */
@Slf4j
public final class ZoneDataIndex {

    private static final int LOCATION_COLUMN = 1;

    private final Set<String> zones;

    public ZoneDataIndex(Set<String> zones) {
        this.zones = Set.copyOf(zones);
    }

    /**
     * Build the index from the CSV exports of the given tabs.
     *
     * @param directory The directory holding the exports
     * @param tabs The tab names
     * @return The index
     * @throws ConfigurationException If the directory is missing, a tab's export is ambiguous, or an export is unreadable
     */
    public static ZoneDataIndex load(Path directory, List<String> tabs) {
        if (!Files.isDirectory(directory)) {
            throw ConfigurationException.of("CSV data directory not found: " + directory);
        }

        CsvMapper mapper = new CsvMapper();
        Set<String> zones = new HashSet<>();
        List<String> problems = new ArrayList<>();

        for (String tab : tabs) {
            List<Path> exports = exportsFor(directory, tab);
            if (exports.isEmpty()) {
                log.warn("No CSV data found for tab '{}' in {}", tab, directory);
                continue;
            }
            if (exports.size() > 1) {
                problems.add("ambiguous CSV data for tab '" + tab + "': " + exports);
                continue;
            }
            try {
                readZones(mapper, exports.get(0), zones);
            } catch (IOException e) {
                problems.add("cannot read " + exports.get(0) + ": " + e.getMessage());
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        log.info("Indexed {} zone(s) with data from {}", zones.size(), directory);
        return new ZoneDataIndex(zones);
    }

    public boolean hasData(String zone) {
        return zones.contains(Names.normalise(zone));
    }

    public Set<String> zones() {
        return zones;
    }

    private static List<Path> exportsFor(Path directory, String tab) {
        List<Path> exports = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.csv")) {
            for (Path path : stream) {
                if (path.getFileName().toString().startsWith(tab)) {
                    exports.add(path);
                }
            }
        } catch (IOException e) {
            throw ConfigurationException.of("cannot list " + directory + ": " + e.getMessage(), e);
        }
        Collections.sort(exports);
        return exports;
    }

    private static void readZones(CsvMapper mapper, Path export, Set<String> zones) throws IOException {
        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(export.toFile())) {
            boolean header = true;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                if (header) {
                    header = false;
                    continue;
                }
                if (row.length > LOCATION_COLUMN) {
                    String zone = Names.normalise(row[LOCATION_COLUMN]);
                    if (!zone.isEmpty()) {
                        zones.add(zone);
                    }
                }
            }
        }
    }
}
