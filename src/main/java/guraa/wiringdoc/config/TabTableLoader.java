package guraa.wiringdoc.config;

import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.model.TabEntry;
import guraa.wiringdoc.model.TabTable;
import guraa.wiringdoc.model.Track;
import guraa.wiringdoc.util.Names;
import guraa.wiringdoc.util.PageRanges;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the tab table: one {@code tab,track,pages} row per track.
 * Tabs keep the order of their first row, tracks the order of their rows.
 */
@Slf4j
@Component
public class TabTableLoader {

    static final List<String> COLUMNS = List.of("tab", "track", "pages");

    public TabTable load(Path file) {
        List<String> problems = new ArrayList<>();
        List<CsvTableReader.Row> rows = CsvTableReader.read(file, COLUMNS, problems);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        Map<String, Map<String, Track>> tracksByTab = new LinkedHashMap<>();
        for (CsvTableReader.Row row : rows) {
            String tab = Names.normalise(row.get("tab"));
            String track = Names.normalise(row.get("track"));
            if (tab.isEmpty() || track.isEmpty()) {
                problems.add(row.where() + ": 'tab' and 'track' must both be set");
                continue;
            }

            List<Integer> pages;
            try {
                pages = PageRanges.parse(row.get("pages"));
            } catch (IllegalArgumentException e) {
                problems.add(row.where() + ": invalid pages for tab '" + tab + "', track '" + track + "': " + e.getMessage());
                continue;
            }

            Map<String, Track> tracks = tracksByTab.computeIfAbsent(tab, key -> new LinkedHashMap<>());
            if (tracks.putIfAbsent(track, new Track(track, pages)) != null) {
                problems.add(row.where() + ": track '" + track + "' of tab '" + tab + "' is defined more than once");
            }
        }

        if (tracksByTab.isEmpty() && problems.isEmpty()) {
            problems.add(file.getFileName() + " defines no tabs");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        List<TabEntry> entries = new ArrayList<>();
        tracksByTab.forEach((tab, tracks) -> entries.add(new TabEntry(tab, new ArrayList<>(tracks.values()), null)));
        log.info("Loaded {} tab(s) from {}", entries.size(), file.getFileName());
        return new TabTable(entries);
    }
}
