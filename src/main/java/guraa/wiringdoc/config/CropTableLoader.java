package guraa.wiringdoc.config;

import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.model.CropKey;
import guraa.wiringdoc.model.CropRegion;
import guraa.wiringdoc.model.CropTable;
import guraa.wiringdoc.util.Names;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the crop table: one {@code room,tab,track,x0,y0,x1,y1} row per crop region.
 * <p>
 * Every malformed row is collected before failing, so one run reports them all.
 * Geometry beyond "is a number" is checked later, against the pages themselves.
 */
@Slf4j
@Component
public class CropTableLoader {

    static final List<String> COLUMNS = List.of("room", "tab", "track", "x0", "y0", "x1", "y1");

    public CropTable load(Path file) {
        List<String> problems = new ArrayList<>();
        List<CsvTableReader.Row> rows = CsvTableReader.read(file, COLUMNS, problems);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        List<CropRegion> regions = new ArrayList<>();
        Map<CropKey, CsvTableReader.Row> firstSeen = new HashMap<>();
        for (CsvTableReader.Row row : rows) {
            String room = Names.normalise(row.get("room"));
            String tab = Names.normalise(row.get("tab"));
            String track = Names.normalise(row.get("track"));
            int before = problems.size();

            requireName(problems, row, "room", room);
            requireName(problems, row, "tab", tab);
            requireName(problems, row, "track", track);
            float x0 = coordinate(problems, row, "x0");
            float y0 = coordinate(problems, row, "y0");
            float x1 = coordinate(problems, row, "x1");
            float y1 = coordinate(problems, row, "y1");
            if (problems.size() > before) {
                continue;
            }

            CropRegion region = new CropRegion(room, tab, track, x0, y0, x1, y1);
            CsvTableReader.Row previous = firstSeen.putIfAbsent(region.getKey(), row);
            if (previous != null) {
                problems.add(row.where() + ": duplicate crop region for " + region.getKey()
                        + ", first defined at " + previous.where());
                continue;
            }
            regions.add(region);
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        log.info("Loaded {} crop region(s) from {}", regions.size(), file.getFileName());
        return CropTable.of(regions);
    }

    private static void requireName(List<String> problems, CsvTableReader.Row row, String column, String value) {
        if (value == null || value.isEmpty()) {
            problems.add(row.where() + ": '" + column + "' is empty");
        }
    }

    private static float coordinate(List<String> problems, CsvTableReader.Row row, String column) {
        String text = row.get(column);
        float value;
        try {
            value = Float.parseFloat(text);
        } catch (NumberFormatException e) {
            problems.add(row.where() + ": '" + column + "' is not a number: '" + text + "'");
            return Float.NaN;
        }
        if (!Float.isFinite(value)) {
            problems.add(row.where() + ": '" + column + "' is not finite: '" + text + "'");
            return Float.NaN;
        }
        return value;
    }
}
