package guraa.wiringdoc.model;

import guraa.wiringdoc.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of crop regions keyed by (room, tab, track), in load order.
 */
public final class CropTable {

    private final Map<CropKey, CropRegion> regions;

    private CropTable(Map<CropKey, CropRegion> regions) {
        this.regions = Collections.unmodifiableMap(regions);
    }

    /**
     * Build a table from a list of regions.
     *
     * @param regions The regions, in declaration order
     * @return The table
     * @throws ConfigurationException If two regions share the same key
     */
    public static CropTable of(List<CropRegion> regions) {
        Map<CropKey, CropRegion> byKey = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        for (CropRegion region : regions) {
            if (byKey.putIfAbsent(region.getKey(), region) != null) {
                problems.add("duplicate crop region for " + region.getKey());
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return new CropTable(byKey);
    }

    public Optional<CropRegion> find(String room, String tab, String track) {
        return Optional.ofNullable(regions.get(new CropKey(room, tab, track)));
    }

    /**
     * Check whether at least one region exists for the given room and tab.
     *
     * @param room The room name
     * @param tab The tab name
     * @return true if any track of the tab has a region for the room
     */
    public boolean hasRoomTab(String room, String tab) {
        return regions.keySet().stream()
                .anyMatch(key -> key.getRoom().equals(room) && key.getTab().equals(tab));
    }

    public Collection<CropRegion> regions() {
        return regions.values();
    }

    public int size() {
        return regions.size();
    }
}
