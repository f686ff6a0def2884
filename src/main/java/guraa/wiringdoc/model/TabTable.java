package guraa.wiringdoc.model;

import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered table of tabs. Tab order decides track order during interleaving.
 */
public final class TabTable {

    private final List<TabEntry> entries;

    public TabTable(List<TabEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<TabEntry> entries() {
        return entries;
    }

    public Optional<TabEntry> find(String tab) {
        return entries.stream().filter(entry -> entry.getTab().equals(tab)).findFirst();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
