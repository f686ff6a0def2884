package guraa.wiringdoc.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * One plan sheet: its tracks in declared order and, once resolved, the PDF it lives in.
 */
@Value
public class TabEntry {
    String tab;
    List<Track> tracks;
    Path source;

    public TabEntry(String tab, List<Track> tracks, Path source) {
        this.tab = tab;
        this.tracks = List.copyOf(tracks);
        this.source = source;
    }

    public TabEntry withSource(Path resolved) {
        return new TabEntry(tab, tracks, resolved);
    }

    public Optional<Track> findTrack(String name) {
        return tracks.stream().filter(track -> track.getName().equals(name)).findFirst();
    }
}
