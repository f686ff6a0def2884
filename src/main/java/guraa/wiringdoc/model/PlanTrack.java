package guraa.wiringdoc.model;

import lombok.Value;

import java.util.List;

/**
 * The cropped pages of one (tab, track) for a single room, in track order.
 */
@Value
public class PlanTrack {
    String tab;
    String track;
    List<CroppedPage> pages;

    public PlanTrack(String tab, String track, List<CroppedPage> pages) {
        this.tab = tab;
        this.track = track;
        this.pages = List.copyOf(pages);
    }

    public String label() {
        return tab + "/" + track;
    }
}
