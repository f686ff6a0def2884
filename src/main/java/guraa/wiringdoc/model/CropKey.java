package guraa.wiringdoc.model;

import lombok.Value;

/**
 * Lookup key of a crop region: the room it belongs to and the tab and track
 * whose pages it trims. Names are stored in normalised form.
 */
@Value
public class CropKey {
    String room;
    String tab;
    String track;

    @Override
    public String toString() {
        return "room '" + room + "', tab '" + tab + "', track '" + track + "'";
    }
}
