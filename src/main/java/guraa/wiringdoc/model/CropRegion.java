package guraa.wiringdoc.model;

import lombok.Value;

/**
 * A rectangle trimming the pages of one track down to the area relevant to one room.
 * <p>
 * Coordinates are PDF points measured from the top-left corner of the page as it
 * is displayed (visible box, page rotation applied), with y growing downwards.
 */
@Value
public class CropRegion {
    String room;
    String tab;
    String track;
    float x0;
    float y0;
    float x1;
    float y1;

    public CropKey getKey() {
        return new CropKey(room, tab, track);
    }

    public float getWidth() {
        return x1 - x0;
    }

    public float getHeight() {
        return y1 - y0;
    }

    /**
     * Describe the region for error messages, naming its key and coordinates.
     *
     * @return A human-readable description
     */
    public String describe() {
        return getKey() + " [x0=" + x0 + ", y0=" + y0 + ", x1=" + x1 + ", y1=" + y1 + "]";
    }
}
