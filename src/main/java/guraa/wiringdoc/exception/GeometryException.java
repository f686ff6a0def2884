package guraa.wiringdoc.exception;

import java.util.List;

/**
 * Thrown when a crop region is degenerate or does not fit inside the
 * bounding box of the page it is applied to. Regions are never clamped.
 */
public class GeometryException extends PackBuildException {

    public GeometryException(List<String> problems) {
        super("Invalid crop geometry", problems);
    }

    public static GeometryException of(String problem) {
        return new GeometryException(List.of(problem));
    }
}
