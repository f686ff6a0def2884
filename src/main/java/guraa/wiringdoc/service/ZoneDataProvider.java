package guraa.wiringdoc.service;

import guraa.wiringdoc.model.RoomSpec;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.util.Set;

/**
 * Supplies the finished data pages of each room.
 * Implementations may be called concurrently for different rooms.
 */
public interface ZoneDataProvider {

    /**
     * Load the data pages of a room. The caller owns and closes the returned document.
     *
     * @param room The room
     * @return The room's data pages
     * @throws guraa.wiringdoc.exception.AssemblyException If no data was supplied for the room
     */
    PDDocument loadDataPages(RoomSpec room);

    /**
     * Report the zones of a room for which no data records exist.
     *
     * @param room The room
     * @return The zones without data, in declared order; empty if coverage is not tracked
     */
    default Set<String> missingZones(RoomSpec room) {
        return Set.of();
    }
}
