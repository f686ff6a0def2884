package guraa.wiringdoc.service;

import guraa.wiringdoc.model.CropTable;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.model.TabTable;
import guraa.wiringdoc.model.TrackLengthPolicy;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Everything one pack build needs. Nothing is read from process-wide state:
 * paths, timestamp source and policies all travel in the request.
 */
@Value
@Builder
public class PackBuildRequest {

    @NonNull
    String title;

    @NonNull
    List<RoomSpec> rooms;

    @NonNull
    CropTable cropTable;

    @NonNull
    TabTable tabTable;

    @NonNull
    SourcePathResolver pathResolver;

    @NonNull
    ZoneDataProvider zoneDataProvider;

    @NonNull
    Path output;

    /**
     * Source of the timestamp embedded in the document metadata.
     * A fixed clock makes the output reproducible.
     */
    @NonNull
    @Builder.Default
    Clock clock = Clock.systemUTC();

    @NonNull
    @Builder.Default
    TrackLengthPolicy trackLengthPolicy = TrackLengthPolicy.SHRINK;

    /**
     * Directory receiving per-room intermediates for debugging, or null.
     */
    Path retainDirectory;
}
