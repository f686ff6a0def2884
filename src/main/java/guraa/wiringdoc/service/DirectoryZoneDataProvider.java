package guraa.wiringdoc.service;

import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.util.SourceDocumentLoader;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads each room's finished data pages from a directory, one PDF per room,
 * named by a pattern such as {@code {room}.pdf}.
 */
@Slf4j
public class DirectoryZoneDataProvider implements ZoneDataProvider {

    private final Path directory;
    private final String filenamePattern;
    private final SourceDocumentLoader loader;
    private final ZoneDataIndex zoneIndex;

    /**
     * @param directory The directory holding the data page PDFs
     * @param filenamePattern File name pattern containing {@code {room}}
     * @param loader Loader used to open the PDFs
     * @param zoneIndex Zones with records, or null to skip the coverage check
     */
    public DirectoryZoneDataProvider(Path directory, String filenamePattern, SourceDocumentLoader loader,
                                     ZoneDataIndex zoneIndex) {
        this.directory = directory;
        this.filenamePattern = filenamePattern;
        this.loader = loader;
        this.zoneIndex = zoneIndex;
    }

    @Override
    public PDDocument loadDataPages(RoomSpec room) {
        Path file = directory.resolve(filenamePattern.replace("{room}", room.getName()));
        if (!Files.isRegularFile(file)) {
            throw AssemblyException.of("no data pages supplied for room '" + room.getName() + "' (expected " + file + ")");
        }
        PDDocument document = loader.load(file);
        log.info("Loaded {} data page(s) for '{}'", document.getNumberOfPages(), room.getName());
        return document;
    }

    @Override
    public Set<String> missingZones(RoomSpec room) {
        if (zoneIndex == null) {
            return Set.of();
        }
        return room.getZones().stream()
                .filter(zone -> !zoneIndex.hasData(zone))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
