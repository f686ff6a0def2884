package guraa.wiringdoc.service;

import guraa.wiringdoc.config.CropTableLoader;
import guraa.wiringdoc.config.PackConfiguration;
import guraa.wiringdoc.config.TabTableLoader;
import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.model.CropTable;
import guraa.wiringdoc.model.TabEntry;
import guraa.wiringdoc.model.TabTable;
import guraa.wiringdoc.util.SourceDocumentLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a loaded pack configuration into a build request: reads both tables and
 * wires up the directory-based collaborators.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackRequestFactory {

    private final CropTableLoader cropTableLoader;
    private final TabTableLoader tabTableLoader;
    private final SourceDocumentLoader sourceDocumentLoader;

    /**
     * Create a build request.
     *
     * @param configuration The pack configuration
     * @param output The output file
     * @param clock Source of the build timestamp
     * @param retainDirectory Directory for intermediates, or null
     * @return The request
     * @throws ConfigurationException With the problems of both tables if either fails to load
     */
    public PackBuildRequest create(PackConfiguration configuration, Path output, Clock clock, Path retainDirectory) {
        List<String> problems = new ArrayList<>();
        CropTable cropTable = null;
        TabTable tabTable = null;
        try {
            cropTable = cropTableLoader.load(configuration.resolve(configuration.getCropsFile()));
        } catch (ConfigurationException e) {
            problems.addAll(e.getProblems());
        }
        try {
            tabTable = tabTableLoader.load(configuration.resolve(configuration.getTabsFile()));
        } catch (ConfigurationException e) {
            problems.addAll(e.getProblems());
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        ZoneDataIndex zoneIndex = null;
        Path csvDirectory = configuration.resolve(configuration.getCsvDataDirectory());
        if (csvDirectory != null) {
            List<String> tabs = tabTable.entries().stream().map(TabEntry::getTab).collect(Collectors.toList());
            zoneIndex = ZoneDataIndex.load(csvDirectory, tabs);
        } else {
            log.debug("No csv_data_directory configured, zone coverage is not checked");
        }

        return PackBuildRequest.builder()
                .title(configuration.getEffectiveTitle())
                .rooms(configuration.getRoomSpecs())
                .cropTable(cropTable)
                .tabTable(tabTable)
                .pathResolver(new GlobSourcePathResolver(
                        configuration.resolve(configuration.getPlanPdfsDirectory()),
                        configuration.getPdfFilenamePattern()))
                .zoneDataProvider(new DirectoryZoneDataProvider(
                        configuration.resolve(configuration.getDataPagesDirectory()),
                        configuration.getDataPagesPattern(),
                        sourceDocumentLoader,
                        zoneIndex))
                .output(output)
                .clock(clock)
                .trackLengthPolicy(configuration.getTrackLengthPolicy())
                .retainDirectory(retainDirectory)
                .build();
    }
}
