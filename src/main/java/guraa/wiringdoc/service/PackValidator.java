package guraa.wiringdoc.service;

import guraa.wiringdoc.core.CropEngine;
import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.exception.GeometryException;
import guraa.wiringdoc.model.CropRegion;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.model.TabEntry;
import guraa.wiringdoc.model.Track;
import guraa.wiringdoc.model.TrackLengthPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pre-flight checks of a build request.
 * <p>
 * Problems are collected per category and reported together: configuration
 * first, then crop geometry, then zone coverage. No source document is opened
 * until all three categories are clean. Checks that need the opened sources
 * return their problems so the caller can gather them across every tab.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackValidator {

    private final CropEngine cropEngine;

    /**
     * Validate a request and resolve every tab to its source document.
     *
     * @param request The build request
     * @return The tabs in declared order, each with its resolved source path
     * @throws ConfigurationException If tables are inconsistent or a tab cannot be resolved
     * @throws GeometryException If a crop region is degenerate
     * @throws AssemblyException If a configured zone has no data
     */
    public List<TabEntry> prepare(PackBuildRequest request) {
        List<String> problems = new ArrayList<>();
        checkRooms(request, problems);
        checkCropReferences(request, problems);
        if (request.getTrackLengthPolicy() == TrackLengthPolicy.STRICT) {
            checkTrackLengths(request, problems);
        }
        List<TabEntry> resolved = resolveSources(request, problems);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        List<String> geometry = new ArrayList<>();
        for (CropRegion region : request.getCropTable().regions()) {
            geometry.addAll(cropEngine.checkShape(region));
        }
        if (!geometry.isEmpty()) {
            throw new GeometryException(geometry);
        }

        List<String> missing = new ArrayList<>();
        for (RoomSpec room : request.getRooms()) {
            for (String zone : request.getZoneDataProvider().missingZones(room)) {
                missing.add("room '" + room.getName() + "': no data for zone '" + zone + "'");
            }
        }
        if (!missing.isEmpty()) {
            throw new AssemblyException(missing);
        }

        log.info("Validated {} room(s), {} tab(s), {} crop region(s)",
                request.getRooms().size(), resolved.size(), request.getCropTable().size());
        return resolved;
    }

    /**
     * Check that every page a tab's tracks refer to exists in its source.
     *
     * @param tab The tab
     * @param source The tab's opened source document
     * @return One problem per missing page, empty if all pages exist
     */
    public List<String> checkTrackPages(TabEntry tab, PDDocument source) {
        int pageCount = source.getNumberOfPages();
        List<String> problems = new ArrayList<>();
        for (Track track : tab.getTracks()) {
            for (int page : track.getPageNumbers()) {
                if (page > pageCount) {
                    problems.add("tab '" + tab.getTab() + "', track '" + track.getName() + "': page " + page
                            + " does not exist in " + tab.getSource().getFileName() + " (" + pageCount + " pages)");
                }
            }
        }
        return problems;
    }

    /**
     * Check every room's crop regions for a tab against the pages they will be applied to.
     * Pages missing from the source are skipped; {@link #checkTrackPages} reports those.
     *
     * @param tab The tab
     * @param source The tab's opened source document
     * @param request The build request
     * @return One problem per region and page it does not fit on
     */
    public List<String> checkRegionBounds(TabEntry tab, PDDocument source, PackBuildRequest request) {
        List<String> problems = new ArrayList<>();
        for (RoomSpec room : request.getRooms()) {
            for (Track track : tab.getTracks()) {
                CropRegion region = request.getCropTable().find(room.getName(), tab.getTab(), track.getName())
                        .orElse(null);
                if (region == null) {
                    continue;
                }
                for (int page : track.getPageNumbers()) {
                    if (page <= source.getNumberOfPages()) {
                        problems.addAll(cropEngine.checkBounds(source.getPage(page - 1), page, region));
                    }
                }
            }
        }
        return problems;
    }

    private void checkRooms(PackBuildRequest request, List<String> problems) {
        if (request.getRooms().isEmpty()) {
            problems.add("no rooms configured");
        }
        if (request.getTabTable().isEmpty()) {
            problems.add("no tabs configured");
        }
        Set<String> seen = new HashSet<>();
        for (RoomSpec room : request.getRooms()) {
            if (!seen.add(room.getName())) {
                problems.add("room '" + room.getName() + "' is configured more than once");
            }
        }
    }

    private void checkCropReferences(PackBuildRequest request, List<String> problems) {
        for (CropRegion region : request.getCropTable().regions()) {
            TabEntry tab = request.getTabTable().find(region.getTab()).orElse(null);
            if (tab == null) {
                problems.add("crop region for " + region.getKey() + " refers to unknown tab '" + region.getTab() + "'");
            } else if (tab.findTrack(region.getTrack()).isEmpty()) {
                problems.add("crop region for " + region.getKey() + " refers to unknown track '" + region.getTrack()
                        + "' of tab '" + region.getTab() + "'");
            }
        }

        for (RoomSpec room : request.getRooms()) {
            for (TabEntry tab : request.getTabTable().entries()) {
                if (!request.getCropTable().hasRoomTab(room.getName(), tab.getTab())) {
                    problems.add("room '" + room.getName() + "' has no crop region for tab '" + tab.getTab() + "'");
                    continue;
                }
                for (Track track : tab.getTracks()) {
                    if (request.getCropTable().find(room.getName(), tab.getTab(), track.getName()).isEmpty()) {
                        problems.add("room '" + room.getName() + "' has no crop region for tab '" + tab.getTab()
                                + "', track '" + track.getName() + "'");
                    }
                }
            }
        }
    }

    private void checkTrackLengths(PackBuildRequest request, List<String> problems) {
        List<String> lengths = new ArrayList<>();
        Set<Integer> distinct = new HashSet<>();
        for (TabEntry tab : request.getTabTable().entries()) {
            for (Track track : tab.getTracks()) {
                lengths.add(tab.getTab() + "/" + track.getName() + ": " + track.size());
                distinct.add(track.size());
            }
        }
        if (distinct.size() > 1) {
            problems.add("track_length_policy is strict but tracks have unequal page counts (" + String.join(", ", lengths) + ")");
        }
    }

    private List<TabEntry> resolveSources(PackBuildRequest request, List<String> problems) {
        List<TabEntry> resolved = new ArrayList<>();
        for (TabEntry tab : request.getTabTable().entries()) {
            try {
                resolved.add(tab.withSource(request.getPathResolver().resolve(tab.getTab())));
            } catch (ConfigurationException e) {
                problems.addAll(e.getProblems());
            }
        }
        return resolved;
    }
}
