package guraa.wiringdoc.service;

import guraa.wiringdoc.core.BuildProgress;
import guraa.wiringdoc.core.CropEngine;
import guraa.wiringdoc.core.CropTarget;
import guraa.wiringdoc.core.PackAssembler;
import guraa.wiringdoc.core.RiffleShuffler;
import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.exception.GeometryException;
import guraa.wiringdoc.exception.PackBuildException;
import guraa.wiringdoc.model.BuildStage;
import guraa.wiringdoc.model.CropRegion;
import guraa.wiringdoc.model.CroppedPage;
import guraa.wiringdoc.model.DocumentationPack;
import guraa.wiringdoc.model.PageBlock;
import guraa.wiringdoc.model.PlanTrack;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.model.TabEntry;
import guraa.wiringdoc.model.Track;
import guraa.wiringdoc.util.Names;
import guraa.wiringdoc.util.SourceDocumentLoader;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds documentation packs.
 * <p>
 * Rooms are cropped in parallel, one task per room, each with its own source
 * documents and its own target document. Results are collected in configured
 * room order, so the output does not depend on which task finishes first.
 */
@Slf4j
@Service
public class PackBuildService {

    private final PackValidator validator;
    private final SourceDocumentLoader loader;
    private final CropEngine cropEngine;
    private final RiffleShuffler shuffler;
    private final PackAssembler assembler;
    private final ExecutorService executorService;

    public PackBuildService(
            PackValidator validator,
            SourceDocumentLoader loader,
            CropEngine cropEngine,
            RiffleShuffler shuffler,
            PackAssembler assembler,
            @Qualifier("roomProcessingExecutor") ExecutorService executorService) {
        this.validator = validator;
        this.loader = loader;
        this.cropEngine = cropEngine;
        this.shuffler = shuffler;
        this.assembler = assembler;
        this.executorService = executorService;
    }

    /**
     * Build a documentation pack and write it to the request's output file.
     *
     * @param request The build request
     * @return Summary of the written pack
     * @throws PackBuildException If the build fails; no output file is written in that case
     */
    public PackBuildResult buildPack(PackBuildRequest request) {
        BuildProgress progress = new BuildProgress(request.getTitle());
        List<TabEntry> tabs = validator.prepare(request);
        inspectSources(request, tabs);
        progress.advance(BuildStage.LOADED);

        List<RoomWork> rooms = new ArrayList<>();
        try {
            rooms.addAll(cropRooms(request, tabs));
            progress.advance(BuildStage.CROPPED);

            List<PageBlock> blocks = new ArrayList<>();
            for (RoomWork room : rooms) {
                blocks.add(room.shuffle(request));
            }
            progress.advance(BuildStage.SHUFFLED);

            if (request.getRetainDirectory() != null) {
                retainIntermediates(blocks, request.getRetainDirectory());
            }

            try (DocumentationPack pack = assembler.assemble(request.getTitle(), blocks)) {
                progress.advance(BuildStage.ASSEMBLED);

                Instant timestamp = assembler.write(pack, request.getOutput(), request.getClock());
                progress.advance(BuildStage.SERIALIZED);

                log.info("Built '{}': {} room(s), {} page(s) in {} ms", request.getTitle(), pack.getBlocks().size(),
                        pack.getPageCount(), progress.elapsed().toMillis());
                return new PackBuildResult(request.getOutput(), timestamp, pack.getBlocks(), pack.getPageCount(),
                        progress.elapsed());
            } catch (IOException e) {
                throw AssemblyException.of("cannot release the assembled pack: " + e.getMessage(), e);
            }
        } finally {
            rooms.forEach(RoomWork::close);
        }
    }

    /**
     * Run every check a build would run, including opening each plan PDF and
     * checking its track pages and crop regions, without cropping anything.
     *
     * @param request The build request; its output is not touched
     * @return The tabs with their resolved source documents
     * @throws PackBuildException If any check fails
     */
    public List<TabEntry> check(PackBuildRequest request) {
        List<TabEntry> tabs = validator.prepare(request);
        inspectSources(request, tabs);
        log.info("Configuration for '{}' is valid: {} room(s), {} tab(s)",
                request.getTitle(), request.getRooms().size(), tabs.size());
        return tabs;
    }

    /**
     * Open each plan PDF once and check every track page and every room's crop
     * regions against it, so that all offending entries are reported in one run.
     */
    private void inspectSources(PackBuildRequest request, List<TabEntry> tabs) {
        List<String> configuration = new ArrayList<>();
        List<String> geometry = new ArrayList<>();
        for (TabEntry tab : tabs) {
            PDDocument source = loader.load(tab.getSource());
            try {
                configuration.addAll(validator.checkTrackPages(tab, source));
                geometry.addAll(validator.checkRegionBounds(tab, source, request));
            } finally {
                closeQuietly(source, tab.getSource().toString());
            }
        }
        if (!configuration.isEmpty()) {
            throw new ConfigurationException(configuration);
        }
        if (!geometry.isEmpty()) {
            throw new GeometryException(geometry);
        }
    }

    private List<RoomWork> cropRooms(PackBuildRequest request, List<TabEntry> tabs) {
        AtomicBoolean aborted = new AtomicBoolean(false);
        Map<RoomSpec, CompletableFuture<RoomWork>> futures = new LinkedHashMap<>();
        for (RoomSpec room : request.getRooms()) {
            futures.put(room, CompletableFuture.supplyAsync(() -> cropRoom(request, tabs, room, aborted), executorService));
        }

        List<RoomWork> completed = new ArrayList<>();
        List<RuntimeException> failures = new ArrayList<>();
        for (Map.Entry<RoomSpec, CompletableFuture<RoomWork>> entry : futures.entrySet()) {
            try {
                RoomWork work = entry.getValue().join();
                if (work != null) {
                    completed.add(work);
                }
            } catch (CompletionException e) {
                failures.add(unwrap(entry.getKey(), e.getCause()));
            }
        }

        if (!failures.isEmpty()) {
            completed.forEach(RoomWork::close);
            RuntimeException first = failures.get(0);
            for (int i = 1; i < failures.size(); i++) {
                first.addSuppressed(failures.get(i));
            }
            throw first;
        }
        return completed;
    }

    private RoomWork cropRoom(PackBuildRequest request, List<TabEntry> tabs, RoomSpec room, AtomicBoolean aborted) {
        if (aborted.get()) {
            return null;
        }
        RoomWork work = new RoomWork(room);
        try {
            log.info("Cropping plans for room '{}'", room.getName());
            for (TabEntry tab : tabs) {
                PDDocument source = work.open(tab.getSource());
                for (Track track : tab.getTracks()) {
                    if (aborted.get()) {
                        work.close();
                        return null;
                    }
                    CropRegion region = request.getCropTable().find(room.getName(), tab.getTab(), track.getName())
                            .orElseThrow(() -> ConfigurationException.of("room '" + room.getName()
                                    + "' has no crop region for tab '" + tab.getTab() + "', track '" + track.getName() + "'"));
                    List<CroppedPage> pages = new ArrayList<>();
                    for (int pageNumber : track.getPageNumbers()) {
                        pages.add(cropEngine.crop(work.target, source, pageNumber, region));
                    }
                    work.tracks.add(new PlanTrack(tab.getTab(), track.getName(), pages));
                }
            }
            work.dataPages = request.getZoneDataProvider().loadDataPages(room);
            return work;
        } catch (RuntimeException e) {
            aborted.set(true);
            work.close();
            throw e;
        }
    }

    private static RuntimeException unwrap(RoomSpec room, Throwable cause) {
        if (cause instanceof PackBuildException) {
            return (PackBuildException) cause;
        }
        return AssemblyException.of("room '" + room.getName() + "': " + cause, cause);
    }

    private void retainIntermediates(List<PageBlock> blocks, Path directory) {
        try {
            Files.createDirectories(directory);
            for (int i = 0; i < blocks.size(); i++) {
                PageBlock block = blocks.get(i);
                // Room position keeps names that only differ in unsafe characters apart
                String name = String.format("%02d-%s", i + 1, Names.fileSafe(block.getRoom().getName()));
                block.getDataPages().save(directory.resolve(name + "-data.pdf").toFile());
                block.getPlanPages().save(directory.resolve(name + "-plans.pdf").toFile());
            }
        } catch (IOException e) {
            throw AssemblyException.of("cannot write intermediates to " + directory + ": " + e.getMessage(), e);
        }
        log.info("Retained per-room intermediates in {}", directory);
    }

    private static void closeQuietly(PDDocument document, String what) {
        if (document == null) {
            return;
        }
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", what, e.getMessage());
        }
    }

    /**
     * Everything one room's task owns: its opened sources, the document its pages
     * are cropped into, the cropped tracks and the room's data pages.
     */
    private final class RoomWork implements Closeable {

        private final RoomSpec room;
        private final PDDocument planPages = new PDDocument();
        private final CropTarget target = new CropTarget(planPages);
        private final Map<Path, PDDocument> sources = new LinkedHashMap<>();
        private final List<PlanTrack> tracks = new ArrayList<>();
        private PDDocument dataPages;

        private RoomWork(RoomSpec room) {
            this.room = room;
        }

        private PDDocument open(Path source) {
            PDDocument document = sources.get(source);
            if (document == null) {
                document = loader.load(source);
                sources.put(source, document);
            }
            return document;
        }

        private PageBlock shuffle(PackBuildRequest request) {
            List<CroppedPage> pages = shuffler.shuffle(room.getName(), tracks, request.getTrackLengthPolicy());
            for (CroppedPage page : pages) {
                planPages.addPage(page.getPage());
            }
            log.debug("Room '{}': interleaved {} plan page(s) from {} track(s)", room.getName(), pages.size(), tracks.size());
            return new PageBlock(room, dataPages, planPages);
        }

        @Override
        public void close() {
            closeQuietly(dataPages, "data pages of room '" + room.getName() + "'");
            dataPages = null;
            closeQuietly(planPages, "plan pages of room '" + room.getName() + "'");
            sources.forEach((path, document) -> closeQuietly(document, path.toString()));
            sources.clear();
        }
    }
}
