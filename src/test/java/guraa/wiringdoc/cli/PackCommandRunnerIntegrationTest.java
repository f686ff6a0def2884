package guraa.wiringdoc.cli;

import guraa.wiringdoc.PdfFixtures;
import guraa.wiringdoc.config.AppProperties;
import guraa.wiringdoc.config.CropTableLoader;
import guraa.wiringdoc.config.PackConfigurationLoader;
import guraa.wiringdoc.config.TabTableLoader;
import guraa.wiringdoc.core.CropEngine;
import guraa.wiringdoc.core.PackAssembler;
import guraa.wiringdoc.core.RiffleShuffler;
import guraa.wiringdoc.service.PackBuildService;
import guraa.wiringdoc.service.PackRequestFactory;
import guraa.wiringdoc.service.PackValidator;
import guraa.wiringdoc.util.SourceDocumentLoader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line against a complete pack directory: YAML configuration,
 * CSV tables, plan sheets, data pages and zone exports.
 */
@DisplayName("PackCommandRunner end to end")
class PackCommandRunnerIntegrationTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private PackCommandRunner runner;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newFixedThreadPool(2);
        SourceDocumentLoader loader = new SourceDocumentLoader();
        CropEngine cropEngine = new CropEngine();
        AppProperties appProperties = new AppProperties();
        PackBuildService buildService = new PackBuildService(new PackValidator(cropEngine), loader, cropEngine,
                new RiffleShuffler(), new PackAssembler(appProperties), executor);
        runner = new PackCommandRunner(new PackConfigurationLoader(),
                new PackRequestFactory(new CropTableLoader(), new TabTableLoader(), loader), buildService, appProperties);

        Files.writeString(tempDir.resolve("crops.csv"), "room,tab,track,x0,y0,x1,y1\n"
                + "Kitchen,Power,circuits,0,0,300,200\n"
                + "Kitchen,Power,risers,0,0,300,200\n"
                + "Kitchen,Data,outlets,0,0,300,200\n"
                + "Store,Power,circuits,0,0,250,150\n"
                + "Store,Power,risers,0,0,250,150\n"
                + "Store,Data,outlets,0,0,250,150\n");
        Files.writeString(tempDir.resolve("tabs.csv"), "tab,track,pages\n"
                + "Power,circuits,1-2\n"
                + "Power,risers,3\n"
                + "Data,outlets,\"1;2\"\n");
        PdfFixtures.write(tempDir.resolve("plans").resolve("L2 Power rev3.pdf"), "PC1", "PC2", "PR1");
        PdfFixtures.write(tempDir.resolve("plans").resolve("L2 Data rev1.pdf"), "DO1", "DO2");
        PdfFixtures.write(tempDir.resolve("data").resolve("Kitchen.pdf"), "Kitchen data");
        PdfFixtures.write(tempDir.resolve("data").resolve("Store.pdf"), "Store data 1", "Store data 2");
        Files.createDirectories(tempDir.resolve("csv"));
        Files.writeString(tempDir.resolve("csv").resolve("Power circuits.csv"), "Circuit,Location\nC1,Kitchen\nC2,Store\n");
        Files.writeString(tempDir.resolve("csv").resolve("Data outlets.csv"), "Outlet,Location\nD1,Pantry\n");
        config = Files.writeString(tempDir.resolve("level2.yaml"), "title: Level 2 wiring\n"
                + "crops_file: crops.csv\n"
                + "tabs_file: tabs.csv\n"
                + "plan_pdfs_directory: plans\n"
                + "data_pages_directory: data\n"
                + "csv_data_directory: csv\n"
                + "rooms:\n"
                + "  - name: Store\n"
                + "    zones: [Store]\n"
                + "  - name: Kitchen\n"
                + "    zones: [Kitchen, Pantry]\n");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should build the pack next to the configuration")
    void shouldBuildPack() throws IOException {
        int exitCode = runner.execute(new DefaultApplicationArguments(
                "build", config.toString(), "--set-timestamp=2025-10-06T15:56:00Z"));

        assertThat(exitCode).isEqualTo(PackCommandRunner.EXIT_OK);
        Path output = tempDir.resolve("level2.pdf");
        assertThat(PdfFixtures.pageTexts(output)).containsExactly(
                "Store data 1", "Store data 2", "PC1", "PR1", "DO1", "PC2", "DO2",
                "Kitchen data", "PC1", "PR1", "DO1", "PC2", "DO2");
        try (PDDocument pack = PDDocument.load(output.toFile())) {
            assertThat(pack.getDocumentInformation().getTitle()).isEqualTo("Level 2 wiring");
            assertThat(pack.getDocumentInformation().getCreationDate().toInstant())
                    .isEqualTo(Instant.parse("2025-10-06T15:56:00Z"));
            assertThat(pack.getPage(2).getMediaBox().getWidth()).isEqualTo(250);
            assertThat(pack.getPage(8).getMediaBox().getHeight()).isEqualTo(200);
        }
    }

    @Test
    @DisplayName("Should fail the check when a zone has no records")
    void shouldFailCheckOnMissingZone() throws IOException {
        Files.writeString(tempDir.resolve("csv").resolve("Data outlets.csv"), "Outlet,Location\nD1,Store\n");

        assertThat(runner.execute(new DefaultApplicationArguments("check", config.toString())))
                .isEqualTo(PackCommandRunner.EXIT_FAILED);
        assertThat(tempDir.resolve("level2.pdf")).doesNotExist();
    }

    @Test
    @DisplayName("Should pass the check for a complete configuration")
    void shouldPassCheck() {
        assertThat(runner.execute(new DefaultApplicationArguments("check", config.toString())))
                .isEqualTo(PackCommandRunner.EXIT_OK);
        assertThat(tempDir.resolve("level2.pdf")).doesNotExist();
    }
}
