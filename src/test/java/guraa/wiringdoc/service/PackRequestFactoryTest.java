package guraa.wiringdoc.service;

import guraa.wiringdoc.PdfFixtures;
import guraa.wiringdoc.config.CropTableLoader;
import guraa.wiringdoc.config.PackConfiguration;
import guraa.wiringdoc.config.PackConfigurationLoader;
import guraa.wiringdoc.config.TabTableLoader;
import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.model.TrackLengthPolicy;
import guraa.wiringdoc.util.SourceDocumentLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackRequestFactoryTest {

    @TempDir
    Path tempDir;

    private final PackConfigurationLoader configurationLoader = new PackConfigurationLoader();
    private final PackRequestFactory factory = new PackRequestFactory(
            new CropTableLoader(), new TabTableLoader(), new SourceDocumentLoader());

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("crops.csv"), "room,tab,track,x0,y0,x1,y1\n"
                + "Kitchen,Power,main,0,0,300,200\n");
        Files.writeString(tempDir.resolve("tabs.csv"), "tab,track,pages\nPower,main,1-2\n");
        PdfFixtures.write(tempDir.resolve("plans").resolve("L2 Power.pdf"), "P1", "P2");
        Files.createDirectories(tempDir.resolve("csv"));
        Files.writeString(tempDir.resolve("csv").resolve("Power.csv"), "Circuit,Location\nC1,Kitchen\n");
    }

    @Test
    void shouldWireTablesAndCollaborators() throws IOException {
        PackConfiguration configuration = configurationLoader.load(writeConfig(
                "crops_file: crops.csv\ntabs_file: tabs.csv\n"));
        Clock clock = Clock.fixed(Instant.parse("2025-10-06T15:56:00Z"), ZoneOffset.UTC);
        Path output = tempDir.resolve("pack.pdf");

        PackBuildRequest request = factory.create(configuration, output, clock, null);

        assertThat(request.getTitle()).isEqualTo("Level 2");
        assertThat(request.getRooms()).containsExactly(new RoomSpec("Kitchen", List.of("Kitchen", "Pantry")));
        assertThat(request.getCropTable().find("Kitchen", "Power", "main")).isPresent();
        assertThat(request.getTabTable().find("Power")).isPresent();
        assertThat(request.getPathResolver().resolve("Power")).isEqualTo(tempDir.resolve("plans").resolve("L2 Power.pdf"));
        assertThat(request.getZoneDataProvider().missingZones(request.getRooms().get(0))).containsExactly("Pantry");
        assertThat(request.getClock()).isSameAs(clock);
        assertThat(request.getOutput()).isEqualTo(output);
        assertThat(request.getTrackLengthPolicy()).isEqualTo(TrackLengthPolicy.SHRINK);
        assertThat(request.getRetainDirectory()).isNull();
    }

    @Test
    void shouldReportProblemsOfBothTablesTogether() throws IOException {
        Files.writeString(tempDir.resolve("bad-crops.csv"), "room,tab,track,x0,y0,x1,y1\nKitchen,Power,main,a,0,1,1\n");
        Files.writeString(tempDir.resolve("bad-tabs.csv"), "tab,track,pages\nPower,main,0\n");
        PackConfiguration configuration = configurationLoader.load(writeConfig(
                "crops_file: bad-crops.csv\ntabs_file: bad-tabs.csv\n"));

        assertThatThrownBy(() -> factory.create(configuration, tempDir.resolve("pack.pdf"), Clock.systemUTC(), null))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getProblems())
                        .hasSize(2)
                        .anyMatch(problem -> problem.startsWith("bad-crops.csv line 2"))
                        .anyMatch(problem -> problem.startsWith("bad-tabs.csv line 2")));
    }

    private Path writeConfig(String tables) throws IOException {
        return Files.writeString(tempDir.resolve("pack.yaml"), "title: Level 2\n"
                + tables
                + "plan_pdfs_directory: plans\n"
                + "data_pages_directory: data\n"
                + "csv_data_directory: csv\n"
                + "rooms:\n"
                + "  - name: Kitchen\n"
                + "    zones: [Kitchen, Pantry]\n");
    }
}
