package guraa.wiringdoc.core;

import guraa.wiringdoc.PdfFixtures;
import guraa.wiringdoc.config.AppProperties;
import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.model.BlockSummary;
import guraa.wiringdoc.model.DocumentationPack;
import guraa.wiringdoc.model.PageBlock;
import guraa.wiringdoc.model.RoomSpec;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PackAssembler")
class PackAssemblerTest {

    private static final Instant TIMESTAMP = Instant.parse("2025-10-06T15:56:00Z");

    @TempDir
    Path tempDir;

    private final List<PDDocument> opened = new ArrayList<>();
    private AppProperties appProperties;
    private PackAssembler assembler;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getPack().setProducer("wiring-documentation-test");
        assembler = new PackAssembler(appProperties);
    }

    @AfterEach
    void tearDown() throws IOException {
        for (PDDocument document : opened) {
            document.close();
        }
    }

    @Test
    @DisplayName("Should place each room's data pages before its plan pages, rooms in the given order")
    void shouldOrderBlocks() throws IOException {
        List<PageBlock> blocks = List.of(
                block("Store", List.of("Store data"), List.of("Store plan 1", "Store plan 2")),
                block("Kitchen", List.of("Kitchen data 1", "Kitchen data 2"), List.of("Kitchen plan")));

        try (DocumentationPack pack = assembler.assemble("Level 2", blocks)) {
            assertThat(PdfFixtures.pageTexts(pack.getDocument())).containsExactly(
                    "Store data", "Store plan 1", "Store plan 2",
                    "Kitchen data 1", "Kitchen data 2", "Kitchen plan");
            assertThat(pack.getBlocks()).containsExactly(
                    new BlockSummary("Store", 1, 1, 2),
                    new BlockSummary("Kitchen", 4, 2, 1));
            assertThat(pack.getPageCount()).isEqualTo(6);
        }
    }

    @Test
    @DisplayName("Should assemble a room without plan pages")
    void shouldAcceptEmptyPlanSection() throws IOException {
        try (DocumentationPack pack = assembler.assemble("Level 2",
                List.of(block("Store", List.of("Store data"), List.of())))) {
            assertThat(pack.getBlocks()).containsExactly(new BlockSummary("Store", 1, 1, 0));
        }
    }

    @Test
    @DisplayName("Should write title, producer and the clock's timestamp into the metadata")
    void shouldWriteMetadata() throws IOException {
        Path output = tempDir.resolve("pack.pdf");

        try (DocumentationPack pack = assembler.assemble("Level 2 wiring",
                List.of(block("Store", List.of("Store data"), List.of("Store plan"))))) {
            Instant written = assembler.write(pack, output, Clock.fixed(TIMESTAMP, ZoneOffset.UTC));
            assertThat(written).isEqualTo(TIMESTAMP);
        }

        try (PDDocument document = PDDocument.load(output.toFile())) {
            PDDocumentInformation info = document.getDocumentInformation();
            assertThat(info.getTitle()).isEqualTo("Level 2 wiring");
            assertThat(info.getProducer()).isEqualTo("wiring-documentation-test");
            assertThat(info.getCreator()).isEqualTo("wiring-documentation-test");
            assertThat(info.getCreationDate().toInstant()).isEqualTo(TIMESTAMP);
            assertThat(info.getModificationDate().toInstant()).isEqualTo(TIMESTAMP);
            assertThat(document.getNumberOfPages()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Should write byte-identical files for identical blocks and a fixed clock")
    void shouldWriteReproducibleOutput() throws IOException {
        Clock clock = Clock.fixed(TIMESTAMP, ZoneOffset.UTC);
        Path first = tempDir.resolve("first.pdf");
        Path second = tempDir.resolve("second.pdf");

        try (DocumentationPack pack = assembler.assemble("Level 2",
                List.of(block("Store", List.of("Store data"), List.of("Store plan"))))) {
            assembler.write(pack, first, clock);
        }
        try (DocumentationPack pack = assembler.assemble("Level 2",
                List.of(block("Store", List.of("Store data"), List.of("Store plan"))))) {
            assembler.write(pack, second, clock);
        }

        assertThat(Files.readAllBytes(first)).isEqualTo(Files.readAllBytes(second));
    }

    @Test
    @DisplayName("Should leave neither output nor temporary file when the write fails")
    void shouldCleanUpAfterFailedWrite() throws IOException {
        Path output = tempDir.resolve("pack.pdf");
        Files.createDirectories(output);
        Files.writeString(output.resolve("keep.txt"), "occupied");

        try (DocumentationPack pack = assembler.assemble("Level 2",
                List.of(block("Store", List.of("Store data"), List.of("Store plan"))))) {
            assertThatThrownBy(() -> assembler.write(pack, output, Clock.fixed(TIMESTAMP, ZoneOffset.UTC)))
                    .isInstanceOf(AssemblyException.class)
                    .hasMessageContaining("cannot write");
        }

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString()).collect(Collectors.toList()))
                    .containsExactly("pack.pdf");
        }
        assertThat(output).isDirectory();
    }

    private PageBlock block(String room, List<String> dataLabels, List<String> planLabels) throws IOException {
        PDDocument data = PdfFixtures.document(dataLabels.toArray(new String[0]));
        PDDocument plans = PdfFixtures.document(planLabels.toArray(new String[0]));
        opened.add(data);
        opened.add(plans);
        return new PageBlock(new RoomSpec(room, List.of(room)), data, plans);
    }
}
