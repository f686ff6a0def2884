package guraa.wiringdoc.service;

import guraa.wiringdoc.PdfFixtures;
import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.model.RoomSpec;
import guraa.wiringdoc.util.SourceDocumentLoader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryZoneDataProviderTest {

    @TempDir
    Path tempDir;

    private final SourceDocumentLoader loader = new SourceDocumentLoader();

    @Test
    void shouldLoadRoomDataPagesByPattern() throws IOException {
        PdfFixtures.write(tempDir.resolve("Kitchen-data.pdf"), "Kitchen 1", "Kitchen 2");
        DirectoryZoneDataProvider provider = new DirectoryZoneDataProvider(tempDir, "{room}-data.pdf", loader, null);

        try (PDDocument pages = provider.loadDataPages(new RoomSpec("Kitchen", List.of("Kitchen")))) {
            assertThat(PdfFixtures.pageTexts(pages)).containsExactly("Kitchen 1", "Kitchen 2");
        }
    }

    @Test
    void shouldRejectRoomWithoutDataPages() {
        DirectoryZoneDataProvider provider = new DirectoryZoneDataProvider(tempDir, "{room}.pdf", loader, null);

        assertThatThrownBy(() -> provider.loadDataPages(new RoomSpec("Store", List.of())))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("no data pages supplied for room 'Store'");
    }

    @Test
    void shouldReportZonesWithoutRecordsInDeclaredOrder() {
        ZoneDataIndex index = new ZoneDataIndex(Set.of("Kitchen"));
        DirectoryZoneDataProvider provider = new DirectoryZoneDataProvider(tempDir, "{room}.pdf", loader, index);

        assertThat(provider.missingZones(new RoomSpec("Kitchen", List.of("Pantry", "Kitchen", "Larder"))))
                .containsExactly("Pantry", "Larder");
    }

    @Test
    void shouldSkipCoverageWithoutIndex() {
        DirectoryZoneDataProvider provider = new DirectoryZoneDataProvider(tempDir, "{room}.pdf", loader, null);

        assertThat(provider.missingZones(new RoomSpec("Kitchen", List.of("Pantry")))).isEmpty();
    }
}
