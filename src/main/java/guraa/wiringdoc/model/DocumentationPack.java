package guraa.wiringdoc.model;

import lombok.Getter;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * The assembled pack: every room block concatenated in configured room order.
 * Lives only until it has been serialized.
 */
@Getter
public class DocumentationPack implements Closeable {

    private final String title;
    private final PDDocument document;
    private final List<BlockSummary> blocks;

    public DocumentationPack(String title, PDDocument document, List<BlockSummary> blocks) {
        this.title = title;
        this.document = document;
        this.blocks = List.copyOf(blocks);
    }

    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
