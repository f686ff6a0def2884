package guraa.wiringdoc.core;

import lombok.Getter;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * The document cropped pages are created in.
 * <p>
 * Holds a single {@link LayerUtility} so that resources shared by several source
 * pages (fonts, images) are cloned into the target once. Not thread-safe: use one
 * target per worker.
 */
@Getter
public class CropTarget {

    private final PDDocument document;
    private final LayerUtility layerUtility;

    public CropTarget(PDDocument document) {
        this.document = document;
        this.layerUtility = new LayerUtility(document);
    }
}
