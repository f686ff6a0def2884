package guraa.wiringdoc.model;

import lombok.Value;
import org.apache.pdfbox.pdmodel.PDPage;

/**
 * A detached page produced by applying a crop region to one source page.
 * The page belongs to the target document it was cropped into but is not yet
 * part of its page tree.
 */
@Value
public class CroppedPage {
    CropRegion region;
    int sourcePageNumber;
    PDPage page;

    public float getWidth() {
        return page.getMediaBox().getWidth();
    }

    public float getHeight() {
        return page.getMediaBox().getHeight();
    }
}
