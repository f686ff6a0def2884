package guraa.wiringdoc.model;

import lombok.Value;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * The pages of one room: its data pages followed by its interleaved plan pages.
 * Both documents stay owned by the build that created them.
 */
@Value
public class PageBlock {
    RoomSpec room;
    PDDocument dataPages;
    PDDocument planPages;

    public int getDataPageCount() {
        return dataPages.getNumberOfPages();
    }

    public int getPlanPageCount() {
        return planPages.getNumberOfPages();
    }
}
