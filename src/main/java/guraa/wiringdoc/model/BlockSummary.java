package guraa.wiringdoc.model;

import lombok.Value;

/**
 * Where a room's block landed in the assembled pack.
 */
@Value
public class BlockSummary {
    String room;
    /** 1-based number of the block's first page in the pack. */
    int firstPage;
    int dataPages;
    int planPages;

    public int getPageCount() {
        return dataPages + planPages;
    }
}
