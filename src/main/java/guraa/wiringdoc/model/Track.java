package guraa.wiringdoc.model;

import lombok.Value;

import java.util.List;

/**
 * A named run of pages of one plan type inside a tab's source document.
 * Page numbers are 1-based and kept in declared order.
 */
@Value
public class Track {
    String name;
    List<Integer> pageNumbers;

    public Track(String name, List<Integer> pageNumbers) {
        this.name = name;
        this.pageNumbers = List.copyOf(pageNumbers);
    }

    public int size() {
        return pageNumbers.size();
    }
}
