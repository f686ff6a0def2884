package guraa.wiringdoc.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for page lists such as {@code "1"}, {@code "2-4"} or {@code "1;3;5-6"}.
 */
public final class PageRanges {

    private static final Pattern SEPARATORS = Pattern.compile("[;,\\s]+");

    private PageRanges() {
    }

    /**
     * Parse a page list into 1-based page numbers, keeping the written order.
     *
     * @param text The page list
     * @return The page numbers
     * @throws IllegalArgumentException If the list is empty or contains an invalid entry
     */
    public static List<Integer> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("page list is empty");
        }
        List<Integer> pages = new ArrayList<>();
        for (String token : SEPARATORS.split(text.trim())) {
            int dash = token.indexOf('-');
            if (dash < 0) {
                pages.add(pageNumber(token));
                continue;
            }
            int first = pageNumber(token.substring(0, dash));
            int last = pageNumber(token.substring(dash + 1));
            if (last < first) {
                throw new IllegalArgumentException("descending page range '" + token + "'");
            }
            for (int page = first; page <= last; page++) {
                pages.add(page);
            }
        }
        return pages;
    }

    private static int pageNumber(String token) {
        int page;
        try {
            page = Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + token + "' is not a page number");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page numbers start at 1, got " + page);
        }
        return page;
    }
}
