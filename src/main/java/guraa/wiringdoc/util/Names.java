package guraa.wiringdoc.util;

import java.util.regex.Pattern;

/**
 * Normalisation of room, tab, track and zone names so that names typed in the
 * YAML configuration match names exported into CSV tables.
 */
public final class Names {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]+");

    private Names() {
    }

    /**
     * Collapse whitespace runs (line breaks included) to one space, trim, and
     * replace typographic quotes with their ASCII counterparts.
     *
     * @param name The raw name, may be null
     * @return The normalised name, or null if the input was null
     */
    public static String normalise(String name) {
        if (name == null) {
            return null;
        }
        String ascii = name
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u201C', '"')
                .replace('\u201D', '"');
        return WHITESPACE.matcher(ascii).replaceAll(" ").trim();
    }

    /**
     * Turn a name into something safe to use as a file name component.
     *
     * @param name The name
     * @return The name with every run of unsafe characters replaced by an underscore
     */
    public static String fileSafe(String name) {
        return UNSAFE_FILE_CHARS.matcher(normalise(name)).replaceAll("_");
    }
}
