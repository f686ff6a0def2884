package guraa.wiringdoc.service;

import guraa.wiringdoc.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a tab's plan PDF by matching a glob pattern such as {@code *{tab}*.pdf}
 * in the plan directory. Exactly one file must match.
 */
@Slf4j
public class GlobSourcePathResolver implements SourcePathResolver {

    private static final Pattern GLOB_SPECIAL = Pattern.compile("[\\\\*?\\[\\]{},]");

    private final Path directory;
    private final String pattern;

    public GlobSourcePathResolver(Path directory, String pattern) {
        this.directory = directory;
        this.pattern = pattern;
    }

    @Override
    public Path resolve(String tab) {
        String glob = pattern.replace("{tab}", escape(tab));
        if (!Files.isDirectory(directory)) {
            throw ConfigurationException.of("plan PDFs directory not found: " + directory);
        }

        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    matches.add(path);
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw ConfigurationException.of("cannot search " + directory + " for tab '" + tab + "' using pattern '"
                    + glob + "': " + e.getMessage(), e);
        }
        Collections.sort(matches);

        if (matches.isEmpty()) {
            throw ConfigurationException.of("no PDF file found for tab '" + tab + "' using pattern '" + glob + "'");
        }
        if (matches.size() > 1) {
            throw ConfigurationException.of("multiple PDF files found for tab '" + tab + "': " + matches);
        }

        log.info("Found PDF for '{}': {}", tab, matches.get(0).getFileName());
        return matches.get(0);
    }

    /**
     * Escape glob syntax in a tab name so that it only matches itself.
     *
     * @param text The tab name
     * @return The name with every glob special character backslash-escaped
     */
    static String escape(String text) {
        return GLOB_SPECIAL.matcher(text).replaceAll(Matcher.quoteReplacement("\\") + "$0");
    }
}
