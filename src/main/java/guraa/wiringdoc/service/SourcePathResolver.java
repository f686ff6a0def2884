package guraa.wiringdoc.service;

import java.nio.file.Path;

/**
 * Maps a tab to the plan PDF that holds its pages.
 */
public interface SourcePathResolver {

    /**
     * Resolve the source document of a tab.
     *
     * @param tab The tab name
     * @return The path of the tab's PDF
     * @throws guraa.wiringdoc.exception.ConfigurationException If the tab maps to no file or to several
     */
    Path resolve(String tab);
}
