package guraa.wiringdoc.exception;

import java.util.List;

/**
 * Thrown when configuration tables are malformed, incomplete or refer to
 * rooms, tabs, tracks or pages that do not exist.
 */
public class ConfigurationException extends PackBuildException {

    public ConfigurationException(List<String> problems) {
        super("Invalid configuration", problems);
    }

    public ConfigurationException(List<String> problems, Throwable cause) {
        super("Invalid configuration", problems, cause);
    }

    public static ConfigurationException of(String problem) {
        return new ConfigurationException(List.of(problem));
    }

    public static ConfigurationException of(String problem, Throwable cause) {
        return new ConfigurationException(List.of(problem), cause);
    }
}
