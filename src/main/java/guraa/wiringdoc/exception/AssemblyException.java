package guraa.wiringdoc.exception;

import java.util.List;

/**
 * Thrown when the pack cannot be put together: a configured room or zone has
 * no supplied data, or merging and writing the output fails.
 */
public class AssemblyException extends PackBuildException {

    public AssemblyException(List<String> problems) {
        super("Pack assembly failed", problems);
    }

    public AssemblyException(List<String> problems, Throwable cause) {
        super("Pack assembly failed", problems, cause);
    }

    public static AssemblyException of(String problem) {
        return new AssemblyException(List.of(problem));
    }

    public static AssemblyException of(String problem, Throwable cause) {
        return new AssemblyException(List.of(problem), cause);
    }
}
