package guraa.wiringdoc.exception;

import java.util.List;

/**
 * Base class of every failure that aborts a documentation pack build.
 * A single exception may carry several problems, one per offending entity,
 * so that a broken configuration is reported in one pass.
 */
public abstract class PackBuildException extends RuntimeException {

    private final List<String> problems;

    protected PackBuildException(String summary, List<String> problems) {
        super(formatMessage(summary, problems));
        this.problems = List.copyOf(problems);
    }

    protected PackBuildException(String summary, List<String> problems, Throwable cause) {
        super(formatMessage(summary, problems), cause);
        this.problems = List.copyOf(problems);
    }

    /**
     * Get the individual problems behind this failure.
     *
     * @return One description per offending entity, never empty
     */
    public List<String> getProblems() {
        return problems;
    }

    private static String formatMessage(String summary, List<String> problems) {
        if (problems.isEmpty()) {
            return summary;
        }
        if (problems.size() == 1) {
            return summary + ": " + problems.get(0);
        }
        StringBuilder message = new StringBuilder(summary)
                .append(" (").append(problems.size()).append(" problems):");
        for (String problem : problems) {
            message.append(System.lineSeparator()).append("  - ").append(problem);
        }
        return message.toString();
    }
}
