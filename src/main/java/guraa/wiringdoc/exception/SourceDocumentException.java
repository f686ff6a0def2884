package guraa.wiringdoc.exception;

import java.util.List;

/**
 * Thrown when a source PDF (plan sheet or data pages) cannot be used.
 */
public class SourceDocumentException extends PackBuildException {

    /**
     * Why the source was rejected.
     */
    public enum Reason {
        /** The file or the requested page does not exist. */
        SOURCE_NOT_FOUND,
        /** The file is encrypted, corrupt or not a PDF at all. */
        UNSUPPORTED_FORMAT
    }

    private final Reason reason;
    private final String source;

    public SourceDocumentException(Reason reason, String source, String detail) {
        super("Source document error", List.of(source + ": " + detail));
        this.reason = reason;
        this.source = source;
    }

    public SourceDocumentException(Reason reason, String source, String detail, Throwable cause) {
        super("Source document error", List.of(source + ": " + detail), cause);
        this.reason = reason;
        this.source = source;
    }

    public Reason getReason() {
        return reason;
    }

    public String getSource() {
        return source;
    }
}
