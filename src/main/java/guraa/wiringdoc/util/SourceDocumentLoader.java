package guraa.wiringdoc.util;

import guraa.wiringdoc.exception.SourceDocumentException;
import guraa.wiringdoc.exception.SourceDocumentException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens plan and data PDFs for reading.
 * Every call returns a fresh document, so workers never share a PDFBox object.
 */
@Slf4j
@Component
public class SourceDocumentLoader {

    /**
     * Load a PDF document, rejecting anything the pipeline cannot crop or merge faithfully.
     *
     * @param file The PDF file to load
     * @return The loaded document; the caller closes it
     * @throws SourceDocumentException If the file is missing, encrypted or unreadable
     */
    public PDDocument load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SourceDocumentException(Reason.SOURCE_NOT_FOUND, file.toString(), "file does not exist");
        }

        PDDocument document;
        try {
            document = PDDocument.load(file.toFile(), MemoryUsageSetting.setupMainMemoryOnly());
        } catch (InvalidPasswordException e) {
            throw new SourceDocumentException(Reason.UNSUPPORTED_FORMAT, file.toString(),
                    "document is password protected", e);
        } catch (IOException e) {
            String detail = isCorruptionError(e)
                    ? "document is corrupt: " + e.getMessage()
                    : "document could not be read: " + e.getMessage();
            throw new SourceDocumentException(Reason.UNSUPPORTED_FORMAT, file.toString(), detail, e);
        }

        if (document.isEncrypted()) {
            closeAfterRejection(document, file);
            throw new SourceDocumentException(Reason.UNSUPPORTED_FORMAT, file.toString(), "document is encrypted");
        }

        log.debug("Loaded {} ({} pages)", file.getFileName(), document.getNumberOfPages());
        return document;
    }

    /**
     * Helper method for determining if a PDF loading error indicates a corrupted file.
     *
     * @param e The exception to check
     * @return true if the exception indicates corruption
     */
    static boolean isCorruptionError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("cross reference")
                || message.contains("xref")
                || message.contains("trailer")
                || message.contains("Header")
                || message.contains("End-of-File")
                || message.contains("EOF");
    }

    private void closeAfterRejection(PDDocument document, Path file) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Failed to close rejected document {}: {}", file, e.getMessage());
        }
    }
}
