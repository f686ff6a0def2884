package guraa.wiringdoc;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.text.PDFTextStripper;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds small PDFs for tests. Every page carries one line of text near its
 * top-left corner, at x=50 and 80pt below the top edge.
 */
public final class PdfFixtures {

    public static final float WIDTH = 400;
    public static final float HEIGHT = 500;

    private PdfFixtures() {
    }

    /**
     * Create an in-memory document with one labelled page per label.
     */
    public static PDDocument document(String... labels) throws IOException {
        PDDocument document = new PDDocument();
        for (String label : labels) {
            document.addPage(page(document, label, WIDTH, HEIGHT));
        }
        return document;
    }

    public static PDPage page(PDDocument document, String label, float width, float height) throws IOException {
        PDPage page = new PDPage(new PDRectangle(width, height));
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(PDType1Font.HELVETICA, 12);
            content.newLineAtOffset(50, height - 80);
            content.showText(label);
            content.endText();
            content.addRect(10, 10, width - 20, height - 20);
            content.stroke();
        }
        return page;
    }

    /**
     * Create a page covered by 50pt square cells, each filled with its own colour,
     * so that any shift or turn of its content shows when rendered.
     */
    public static PDPage grid(PDDocument document, PDRectangle mediaBox) throws IOException {
        PDPage page = new PDPage(mediaBox);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            for (int col = 0; col * 50 < mediaBox.getWidth(); col++) {
                for (int row = 0; row * 50 < mediaBox.getHeight(); row++) {
                    content.setNonStrokingColor(new Color(col * 20 % 256, row * 15 % 256, (col * 7 + row * 3) % 16 * 16));
                    content.addRect(mediaBox.getLowerLeftX() + col * 50, mediaBox.getLowerLeftY() + row * 50, 50, 50);
                    content.fill();
                }
            }
        }
        return page;
    }

    /**
     * Write a PDF with one labelled page per label.
     */
    public static Path write(Path file, String... labels) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (PDDocument document = document(labels)) {
            document.save(file.toFile());
        }
        return file;
    }

    /**
     * Write a PDF that needs a user password to open.
     */
    public static Path writeEncrypted(Path file, String... labels) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (PDDocument document = document(labels)) {
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner", "user", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            document.save(file.toFile());
        }
        return file;
    }

    /**
     * Extract the trimmed text of every page of a document, in page order.
     */
    public static List<String> pageTexts(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        List<String> texts = new ArrayList<>();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            texts.add(stripper.getText(document).trim());
        }
        return texts;
    }

    public static List<String> pageTexts(Path file) throws IOException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            return pageTexts(document);
        }
    }
}
