package guraa.wiringdoc.core;

import guraa.wiringdoc.exception.GeometryException;
import guraa.wiringdoc.exception.SourceDocumentException;
import guraa.wiringdoc.exception.SourceDocumentException.Reason;
import guraa.wiringdoc.model.CropRegion;
import guraa.wiringdoc.model.CroppedPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Trims source plan pages to crop regions without rasterizing them.
 * <p>
 * The source page is imported into the target document as a Form XObject and
 * drawn, turned as displayed, shifted and clipped, onto a new page the size of the region. Text and
 * vector paths stay as they are; resources are cloned along with the form.
 */
@Slf4j
@Component
public class CropEngine {

    /**
     * Validate a region's shape. This needs no page and runs before any source is opened.
     *
     * @param region The region to check
     * @return The problems found, empty if the region is well formed
     */
    public List<String> checkShape(CropRegion region) {
        List<String> problems = new ArrayList<>();
        if (region.getX1() <= region.getX0()) {
            problems.add(region.describe() + ": x1 must be greater than x0");
        }
        if (region.getY1() <= region.getY0()) {
            problems.add(region.describe() + ": y1 must be greater than y0");
        }
        if (region.getX0() < 0 || region.getY0() < 0) {
            problems.add(region.describe() + ": coordinates must not be negative");
        }
        return problems;
    }

    /**
     * Crop one page of a source document.
     *
     * @param target The document the new page is created in
     * @param source The source document
     * @param pageNumber The 1-based page number in the source
     * @param region The crop region
     * @return The cropped page, not yet added to the target's page tree
     * @throws SourceDocumentException If the page does not exist or cannot be imported
     * @throws GeometryException If the region is degenerate or leaves the page's bounding box
     */
    public CroppedPage crop(CropTarget target, PDDocument source, int pageNumber, CropRegion region) {
        if (pageNumber < 1 || pageNumber > source.getNumberOfPages()) {
            throw new SourceDocumentException(Reason.SOURCE_NOT_FOUND, "tab '" + region.getTab() + "'",
                    "page " + pageNumber + " does not exist (document has " + source.getNumberOfPages() + " pages)");
        }

        List<String> shapeProblems = checkShape(region);
        if (!shapeProblems.isEmpty()) {
            throw new GeometryException(shapeProblems);
        }

        PDPage sourcePage = source.getPage(pageNumber - 1);
        List<String> boundsProblems = checkBounds(sourcePage, pageNumber, region);
        if (!boundsProblems.isEmpty()) {
            throw new GeometryException(boundsProblems);
        }

        try {
            PDFormXObject form = target.getLayerUtility().importPageAsForm(source, sourcePage);
            // Keep the form in the source page's user space; placement is done below
            form.setMatrix(new AffineTransform());

            float width = region.getWidth();
            float height = region.getHeight();
            PDPage page = new PDPage(new PDRectangle(width, height));

            try (PDPageContentStream content = new PDPageContentStream(target.getDocument(), page)) {
                content.saveGraphicsState();
                content.addRect(0, 0, width, height);
                content.clip();
                content.transform(new Matrix(placement(sourcePage, region)));
                content.drawForm(form);
                content.restoreGraphicsState();
            }

            log.debug("Cropped page {} of tab '{}' for room '{}' to {} x {}",
                    pageNumber, region.getTab(), region.getRoom(), width, height);
            return new CroppedPage(region, pageNumber, page);
        } catch (IOException e) {
            throw new SourceDocumentException(Reason.UNSUPPORTED_FORMAT, "tab '" + region.getTab() + "'",
                    "page " + pageNumber + " could not be imported: " + e.getMessage(), e);
        }
    }

    /**
     * Check that a region fits inside a page as displayed.
     *
     * @param page The source page
     * @param pageNumber The 1-based page number, for messages
     * @param region The crop region
     * @return The problems found, empty if the region fits
     */
    public List<String> checkBounds(PDPage page, int pageNumber, CropRegion region) {
        PDRectangle bounds = displayBounds(page);
        if (region.getX1() > bounds.getWidth() || region.getY1() > bounds.getHeight()) {
            return List.of(region.describe() + ": outside page " + pageNumber + " of tab '" + region.getTab()
                    + "' (page is " + bounds.getWidth() + " x " + bounds.getHeight() + ")");
        }
        return List.of();
    }

    /**
     * Map the source page's user space onto the cropped page.
     * <p>
     * Moves the visible box to the origin, turns the page the way a viewer shows
     * it, then shifts the region's top-left corner to the top-left of the new page.
     *
     * @param page The source page
     * @param region The crop region, in displayed top-left coordinates
     * @return The transform from source user space to cropped page space
     */
    static AffineTransform placement(PDPage page, CropRegion region) {
        PDRectangle box = page.getCropBox();
        float boxWidth = box.getWidth();
        float boxHeight = box.getHeight();
        float displayedHeight = displayBounds(page).getHeight();

        // Transforms are applied to points in reverse order of the calls below
        AffineTransform transform = new AffineTransform();
        transform.translate(-region.getX0(), -(displayedHeight - region.getY1()));
        switch (rotation(page)) {
            case 90:
                transform.translate(0, boxWidth);
                transform.quadrantRotate(-1);
                break;
            case 180:
                transform.translate(boxWidth, boxHeight);
                transform.quadrantRotate(2);
                break;
            case 270:
                transform.translate(boxHeight, 0);
                transform.quadrantRotate(1);
                break;
            default:
                break;
        }
        transform.translate(-box.getLowerLeftX(), -box.getLowerLeftY());
        return transform;
    }

    /**
     * Get the bounding box of a page as displayed: its visible box, with width and
     * height swapped for pages rotated by a quarter turn.
     *
     * @param page The page
     * @return A rectangle at the origin with the displayed width and height
     */
    static PDRectangle displayBounds(PDPage page) {
        PDRectangle box = page.getCropBox();
        int rotation = rotation(page);
        if (rotation == 90 || rotation == 270) {
            return new PDRectangle(box.getHeight(), box.getWidth());
        }
        return new PDRectangle(box.getWidth(), box.getHeight());
    }

    private static int rotation(PDPage page) {
        return ((page.getRotation() % 360) + 360) % 360;
    }
}
