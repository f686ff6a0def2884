package guraa.wiringdoc.core;

import guraa.wiringdoc.config.AppProperties;
import guraa.wiringdoc.exception.AssemblyException;
import guraa.wiringdoc.model.BlockSummary;
import guraa.wiringdoc.model.DocumentationPack;
import guraa.wiringdoc.model.PageBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.List;

/**
 * Concatenates room blocks into the documentation pack and writes it out.
 * <p>
 * Blocks are appended in the order given, each as data pages then plan pages,
 * without touching page sizes. The build timestamp is the only value taken from
 * the environment and it comes from the supplied {@link Clock}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackAssembler {

    private final AppProperties appProperties;

    /**
     * Assemble the pack from room blocks.
     *
     * @param title The pack title
     * @param blocks The room blocks, in configured room order
     * @return The pack; the caller closes it
     * @throws AssemblyException If a block cannot be merged
     */
    public DocumentationPack assemble(String title, List<PageBlock> blocks) {
        PDDocument document = new PDDocument();
        PDFMergerUtility merger = new PDFMergerUtility();
        List<BlockSummary> summaries = new ArrayList<>();
        String room = null;

        try {
            for (PageBlock block : blocks) {
                room = block.getRoom().getName();
                int firstPage = document.getNumberOfPages() + 1;
                merger.appendDocument(document, block.getDataPages());
                merger.appendDocument(document, block.getPlanPages());

                int expected = firstPage - 1 + block.getDataPageCount() + block.getPlanPageCount();
                if (document.getNumberOfPages() != expected) {
                    throw AssemblyException.of("room '" + room + "': expected the pack to have " + expected
                            + " pages after its block, found " + document.getNumberOfPages());
                }

                summaries.add(new BlockSummary(room, firstPage, block.getDataPageCount(), block.getPlanPageCount()));
                log.info("Added room '{}': {} data page(s), {} plan page(s), starting at page {}",
                        room, block.getDataPageCount(), block.getPlanPageCount(), firstPage);
            }
        } catch (IOException e) {
            closeAfterFailure(document);
            throw AssemblyException.of("room '" + room + "': pages could not be merged: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeAfterFailure(document);
            throw e;
        }

        return new DocumentationPack(title, document, summaries);
    }

    /**
     * Write the pack to its output file.
     * <p>
     * The document is saved to a temporary file next to the output and moved into
     * place only once complete, so a failure never leaves a partial file behind.
     *
     * @param pack The assembled pack
     * @param output The output file
     * @param clock Source of the timestamp written into the metadata
     * @return The timestamp written into the metadata
     * @throws AssemblyException If the pack cannot be written
     */
    public Instant write(DocumentationPack pack, Path output, Clock clock) {
        Instant timestamp = clock.instant();
        applyMetadata(pack, timestamp);

        Path target = output.toAbsolutePath().normalize();
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".part");
            pack.getDocument().save(temp.toFile());
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteTemp(temp);
            throw AssemblyException.of("cannot write " + target + ": " + e.getMessage(), e);
        }

        log.info("Wrote {} page(s) to {}", pack.getPageCount(), target);
        return timestamp;
    }

    private void applyMetadata(DocumentationPack pack, Instant timestamp) {
        String producer = appProperties.getPack().getProducer();
        Calendar date = GregorianCalendar.from(timestamp.atZone(ZoneId.of(appProperties.getPack().getTimeZone())));

        // Replaces whatever info the merged inputs brought along.
        PDDocumentInformation info = new PDDocumentInformation();
        info.setTitle(pack.getTitle());
        info.setCreator(producer);
        info.setProducer(producer);
        info.setCreationDate(date);
        info.setModificationDate(date);
        pack.getDocument().setDocumentInformation(info);

        // Without an /ID, PDFBox derives one from the wall clock on save.
        byte[] id = documentId(pack, timestamp);
        COSArray idArray = new COSArray();
        idArray.add(new COSString(id));
        idArray.add(new COSString(id));
        pack.getDocument().getDocument().getTrailer().setItem(COSName.ID, idArray);
    }

    private static byte[] documentId(DocumentationPack pack, Instant timestamp) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
        md.update(pack.getTitle().getBytes(StandardCharsets.UTF_8));
        md.update(Long.toString(timestamp.toEpochMilli()).getBytes(StandardCharsets.UTF_8));
        for (BlockSummary block : pack.getBlocks()) {
            md.update(block.getRoom().getBytes(StandardCharsets.UTF_8));
            md.update((":" + block.getDataPages() + ":" + block.getPlanPages() + ";").getBytes(StandardCharsets.UTF_8));
        }
        return md.digest();
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static void closeAfterFailure(PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Failed to close partially assembled pack: {}", e.getMessage());
        }
    }
}
