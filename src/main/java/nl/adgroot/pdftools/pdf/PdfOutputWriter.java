package nl.adgroot.pdftools.pdf;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves a document next to its destination and moves it into place only once the save succeeded,
 * so a failed save never leaves a truncated file at the destination.
 *
 * <p>Two concurrent saves to the same destination are not coordinated: the last move wins.
 */
public class PdfOutputWriter {

  private static final Logger log = LoggerFactory.getLogger(PdfOutputWriter.class);

  public void save(PDDocument document, Path destination) throws IOException {
    Path target = destination.toAbsolutePath();
    Path dir = target.getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }

    // created by the save itself so the output gets the default permissions for new files
    Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
    boolean moved = false;
    try {
      document.save(tmp.toFile());
      move(tmp, target);
      moved = true;
    } finally {
      if (!moved) {
        try {
          Files.deleteIfExists(tmp);
        } catch (IOException e) {
          log.warn("Could not remove temporary file {}: {}", tmp, e.toString());
        }
      }
    }
  }

  private static void move(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to plain replace", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
