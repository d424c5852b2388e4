package nl.adgroot.pdftools.pdf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.pdftools.result.ConversionException;
import nl.adgroot.pdftools.result.ErrorKind;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

public final class PdfSources {

  private PdfSources() {
    // utility class
  }

  public static void requireExists(Path source) {
    if (!Files.exists(source)) {
      throw ConversionException.notFound("Input file not found: " + source);
    }
  }

  /**
   * Opens {@code source} for reading. The caller closes the returned document.
   *
   * @throws ConversionException NOT_FOUND for a missing file, LIBRARY_FAILURE when PDFBox cannot
   *                             parse it
   */
  public static PDDocument open(Path source) {
    requireExists(source);
    try {
      return Loader.loadPDF(source.toFile());
    } catch (IOException e) {
      throw new ConversionException(ErrorKind.LIBRARY_FAILURE,
          "Could not read PDF " + source + ": " + e.getMessage(), e);
    }
  }
}
