package nl.adgroot.pdftools.impose;

import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.pdftools.geometry.PagePlacement;
import nl.adgroot.pdftools.geometry.SheetLayout;
import nl.adgroot.pdftools.geometry.SheetSize;
import nl.adgroot.pdftools.pdf.PdfOutputWriter;
import nl.adgroot.pdftools.pdf.PdfSources;
import nl.adgroot.pdftools.progress.ConversionListener;
import nl.adgroot.pdftools.progress.LoggingConversionListener;
import nl.adgroot.pdftools.result.ConversionException;
import nl.adgroot.pdftools.result.ConversionResult;
import nl.adgroot.pdftools.result.ErrorKind;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.util.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out a PDF "2-up": every output page is a landscape sheet holding two source pages side by
 * side, each scaled to fit its half and centered on it.
 *
 * <p>Source page {@code 2k} goes to the left half of sheet {@code k}, page {@code 2k+1} to the right
 * half. With an odd page count the right half of the last sheet stays blank. Rotated source pages
 * are turned upright as part of the placement, so the output sheets carry no /Rotate entry.
 */
public class TwoUpImposer {

  private static final Logger log = LoggerFactory.getLogger(TwoUpImposer.class);
  private static final String OPERATION = "2-up imposition";

  private final PdfOutputWriter writer;
  private final ConversionListener listener;

  public TwoUpImposer() {
    this(new LoggingConversionListener());
  }

  public TwoUpImposer(ConversionListener listener) {
    this(new PdfOutputWriter(), listener);
  }

  public TwoUpImposer(PdfOutputWriter writer, ConversionListener listener) {
    this.writer = writer;
    this.listener = listener == null ? ConversionListener.NONE : listener;
  }

  /** Imposes onto a named sheet preset ("A4" or "Letter"). */
  public ConversionResult impose(Path source, Path destination, String preset, float marginPt, boolean scaleUp) {
    listener.started(OPERATION, sourceList(source), destination);
    SheetSize sheet;
    try {
      sheet = SheetSize.named(preset);
    } catch (ConversionException e) {
      return fail(source, destination, e);
    }
    return run(source, destination, sheet, marginPt, scaleUp);
  }

  public ConversionResult impose(Path source, Path destination, SheetSize sheet, float marginPt, boolean scaleUp) {
    listener.started(OPERATION, sourceList(source), destination);
    return run(source, destination, sheet, marginPt, scaleUp);
  }

  private static List<Path> sourceList(Path source) {
    return source == null ? List.of() : List.of(source);
  }

  private ConversionResult run(Path source, Path destination, SheetSize sheet, float marginPt, boolean scaleUp) {
    ConversionResult result;
    try {
      int sheets = imposeOrThrow(source, destination, sheet, marginPt, scaleUp);
      result = ConversionResult.success(destination, sheets);
    } catch (IOException | RuntimeException e) {
      return fail(source, destination, e);
    }
    listener.finished(result);
    return result;
  }

  private ConversionResult fail(Path source, Path destination, Exception e) {
    log.error("Error creating 2-up PDF from {}: {}", source, e.getMessage(), e);
    ConversionResult result = ConversionResult.failure(destination, e);
    listener.finished(result);
    return result;
  }

  private int imposeOrThrow(Path source, Path destination, SheetSize sheet, float marginPt, boolean scaleUp)
      throws IOException {

    // validated before the source is touched
    SheetLayout layout = SheetLayout.of(sheet, marginPt);

    try (PDDocument src = PdfSources.open(source);
         PDDocument out = new PDDocument()) {

      int totalPages = src.getNumberOfPages();
      listener.sourceOpened(source, totalPages);
      if (totalPages == 0) {
        throw ConversionException.invalidArgument("Source document has no pages: " + source);
      }

      log.info("Output sheet size: {} (landscape)",
          new SheetSize(layout.sheetWidth(), layout.sheetHeight()));

      LayerUtility layerUtility = new LayerUtility(out);
      int sheetCount = SheetLayout.sheetCount(totalPages);

      for (int first = 0; first < totalPages; first += 2) {
        PDPage sheetPage = new PDPage(new PDRectangle((float) layout.sheetWidth(), (float) layout.sheetHeight()));
        out.addPage(sheetPage);

        try (PDPageContentStream cs = new PDPageContentStream(out, sheetPage)) {
          int last = Math.min(first + 2, totalPages);
          for (int index = first; index < last; index++) {
            placePage(src, index, layerUtility, cs, layout, scaleUp);
          }
        }
        listener.sheetWritten(first / 2 + 1, sheetCount);
      }

      writer.save(out, destination);
      log.info("Sheets produced: {} (each sheet is landscape with 2-up layout)", out.getNumberOfPages());
      return out.getNumberOfPages();
    }
  }

  private static void placePage(
      PDDocument src,
      int index,
      LayerUtility layerUtility,
      PDPageContentStream cs,
      SheetLayout layout,
      boolean scaleUp
  ) throws IOException {

    PDPage page = src.getPage(index);
    PDRectangle mediaBox = page.getMediaBox();
    if (mediaBox.getWidth() <= 0 || mediaBox.getHeight() <= 0) {
      throw new ConversionException(ErrorKind.LIBRARY_FAILURE,
          "Page " + (index + 1) + " has an empty media box: " + mediaBox);
    }

    PagePlacement placement = PagePlacement.compute(
        layout,
        SheetLayout.sideOf(index),
        mediaBox.getLowerLeftX(),
        mediaBox.getLowerLeftY(),
        mediaBox.getWidth(),
        mediaBox.getHeight(),
        readRotation(page, index),
        scaleUp
    );
    log.debug("Page {}: {}", index + 1, placement);

    PDFormXObject form = layerUtility.importPageAsForm(src, page);
    // drop the form matrix LayerUtility derives from /Rotate and the crop box; the placement
    // transform below does the rotation itself
    form.setMatrix(new AffineTransform());
    form.setBBox(new PDRectangle(mediaBox.getLowerLeftX(), mediaBox.getLowerLeftY(),
        mediaBox.getWidth(), mediaBox.getHeight()));

    cs.saveGraphicsState();
    cs.transform(new Matrix(placement.toTransform()));
    cs.drawForm(form);
    cs.restoreGraphicsState();
  }

  private static int readRotation(PDPage page, int index) {
    try {
      return page.getRotation();
    } catch (RuntimeException e) {
      log.debug("Unreadable /Rotate on page {}, assuming 0: {}", index + 1, e.toString());
      return 0;
    }
  }
}
