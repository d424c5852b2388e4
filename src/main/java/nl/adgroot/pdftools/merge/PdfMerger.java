package nl.adgroot.pdftools.merge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.pdftools.config.AppConfig;
import nl.adgroot.pdftools.pdf.OutputNames;
import nl.adgroot.pdftools.pdf.PdfOutputWriter;
import nl.adgroot.pdftools.pdf.PdfSources;
import nl.adgroot.pdftools.progress.ConversionListener;
import nl.adgroot.pdftools.progress.LoggingConversionListener;
import nl.adgroot.pdftools.result.ConversionException;
import nl.adgroot.pdftools.result.ConversionResult;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concatenates PDFs into one document, in input order.
 *
 * <p>Every source contributes the pages of the optional {@link PageRange} (clamped to its own page
 * count) or all of its pages. Bookmarks are carried over on a best-effort basis: when they cannot
 * be copied the merge logs a warning and goes on without them.
 */
public class PdfMerger {

  private static final Logger log = LoggerFactory.getLogger(PdfMerger.class);
  private static final String OPERATION = "merge";

  private final AppConfig.MergeConfig cfg;
  private final PdfOutputWriter writer;
  private final OutlineCopier outlineCopier;
  private final ConversionListener listener;

  public PdfMerger() {
    this(new AppConfig.MergeConfig(), new LoggingConversionListener());
  }

  public PdfMerger(AppConfig.MergeConfig cfg, ConversionListener listener) {
    this(cfg, new PdfOutputWriter(), new OutlineCopier(), listener);
  }

  public PdfMerger(
      AppConfig.MergeConfig cfg,
      PdfOutputWriter writer,
      OutlineCopier outlineCopier,
      ConversionListener listener
  ) {
    this.cfg = cfg == null ? new AppConfig.MergeConfig() : cfg;
    this.writer = writer;
    this.outlineCopier = outlineCopier;
    this.listener = listener == null ? ConversionListener.NONE : listener;
  }

  public ConversionResult merge(List<Path> sources, Path destination, boolean preserveBookmarks) {
    return merge(sources, destination, preserveBookmarks, null);
  }

  /**
   * Merges {@code sources} into {@code destination}.
   *
   * @param pageRange pages to take from every source, or {@code null} for all pages
   */
  public ConversionResult merge(List<Path> sources, Path destination, boolean preserveBookmarks, PageRange pageRange) {
    listener.started(OPERATION, sourceList(sources), destination);
    ConversionResult result;
    try {
      int pages = mergeOrThrow(sources, destination, preserveBookmarks, pageRange);
      result = ConversionResult.success(destination, pages);
    } catch (IOException | RuntimeException e) {
      return fail(destination, e);
    }
    listener.finished(result);
    return result;
  }

  /** Merges exactly two files. */
  public ConversionResult mergeTwo(Path first, Path second, Path destination, boolean preserveBookmarks) {
    return merge(List.of(first, second), destination, preserveBookmarks);
  }

  /**
   * Merges at least two files; {@code destination} defaults to
   * {@code <first_input_base>_merged.pdf} next to the first input.
   */
  public ConversionResult mergeFiles(List<Path> sources, Path destination, boolean preserveBookmarks) {
    Path out = destination;
    try {
      MergeInputResolver.requireEnoughInputs(sources);
      if (out == null) {
        out = OutputNames.withSuffix(sources.get(0), cfg.outputSuffix);
      }
    } catch (RuntimeException e) {
      listener.started(OPERATION, sourceList(sources), out);
      return fail(out, e);
    }
    return merge(sources, out, preserveBookmarks);
  }

  /**
   * Merges every PDF directly inside {@code directory}, ordered by file name.
   */
  public ConversionResult mergeDirectory(Path directory, Path destination, boolean preserveBookmarks) {
    List<Path> sources;
    try {
      sources = MergeInputResolver.listPdfs(directory);
    } catch (IOException | RuntimeException e) {
      listener.started(OPERATION, List.of(), destination);
      return fail(destination, e);
    }
    log.info("Found {} PDF file(s) in {}", sources.size(), directory);
    return mergeFiles(sources, destination, preserveBookmarks);
  }

  private static List<Path> sourceList(List<Path> sources) {
    return sources == null ? List.of() : sources;
  }

  private ConversionResult fail(Path destination, Exception e) {
    log.error("Error merging PDFs: {}", e.getMessage(), e);
    ConversionResult result = ConversionResult.failure(destination, e);
    listener.finished(result);
    return result;
  }

  private int mergeOrThrow(List<Path> sources, Path destination, boolean preserveBookmarks, PageRange pageRange)
      throws IOException {

    if (sources == null || sources.isEmpty()) {
      throw ConversionException.invalidArgument("No input PDF paths provided.");
    }
    // every input is checked before any of them is opened
    sources.forEach(PdfSources::requireExists);

    log.info("Preserve bookmarks: {}", preserveBookmarks);

    // appended content may still be backed by the sources until the output is saved
    List<PDDocument> opened = new ArrayList<>(sources.size());
    try (PDDocument out = new PDDocument()) {
      PDFMergerUtility merger = new PDFMergerUtility();

      for (Path source : sources) {
        PDDocument src = PdfSources.open(source);
        opened.add(src);
        listener.sourceOpened(source, src.getNumberOfPages());

        int added = appendSource(out, src, source, merger, preserveBookmarks, pageRange);
        listener.pagesAppended(source, added);
      }

      writer.save(out, destination);
      log.info("Successfully merged {} PDFs", sources.size());
      return out.getNumberOfPages();
    } finally {
      closeAll(opened);
    }
  }

  private int appendSource(
      PDDocument out,
      PDDocument src,
      Path source,
      PDFMergerUtility merger,
      boolean preserveBookmarks,
      PageRange pageRange
  ) throws IOException {

    int pageCount = src.getNumberOfPages();
    PageRange selected = pageRange == null ? PageRange.all(pageCount) : pageRange.clamp(pageCount);

    // drop unselected pages from the in-memory copy, back to front so indexes stay valid
    for (int i = pageCount - 1; i >= 0; i--) {
      if (!selected.contains(i)) {
        src.removePage(i);
      }
    }

    List<BookmarkNode> bookmarks = List.of();
    if (preserveBookmarks && src.getDocumentCatalog().getDocumentOutline() != null) {
      bookmarks = captureBookmarks(src, source);
    }
    // outlines are rebuilt by OutlineCopier, never by PDFMergerUtility
    src.getDocumentCatalog().setDocumentOutline(null);

    int offset = out.getNumberOfPages();
    merger.appendDocument(out, src);

    if (!bookmarks.isEmpty()) {
      appendBookmarks(out, bookmarks, offset, source);
    }
    return out.getNumberOfPages() - offset;
  }

  private List<BookmarkNode> captureBookmarks(PDDocument src, Path source) {
    try {
      return outlineCopier.capture(src);
    } catch (IOException | RuntimeException e) {
      warnBookmarks(source, e);
      return List.of();
    }
  }

  private void appendBookmarks(PDDocument out, List<BookmarkNode> bookmarks, int offset, Path source) {
    try {
      int added = outlineCopier.append(out, bookmarks, offset);
      log.debug("Copied {} bookmark(s) from {}", added, source.getFileName());
    } catch (RuntimeException e) {
      warnBookmarks(source, e);
    }
  }

  private void warnBookmarks(Path source, Exception e) {
    String message = "Could not preserve bookmarks from " + source;
    log.warn("{}: {}", message, e.toString());
    listener.warning(message, e);
  }

  private static void closeAll(List<PDDocument> documents) {
    for (PDDocument d : documents) {
      try {
        d.close();
      } catch (IOException e) {
        log.warn("Could not close source document: {}", e.toString());
      }
    }
  }
}
