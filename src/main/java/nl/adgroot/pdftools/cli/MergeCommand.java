package nl.adgroot.pdftools.cli;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.pdftools.config.AppConfig;
import nl.adgroot.pdftools.config.ConfigLoader;
import nl.adgroot.pdftools.merge.PdfMerger;
import nl.adgroot.pdftools.progress.LoggingConversionListener;
import nl.adgroot.pdftools.result.ConversionResult;

/**
 * {@code merge <input1_pdf> <input2_pdf> [output_pdf]} or {@code merge <directory> [output_pdf]}.
 *
 * <p>The mode follows from the argument count and whether the first argument is a directory.
 */
public class MergeCommand {

  private final AppConfig cfg;
  private final PdfMerger merger;

  public MergeCommand() {
    this(ConfigLoader.loadDefaults());
  }

  private MergeCommand(AppConfig cfg) {
    this(cfg, new PdfMerger(cfg.merge, new LoggingConversionListener()));
  }

  public MergeCommand(AppConfig cfg, PdfMerger merger) {
    this.cfg = cfg;
    this.merger = merger;
  }

  public static void main(String[] args) {
    int code = new MergeCommand().run(args, System.out);
    if (code != 0) {
      System.exit(code);
    }
  }

  /** @return process exit code */
  public int run(String[] args, PrintStream out) {
    if (args.length < 1) {
      printUsage(out);
      return 0;
    }
    if (args.length > 3) {
      out.println("Error: Too many arguments.");
      printUsage(out);
      return 0;
    }

    boolean bookmarks = cfg.merge.preserveBookmarks;
    Path first = Path.of(args[0]);
    ConversionResult result;

    if (args.length == 1) {
      out.println("Mode: Directory merge - " + first);
      result = merger.mergeDirectory(first, null, bookmarks);
    } else if (args.length == 2 && Files.isDirectory(first)) {
      Path output = Path.of(args[1]);
      out.println("Mode: Directory merge with output - " + first + " -> " + output);
      result = merger.mergeDirectory(first, output, bookmarks);
    } else if (args.length == 2) {
      List<Path> inputs = List.of(first, Path.of(args[1]));
      out.println("Mode: Two file merge - " + inputs);
      result = merger.mergeFiles(inputs, null, bookmarks);
    } else {
      Path output = Path.of(args[2]);
      out.println("Mode: Two file merge with output - " + List.of(args[0], args[1]) + " -> " + output);
      result = merger.mergeTwo(first, Path.of(args[1]), output, bookmarks);
    }

    if (result.isSuccess()) {
      out.println("Merge completed successfully!");
      return 0;
    }
    out.println("Merge failed! " + result.error());
    return 1;
  }

  static void printUsage(PrintStream out) {
    out.println("""
        Usage:
          merge <input1_pdf> <input2_pdf> [output_pdf]
          merge <directory_path> [output_pdf]

        Arguments:
          input1_pdf     : Path to the first input PDF file
          input2_pdf     : Path to the second input PDF file
          directory_path : Path to directory containing PDF files to merge
          output_pdf     : Path to the output PDF file (optional)

        Examples:
          merge document1.pdf document2.pdf
          merge document1.pdf document2.pdf merged.pdf
          merge /path/to/pdf/folder/
          merge /path/to/pdf/folder/ all_merged.pdf""");
  }
}
