package nl.adgroot.pdftools.cli;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.pdftools.config.AppConfig;
import nl.adgroot.pdftools.config.ConfigLoader;
import nl.adgroot.pdftools.impose.TwoUpImposer;
import nl.adgroot.pdftools.pdf.OutputNames;
import nl.adgroot.pdftools.result.ConversionResult;

/**
 * {@code impose <input_pdf> [output_pdf] [format]}
 */
public class ImposeCommand {

  private final AppConfig cfg;
  private final TwoUpImposer imposer;

  public ImposeCommand() {
    this(ConfigLoader.loadDefaults(), new TwoUpImposer());
  }

  public ImposeCommand(AppConfig cfg, TwoUpImposer imposer) {
    this.cfg = cfg;
    this.imposer = imposer;
  }

  public static void main(String[] args) {
    int code = new ImposeCommand().run(args, System.out);
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

    Path input = Path.of(args[0]);
    Path output = args.length > 1 ? Path.of(args[1]) : OutputNames.withSuffix(input, cfg.impose.outputSuffix);
    String format = args.length > 2 ? args[2] : cfg.impose.format;

    if (!Files.exists(input)) {
      out.println("Error: Input file '" + input + "' not found.");
      return 1;
    }

    out.println("Converting '" + input + "' to 2-pages-per-sheet format...");
    out.println("Output page format: " + format + " (landscape)");

    ConversionResult result = imposer.impose(input, output, format, cfg.impose.marginPt, cfg.impose.scaleUp);
    if (result.isSuccess()) {
      out.println("Conversion completed successfully!");
      return 0;
    }
    out.println("Conversion failed! " + result.error());
    return 1;
  }

  static void printUsage(PrintStream out) {
    out.println("""
        Usage:
          impose <input_pdf> [output_pdf] [format]

        Arguments:
          input_pdf   : Path to the input PDF file
          output_pdf  : Path to the output PDF file (optional, default <input>_2pp.pdf)
          format      : Output format 'A4' or 'Letter' (default: A4)

        Example:
          impose document.pdf
          impose document.pdf output.pdf A4""");
  }
}
