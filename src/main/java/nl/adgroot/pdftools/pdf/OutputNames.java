package nl.adgroot.pdftools.pdf;

import java.nio.file.Path;

public final class OutputNames {

  private OutputNames() {
    // utility class
  }

  /**
   * {@code /dir/report.pdf} with suffix {@code _2pp} becomes {@code /dir/report_2pp.pdf}. Only the
   * last extension is replaced; a name without extension just gets the suffix and ".pdf".
   */
  public static Path withSuffix(Path input, String suffix) {
    String fileName = input.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String base = dot > 0 ? fileName.substring(0, dot) : fileName;
    return input.resolveSibling(base + suffix + ".pdf");
  }
}
