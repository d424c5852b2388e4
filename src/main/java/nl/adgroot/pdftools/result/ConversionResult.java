package nl.adgroot.pdftools.result;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * Outcome of a single imposition or merge call.
 * - success: output holds the written file, pageCount the number of pages in it, error is null
 * - failure: error is set; output names the intended destination, which may not exist
 */
public record ConversionResult(
    Path output,
    int pageCount,
    ConversionError error
) {

  public static ConversionResult success(Path output, int pageCount) {
    return new ConversionResult(output, pageCount, null);
  }

  public static ConversionResult failure(Path output, ConversionError error) {
    return new ConversionResult(output, 0, error);
  }

  public static ConversionResult failure(Path output, Throwable t) {
    return failure(output, ConversionError.classify(t));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public ErrorKind errorKind() {
    return error == null ? null : error.kind();
  }

  @NotNull
  @Override
  public String toString() {
    return isSuccess()
        ? "OK " + output + " (" + pageCount + " pages)"
        : "FAILED " + output + " - " + error;
  }
}
