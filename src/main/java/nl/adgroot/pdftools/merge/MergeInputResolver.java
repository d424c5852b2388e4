package nl.adgroot.pdftools.merge;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import nl.adgroot.pdftools.result.ConversionException;

/**
 * Turns a directory into the ordered list of PDFs to merge.
 */
public final class MergeInputResolver {

  public static final int MIN_INPUTS = 2;

  private MergeInputResolver() {
    // utility class
  }

  /**
   * Regular files directly inside {@code dir} whose name ends in ".pdf" (any case), sorted by file
   * name. Subdirectories are not searched.
   */
  public static List<Path> listPdfs(Path dir) throws IOException {
    if (!Files.exists(dir)) {
      throw ConversionException.notFound("Directory not found: " + dir);
    }
    if (!Files.isDirectory(dir)) {
      throw ConversionException.invalidArgument("Single path input must be a directory: " + dir);
    }
    try (Stream<Path> entries = Files.list(dir)) {
      return selectPdfs(entries.filter(Files::isRegularFile).toList());
    }
  }

  /** Pure part of {@link #listPdfs}: filter and order an existing listing. */
  static List<Path> selectPdfs(List<Path> listing) {
    return listing.stream()
        .filter(MergeInputResolver::isPdf)
        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
        .toList();
  }

  static boolean isPdf(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  public static void requireEnoughInputs(List<Path> inputs) {
    if (inputs == null || inputs.size() < MIN_INPUTS) {
      throw ConversionException.invalidArgument(
          "At least " + MIN_INPUTS + " PDF files are required for merging, got "
              + (inputs == null ? 0 : inputs.size()));
    }
  }
}
