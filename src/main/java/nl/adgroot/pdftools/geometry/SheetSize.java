package nl.adgroot.pdftools.geometry;

import java.util.Locale;

import nl.adgroot.pdftools.result.ConversionException;
import org.jetbrains.annotations.NotNull;

/**
 * Physical sheet dimensions in PostScript points (1/72 inch).
 */
public record SheetSize(double width, double height) {

  private static final double POINTS_PER_MM = 72.0 / 25.4;

  public static final SheetSize A4 = new SheetSize(210 * POINTS_PER_MM, 297 * POINTS_PER_MM);
  public static final SheetSize LETTER = new SheetSize(612, 792);

  public SheetSize {
    if (!(width > 0) || !(height > 0)) {
      throw ConversionException.invalidArgument(
          "Sheet dimensions must be positive, got " + width + " x " + height);
    }
  }

  /**
   * Resolves a named preset ("A4", "Letter"), ignoring case.
   *
   * @throws ConversionException INVALID_ARGUMENT for unknown names
   */
  public static SheetSize named(String name) {
    if (name == null || name.isBlank()) {
      throw ConversionException.invalidArgument("Page size name is empty. Use 'A4' or 'Letter'.");
    }
    return switch (name.trim().toUpperCase(Locale.ROOT)) {
      case "A4" -> A4;
      case "LETTER" -> LETTER;
      default -> throw ConversionException.invalidArgument(
          "Unknown page size '" + name + "'. Use 'A4' or 'Letter', or give (width, height) in points.");
    };
  }

  /** Same sheet with width >= height. */
  public SheetSize landscape() {
    return width >= height ? this : new SheetSize(height, width);
  }

  @NotNull
  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%.2f x %.2f pt", width, height);
  }
}
