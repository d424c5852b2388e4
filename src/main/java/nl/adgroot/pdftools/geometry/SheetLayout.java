package nl.adgroot.pdftools.geometry;

import nl.adgroot.pdftools.result.ConversionException;

/**
 * Landscape sheet split into two halves, each with a margin on every side.
 *
 * <p>Every source page is fitted into the {@code availableWidth x availableHeight} box of its half and
 * centered on that half.
 */
public record SheetLayout(
    double sheetWidth,
    double sheetHeight,
    double margin,
    double availableWidth,
    double availableHeight
) {

  public enum Side {
    LEFT(0.25),
    RIGHT(0.75);

    private final double centerFraction;

    Side(double centerFraction) {
      this.centerFraction = centerFraction;
    }
  }

  /**
   * Builds the layout for {@code sheet} forced to landscape.
   *
   * @throws ConversionException INVALID_ARGUMENT when the margins leave no room on a half-sheet
   */
  public static SheetLayout of(SheetSize sheet, double margin) {
    if (margin < 0 || Double.isNaN(margin)) {
      throw ConversionException.invalidArgument("Margin must not be negative, got " + margin);
    }
    SheetSize landscape = sheet.landscape();

    double halfWidth = landscape.width() / 2.0;
    double availableWidth = halfWidth - 2 * margin;
    double availableHeight = landscape.height() - 2 * margin;
    if (availableWidth <= 0 || availableHeight <= 0) {
      throw ConversionException.invalidArgument("Margins too large for chosen page size.");
    }

    return new SheetLayout(landscape.width(), landscape.height(), margin, availableWidth, availableHeight);
  }

  public double centerX(Side side) {
    return sheetWidth * side.centerFraction;
  }

  public double centerY() {
    return sheetHeight / 2.0;
  }

  /** Side for the source page at {@code pageIndex}: even pages left, odd pages right. */
  public static Side sideOf(int pageIndex) {
    return pageIndex % 2 == 0 ? Side.LEFT : Side.RIGHT;
  }

  /** Number of sheets needed for {@code pageCount} source pages. */
  public static int sheetCount(int pageCount) {
    return (pageCount + 1) / 2;
  }
}
