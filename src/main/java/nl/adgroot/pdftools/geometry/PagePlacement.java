package nl.adgroot.pdftools.geometry;

import java.awt.geom.AffineTransform;

import org.jetbrains.annotations.NotNull;

/**
 * Where and how large one source page lands on its half of the sheet.
 *
 * <p>The source page is described by its media box and its /Rotate value. The rotation is baked into
 * the transform so the result is always upright on the (unrotated) output sheet.
 */
public record PagePlacement(
    double mediaX,
    double mediaY,
    double mediaWidth,
    double mediaHeight,
    int rotation,
    double viewedWidth,
    double viewedHeight,
    double scale,
    double offsetX,
    double offsetY
) {

  public static PagePlacement compute(
      SheetLayout layout,
      SheetLayout.Side side,
      double mediaX,
      double mediaY,
      double mediaWidth,
      double mediaHeight,
      int rawRotation,
      boolean scaleUp
  ) {
    int rotation = normalizeRotation(rawRotation);

    // a quarter turn swaps the visual bounding box
    boolean quarterTurn = rotation == 90 || rotation == 270;
    double viewedWidth = quarterTurn ? mediaHeight : mediaWidth;
    double viewedHeight = quarterTurn ? mediaWidth : mediaHeight;

    double scale = Math.min(layout.availableWidth() / viewedWidth, layout.availableHeight() / viewedHeight);
    if (!scaleUp) {
      scale = Math.min(scale, 1.0);
    }

    double offsetX = layout.centerX(side) - (viewedWidth * scale) / 2.0;
    double offsetY = layout.centerY() - (viewedHeight * scale) / 2.0;

    return new PagePlacement(mediaX, mediaY, mediaWidth, mediaHeight, rotation,
        viewedWidth, viewedHeight, scale, offsetX, offsetY);
  }

  /**
   * Folds any integer into {0, 90, 180, 270}. Values that are not a multiple of 90 become 0, the
   * same as an unreadable /Rotate entry.
   */
  public static int normalizeRotation(int rotation) {
    int r = ((rotation % 360) + 360) % 360;
    return r % 90 == 0 ? r : 0;
  }

  /**
   * Content transform from the source page's user space onto the sheet.
   *
   * <p>Points go through: origin shift, rotate by -rotation, translate-to-flatten, scale,
   * translate-to-position. {@link AffineTransform} concatenation applies the last call first, so
   * the calls below are in reverse.
   */
  public AffineTransform toTransform() {
    AffineTransform at = new AffineTransform();
    at.translate(offsetX, offsetY);
    at.scale(scale, scale);
    if (rotation != 0) {
      at.translate(flattenX(), flattenY());
      at.quadrantRotate(-rotation / 90);
    }
    at.translate(-mediaX, -mediaY);
    return at;
  }

  double flattenX() {
    return switch (rotation) {
      case 180 -> mediaWidth;
      case 270 -> mediaHeight;
      default -> 0;
    };
  }

  double flattenY() {
    return switch (rotation) {
      case 90 -> mediaWidth;
      case 180 -> mediaHeight;
      default -> 0;
    };
  }

  public double scaledWidth() {
    return viewedWidth * scale;
  }

  public double scaledHeight() {
    return viewedHeight * scale;
  }

  @NotNull
  @Override
  public String toString() {
    return String.format(java.util.Locale.ROOT,
        "rotation=%d viewed=%.1fx%.1f scale=%.4f at (%.1f, %.1f)",
        rotation, viewedWidth, viewedHeight, scale, offsetX, offsetY);
  }
}
