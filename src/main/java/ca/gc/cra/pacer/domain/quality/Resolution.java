package ca.gc.cra.pacer.domain.quality;

/**
 * Target analysis resolution in pixels.
 *
 * @param width horizontal pixels; positive
 * @param height vertical pixels; positive
 * @since PACER 0.1
 */
public record Resolution(int width, int height) {
  /**
   * Validates the dimensions.
   *
   * @throws IllegalArgumentException when either dimension is not positive
   */
  public Resolution {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("resolution must be positive (was " + width + "x" + height + ")");
    }
  }

  /**
   * Computes the uniform scale factor that fits a source frame inside this resolution.
   *
   * @param sourceWidth source frame width in pixels
   * @param sourceHeight source frame height in pixels
   * @return scale in {@code (0, 1]}; {@code 1} when the source already fits
   */
  public double downscaleFactor(int sourceWidth, int sourceHeight) {
    if (sourceWidth <= width && sourceHeight <= height) {
      return 1d;
    }
    double scaleX = (double) width / sourceWidth;
    double scaleY = (double) height / sourceHeight;
    return Math.min(scaleX, scaleY);
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
