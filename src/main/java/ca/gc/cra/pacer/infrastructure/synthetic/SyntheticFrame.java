package ca.gc.cra.pacer.infrastructure.synthetic;

/**
 * Frame handle produced by {@link SyntheticFrameSource}. Carries no pixels.
 *
 * @param sequence zero-based frame number
 * @param width nominal sensor width
 * @param height nominal sensor height
 * @param capturedAtNanos monotonic capture time
 * @since PACER 0.1
 */
public record SyntheticFrame(long sequence, int width, int height, long capturedAtNanos) {}
