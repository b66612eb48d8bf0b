package ca.gc.cra.pacer.domain.metrics;

/**
 * Fixed-capacity FIFO ring buffer of nanosecond samples with a running sum.
 * <p>Not thread-safe; owners guard instances with their own lock.</p>
 *
 * @since PACER 0.1
 */
public final class RollingWindow {
  private final long[] samples;
  private int head;
  private int size;
  private long sum;

  /**
   * Creates an empty window.
   *
   * @param capacity maximum retained samples; must be positive
   * @throws IllegalArgumentException when {@code capacity} is not positive
   */
  public RollingWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.samples = new long[capacity];
  }

  /**
   * Appends a sample, dropping the oldest one when full.
   *
   * @param value sample in nanoseconds
   */
  public void add(long value) {
    if (size == samples.length) {
      sum -= samples[head];
    } else {
      size++;
    }
    samples[head] = value;
    sum += value;
    head = (head + 1) % samples.length;
  }

  /**
   * Returns the arithmetic mean of all retained samples.
   *
   * @return mean, or {@code 0} when empty
   */
  public double average() {
    return size == 0 ? 0d : (double) sum / size;
  }

  /**
   * Returns the mean of the most recent {@code count} samples.
   *
   * @param count number of recent samples to include; values above {@link #size()} use every sample
   * @return mean, or {@code 0} when empty or {@code count <= 0}
   */
  public double averageOfLatest(int count) {
    int n = Math.min(count, size);
    if (n <= 0) {
      return 0d;
    }
    if (n == size) {
      return average();
    }
    long partial = 0;
    int index = head;
    for (int i = 0; i < n; i++) {
      index = index == 0 ? samples.length - 1 : index - 1;
      partial += samples[index];
    }
    return (double) partial / n;
  }

  public int size() {
    return size;
  }

  public int capacity() {
    return samples.length;
  }

  public boolean isFull() {
    return size == samples.length;
  }

  /**
   * Discards all samples.
   */
  public void clear() {
    head = 0;
    size = 0;
    sum = 0;
  }
}
