package ca.gc.cra.pacer.infrastructure.metrics;

import ca.gc.cra.pacer.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when the exporter is {@code none}.
 *
 * @since PACER 0.1
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
