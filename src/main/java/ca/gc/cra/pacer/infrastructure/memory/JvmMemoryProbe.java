package ca.gc.cra.pacer.infrastructure.memory;

import ca.gc.cra.pacer.application.port.MemoryProbePort;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximates resident memory as JVM heap plus non-heap usage.
 * <p>Used where procfs is unavailable; undercounts native allocations such as camera buffers.</p>
 *
 * @since PACER 0.1
 */
public final class JvmMemoryProbe implements MemoryProbePort {
  private static final Logger log = LoggerFactory.getLogger(JvmMemoryProbe.class);

  private final MemoryMXBean memoryBean;

  /**
   * Creates a probe backed by the platform memory bean.
   */
  public JvmMemoryProbe() {
    this(ManagementFactory.getMemoryMXBean());
  }

  JvmMemoryProbe(MemoryMXBean memoryBean) {
    this.memoryBean = Objects.requireNonNull(memoryBean, "memoryBean");
  }

  @Override
  public long residentMemoryBytes() {
    try {
      long heap = memoryBean.getHeapMemoryUsage().getUsed();
      long nonHeap = memoryBean.getNonHeapMemoryUsage().getUsed();
      return Math.max(0L, heap) + Math.max(0L, nonHeap);
    } catch (RuntimeException ex) {
      log.debug("Failed to query JVM memory usage", ex);
      return 0L;
    }
  }
}
