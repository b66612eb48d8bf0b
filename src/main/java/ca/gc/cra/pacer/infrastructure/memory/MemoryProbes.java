package ca.gc.cra.pacer.infrastructure.memory;

import ca.gc.cra.pacer.application.port.MemoryProbePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the most accurate memory probe available on the running platform.
 *
 * @since PACER 0.1
 */
public final class MemoryProbes {
  private static final Logger log = LoggerFactory.getLogger(MemoryProbes.class);

  private MemoryProbes() {}

  /**
   * Returns a procfs probe when {@code /proc/self/status} reports a resident size, otherwise a JVM probe.
   *
   * @return memory probe for this process
   */
  public static MemoryProbePort detect() {
    ProcStatusMemoryProbe proc = new ProcStatusMemoryProbe();
    if (proc.isAvailable() && proc.residentMemoryBytes() > 0) {
      log.debug("Using procfs resident memory probe");
      return proc;
    }
    log.debug("procfs unavailable; using JVM heap/non-heap memory probe");
    return new JvmMemoryProbe();
  }
}
