package ca.gc.cra.pacer.infrastructure.memory;

import ca.gc.cra.pacer.application.port.MemoryProbePort;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the resident set size from a Linux {@code /proc/<pid>/status} file ({@code VmRSS} line, kB units).
 *
 * @since PACER 0.1
 */
public final class ProcStatusMemoryProbe implements MemoryProbePort {
  private static final Logger log = LoggerFactory.getLogger(ProcStatusMemoryProbe.class);

  /** Status file of the current process. */
  public static final Path SELF_STATUS = Path.of("/proc/self/status");

  private static final String RSS_FIELD = "VmRSS:";
  private static final long BYTES_PER_KIB = 1024L;

  private final Path statusFile;

  /**
   * Creates a probe for the current process.
   */
  public ProcStatusMemoryProbe() {
    this(SELF_STATUS);
  }

  /**
   * Creates a probe for an explicit status file.
   *
   * @param statusFile procfs status file
   */
  public ProcStatusMemoryProbe(Path statusFile) {
    this.statusFile = Objects.requireNonNull(statusFile, "statusFile");
  }

  /**
   * Indicates whether the status file exists and is readable.
   *
   * @return {@code true} on Linux-like systems
   */
  public boolean isAvailable() {
    return Files.isReadable(statusFile);
  }

  @Override
  public long residentMemoryBytes() {
    try (BufferedReader reader = Files.newBufferedReader(statusFile, StandardCharsets.US_ASCII)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.startsWith(RSS_FIELD)) {
          return parseKibibytes(line.substring(RSS_FIELD.length())) * BYTES_PER_KIB;
        }
      }
      log.debug("No {} line in {}", RSS_FIELD, statusFile);
      return 0L;
    } catch (IOException | RuntimeException ex) {
      log.debug("Failed to read resident memory from {}", statusFile, ex);
      return 0L;
    }
  }

  static long parseKibibytes(String field) {
    String value = field.trim();
    int space = value.indexOf(' ');
    if (space > 0) {
      value = value.substring(0, space);
    }
    long kib = Long.parseLong(value);
    return Math.max(0L, kib);
  }
}
