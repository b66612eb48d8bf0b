package ca.gc.cra.pacer.infrastructure.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcStatusMemoryProbeTest {

  @TempDir Path tempDir;

  @Test
  void readsResidentSetSize() throws IOException {
    Path status = tempDir.resolve("status");
    Files.writeString(status, String.join("\n",
        "Name:\tjava",
        "VmPeak:\t 9000000 kB",
        "VmRSS:\t  204800 kB",
        "Threads:\t42",
        ""), StandardCharsets.US_ASCII);

    ProcStatusMemoryProbe probe = new ProcStatusMemoryProbe(status);

    assertTrue(probe.isAvailable());
    assertEquals(204_800L * 1024, probe.residentMemoryBytes());
  }

  @Test
  void missingFileOrFieldReadsAsZero() throws IOException {
    ProcStatusMemoryProbe absent = new ProcStatusMemoryProbe(tempDir.resolve("absent"));
    assertFalse(absent.isAvailable());
    assertEquals(0L, absent.residentMemoryBytes());

    Path status = tempDir.resolve("status");
    Files.writeString(status, "Name:\tjava\n", StandardCharsets.US_ASCII);
    assertEquals(0L, new ProcStatusMemoryProbe(status).residentMemoryBytes());
  }

  @Test
  void malformedValueReadsAsZero() throws IOException {
    Path status = tempDir.resolve("status");
    Files.writeString(status, "VmRSS:\tlots kB\n", StandardCharsets.US_ASCII);
    assertEquals(0L, new ProcStatusMemoryProbe(status).residentMemoryBytes());
  }

  @Test
  void parseKibibytesStripsUnit() {
    assertEquals(1234L, ProcStatusMemoryProbe.parseKibibytes("   1234 kB"));
    assertEquals(7L, ProcStatusMemoryProbe.parseKibibytes("7"));
    assertEquals(0L, ProcStatusMemoryProbe.parseKibibytes("-5 kB"));
    assertThrows(NumberFormatException.class, () -> ProcStatusMemoryProbe.parseKibibytes("kB"));
  }
}
