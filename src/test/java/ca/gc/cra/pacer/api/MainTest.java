package ca.gc.cra.pacer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void redirect() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void restore() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(null));
    assertTrue(buffer.toString().contains("usage: pacer"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: pacer"));
  }

  @Test
  void helpVariantsSucceed() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("simulate    Run the governor"));
  }

  @Test
  void commandNameIsCaseInsensitive() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"SIMULATE", "--dry-run"}));
    assertTrue(buffer.toString().contains("Simulate dry-run"));
  }

  @Test
  void delegatesArgumentsToSubcommand() {
    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {"simulate", "analysisWorkers=0", "--dry-run"}));
  }
}
