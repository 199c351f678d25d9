package ca.gc.cra.prplan.api;

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
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: prplan <generate|report> <module> [options]"));
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"apply", "iam"}));
  }

  @Test
  void dispatchesToCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"report", "--help"}));
    assertTrue(buffer.toString().contains("prplan report"));
  }

  @Test
  void commandTokenRemovedBeforeDelegating() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"generate"}));
    assertTrue(buffer.toString().contains("usage: prplan generate"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(6, ExitCode.VALIDATION_FAILURE.code());
    assertEquals(7, ExitCode.PLAN_FAILURE.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
