package ca.gc.cra.prplan.infrastructure.exec;

import ca.gc.cra.prplan.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one external command to completion, capturing stdout in memory and stderr in a temp file.
 * <p>Stderr goes to a file so a chatty process cannot block on a full pipe while stdout is being read.</p>
 */
final class ProcessRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
  static final int STDERR_TAIL_BYTES = 2_048;

  private final Path workDir;

  ProcessRunner(Path workDir) {
    this.workDir = Objects.requireNonNull(workDir, "workDir");
  }

  Path workDir() {
    return workDir;
  }

  /**
   * Starts the command and waits for it.
   *
   * @param command program and arguments
   * @return captured result
   * @throws IOException if the process cannot be started or its output cannot be read
   * @throws InterruptedException if interrupted while waiting; the process is destroyed
   */
  Completed run(List<String> command) throws IOException, InterruptedException {
    Path stderrFile = Files.createTempFile("prplan-stderr-", ".log");
    try {
      ProcessBuilder builder = new ProcessBuilder(command)
          .directory(workDir.toFile())
          .redirectError(stderrFile.toFile());
      log.debug("Starting {} in {}", String.join(" ", command), workDir);
      Process process = builder.start();
      process.getOutputStream().close();
      String stdout;
      try (InputStream in = process.getInputStream()) {
        stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException ex) {
        process.destroyForcibly();
        throw ex;
      }
      int exitCode;
      try {
        exitCode = process.waitFor();
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        throw ex;
      }
      String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
      return new Completed(exitCode, stdout, Logs.tail(stderr, STDERR_TAIL_BYTES));
    } finally {
      try {
        Files.deleteIfExists(stderrFile);
      } catch (IOException ex) {
        log.debug("Unable to delete {}", stderrFile, ex);
      }
    }
  }

  /**
   * Result of a finished process.
   *
   * @param exitCode process exit status
   * @param stdout full standard output
   * @param stderrTail last part of standard error, trimmed
   */
  record Completed(int exitCode, String stdout, String stderrTail) {
    boolean succeeded() {
      return exitCode == 0;
    }

    String describeFailure() {
      String detail = stderrTail.isEmpty() ? "" : ": " + stderrTail;
      return "exit status " + exitCode + detail;
    }
  }
}
