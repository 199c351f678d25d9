package ca.gc.cra.prplan.infrastructure.persistence;

import ca.gc.cra.prplan.application.port.PlanArtifactPort;
import ca.gc.cra.prplan.domain.plan.AccountClass;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores group output and the PR report as UTF-8 files in one output directory.
 * <p>The directory is created on first write. Each account class owns one file, so the two group threads
 * never write the same path.</p>
 *
 * @since 0.1.0
 */
public final class FilePlanArtifactStore implements PlanArtifactPort {
  private static final Logger log = LoggerFactory.getLogger(FilePlanArtifactStore.class);
  /** File name of the rendered report. */
  public static final String REPORT_FILE_NAME = "pr-ready.md";

  private final Path outputDirectory;

  /**
   * Creates a store rooted at the given directory.
   *
   * @param outputDirectory directory for every artifact; may not exist yet
   */
  public FilePlanArtifactStore(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public Path writeGroupOutput(AccountClass accountClass, String rawOutput) throws IOException {
    Objects.requireNonNull(rawOutput, "rawOutput");
    return write(groupFile(accountClass), rawOutput);
  }

  @Override
  public Optional<String> readGroupOutput(AccountClass accountClass) throws IOException {
    Path file = groupFile(accountClass);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
  }

  @Override
  public void deleteGroupOutput(AccountClass accountClass) throws IOException {
    if (Files.deleteIfExists(groupFile(accountClass))) {
      log.info("Removed stale {}", accountClass.artifactFileName());
    }
  }

  @Override
  public Path writeReport(String markdown) throws IOException {
    return write(outputDirectory.resolve(REPORT_FILE_NAME), Objects.requireNonNull(markdown, "markdown"));
  }

  @Override
  public Path directory() {
    return outputDirectory;
  }

  private Path groupFile(AccountClass accountClass) {
    return outputDirectory.resolve(Objects.requireNonNull(accountClass, "accountClass").artifactFileName());
  }

  private Path write(Path file, String content) throws IOException {
    ensureDirectory();
    Files.writeString(file, content, StandardCharsets.UTF_8);
    log.debug("Wrote {} ({} chars)", file, content.length());
    return file;
  }

  private synchronized void ensureDirectory() throws IOException {
    if (!Files.isDirectory(outputDirectory)) {
      Files.createDirectories(outputDirectory);
    }
  }
}
