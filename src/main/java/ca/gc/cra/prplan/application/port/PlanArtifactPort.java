package ca.gc.cra.prplan.application.port;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable storage for raw group output and the rendered report.
 * <p><strong>Why:</strong> Lets a later report pass run purely from stored artifacts without re-running any executor.</p>
 * <p><strong>Thread-safety:</strong> Each account class owns its own artifact; implementations must allow the two
 * groups to write concurrently.</p>
 *
 * @since 0.1.0
 */
public interface PlanArtifactPort {
  /**
   * Writes the raw output of a group, replacing any earlier artifact.
   *
   * @param accountClass group that produced the output
   * @param rawOutput captured text or sentinel
   * @return location of the written artifact
   * @throws IOException if the artifact cannot be written
   */
  Path writeGroupOutput(AccountClass accountClass, String rawOutput) throws IOException;

  /**
   * Reads the raw output of a group.
   *
   * @param accountClass group to read
   * @return artifact contents, empty when no artifact exists
   * @throws IOException if the artifact exists but cannot be read
   */
  Optional<String> readGroupOutput(AccountClass accountClass) throws IOException;

  /**
   * Removes the artifact of a group if present.
   *
   * @param accountClass group whose artifact should be removed
   * @throws IOException if the artifact cannot be deleted
   */
  void deleteGroupOutput(AccountClass accountClass) throws IOException;

  /**
   * Writes the rendered report.
   *
   * @param markdown report body
   * @return location of the written report
   * @throws IOException if the report cannot be written
   */
  Path writeReport(String markdown) throws IOException;

  /**
   * Returns the directory holding every artifact.
   *
   * @return output directory
   */
  Path directory();
}
