package ca.gc.cra.prplan.application.port;

import ca.gc.cra.prplan.domain.plan.RunSummary;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Port persisting a machine-readable summary of a generation run.
 *
 * @since 0.1.0
 */
public interface RunSummaryPort {
  /**
   * Persists the summary.
   *
   * @param summary completed run summary
   * @return location of the written summary
   * @throws IOException if the summary cannot be written
   */
  Path write(RunSummary summary) throws IOException;
}
