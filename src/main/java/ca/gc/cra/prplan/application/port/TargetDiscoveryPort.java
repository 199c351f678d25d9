package ca.gc.cra.prplan.application.port;

import ca.gc.cra.prplan.domain.plan.TargetDiscoveryException;
import java.util.List;

/**
 * Port returning the targets affected by changes to a module.
 *
 * @since 0.1.0
 */
public interface TargetDiscoveryPort {
  /**
   * Discovers affected targets.
   *
   * @param moduleName module whose dependents should be planned
   * @return targets in discovery order; may be empty
   * @throws TargetDiscoveryException if discovery is unavailable or fails
   * @throws InterruptedException if interrupted while waiting for the discovery process
   */
  List<String> discover(String moduleName) throws TargetDiscoveryException, InterruptedException;
}
