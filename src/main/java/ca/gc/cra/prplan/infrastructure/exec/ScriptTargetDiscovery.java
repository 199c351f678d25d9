package ca.gc.cra.prplan.infrastructure.exec;

import ca.gc.cra.prplan.application.port.TargetDiscoveryPort;
import ca.gc.cra.prplan.domain.plan.TargetDiscoveryException;
import ca.gc.cra.prplan.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TargetDiscoveryPort} that runs the affected-modules script and reads the plan commands it prints.
 * <p>Each output line containing {@code kitman tg plan} contributes the token after {@code -w}, with the
 * {@code /terragrunt.hcl} suffix removed.</p>
 *
 * @since 0.1.0
 */
public final class ScriptTargetDiscovery implements TargetDiscoveryPort {
  private static final Logger log = LoggerFactory.getLogger(ScriptTargetDiscovery.class);
  private static final int LOGGED_OUTPUT_BYTES = 4_096;
  /** Script used when none is configured, relative to the working directory. */
  public static final String DEFAULT_SCRIPT = "./affected-modules.sh";
  static final String PLAN_COMMAND_MARKER = "kitman tg plan";
  static final String WORKDIR_FLAG = "-w";
  static final String TERRAGRUNT_FILE_SUFFIX = "/terragrunt.hcl";

  private final ProcessRunner runner;
  private final String script;

  /**
   * Creates a discovery adapter.
   *
   * @param workDir directory the script runs in
   * @param script script path, resolved against {@code workDir} when relative
   */
  public ScriptTargetDiscovery(Path workDir, String script) {
    this.runner = new ProcessRunner(workDir);
    this.script = Objects.requireNonNull(script, "script");
  }

  @Override
  public List<String> discover(String moduleName) throws TargetDiscoveryException, InterruptedException {
    Objects.requireNonNull(moduleName, "moduleName");
    Path scriptPath = runner.workDir().resolve(script).normalize();
    if (!Files.isRegularFile(scriptPath)) {
      throw new TargetDiscoveryException(script + " not found in " + runner.workDir());
    }
    ProcessRunner.Completed completed;
    try {
      completed = runner.run(List.of(script, moduleName, "."));
    } catch (IOException ex) {
      throw new TargetDiscoveryException("could not run " + script + ": " + ex.getMessage(), ex);
    }
    if (!completed.succeeded()) {
      throw new TargetDiscoveryException(script + " failed with " + completed.describeFailure());
    }
    log.debug("{} output: {}", script, Logs.truncate(completed.stdout(), LOGGED_OUTPUT_BYTES));
    return parseTargets(completed.stdout());
  }

  /**
   * Extracts plan targets from script output.
   *
   * @param output script standard output
   * @return targets in output order
   */
  static List<String> parseTargets(String output) {
    List<String> targets = new ArrayList<>();
    for (String rawLine : output.split("\n")) {
      String line = rawLine.trim();
      if (!line.contains(PLAN_COMMAND_MARKER)) {
        continue;
      }
      String[] tokens = line.split("\\s+");
      for (int i = 0; i < tokens.length - 1; i++) {
        if (WORKDIR_FLAG.equals(tokens[i])) {
          String target = removeFirst(tokens[i + 1], TERRAGRUNT_FILE_SUFFIX);
          if (!target.isBlank()) {
            targets.add(target);
          }
          break;
        }
      }
    }
    return List.copyOf(targets);
  }

  private static String removeFirst(String value, String fragment) {
    int idx = value.indexOf(fragment);
    return idx < 0 ? value : value.substring(0, idx) + value.substring(idx + fragment.length());
  }
}
