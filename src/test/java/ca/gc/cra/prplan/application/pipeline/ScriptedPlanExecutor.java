package ca.gc.cra.prplan.application.pipeline;

import ca.gc.cra.prplan.application.port.PlanExecutorPort;
import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Executor fake returning canned output keyed by invocation label. */
final class ScriptedPlanExecutor implements PlanExecutorPort {
  private final Map<String, String> outputs = new ConcurrentHashMap<>();
  private final Map<String, Integer> failures = new ConcurrentHashMap<>();
  private final List<String> invocations = Collections.synchronizedList(new ArrayList<>());

  static String batchLabel(AccountClass accountClass, String moduleName) {
    return accountClass.name() + ":" + moduleName;
  }

  ScriptedPlanExecutor respond(String label, String output) {
    outputs.put(label, output);
    return this;
  }

  ScriptedPlanExecutor fail(String label, int exitCode) {
    failures.put(label, exitCode);
    return this;
  }

  List<String> invocations() {
    synchronized (invocations) {
      return List.copyOf(invocations);
    }
  }

  @Override
  public String planAll(AccountClass accountClass, String moduleName) throws PlanExecutionException {
    return answer(batchLabel(accountClass, moduleName));
  }

  @Override
  public String planTarget(String target) throws PlanExecutionException {
    return answer(target);
  }

  private String answer(String label) throws PlanExecutionException {
    invocations.add(label);
    Integer exitCode = failures.get(label);
    if (exitCode != null) {
      throw new PlanExecutionException(label, exitCode, "exit status " + exitCode + ": failed " + label);
    }
    return outputs.getOrDefault(label, "");
  }
}
