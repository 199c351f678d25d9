package ca.gc.cra.prplan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void generateDefaultsMatchToolConventions() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("generate");

    assertEquals("kitman", defaults.get("executorCommand"));
    assertEquals("./affected-modules.sh", defaults.get("discoveryScript"));
    assertEquals("govcloud", defaults.get("restrictedMarker"));
    assertEquals("govcloud-staging|govcloud-production", defaults.get("govcloud.organizations"));
    assertEquals("us-gov-west-1", defaults.get("govcloud.regions"));
    assertEquals("false", defaults.get("targeted"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("kitman tg plan_all", defaults.get("report.commandLabel"));
  }

  @Test
  void reportDefaultsOmitGenerateOnlyKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" REPORT ");

    assertEquals("", defaults.get("in"));
    assertFalse(defaults.containsKey("executorCommand"));
  }

  @Test
  void unknownModeRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("apply"));
  }
}
