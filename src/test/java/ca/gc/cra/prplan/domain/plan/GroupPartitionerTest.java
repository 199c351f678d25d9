package ca.gc.cra.prplan.domain.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class GroupPartitionerTest {

  @Test
  void splitsTargetsByRestrictedMarkerPreservingOrder() {
    GroupPartitioner partitioner = new GroupPartitioner();

    GroupPartition partition = partitioner.partition(List.of(
        "terragrunt_iam/organizations/staging/eu-west-1/roles",
        "terragrunt_iam/organizations/govcloud-staging/us-gov-west-1/roles",
        "terragrunt_iam/organizations/production/us-east-1/roles",
        "terragrunt_iam/organizations/govcloud-production/us-gov-west-1/roles"));

    assertEquals(List.of(
        "terragrunt_iam/organizations/staging/eu-west-1/roles",
        "terragrunt_iam/organizations/production/us-east-1/roles"), partition.commercial());
    assertEquals(List.of(
        "terragrunt_iam/organizations/govcloud-staging/us-gov-west-1/roles",
        "terragrunt_iam/organizations/govcloud-production/us-gov-west-1/roles"),
        partition.govcloud());
    assertEquals(4, partition.size());
  }

  @Test
  void markerMatchIsCaseSensitiveSubstring() {
    GroupPartitioner partitioner = new GroupPartitioner();

    assertEquals(AccountClass.COMMERCIAL, partitioner.classify("modules/GovCloud/eu-west-1"));
    assertEquals(AccountClass.GOVCLOUD, partitioner.classify("modules/mygovcloudthing"));
  }

  @Test
  void customMarkerIsHonoured() {
    GroupPartitioner partitioner = new GroupPartitioner("restricted");
    assertEquals("restricted", partitioner.restrictedMarker());
    assertFalse(partitioner.usesDefaultMarker());
    assertTrue(new GroupPartitioner().usesDefaultMarker());

    GroupPartition partition = partitioner.partition(List.of("a/restricted/b", "a/govcloud/b"));

    assertEquals(List.of("a/govcloud/b"), partition.commercial());
    assertEquals(List.of("a/restricted/b"), partition.targets(AccountClass.GOVCLOUD));
  }

  @Test
  void emptyInputGivesEmptyGroups() {
    GroupPartition partition = new GroupPartitioner().partition(List.of());

    assertTrue(partition.commercial().isEmpty());
    assertTrue(partition.govcloud().isEmpty());
  }

  @Test
  void blankMarkerRejected() {
    assertThrows(IllegalArgumentException.class, () -> new GroupPartitioner("  "));
  }
}
