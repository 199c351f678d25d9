package ca.gc.cra.prplan.domain.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Classifies discovered targets into commercial and GovCloud groups.
 * <p><strong>Role:</strong> Pure domain service invoked between target discovery and group execution.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class GroupPartitioner {
  /** Marker found in every GovCloud target path. */
  public static final String DEFAULT_RESTRICTED_MARKER = "govcloud";

  private final String restrictedMarker;

  /**
   * Creates a partitioner using {@link #DEFAULT_RESTRICTED_MARKER}.
   */
  public GroupPartitioner() {
    this(DEFAULT_RESTRICTED_MARKER);
  }

  /**
   * Creates a partitioner with a custom restricted marker.
   *
   * @param restrictedMarker substring identifying restricted targets; must not be blank
   * @throws IllegalArgumentException if the marker is blank
   */
  public GroupPartitioner(String restrictedMarker) {
    Objects.requireNonNull(restrictedMarker, "restrictedMarker");
    if (restrictedMarker.isBlank()) {
      throw new IllegalArgumentException("restrictedMarker must not be blank");
    }
    this.restrictedMarker = restrictedMarker;
  }

  /**
   * Splits targets by substring match on the restricted marker, preserving input order.
   *
   * @param targets ordered target identifiers; must not be {@code null}
   * @return partition whose two lists together contain every input target exactly once
   */
  public GroupPartition partition(List<String> targets) {
    Objects.requireNonNull(targets, "targets");
    List<String> commercial = new ArrayList<>();
    List<String> govcloud = new ArrayList<>();
    for (String target : targets) {
      if (classify(target) == AccountClass.GOVCLOUD) {
        govcloud.add(target);
      } else {
        commercial.add(target);
      }
    }
    return new GroupPartition(commercial, govcloud);
  }

  /**
   * Returns the account class of a single target.
   *
   * @param target target identifier; must not be {@code null}
   * @return {@link AccountClass#GOVCLOUD} iff the identifier contains the restricted marker
   */
  public AccountClass classify(String target) {
    Objects.requireNonNull(target, "target");
    return target.contains(restrictedMarker) ? AccountClass.GOVCLOUD : AccountClass.COMMERCIAL;
  }

  /**
   * Returns the configured marker.
   *
   * @return restricted marker substring
   */
  public String restrictedMarker() {
    return restrictedMarker;
  }

  /**
   * Indicates whether the marker is the one GovCloud scan patterns expect.
   * <p>GovCloud output is scanned for {@code govcloud-} environments and {@code us-gov-} regions
   * whatever the marker, so targets routed by another marker may yield no report blocks.</p>
   *
   * @return {@code true} when the marker equals {@link #DEFAULT_RESTRICTED_MARKER}
   */
  public boolean usesDefaultMarker() {
    return DEFAULT_RESTRICTED_MARKER.equals(restrictedMarker);
  }
}
