package ca.gc.cra.prplan.domain.report;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Plan blocks of one environment keyed by region, kept in ascending region order.
 * <p>Mutable while the assembler folds records; {@link PlanReport} only exposes read-only views.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentGroup {
  private final String name;
  private final SortedMap<String, String> blocksByRegion = new TreeMap<>();

  /**
   * Creates an empty group.
   *
   * @param name environment name; must not be {@code null}
   */
  public EnvironmentGroup(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Stores the block for a region, replacing any earlier block for the same region.
   *
   * @param region region name
   * @param blockText verbatim plan excerpt
   * @return block that was replaced, if any
   */
  Optional<String> put(String region, String blockText) {
    return Optional.ofNullable(blocksByRegion.put(region, blockText));
  }

  /**
   * Returns the environment name.
   *
   * @return environment name
   */
  public String name() {
    return name;
  }

  /**
   * Returns region names in ascending order.
   *
   * @return immutable sorted region list
   */
  public List<String> regions() {
    return List.copyOf(blocksByRegion.keySet());
  }

  /**
   * Returns the block recorded for a region.
   *
   * @param region region name
   * @return block text when present
   */
  public Optional<String> block(String region) {
    return Optional.ofNullable(blocksByRegion.get(region));
  }

  /**
   * Returns a read-only view of region to block text, sorted by region.
   *
   * @return unmodifiable sorted view
   */
  public Map<String, String> blocksByRegion() {
    return Collections.unmodifiableSortedMap(blocksByRegion);
  }
}
