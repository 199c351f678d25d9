package ca.gc.cra.prplan.domain.scan;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.ActionRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Single-pass state machine extracting action blocks from captured plan text.
 * <p><strong>Why:</strong> Plan output is human-oriented; the environment and region of a block are only known
 * from the most recent path-like marker lines, so context must be carried across lines.</p>
 * <p><strong>Role:</strong> Domain parser between raw group artifacts and the report assembler.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Latch the last seen environment and region markers.</li>
 *   <li>Collect lines from the actions header through the {@code Plan:} summary.</li>
 *   <li>Emit a record when both context values are known, otherwise drop the block.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. {@link #scan(String)} starts from a fresh state on every call,
 * so one instance may be reused sequentially; {@link #accept(String)} keeps feeding the current state.</p>
 *
 * @since 0.1.0
 */
public final class PlanTextScanner {
  /** Line fragment that opens an action block. */
  public static final String ACTIONS_HEADER = "Terraform will perform the following actions:";
  /** Line fragment present in the closing summary line. */
  public static final String SUMMARY_MARKER = "Plan:";

  private static final String[] CHANGE_COUNTS = {"to add", "to change", "to destroy"};

  private final ScanPatterns patterns;
  private String currentEnvironment;
  private String currentRegion;
  private boolean insideActionBlock;
  private List<String> blockLines = new ArrayList<>();
  private int emittedRecords;
  private int droppedBlocks;

  /**
   * Creates a scanner for the supplied marker patterns.
   *
   * @param patterns environment/region patterns; must not be {@code null}
   */
  public PlanTextScanner(ScanPatterns patterns) {
    this.patterns = Objects.requireNonNull(patterns, "patterns");
  }

  /**
   * Creates a scanner configured for an account class.
   *
   * @param accountClass class whose output will be scanned
   * @return fresh scanner
   */
  public static PlanTextScanner forAccountClass(AccountClass accountClass) {
    return new PlanTextScanner(ScanPatterns.forAccountClass(accountClass));
  }

  /**
   * Scans a full buffer from a fresh state and returns every emitted record in order.
   * <p>Context, any open block and the counters from earlier input are discarded first.</p>
   *
   * @param text captured group output; {@code null} is treated as empty
   * @return records in the order their blocks closed
   */
  public List<ActionRecord> scan(String text) {
    reset();
    List<ActionRecord> records = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return records;
    }
    for (String line : text.split("\n", -1)) {
      accept(line).ifPresent(records::add);
    }
    return records;
  }

  /**
   * Feeds one line through the transition rules.
   *
   * @param line line without its terminating newline; must not be {@code null}
   * @return record emitted when this line closed a block with full context
   */
  public Optional<ActionRecord> accept(String line) {
    Objects.requireNonNull(line, "line");
    updateEnvironment(line);
    updateRegion(line);
    if (tryOpen(line)) {
      return Optional.empty();
    }
    return appendAndMaybeClose(line);
  }

  void reset() {
    currentEnvironment = null;
    currentRegion = null;
    insideActionBlock = false;
    blockLines = new ArrayList<>();
    emittedRecords = 0;
    droppedBlocks = 0;
  }

  boolean updateEnvironment(String line) {
    Optional<String> environment = patterns.findEnvironment(line);
    environment.ifPresent(value -> currentEnvironment = value);
    return environment.isPresent();
  }

  boolean updateRegion(String line) {
    Optional<String> region = patterns.findRegion(line);
    region.ifPresent(value -> currentRegion = value);
    return region.isPresent();
  }

  boolean tryOpen(String line) {
    if (insideActionBlock || !line.contains(ACTIONS_HEADER)) {
      return false;
    }
    insideActionBlock = true;
    blockLines = new ArrayList<>();
    blockLines.add(line);
    return true;
  }

  Optional<ActionRecord> appendAndMaybeClose(String line) {
    if (!insideActionBlock) {
      return Optional.empty();
    }
    blockLines.add(line);
    if (!isSummaryLine(line)) {
      return Optional.empty();
    }
    Optional<ActionRecord> emitted = Optional.empty();
    if (hasText(currentEnvironment) && hasText(currentRegion)) {
      emitted = Optional.of(
          new ActionRecord(currentEnvironment, currentRegion, String.join("\n", blockLines)));
      emittedRecords++;
    } else {
      droppedBlocks++;
    }
    insideActionBlock = false;
    blockLines = new ArrayList<>();
    return emitted;
  }

  static boolean isSummaryLine(String line) {
    if (!line.contains(SUMMARY_MARKER)) {
      return false;
    }
    for (String count : CHANGE_COUNTS) {
      if (line.contains(count)) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }

  /**
   * Returns the environment currently latched.
   *
   * @return latched environment, empty until a marker is seen
   */
  public Optional<String> currentEnvironment() {
    return Optional.ofNullable(currentEnvironment);
  }

  /**
   * Returns the region currently latched.
   *
   * @return latched region, empty until a marker is seen
   */
  public Optional<String> currentRegion() {
    return Optional.ofNullable(currentRegion);
  }

  boolean insideActionBlock() {
    return insideActionBlock;
  }

  /**
   * Indicates whether input ended inside an action block, whose lines are then discarded.
   *
   * @return {@code true} when the last block never saw its summary line
   */
  public boolean unterminatedBlock() {
    return insideActionBlock;
  }

  /**
   * Returns how many records have been emitted since the last {@link #scan(String)} began.
   *
   * @return emitted record count
   */
  public int emittedRecords() {
    return emittedRecords;
  }

  /**
   * Returns how many closed blocks were dropped for missing context since the last {@link #scan(String)} began.
   *
   * @return dropped block count
   */
  public int droppedBlocks() {
    return droppedBlocks;
  }
}
