package ca.gc.cra.prplan.domain.plan;

/**
 * <strong>What:</strong> Account classes planned independently by the PR plan workflow.
 * <p><strong>Why:</strong> Commercial and GovCloud accounts are planned with different executor arguments and
 * their plan output carries different environment/region markers.</p>
 * <p><strong>Role:</strong> Domain enum keying artifacts, scan patterns, and group results.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum AccountClass {
  /** Default class for every target that does not carry the restricted marker. */
  COMMERCIAL("commercial", "commercial-plans.txt", "No commercial plans needed"),
  /** Restricted government accounts. */
  GOVCLOUD("GovCloud", "govcloud-plans.txt", "No GovCloud plans needed");

  private final String displayName;
  private final String artifactFileName;
  private final String noWorkText;

  AccountClass(String displayName, String artifactFileName, String noWorkText) {
    this.displayName = displayName;
    this.artifactFileName = artifactFileName;
    this.noWorkText = noWorkText;
  }

  /**
   * Returns the label used in logs and console output.
   *
   * @return human readable class name
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns the file name of the raw plan artifact for this class.
   *
   * @return artifact file name relative to the output directory
   */
  public String artifactFileName() {
    return artifactFileName;
  }

  /**
   * Returns the sentinel text written when the group had no targets.
   *
   * @return sentinel line, without trailing newline
   */
  public String noWorkText() {
    return noWorkText;
  }

  /**
   * Returns the exact artifact body written for an empty group.
   *
   * @return sentinel text followed by a newline
   */
  public String noWorkArtifact() {
    return noWorkText + "\n";
  }

  /**
   * Indicates whether the supplied artifact text is a "no work" placeholder of any class.
   *
   * @param text artifact contents; {@code null} is treated as not a sentinel
   * @return {@code true} when the text contains a known sentinel
   */
  public static boolean isNoWorkText(String text) {
    if (text == null) {
      return false;
    }
    for (AccountClass accountClass : values()) {
      if (text.contains(accountClass.noWorkText)) {
        return true;
      }
    }
    return false;
  }
}
