package ca.gc.cra.prplan.domain.scan;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Environment and region marker patterns for one account class.
 * <p>Each pattern captures the marker value in group 1.</p>
 *
 * @param environment pattern locating the environment marker
 * @param region pattern locating the region marker
 * @since 0.1.0
 */
public record ScanPatterns(Pattern environment, Pattern region) {
  /** Commercial plans print terragrunt paths such as {@code .../organizations/staging/eu-west-1/...}. */
  public static final ScanPatterns COMMERCIAL = new ScanPatterns(
      Pattern.compile("/organizations/([^/]+)/"),
      Pattern.compile("/([a-z]{2}-[a-z]+-[0-9])/"));

  /** GovCloud plans name the organization and region tokens directly. */
  public static final ScanPatterns GOVCLOUD = new ScanPatterns(
      Pattern.compile("(govcloud-[^/]+)"),
      Pattern.compile("(us-gov-[a-z]+-[0-9])"));

  /**
   * Validates both patterns.
   */
  public ScanPatterns {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(region, "region");
  }

  /**
   * Returns the patterns used for the supplied account class.
   *
   * @param accountClass class whose output is being scanned
   * @return matching pattern pair
   */
  public static ScanPatterns forAccountClass(AccountClass accountClass) {
    return switch (Objects.requireNonNull(accountClass, "accountClass")) {
      case COMMERCIAL -> COMMERCIAL;
      case GOVCLOUD -> GOVCLOUD;
    };
  }

  Optional<String> findEnvironment(String line) {
    return firstGroup(environment, line);
  }

  Optional<String> findRegion(String line) {
    return firstGroup(region, line);
  }

  private static Optional<String> firstGroup(Pattern pattern, String line) {
    Matcher matcher = pattern.matcher(line);
    if (matcher.find() && matcher.groupCount() >= 1) {
      return Optional.ofNullable(matcher.group(1));
    }
    return Optional.empty();
  }
}
