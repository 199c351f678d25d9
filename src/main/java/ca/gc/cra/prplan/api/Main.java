package ca.gc.cra.prplan.api;

import ca.gc.cra.prplan.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for {@code prplan}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: prplan <generate|report> <module> [options]";
  private static final String HELP_TEXT = """
      prplan: terraform plan generator for pull requests

      Usage:
        prplan <command> <module> [options]

      Commands:
        generate    Run commercial and GovCloud plans and write the PR report
        report      Rebuild the PR report from an existing output directory

      Global flags:
        --help      Show this message (or a command's help after the command)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    CliInput input = CliInput.parse(safeArgs);
    if (input.positionals().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String commandToken = input.positionals().get(0);
    String[] delegateArgs = withoutFirst(safeArgs, commandToken);
    return switch (commandToken.toLowerCase(Locale.ROOT)) {
      case "generate" -> GenerateCli.run(delegateArgs);
      case "report" -> ReportCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", commandToken);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String token) {
    List<String> remaining = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < remaining.size(); i++) {
      String candidate = remaining.get(i);
      if (candidate != null && candidate.trim().equals(token)) {
        remaining.remove(i);
        break;
      }
    }
    return remaining.toArray(String[]::new);
  }
}
