package ca.gc.cra.prplan.api;

import ca.gc.cra.prplan.config.ConfigMerger;
import ca.gc.cra.prplan.config.DefaultsForMode;
import ca.gc.cra.prplan.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Argument helpers shared by the subcommand CLIs.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} entry.
   *
   * @param args mutable argument map
   * @return configured path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return (value == null || value.isBlank()) ? null : value.trim();
  }

  /**
   * Copies the single positional module name into {@code module}.
   *
   * @param args mutable argument map
   * @param positionals positional tokens after the subcommand
   * @throws IllegalArgumentException if more than one positional token was supplied or the module was given twice
   */
  static void applyPositionalModule(Map<String, String> args, List<String> positionals) {
    if (positionals.isEmpty()) {
      return;
    }
    if (positionals.size() > 1) {
      throw new IllegalArgumentException("unexpected arguments: " + positionals.subList(1, positionals.size()));
    }
    String module = positionals.get(0);
    String explicit = args.get("module");
    if (explicit != null && !explicit.equals(module)) {
      throw new IllegalArgumentException("module given twice: " + module + " and " + explicit);
    }
    args.put("module", module);
  }

  /**
   * Loads YAML (when configured) and merges it with defaults and CLI arguments.
   *
   * @param mode subcommand name
   * @param cli CLI arguments without {@code config}
   * @param configPath YAML path or {@code null}
   * @param log logger receiving override warnings
   * @return effective configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or a merged value is invalid
   */
  static Map<String, String> effectiveConfig(
      String mode, Map<String, String> cli, String configPath, Logger log) throws IOException {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
