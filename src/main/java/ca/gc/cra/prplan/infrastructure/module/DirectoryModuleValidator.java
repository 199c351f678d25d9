package ca.gc.cra.prplan.infrastructure.module;

import ca.gc.cra.prplan.application.port.ModuleValidatorPort;
import ca.gc.cra.prplan.domain.plan.ModuleValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Accepts a module when {@code terragrunt_<module>} exists as a directory under the working directory.
 *
 * @since 0.1.0
 */
public final class DirectoryModuleValidator implements ModuleValidatorPort {
  static final String MODULE_DIR_PREFIX = "terragrunt_";

  private final Path workDir;

  /**
   * Creates a validator.
   *
   * @param workDir directory expected to contain the module directories
   */
  public DirectoryModuleValidator(Path workDir) {
    this.workDir = Objects.requireNonNull(workDir, "workDir");
  }

  @Override
  public void validate(String moduleName) throws ModuleValidationException {
    if (moduleName == null || moduleName.isBlank()) {
      throw new ModuleValidationException("module name is required");
    }
    if (moduleName.contains("/") || moduleName.contains("\\") || moduleName.contains("..")) {
      throw new ModuleValidationException("module name must be a plain name: " + moduleName);
    }
    Path moduleDir = moduleDirectory(moduleName);
    if (!Files.isDirectory(moduleDir)) {
      throw new ModuleValidationException("module directory " + moduleDir.getFileName()
          + " does not exist in " + workDir.toAbsolutePath().normalize());
    }
  }

  /**
   * Resolves the directory that holds a module.
   *
   * @param moduleName module name
   * @return {@code <workDir>/terragrunt_<module>}
   */
  public Path moduleDirectory(String moduleName) {
    return workDir.resolve(MODULE_DIR_PREFIX + moduleName);
  }
}
