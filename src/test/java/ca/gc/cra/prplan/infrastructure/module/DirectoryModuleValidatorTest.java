package ca.gc.cra.prplan.infrastructure.module;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prplan.domain.plan.ModuleValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryModuleValidatorTest {

  @TempDir
  Path tempDir;

  @Test
  void acceptsExistingTerragruntDirectory() throws Exception {
    Files.createDirectory(tempDir.resolve("terragrunt_iam"));
    DirectoryModuleValidator validator = new DirectoryModuleValidator(tempDir);

    assertDoesNotThrow(() -> validator.validate("iam"));
    assertEquals(tempDir.resolve("terragrunt_iam"), validator.moduleDirectory("iam"));
  }

  @Test
  void rejectsMissingDirectory() {
    ModuleValidationException ex = assertThrows(ModuleValidationException.class,
        () -> new DirectoryModuleValidator(tempDir).validate("network"));

    assertTrue(ex.getMessage().contains("terragrunt_network does not exist"));
  }

  @Test
  void plainFileIsNotAModule() throws Exception {
    Files.writeString(tempDir.resolve("terragrunt_iam"), "");

    assertThrows(ModuleValidationException.class,
        () -> new DirectoryModuleValidator(tempDir).validate("iam"));
  }

  @Test
  void rejectsPathLikeNames() {
    DirectoryModuleValidator validator = new DirectoryModuleValidator(tempDir);

    assertThrows(ModuleValidationException.class, () -> validator.validate("../etc"));
    assertThrows(ModuleValidationException.class, () -> validator.validate("a/b"));
    assertThrows(ModuleValidationException.class, () -> validator.validate(" "));
  }
}
