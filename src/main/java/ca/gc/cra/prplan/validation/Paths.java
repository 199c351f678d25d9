package ca.gc.cra.prplan.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Validates directories supplied on the command line or in YAML.
 * <p><strong>Why:</strong> Catches unusable output and input locations before any plan runs, so a long run never
 * fails at the last write.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {}

  /**
   * Validates an output directory without creating it.
   *
   * @param path candidate directory
   * @param allowReuse whether an existing non-empty directory may be reused
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the directory cannot be used
   */
  public static Path validateWritableDir(Path path, boolean allowReuse) {
    return validateWritableDir(path, null, false, allowReuse);
  }

  /**
   * Validates an output directory.
   * <p>An existing directory must be writable and, unless {@code allowReuse} is set, empty. A missing directory
   * needs a writable nearest existing ancestor.</p>
   *
   * @param path candidate directory
   * @param allowedBase optional base the directory must stay under; {@code null} disables the check
   * @param createIfMissing whether to create the directory now
   * @param allowReuse whether an existing non-empty directory may be reused
   * @return absolute, normalized path (the real path when it exists)
   * @throws IllegalArgumentException if the directory cannot be used
   */
  public static Path validateWritableDir(
      Path path, Path allowedBase, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize(path);
    Path base = allowedBase == null ? null : allowedBase.toAbsolutePath().normalize();
    ensureWithinBase(normalized, base);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath();
        ensureWithinBase(real, base);
        ensureUsableDirectory(real, allowReuse);
        return real;
      }
      Path ancestor = nearestExistingAncestor(normalized);
      if (!Files.isDirectory(ancestor)) {
        throw new IllegalArgumentException("parent is not a directory: " + ancestor);
      }
      if (!Files.isWritable(ancestor)) {
        throw new IllegalArgumentException("directory is not writable: " + ancestor);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        return normalized.toRealPath();
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a directory that must already exist and be readable.
   *
   * @param name option name used in messages
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path validateReadableDir(String name, Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " directory does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " directory is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " directory " + normalized, ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureUsableDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static void ensureWithinBase(Path candidate, Path base) {
    if (base != null && !candidate.startsWith(base)) {
      throw new IllegalArgumentException("path " + candidate + " escapes allowed base " + base);
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start.getParent();
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}
