package ca.gc.cra.tagcal.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks run before a calibration reads its inputs or writes products.
 * <p><strong>Why:</strong> A run that fails late would leave a half-written product directory behind; rejecting bad
 * paths up front keeps the output directory either complete or untouched.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require input documents to be existing readable files.</li>
 *   <li>Create output directories on demand and refuse to reuse populated ones unless allowed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is reported as such.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an input file.
   *
   * @param name configuration key used in diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException when the path is missing, not a regular file or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " does not exist or is not a file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a product directory, optionally creating it.
   *
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException when the path is not a writable directory, is populated without
   *     {@code allowReuse}, or cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize("out", path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      if (!createIfMissing) {
        return normalized;
      }
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      ensureDirectory(real, allowReuse);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with allowOverwrite=true to reuse");
        }
      }
    }
  }
}
