package ca.gc.cra.tagcal.validation;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableFileIsNormalized() throws IOException {
    Path file = Files.writeString(tempDir.resolve("raw.json"), "{}");

    assertEquals(file.toAbsolutePath().normalize(),
        Paths.requireReadableFile("in", tempDir.resolve("sub/../raw.json")));
  }

  @Test
  void missingFileOrDirectoryIsRejected() {
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("absent.json")));
    assertTrue(missing.getMessage().startsWith("in does not exist"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("refs", tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("refs", null));
  }

  @Test
  void createsMissingDirectoryOnlyWhenAsked() {
    Path out = tempDir.resolve("products/run1");

    Path planned = Paths.validateWritableDir(out, false, false);
    assertFalse(Files.exists(out));
    assertEquals(out.toAbsolutePath().normalize(), planned);

    Path created = Paths.validateWritableDir(out, true, false);
    assertTrue(Files.isDirectory(created));
  }

  @Test
  void populatedDirectoryNeedsReuse() throws IOException {
    Files.writeString(tempDir.resolve("old_flt.tci"), "x");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(tempDir, true, false));
    assertTrue(ex.getMessage().contains("allowOverwrite=true"));
    assertEquals(tempDir.toRealPath(), Paths.validateWritableDir(tempDir, true, true));
  }

  @Test
  void regularFileIsNotADirectory() throws IOException {
    Path file = Files.writeString(tempDir.resolve("file"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true, true));
  }
}
