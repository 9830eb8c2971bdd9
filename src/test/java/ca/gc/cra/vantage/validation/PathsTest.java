package ca.gc.cra.vantage.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableFileIsNormalized() throws IOException {
    Path file = Files.writeString(tempDir.resolve("topology.json"), "{}");

    Path resolved = Paths.requireReadableFile("topology", tempDir.resolve("sub/../topology.json").toString());

    assertEquals(file.toAbsolutePath().normalize(), resolved);
  }

  @Test
  void directoriesAndMissingFilesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("topology", tempDir.toString()));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("topology", tempDir.resolve("missing.json").toString()));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("topology", " "));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("topology", null));
  }
}
