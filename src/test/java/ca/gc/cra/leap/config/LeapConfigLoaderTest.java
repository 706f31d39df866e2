package ca.gc.cra.leap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LeapConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void profileSectionOverridesCommonAndIsFlattened() throws IOException {
    Path yaml = tempDir.resolve("leap.yaml");
    Files.writeString(yaml, """
        common:
          native:
            library: LeapShim
          dispatch:
            failureExitCode: 134
        Test:
          dispatch:
            failureExitCode: 70
          metrics:
            enabled: true
        """);

    Map<String, String> map = LeapConfigLoader.load(yaml, "test").orElseThrow();

    assertEquals("LeapShim", map.get("native.library"));
    assertEquals("70", map.get("dispatch.failureExitCode"));
    assertEquals("true", map.get("metrics.enabled"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    assertFalse(LeapConfigLoader.load(tempDir.resolve("missing.yaml"), "prod").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), LeapConfigLoader.load(yaml, "prod").orElseThrow());
  }

  @Test
  void listsAndNonMappingRootsAreRejected() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        common:
          native:
            - a
            - b
        """);
    Path root = tempDir.resolve("root.yaml");
    Files.writeString(root, "- common\n");

    assertThrows(IllegalArgumentException.class, () -> LeapConfigLoader.load(list, "prod"));
    assertThrows(IllegalArgumentException.class, () -> LeapConfigLoader.load(root, "prod"));
  }

  @Test
  void malformedYamlIsReportedWithPath() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "common: [unclosed\n");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> LeapConfigLoader.load(yaml, "prod"));
    assertEquals("Failed to parse YAML config at " + yaml, ex.getMessage());
  }
}
