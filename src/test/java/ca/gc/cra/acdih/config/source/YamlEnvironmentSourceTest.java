package ca.gc.cra.acdih.config.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlEnvironmentSourceTest {
  @TempDir Path tempDir;

  @Test
  void nestedKeysFlattenToVariableNames() throws IOException {
    Path yaml = tempDir.resolve("acdih.yaml");
    Files.writeString(yaml, """
        firebase:
          project-id: yaml-project
          client.email: svc@yaml.example
        max_workers: 6
        causal_confidence_threshold: 0.9
        log_file:
        """);

    YamlEnvironmentSource source = YamlEnvironmentSource.load(yaml);

    assertEquals(Optional.of("yaml-project"), source.get("FIREBASE_PROJECT_ID"));
    assertEquals(Optional.of("svc@yaml.example"), source.get("FIREBASE_CLIENT_EMAIL"));
    assertEquals(Optional.of("6"), source.get("MAX_WORKERS"));
    assertEquals(Optional.of("0.9"), source.get("CAUSAL_CONFIDENCE_THRESHOLD"));
    assertEquals(Optional.of(""), source.get("LOG_FILE"));
  }

  @Test
  void missingAndEmptyFilesYieldEmptySource() throws IOException {
    assertEquals(0, YamlEnvironmentSource.load(tempDir.resolve("missing.yaml")).size());

    Path empty = tempDir.resolve("empty.yaml");
    Files.writeString(empty, "");
    assertEquals(0, YamlEnvironmentSource.load(empty).size());
  }

  @Test
  void sequencesAreRejected() throws IOException {
    Path rootList = tempDir.resolve("list.yaml");
    Files.writeString(rootList, """
        - max_workers: 2
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlEnvironmentSource.load(rootList));

    Path nestedList = tempDir.resolve("nested.yaml");
    Files.writeString(nestedList, """
        redis_url:
          - redis://a:6379
        """);
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlEnvironmentSource.load(nestedList));
    assertTrue(ex.getMessage().contains("REDIS_URL"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "max_workers: [unterminated\n");

    assertThrows(IllegalArgumentException.class, () -> YamlEnvironmentSource.load(broken));
  }
}
