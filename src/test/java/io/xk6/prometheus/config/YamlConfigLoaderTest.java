package io.xk6.prometheus.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndExporterSections() throws IOException {
    Path yaml = tempDir.resolve("xk6.yaml");
    Files.writeString(yaml, """
        common:
          namespace: k6
          port: 9000
        exporter:
          port: 9090
          subsystem: run
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, YamlConfigLoader.EXPORTER_SECTION);

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("k6", map.get("namespace"));
    assertEquals("9090", map.get("port"));
    assertEquals("run", map.get("subsystem"));
  }

  @Test
  void listsAreJoinedAndKeysLowerCased() throws IOException {
    Path yaml = tempDir.resolve("buckets.yaml");
    Files.writeString(yaml, """
        Exporter:
          Buckets: [1, 2.5, 10]
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "exporter").orElseThrow();

    assertEquals("1,2.5,10", map.get("buckets"));
    assertEquals(3, OptionsParser.fromMap(map).buckets().size());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "exporter").orElseThrow());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "exporter").isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - exporter:
            port: 1
        """);

    assertThrows(ExporterConfigException.class, () -> YamlConfigLoader.load(yaml, "exporter"));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "exporter: [unclosed\n");

    assertThrows(ExporterConfigException.class, () -> YamlConfigLoader.load(yaml, "exporter"));
  }

  @Test
  void duplicateKeysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("duplicate.yaml");
    Files.writeString(yaml, """
        exporter:
          port: 1
          port: 2
        """);

    assertThrows(ExporterConfigException.class, () -> YamlConfigLoader.load(yaml, "exporter"));
  }

  @Test
  void nestedMappingsBecomeDottedKeysAndOtherSectionsAreIgnored() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        exporter:
          tls:
            enabled: false
        replay:
          port: 1
        """);

    assertEquals(Map.of("tls.enabled", "false"), YamlConfigLoader.load(yaml, "exporter").orElseThrow());
  }
}
