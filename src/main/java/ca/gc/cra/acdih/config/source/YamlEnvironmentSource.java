package ca.gc.cra.acdih.config.source;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * {@link EnvironmentSource} read from a YAML document whose nested keys are flattened into
 * variable names.
 *
 * <p>{@code firebase: {project_id: demo}} becomes {@code FIREBASE_PROJECT_ID=demo}: path segments are
 * joined with {@code '_'}, dashes and dots become {@code '_'}, and the result is upper-cased.</p>
 *
 * @since 0.1.0
 */
public final class YamlEnvironmentSource extends MapEnvironmentSource {

  private YamlEnvironmentSource(Map<String, String> values, Path path) {
    super(values, "yaml:" + path);
  }

  /**
   * Loads and flattens the YAML document at {@code path}.
   *
   * @param path location of the YAML configuration
   * @return source with flattened variables; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static YamlEnvironmentSource load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path absolute = path.toAbsolutePath().normalize();
    if (!Files.exists(absolute)) {
      return new YamlEnvironmentSource(Map.of(), absolute);
    }
    if (!Files.isRegularFile(absolute)) {
      throw new IOException("YAML config is not a regular file: " + absolute);
    }
    try (Reader reader = Files.newBufferedReader(absolute, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return new YamlEnvironmentSource(Map.of(), absolute);
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(document, "root"), "", flattened);
      return new YamlEnvironmentSource(flattened, absolute);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + absolute, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String segment = key.trim().replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT);
      String composite = prefix.isEmpty() ? segment : prefix + '_' + segment;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
