package ca.gc.cra.acdih.config.source;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory {@link EnvironmentSource}.
 *
 * <p>Lookups try the exact key first, then the upper-cased key, so {@code firebase_project_id} and
 * {@code FIREBASE_PROJECT_ID} resolve to the same entry.</p>
 *
 * @since 0.1.0
 */
public class MapEnvironmentSource implements EnvironmentSource {
  private final Map<String, String> values;
  private final Map<String, String> normalized;
  private final String description;

  /**
   * Creates a source backed by a copy of {@code values}.
   *
   * @param values variable map; {@code null} keys and values are skipped
   */
  public MapEnvironmentSource(Map<String, String> values) {
    this(values, "map");
  }

  /**
   * Creates a source backed by a copy of {@code values} with a custom description.
   *
   * @param values variable map; {@code null} keys and values are skipped
   * @param description label used in logs
   */
  public MapEnvironmentSource(Map<String, String> values, String description) {
    Map<String, String> exact = new LinkedHashMap<>();
    Map<String, String> upper = new LinkedHashMap<>();
    if (values != null) {
      for (Map.Entry<String, String> entry : values.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        exact.put(entry.getKey(), entry.getValue());
        upper.putIfAbsent(normalize(entry.getKey()), entry.getValue());
      }
    }
    this.values = Map.copyOf(exact);
    this.normalized = Map.copyOf(upper);
    this.description = Objects.requireNonNullElse(description, "map");
  }

  /**
   * Creates an empty source.
   *
   * @return source with no variables
   */
  public static MapEnvironmentSource empty() {
    return new MapEnvironmentSource(Map.of(), "empty");
  }

  @Override
  public Optional<String> get(String variable) {
    Objects.requireNonNull(variable, "variable");
    String value = values.get(variable);
    if (value == null) {
      value = normalized.get(normalize(variable));
    }
    return Optional.ofNullable(value);
  }

  @Override
  public String description() {
    return description;
  }

  /**
   * Returns the number of defined variables.
   *
   * @return variable count
   */
  public int size() {
    return values.size();
  }

  static String normalize(String key) {
    return key.trim().toUpperCase(Locale.ROOT);
  }
}
