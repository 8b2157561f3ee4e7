package ca.gc.cra.acdih.config.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines several sources using first-wins precedence.
 *
 * <p>The usual stack is process environment, then {@code .env}, then YAML; declared defaults apply only
 * when no layer defines a variable.</p>
 *
 * @since 0.1.0
 */
public final class LayeredEnvironmentSource implements EnvironmentSource {
  private static final Logger log = LoggerFactory.getLogger(LayeredEnvironmentSource.class);

  private final List<EnvironmentSource> layers;

  /**
   * Creates a layered view.
   *
   * @param layers sources in precedence order (highest first); must not be empty
   */
  public LayeredEnvironmentSource(List<? extends EnvironmentSource> layers) {
    Objects.requireNonNull(layers, "layers");
    if (layers.isEmpty()) {
      throw new IllegalArgumentException("layers must not be empty");
    }
    List<EnvironmentSource> copy = new ArrayList<>(layers.size());
    for (EnvironmentSource layer : layers) {
      copy.add(Objects.requireNonNull(layer, "layer"));
    }
    this.layers = List.copyOf(copy);
  }

  /**
   * Convenience factory for a fixed list of layers.
   *
   * @param layers sources in precedence order (highest first)
   * @return layered source
   */
  public static LayeredEnvironmentSource of(EnvironmentSource... layers) {
    return new LayeredEnvironmentSource(List.of(layers));
  }

  @Override
  public Optional<String> get(String variable) {
    Objects.requireNonNull(variable, "variable");
    for (int i = 0; i < layers.size(); i++) {
      Optional<String> value = layers.get(i).get(variable);
      if (value.isPresent()) {
        if (log.isDebugEnabled()) {
          logShadowed(variable, i);
        }
        return value;
      }
    }
    return Optional.empty();
  }

  @Override
  public String description() {
    return layers.stream().map(EnvironmentSource::description).collect(Collectors.joining(" > "));
  }

  private void logShadowed(String variable, int winner) {
    for (int j = winner + 1; j < layers.size(); j++) {
      if (layers.get(j).get(variable).isPresent()) {
        log.debug("{} from {} overrides {}", variable, layers.get(winner).description(),
            layers.get(j).description());
      }
    }
  }
}
