package ca.gc.cra.acdih.config.source;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvBuilder;
import io.github.cdimascio.dotenv.DotenvEntry;
import io.github.cdimascio.dotenv.DotenvException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EnvironmentSource} holding the entries declared in a {@code .env} file.
 *
 * <p>Only entries from the file are exposed; the process environment is layered separately by
 * {@link LayeredEnvironmentSource}. A missing file yields an empty source. Lines that are not
 * assignments are skipped with a warning and the remaining entries are kept.</p>
 *
 * @since 0.1.0
 */
public final class DotenvEnvironmentSource extends MapEnvironmentSource {
  private static final Logger log = LoggerFactory.getLogger(DotenvEnvironmentSource.class);

  /** Default file name looked up in the working directory. */
  public static final String DEFAULT_FILE = ".env";

  private DotenvEnvironmentSource(Map<String, String> values, Path file) {
    super(values, describe(file));
  }

  /**
   * Loads the given {@code .env} style file.
   *
   * @param file file location; must not be {@code null}
   * @return source with the declared entries; empty when the file does not exist
   * @throws EnvironmentSourceException when the file exists but cannot be read
   */
  public static DotenvEnvironmentSource load(Path file) {
    Objects.requireNonNull(file, "file");
    Path absolute = file.toAbsolutePath().normalize();
    if (!Files.isRegularFile(absolute)) {
      log.debug("No dotenv file at {}; continuing without it", absolute);
      return new DotenvEnvironmentSource(Map.of(), absolute);
    }
    Dotenv dotenv;
    try {
      dotenv = builder(absolute).load();
    } catch (DotenvException strict) {
      log.warn("Skipping malformed entries in dotenv file {}: {}", absolute, strict.getMessage());
      try {
        dotenv = builder(absolute).ignoreIfMalformed().load();
      } catch (DotenvException ex) {
        throw new EnvironmentSourceException("Failed to read dotenv file at " + absolute, ex);
      }
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
      values.put(entry.getKey(), entry.getValue());
    }
    log.debug("Loaded {} entries from {}", values.size(), absolute);
    return new DotenvEnvironmentSource(values, absolute);
  }

  /**
   * Returns a source that reads {@code file} on first lookup instead of now.
   *
   * <p>A read failure is thrown from {@link EnvironmentSource#get(String)} and is not remembered, so a
   * later lookup tries again.</p>
   *
   * @param file file location; must not be {@code null}
   * @return lazily loaded source
   */
  public static EnvironmentSource deferred(Path file) {
    return new Deferred(Objects.requireNonNull(file, "file").toAbsolutePath().normalize());
  }

  private static DotenvBuilder builder(Path absolute) {
    Path directory = absolute.getParent() == null ? Path.of(".") : absolute.getParent();
    return Dotenv.configure()
        .directory(directory.toString())
        .filename(absolute.getFileName().toString());
  }

  private static String describe(Path file) {
    return "dotenv:" + file;
  }

  private static final class Deferred implements EnvironmentSource {
    private final Path file;
    private volatile DotenvEnvironmentSource loaded;

    private Deferred(Path file) {
      this.file = file;
    }

    @Override
    public Optional<String> get(String variable) {
      DotenvEnvironmentSource current = loaded;
      if (current == null) {
        synchronized (this) {
          current = loaded;
          if (current == null) {
            current = load(file);
            loaded = current;
          }
        }
      }
      return current.get(variable);
    }

    @Override
    public String description() {
      return describe(file);
    }
  }
}
