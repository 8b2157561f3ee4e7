package ca.gc.cra.acdih.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Endpoint URL validation for service and cache targets.
 *
 * @since 0.1.0
 */
public final class Urls {
  private static final int MAX_URL_LENGTH = 2_048;
  /** Scheme of local socket endpoints ({@code unix:///path/to.sock}), which carry a path instead of a host. */
  public static final String SOCKET_SCHEME = "unix";

  private Urls() {
    // Utility
  }

  /**
   * Validates an absolute URL whose scheme is one of {@code schemes} and which names a host.
   *
   * <p>Authorities that {@link URI} cannot split into a host, such as container service names with
   * underscores ({@code redis://redis_cache:6379}), are accepted as long as they are non-blank.
   * {@link #SOCKET_SCHEME} URLs need a socket path instead of an authority.</p>
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate URL
   * @param schemes accepted lower-case schemes (e.g. {@code http}, {@code https})
   * @return trimmed URL
   * @throws IllegalArgumentException if the value is not a valid URL for the accepted schemes
   */
  public static String requireUrl(String name, String value, Set<String> schemes) {
    String sanitized = Strings.requirePrintableAscii(name, value, MAX_URL_LENGTH);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI (was " + sanitized + ")", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !schemes.contains(scheme.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          name + " must use one of the schemes " + schemes + " (was " + sanitized + ")");
    }
    if (SOCKET_SCHEME.equalsIgnoreCase(scheme)) {
      if (uri.getPath() == null || uri.getPath().isBlank() || "/".equals(uri.getPath())) {
        throw new IllegalArgumentException(name + " must include a socket path (was " + sanitized + ")");
      }
      return sanitized;
    }
    if (!hasHost(uri)) {
      throw new IllegalArgumentException(name + " must include a host (was " + sanitized + ")");
    }
    return sanitized;
  }

  private static boolean hasHost(URI uri) {
    if (uri.getHost() != null && !uri.getHost().isBlank()) {
      return true;
    }
    String authority = uri.getRawAuthority();
    if (authority == null) {
      return false;
    }
    int userInfo = authority.lastIndexOf('@');
    String hostPort = userInfo >= 0 ? authority.substring(userInfo + 1) : authority;
    return !hostPort.isBlank() && !hostPort.startsWith(":");
  }
}
