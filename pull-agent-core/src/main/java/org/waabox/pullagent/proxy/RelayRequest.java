package org.waabox.pullagent.proxy;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed proxy request.
 *
 * <p>The query is split on its raw form and each value is URL-decoded
 * exactly once, so an escaped {@code source} keeps its own query string.
 * When a parameter repeats, the first occurrence wins.
 *
 * @param digest  the decoded request path, the layer key, never null
 * @param rawPath the request path as received, used to relay, never null
 * @param length  the declared length of the layer in bytes
 * @param relay   whether a peer asked for the local copy, set by any
 *     non-empty {@code relay} value
 * @param source  the origin URL, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
record RelayRequest(String digest, String rawPath, long length,
    boolean relay, URI source) {

  /** Validates the fields. */
  RelayRequest {
    Objects.requireNonNull(digest, "digest must not be null");
    Objects.requireNonNull(rawPath, "rawPath must not be null");
    if (length < 0) {
      throw new IllegalArgumentException("len must not be negative");
    }
  }

  /**
   * Returns the origin URL, when one was given.
   *
   * @return the origin, never null
   */
  Optional<URI> origin() {
    return Optional.ofNullable(source);
  }

  /**
   * Parses the request URI.
   *
   * @param uri the request URI, never null
   *
   * @return the parsed request, never null
   *
   * @throws IllegalArgumentException if the path is empty or climbs out of
   *     the cache directory, if {@code len} is missing or not a
   *     non-negative integer, or if {@code source} is not an absolute
   *     http(s) URL
   */
  static RelayRequest parse(final URI uri) {
    final String digest = uri.getPath();
    if (digest == null || digest.isEmpty() || "/".equals(digest)) {
      throw new IllegalArgumentException("Missing layer path");
    }
    for (final String segment : digest.split("/")) {
      if ("..".equals(segment)) {
        throw new IllegalArgumentException("Path must not contain '..'");
      }
    }

    final Map<String, String> query = parseQuery(uri.getRawQuery());

    final String len = query.get("len");
    if (len == null || len.isEmpty()) {
      throw new IllegalArgumentException("Missing len parameter");
    }
    final long length;
    try {
      length = Long.parseLong(len);
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid len parameter: " + len, e);
    }

    final String relayValue = query.get("relay");
    final boolean relay = relayValue != null && !relayValue.isEmpty();

    URI source = null;
    final String rawSource = query.get("source");
    if (rawSource != null && !rawSource.isEmpty()) {
      source = parseSource(rawSource);
    }

    return new RelayRequest(digest, uri.getRawPath(), length, relay, source);
  }

  /** Splits the raw query into decoded values, first occurrence wins.
   *
   * @throws IllegalArgumentException on a malformed escape sequence
   */
  private static Map<String, String> parseQuery(final String rawQuery) {
    final Map<String, String> params = new HashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (final String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      final int eq = pair.indexOf('=');
      final String name = decode(eq < 0 ? pair : pair.substring(0, eq));
      final String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      params.putIfAbsent(name, value);
    }
    return params;
  }

  private static String decode(final String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed query value: " + value,
          e);
    }
  }

  private static URI parseSource(final String value) {
    final URI source;
    try {
      source = new URI(value);
    } catch (final URISyntaxException e) {
      throw new IllegalArgumentException("Invalid source url: " + value, e);
    }
    final String scheme = source.getScheme();
    if (scheme == null
        || !("http".equalsIgnoreCase(scheme)
            || "https".equalsIgnoreCase(scheme))
        || source.getHost() == null) {
      throw new IllegalArgumentException(
          "Source must be an absolute http(s) url: " + value);
    }
    return source;
  }
}
