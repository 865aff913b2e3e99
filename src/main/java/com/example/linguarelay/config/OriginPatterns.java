package com.example.linguarelay.config;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns the configured origin list into allowed-origin patterns for the relay socket and /api/**.
 * A loopback origin also admits the other loopback host on any port, so a dev client on another port still connects.
 */
final class OriginPatterns {

  private static final Pattern LOOPBACK = Pattern.compile("^(https?)://(localhost|127\\.0\\.0\\.1)(:\\d+)?/?$");

  private OriginPatterns() { }

  /** Comma-separated origins; an empty list allows any origin. */
  static List<String> fromCsv(String originsCsv) {
    if (originsCsv == null || originsCsv.isBlank()) return List.of("*");
    List<String> patterns = Stream.of(originsCsv.split(","))
        .map(String::trim)
        .filter(origin -> !origin.isEmpty())
        .flatMap(OriginPatterns::variants)
        .distinct()
        .collect(Collectors.toList());
    return patterns.isEmpty() ? List.of("*") : patterns;
  }

  private static Stream<String> variants(String origin) {
    Matcher m = LOOPBACK.matcher(origin);
    if (!m.matches()) return Stream.of(origin);
    String scheme = m.group(1);
    return Stream.of(origin, scheme + "://localhost:*", scheme + "://127.0.0.1:*");
  }
}
