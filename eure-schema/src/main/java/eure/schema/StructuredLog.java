package eure.schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// `event=NAME key=value ...` lines over JUL, with sampling for per-frame events
final class StructuredLog {
  private static final Map<String, AtomicLong> COUNTERS = new ConcurrentHashMap<>();
  private static final int MAX_VALUE_LENGTH = 200;

  private StructuredLog() {}

  static void fine(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
  }

  static void finer(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
  }

  /// FINEST, emitted only on every `everyN`th occurrence of `event`
  static void finestSampled(Logger log, String event, int everyN, Object... kv) {
    if (!log.isLoggable(Level.FINEST)) return;
    final long n = COUNTERS.computeIfAbsent(event, k -> new AtomicLong()).incrementAndGet();
    if (everyN <= 1 || n % everyN == 0L) {
      log.finest(() -> ev(event, kv) + " sample=" + n);
    }
  }

  static String ev(String event, Object... kv) {
    final var sb = new StringBuilder(64);
    sb.append("event=").append(event);
    for (int i = 0; i + 1 < kv.length; i += 2) {
      final var value = kv[i + 1] == null ? "null" : clean(kv[i + 1].toString());
      sb.append(' ').append(kv[i]).append('=');
      if (value.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"')) {
        sb.append('"').append(value.replace("\"", "\\\"")).append('"');
      } else {
        sb.append(value);
      }
    }
    return sb.toString();
  }

  private static String clean(String s) {
    final var trimmed = s.length() > MAX_VALUE_LENGTH ? s.substring(0, MAX_VALUE_LENGTH) + "..." : s;
    return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
  }
}
