package vnc;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Hands out Ren'Py identifiers within one namespace. Each key gets one identifier for good, so the
 * result only depends on the order in which keys are first seen.
 */
final class IdentifierAllocator {
  /** Python keywords and statement words that cannot name a variable or a label. */
  static final ImmutableSet<String> RESERVED_NAMES =
      ImmutableSet.of(
          "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del",
          "elif", "else", "except", "exec", "finally", "for", "from", "global", "if", "import",
          "in", "is", "lambda", "nonlocal", "not", "or", "pass", "print", "raise", "return", "try",
          "while", "with", "yield", "None", "True", "False",
          // Ren'Py statements and predefined names.
          "at", "behind", "call", "camera", "define", "default", "expression", "extend", "hide",
          "image", "init", "jump", "label", "layeredimage", "menu", "narrator", "nvl", "onlayer",
          "play", "python", "queue", "renpy", "scene", "screen", "show", "stop", "style",
          "transform", "translate", "voice", "window", "zorder", "centered", "config", "store",
          "persistent", "start", "main_menu", "splashscreen", "quit", "after_load");

  /** Image tags used by Ren'Py itself or by the generated script. */
  static final ImmutableSet<String> RESERVED_TAGS =
      ImmutableSet.of("bg", "black", "text", "vtext", "side", "image", "expression");

  private static final CharMatcher UNDERSCORE = CharMatcher.is('_');

  private final ImmutableSet<String> reserved;
  private final String fallback;
  private final Map<Object, String> allocated = new HashMap<>();
  private final Set<String> taken = new HashSet<>();

  IdentifierAllocator(ImmutableSet<String> reserved, String fallback) {
    this.reserved = reserved;
    this.fallback = fallback;
  }

  /** Returns the identifier of {@code key}, allocating one derived from {@code name} if new. */
  String allocate(Object key, String name) {
    String existing = allocated.get(key);
    if (existing != null) return existing;

    String base = sanitize(name, fallback);
    String identifier = base;
    for (int i = 2; taken.contains(identifier) || reserved.contains(identifier); i++) {
      identifier = base + "_" + i;
    }
    taken.add(identifier);
    allocated.put(key, identifier);
    return identifier;
  }

  Optional<String> lookup(Object key) {
    return Optional.ofNullable(allocated.get(key));
  }

  String get(Object key) {
    String identifier = allocated.get(key);
    Preconditions.checkArgument(identifier != null, "no identifier allocated for %s", key);
    return identifier;
  }

  /**
   * Keeps letters and digits of any script, replacing everything else with underscores. Ren'Py
   * accepts non-ASCII letters in names; a leading digit gets a prefix.
   */
  static String sanitize(String name, String fallback) {
    StringBuilder sb = new StringBuilder();
    name.codePoints()
        .forEach(
            c -> {
              if (java.lang.Character.isLetterOrDigit(c)) {
                sb.appendCodePoint(c);
              } else {
                sb.append('_');
              }
            });

    String result = UNDERSCORE.trimAndCollapseFrom(sb, '_');
    if (result.isEmpty()) return fallback;
    if (java.lang.Character.isDigit(result.codePointAt(0))) return fallback + "_" + result;
    return result;
  }
}
