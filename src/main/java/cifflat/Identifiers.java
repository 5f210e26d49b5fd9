package cifflat;

import java.util.Set;
import java.util.regex.Pattern;

/** Identifier rules shared by the XML validator, the grouping table and the flat-model reader. */
final class Identifiers {
  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Words that cannot be used as names in the flattened text. */
  static final Set<String> RESERVED = Set.of(
      "requirement", "invariant", "disables", "plant", "automaton", "group", "end",
      "controllable", "uncontrollable", "location", "initial", "marked", "edge", "goto",
      "not", "and", "or");

  private Identifiers() {}

  static boolean isIdentifier(String value) {
    return value != null && NAME_PATTERN.matcher(value).matches() && !RESERVED.contains(value);
  }
}
