package cifflat;

import java.util.Locale;

/** Whether a supervisor may disable an event. */
public enum Controllability {
  CONTROLLABLE("controllable"),
  UNCONTROLLABLE("uncontrollable");

  private final String keyword;

  Controllability(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  public static Controllability fromKeyword(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (Controllability c : values()) {
        if (c.keyword.equals(normalized)) return c;
      }
    }
    throw new IllegalArgumentException("Unknown controllability '" + value + "'");
  }
}
