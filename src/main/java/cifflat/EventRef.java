package cifflat;

import java.util.Objects;

/**
 * Textual reference to an event: {@code name} for an event of the referencing instance, or
 * {@code instance.name} for an event owned by another instance.
 */
public record EventRef(String instance, String event) {

  public EventRef {
    Objects.requireNonNull(event, "event");
  }

  public static EventRef local(String event) {
    return new EventRef(null, event);
  }

  public static EventRef qualified(String instance, String event) {
    return new EventRef(Objects.requireNonNull(instance, "instance"), event);
  }

  /** Parses {@code name} or {@code instance.name}. */
  public static EventRef parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Empty event reference");
    }
    String trimmed = text.trim();
    int dot = trimmed.indexOf('.');
    if (dot < 0) {
      return local(trimmed);
    }
    if (dot == 0 || dot == trimmed.length() - 1 || trimmed.indexOf('.', dot + 1) >= 0) {
      throw new IllegalArgumentException("Malformed event reference '" + trimmed + "'");
    }
    return qualified(trimmed.substring(0, dot).trim(), trimmed.substring(dot + 1).trim());
  }

  public boolean isQualified() {
    return instance != null;
  }

  @Override
  public String toString() {
    return isQualified() ? instance + "." + event : event;
  }
}
