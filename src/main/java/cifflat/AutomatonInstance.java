package cifflat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully resolved plant automaton. Edges carry event ids from the run's {@link EventArena};
 * an id that is not in {@link #events()} belongs to another instance.
 *
 * @param events owned events by local name, in declaration order
 * @param bindings template event and parameter names to the ids they were bound to
 */
public record AutomatonInstance(
    String name,
    String templateName,
    Map<String, Integer> events,
    Map<String, Integer> bindings,
    List<Location> locations,
    List<Edge> edges) {

  public record Location(String name, boolean initial, boolean marked) {}

  /** Transition; {@code target == null} keeps the current location. */
  public record Edge(String source, int event, String target) {
    public boolean isSelfLoop() {
      return target == null;
    }
  }

  public AutomatonInstance {
    Objects.requireNonNull(name, "name");
    events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
    bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    locations = List.copyOf(locations);
    edges = List.copyOf(edges);
  }

  public Optional<Location> location(String locationName) {
    for (Location loc : locations) {
      if (loc.name().equals(locationName)) return Optional.of(loc);
    }
    return Optional.empty();
  }

  public boolean hasLocation(String locationName) {
    return location(locationName).isPresent();
  }

  public boolean owns(int eventId) {
    return events.containsValue(eventId);
  }

  public List<Edge> edgesFrom(String locationName) {
    return edges.stream().filter(e -> e.source().equals(locationName)).toList();
  }
}
