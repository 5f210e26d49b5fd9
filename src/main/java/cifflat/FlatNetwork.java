package cifflat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of an elaboration run: resolved instances in declaration order, expanded requirement
 * clauses and the optional group partition. Immutable.
 */
public final class FlatNetwork {
  private final EventArena events;
  private final Map<String, AutomatonInstance> instances;
  private final List<RequirementClause> requirements;
  private final Map<String, String> groups;

  public FlatNetwork(
      SymbolTable table, List<RequirementClause> requirements, Map<String, String> groups) {
    if (!table.isFrozen()) {
      throw new IllegalStateException("Symbol table must be frozen before building a network");
    }
    this.events = table.events();
    this.instances = table.instances();
    this.requirements = List.copyOf(requirements);
    this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
  }

  public Event event(int id) {
    return events.get(id);
  }

  public List<Event> events() {
    return events.events();
  }

  public Map<String, AutomatonInstance> instances() {
    return instances;
  }

  public AutomatonInstance instance(String name) {
    return instances.get(name);
  }

  public List<RequirementClause> requirements() {
    return requirements;
  }

  /** Instance name to group name; ungrouped instances are absent. */
  public Map<String, String> groups() {
    return groups;
  }

  public Optional<String> groupOf(String instanceName) {
    return Optional.ofNullable(groups.get(instanceName));
  }

  public List<AutomatonInstance> ungrouped() {
    List<AutomatonInstance> out = new ArrayList<>();
    for (AutomatonInstance instance : instances.values()) {
      if (!groups.containsKey(instance.name())) out.add(instance);
    }
    return out;
  }

  /** Group name to members, groups ordered by their first member, members in declaration order. */
  public Map<String, List<AutomatonInstance>> grouped() {
    Map<String, List<AutomatonInstance>> out = new LinkedHashMap<>();
    for (AutomatonInstance instance : instances.values()) {
      String group = groups.get(instance.name());
      if (group != null) {
        out.computeIfAbsent(group, g -> new ArrayList<>()).add(instance);
      }
    }
    return out;
  }
}
