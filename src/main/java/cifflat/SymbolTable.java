package cifflat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run symbol table: templates, the event arena and the resolved instances in declaration
 * order. Append-only while a run resolves, then frozen and shared read-only with later passes.
 */
public final class SymbolTable {
  private final TemplateRegistry templates;
  private final EventArena events = new EventArena();
  private final Map<String, AutomatonInstance> instances = new LinkedHashMap<>();
  private boolean frozen;

  public SymbolTable(TemplateRegistry templates) {
    this.templates = templates;
  }

  public TemplateRegistry templates() {
    return templates;
  }

  public EventArena events() {
    return events;
  }

  public Event event(int id) {
    return events.get(id);
  }

  public void add(AutomatonInstance instance) {
    if (frozen) {
      throw new IllegalStateException("Symbol table is frozen");
    }
    if (instances.putIfAbsent(instance.name(), instance) != null) {
      throw new IllegalStateException("Instance '" + instance.name() + "' is already registered");
    }
  }

  public AutomatonInstance instance(String name) {
    return instances.get(name);
  }

  public Map<String, AutomatonInstance> instances() {
    return Collections.unmodifiableMap(instances);
  }

  public void freeze() {
    frozen = true;
    events.freeze();
  }

  public boolean isFrozen() {
    return frozen;
  }
}
