package cifflat;

import java.util.*;

/** Validated, name-indexed template library of one elaboration run. */
public class TemplateRegistry {
  private static final String KIND = "template";

  private final Map<String, ModelSource.Template> templates = new LinkedHashMap<>();

  public static TemplateRegistry of(List<ModelSource.Template> templates) {
    TemplateRegistry registry = new TemplateRegistry();
    for (int i = 0; i < templates.size(); i++) {
      registry.register(templates.get(i), i);
    }
    return registry;
  }

  public void register(ModelSource.Template template, int index) {
    if (template == null || template.name == null || template.name.isBlank()) {
      throw new ElaborationException("Template without a name", KIND, index);
    }
    String name = template.name;
    requireIdentifier(name, "Template name", index);
    if (templates.containsKey(name)) {
      throw new DuplicateNameException("Template '" + name + "' is defined twice", KIND, index);
    }

    Set<String> eventNames = new HashSet<>();
    for (ModelSource.EventDecl decl : template.parameters) {
      checkEventDecl(template, decl, "parameter", eventNames, index);
    }
    for (ModelSource.EventDecl decl : template.events) {
      checkEventDecl(template, decl, "event", eventNames, index);
    }

    Set<String> locationNames = new HashSet<>();
    int initials = 0;
    for (ModelSource.Location loc : template.locations) {
      if (loc.name == null || loc.name.isBlank()) {
        throw new ElaborationException("Template '" + name + "' has a location without a name", KIND, index);
      }
      requireIdentifier(loc.name, "Location name in template '" + name + "'", index);
      if (!locationNames.add(loc.name)) {
        throw new DuplicateNameException(
            "Location '" + loc.name + "' is declared twice in template '" + name + "'", KIND, index);
      }
      if (loc.initial) initials++;
    }
    if (initials != 1) {
      throw new ElaborationException(
          "Template '" + name + "' must have exactly one initial location, found " + initials, KIND, index);
    }

    for (ModelSource.Edge edge : template.edges) {
      if (!locationNames.contains(edge.source)) {
        throw new UnknownReferenceException(
            "Edge in template '" + name + "' leaves unknown location '" + edge.source + "'", KIND, index);
      }
      if (edge.target != null && !locationNames.contains(edge.target)) {
        throw new UnknownReferenceException(
            "Edge in template '" + name + "' enters unknown location '" + edge.target + "'", KIND, index);
      }
      if (!eventNames.contains(edge.event)) {
        throw new UnknownReferenceException(
            "Edge in template '" + name + "' uses undeclared event '" + edge.event + "'", KIND, index);
      }
    }

    templates.put(name, template);
  }

  public ModelSource.Template template(String name) {
    return templates.get(name);
  }

  public boolean contains(String name) {
    return templates.containsKey(name);
  }

  public Collection<ModelSource.Template> templates() {
    return Collections.unmodifiableCollection(templates.values());
  }

  public int size() {
    return templates.size();
  }

  private static void checkEventDecl(
      ModelSource.Template template, ModelSource.EventDecl decl, String what, Set<String> seen, int index) {
    if (decl == null || decl.name == null || decl.name.isBlank()) {
      throw new ElaborationException("Template '" + template.name + "' has a " + what + " without a name", KIND, index);
    }
    requireIdentifier(decl.name, "The " + what + " name in template '" + template.name + "'", index);
    if (decl.controllability == null) {
      throw new ElaborationException(
          "The " + what + " '" + decl.name + "' of template '" + template.name + "' has no controllability", KIND, index);
    }
    if (!seen.add(decl.name)) {
      throw new DuplicateNameException(
          "Event '" + decl.name + "' is declared twice in template '" + template.name + "'", KIND, index);
    }
  }

  /** Rejects names the flattened-model reader could not read back. */
  private static void requireIdentifier(String value, String description, int index) {
    if (!Identifiers.isIdentifier(value)) {
      throw new ElaborationException(description + " '" + value + "' is not an identifier or is reserved", KIND, index);
    }
  }
}
