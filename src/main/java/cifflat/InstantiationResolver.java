package cifflat;

import java.util.*;

import org.apache.log4j.Logger;

/**
 * Binds actual events to template parameters and materializes one automaton per instantiation
 * statement. Statements are processed in order; a dotted argument may only refer to an instance
 * declared by an earlier statement.
 */
public class InstantiationResolver {
  private static final Logger logger = Logger.getLogger(InstantiationResolver.class);
  private static final String KIND = "instantiation";

  public SymbolTable resolve(TemplateRegistry registry, List<ModelSource.Instantiation> statements) {
    SymbolTable table = new SymbolTable(registry);

    Map<String, Integer> declaredAt = new HashMap<>();
    for (int i = 0; i < statements.size(); i++) {
      ModelSource.Instantiation stmt = statements.get(i);
      if (stmt == null || stmt.instanceName == null || stmt.instanceName.isBlank()) {
        throw new ElaborationException("Instantiation without an instance name", KIND, i);
      }
      if (!Identifiers.isIdentifier(stmt.instanceName)) {
        throw new ElaborationException(
            "Instance name '" + stmt.instanceName + "' is not an identifier or is reserved", KIND, i);
      }
      Integer previous = declaredAt.putIfAbsent(stmt.instanceName, i);
      if (previous != null) {
        throw new DuplicateNameException(
            "Instance '" + stmt.instanceName + "' is already declared by instantiation #" + (previous + 1), KIND, i);
      }
    }

    for (int i = 0; i < statements.size(); i++) {
      AutomatonInstance instance = instantiate(table, statements.get(i), i, declaredAt);
      table.add(instance);
      logger.debug("Resolved " + statements.get(i) + " with " + instance.events().size()
          + " owned event(s) and " + instance.edges().size() + " edge(s)");
    }

    table.freeze();
    return table;
  }

  private AutomatonInstance instantiate(
      SymbolTable table, ModelSource.Instantiation stmt, int index, Map<String, Integer> declaredAt) {
    ModelSource.Template template = table.templates().template(stmt.templateName);
    if (template == null) {
      throw new UnknownReferenceException(
          "Instance '" + stmt.instanceName + "' uses unknown template '" + stmt.templateName + "'", KIND, index);
    }
    if (stmt.arguments.size() != template.parameters.size()) {
      throw new ArityException(
          "Template '" + template.name + "' expects " + template.parameters.size()
              + " event argument(s) but instance '" + stmt.instanceName + "' passes " + stmt.arguments.size(),
          KIND, index);
    }

    EventArena arena = table.events();
    Map<String, Integer> owned = new LinkedHashMap<>();
    Map<String, Integer> bindings = new LinkedHashMap<>();

    for (int k = 0; k < template.parameters.size(); k++) {
      ModelSource.EventDecl param = template.parameters.get(k);
      EventRef arg = stmt.arguments.get(k);
      int id;
      if (arg.isQualified()) {
        id = borrow(table, stmt, param, arg, index, declaredAt);
      } else {
        if (!Identifiers.isIdentifier(arg.event())) {
          throw new ElaborationException(
              "Event argument '" + arg.event() + "' of instance '" + stmt.instanceName
                  + "' is not an identifier or is reserved",
              KIND, index);
        }
        id = declareOwned(arena, owned, stmt.instanceName, arg.event(), param.controllability, index);
      }
      bindings.put(param.name, id);
    }

    for (ModelSource.EventDecl decl : template.events) {
      int id = declareOwned(arena, owned, stmt.instanceName, decl.name, decl.controllability, index);
      bindings.put(decl.name, id);
    }

    List<AutomatonInstance.Location> locations = new ArrayList<>();
    for (ModelSource.Location loc : template.locations) {
      locations.add(new AutomatonInstance.Location(loc.name, loc.initial, loc.marked));
    }
    List<AutomatonInstance.Edge> edges = new ArrayList<>();
    for (ModelSource.Edge edge : template.edges) {
      edges.add(new AutomatonInstance.Edge(edge.source, bindings.get(edge.event), edge.target));
    }

    return new AutomatonInstance(stmt.instanceName, template.name, owned, bindings, locations, edges);
  }

  private int borrow(
      SymbolTable table,
      ModelSource.Instantiation stmt,
      ModelSource.EventDecl param,
      EventRef arg,
      int index,
      Map<String, Integer> declaredAt) {
    if (param.controllability == Controllability.CONTROLLABLE) {
      throw new ControllabilityMismatchException(
          "Controllable parameter '" + param.name + "' of template '" + stmt.templateName
              + "' must be bound to a fresh local event, not to '" + arg + "'",
          KIND, index);
    }
    AutomatonInstance source = table.instance(arg.instance());
    if (source == null) {
      Integer at = declaredAt.get(arg.instance());
      if (at != null) {
        throw new DependencyOrderException(
            "Event '" + arg + "' refers to instance '" + arg.instance() + "' which is only declared by instantiation #"
                + (at + 1) + "; declare it first",
            KIND, index);
      }
      throw new UnresolvedEventException("Event '" + arg + "' refers to unknown instance '" + arg.instance() + "'", KIND, index);
    }
    Integer id = source.events().get(arg.event());
    if (id == null) {
      throw new UnresolvedEventException(
          "Instance '" + arg.instance() + "' declares no event '" + arg.event() + "'", KIND, index);
    }
    Event event = table.event(id);
    if (event.controllability() != param.controllability) {
      throw new ControllabilityMismatchException(
          "Parameter '" + param.name + "' of template '" + stmt.templateName + "' is " + param.controllability.keyword()
              + " but '" + event.qualifiedName() + "' is " + event.controllability().keyword(),
          KIND, index);
    }
    return id;
  }

  private int declareOwned(
      EventArena arena, Map<String, Integer> owned, String instanceName, String eventName,
      Controllability controllability, int index) {
    if (owned.containsKey(eventName)) {
      throw new DuplicateNameException(
          "Instance '" + instanceName + "' declares event '" + eventName + "' twice", KIND, index);
    }
    int id = arena.declare(instanceName, eventName, controllability);
    owned.put(eventName, id);
    return id;
  }
}
