package cifflat;

import java.util.*;

import org.apache.log4j.Logger;

import cifflat.ModelLexer.Kind;
import cifflat.ModelLexer.Token;

/**
 * Reads flattened model text back into a {@link FlatNetwork}. Accepts everything
 * {@link NetworkSerializer} writes, plus {@code requirement <guard> disables {a.b, c.d};} set
 * literals and {@code //} comments.
 *
 * <pre>
 * model       := item*
 * item        := requirement | plant | group
 * requirement := 'requirement' 'invariant'? guard 'disables' targets ';'
 * plant       := 'plant' 'automaton'? IDENT ':' (events | location)* 'end'
 * group       := 'group' IDENT ':' plant* 'end'
 * events      := ('controllable' | 'uncontrollable') IDENT (',' IDENT)* ';'
 * location    := 'location' IDENT (';' | ':' ('initial' ';' | 'marked' ';' | edge)*)
 * edge        := 'edge' IDENT ('.' IDENT)? ('goto' IDENT)? ';'
 * </pre>
 */
public class FlatModelReader {
  private static final Logger logger = Logger.getLogger(FlatModelReader.class);
  private static final String PLANT = "plant";

  private final RequirementExpander expander;

  public FlatModelReader() {
    this(new RequirementExpander());
  }

  public FlatModelReader(RequirementExpander expander) {
    this.expander = expander;
  }

  private static final class PlantDecl {
    String name;
    String group;
    final List<ModelSource.EventDecl> events = new ArrayList<>();
    final List<ModelSource.Location> locations = new ArrayList<>();
    final List<EdgeDecl> edges = new ArrayList<>();
  }

  private record EdgeDecl(String source, EventRef event, String target, Token at) {}

  public FlatNetwork read(String text) {
    TokenCursor c = TokenCursor.of(text);
    List<PlantDecl> plants = new ArrayList<>();
    List<ModelSource.Requirement> requirements = new ArrayList<>();

    while (!c.atEnd()) {
      if (c.acceptKeyword("requirement")) {
        requirements.add(parseRequirement(c));
      } else if (c.peek().isKeyword(PLANT)) {
        plants.add(parsePlant(c, null));
      } else if (c.acceptKeyword("group")) {
        String group = name(c, "group name");
        c.expect(Kind.COLON, "':'");
        while (c.peek().isKeyword(PLANT)) {
          plants.add(parsePlant(c, group));
        }
        c.expectKeyword("end");
      } else {
        throw c.error("Expected 'requirement', 'plant' or 'group' but found " + c.peek());
      }
    }

    SymbolTable table = new SymbolTable(new TemplateRegistry());
    Map<String, Map<String, Integer>> owned = declareEvents(plants, table.events());
    Map<String, String> groups = new LinkedHashMap<>();
    for (int i = 0; i < plants.size(); i++) {
      PlantDecl plant = plants.get(i);
      table.add(buildInstance(plant, owned, i));
      if (plant.group != null) groups.put(plant.name, plant.group);
    }
    table.freeze();

    Set<String> groupNames = new HashSet<>(groups.values());
    for (String group : groupNames) {
      if (table.instance(group) != null) {
        throw new DuplicateNameException("Group '" + group + "' has the same name as a plant", "group", -1);
      }
    }

    List<RequirementClause> clauses = expander.expand(requirements, table);
    logger.debug("Read " + plants.size() + " plant(s) and " + clauses.size() + " requirement clause(s)");
    return new FlatNetwork(table, clauses, groups);
  }

  private ModelSource.Requirement parseRequirement(TokenCursor c) {
    c.acceptKeyword("invariant");
    ModelSource.Requirement req = new ModelSource.Requirement();
    req.guard = GuardParser.parseGuard(c);
    c.expectKeyword("disables");
    GuardParser.Targets targets = GuardParser.parseTargets(c);
    req.targets.addAll(targets.refs());
    req.setLiteral = targets.setLiteral();
    c.expect(Kind.SEMI, "';'");
    return req;
  }

  private PlantDecl parsePlant(TokenCursor c, String group) {
    c.expectKeyword(PLANT);
    c.acceptKeyword("automaton");
    PlantDecl plant = new PlantDecl();
    plant.name = name(c, "plant name");
    plant.group = group;
    c.expect(Kind.COLON, "':'");

    while (!c.acceptKeyword("end")) {
      Token t = c.peek();
      if (t.isKeyword("controllable") || t.isKeyword("uncontrollable")) {
        Controllability kind = Controllability.fromKeyword(c.next().text());
        do {
          plant.events.add(new ModelSource.EventDecl(name(c, "event name"), kind));
        } while (c.accept(Kind.COMMA));
        c.expect(Kind.SEMI, "';'");
      } else if (c.acceptKeyword("location")) {
        parseLocation(c, plant);
      } else {
        throw c.error("Expected event declaration, 'location' or 'end' but found " + t);
      }
    }
    return plant;
  }

  private void parseLocation(TokenCursor c, PlantDecl plant) {
    ModelSource.Location loc = new ModelSource.Location();
    loc.name = name(c, "location name");
    plant.locations.add(loc);
    if (c.accept(Kind.SEMI)) {
      return;
    }
    c.expect(Kind.COLON, "':' or ';'");
    while (true) {
      if (c.acceptKeyword("initial")) {
        loc.initial = true;
        c.expect(Kind.SEMI, "';'");
      } else if (c.acceptKeyword("marked")) {
        loc.marked = true;
        c.expect(Kind.SEMI, "';'");
      } else if (c.peek().isKeyword("edge")) {
        Token at = c.next();
        String first = name(c, "event name");
        EventRef ref = c.accept(Kind.DOT)
            ? EventRef.qualified(first, name(c, "event name"))
            : EventRef.local(first);
        String target = c.acceptKeyword("goto") ? name(c, "target location") : null;
        c.expect(Kind.SEMI, "';'");
        plant.edges.add(new EdgeDecl(loc.name, ref, target, at));
      } else {
        return;
      }
    }
  }

  private Map<String, Map<String, Integer>> declareEvents(List<PlantDecl> plants, EventArena arena) {
    Map<String, Map<String, Integer>> owned = new LinkedHashMap<>();
    for (int i = 0; i < plants.size(); i++) {
      PlantDecl plant = plants.get(i);
      if (owned.containsKey(plant.name)) {
        throw new DuplicateNameException("Plant '" + plant.name + "' is declared twice", PLANT, i);
      }
      Map<String, Integer> events = new LinkedHashMap<>();
      for (ModelSource.EventDecl decl : plant.events) {
        if (events.containsKey(decl.name)) {
          throw new DuplicateNameException(
              "Plant '" + plant.name + "' declares event '" + decl.name + "' twice", PLANT, i);
        }
        events.put(decl.name, arena.declare(plant.name, decl.name, decl.controllability));
      }
      owned.put(plant.name, events);
    }
    return owned;
  }

  private AutomatonInstance buildInstance(PlantDecl plant, Map<String, Map<String, Integer>> owned, int index) {
    Set<String> locationNames = new HashSet<>();
    List<AutomatonInstance.Location> locations = new ArrayList<>();
    int initials = 0;
    for (ModelSource.Location loc : plant.locations) {
      if (!locationNames.add(loc.name)) {
        throw new DuplicateNameException(
            "Location '" + loc.name + "' is declared twice in plant '" + plant.name + "'", PLANT, index);
      }
      if (loc.initial) initials++;
      locations.add(new AutomatonInstance.Location(loc.name, loc.initial, loc.marked));
    }
    if (initials != 1) {
      throw new ElaborationException(
          "Plant '" + plant.name + "' must have exactly one initial location, found " + initials, PLANT, index);
    }

    List<AutomatonInstance.Edge> edges = new ArrayList<>();
    for (EdgeDecl edge : plant.edges) {
      String ownerName = edge.event().isQualified() ? edge.event().instance() : plant.name;
      Map<String, Integer> ownerEvents = owned.get(ownerName);
      Integer id = ownerEvents == null ? null : ownerEvents.get(edge.event().event());
      if (id == null) {
        throw new UnresolvedEventException(
            "Edge at line " + edge.at().line() + " of plant '" + plant.name + "' uses unknown event '" + edge.event() + "'",
            PLANT, index);
      }
      if (edge.target() != null && !locationNames.contains(edge.target())) {
        throw new UnknownReferenceException(
            "Edge at line " + edge.at().line() + " of plant '" + plant.name + "' enters unknown location '"
                + edge.target() + "'",
            PLANT, index);
      }
      edges.add(new AutomatonInstance.Edge(edge.source(), id, edge.target()));
    }

    Map<String, Integer> events = owned.get(plant.name);
    return new AutomatonInstance(plant.name, plant.name, events, events, locations, edges);
  }

  private static String name(TokenCursor c, String what) {
    Token t = c.peek();
    if (!t.is(Kind.IDENT) || Identifiers.RESERVED.contains(t.text())) {
      throw c.error("Expected " + what + " but found " + t);
    }
    return c.next().text();
  }
}
