package cifflat;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

/**
 * Expands requirement statements into one clause per disabled event, validating every guard atom
 * and target against the resolved instances.
 */
public class RequirementExpander {
  private static final Logger logger = Logger.getLogger(RequirementExpander.class);
  private static final String KIND = "requirement";

  public List<RequirementClause> expand(List<ModelSource.Requirement> requirements, SymbolTable table) {
    List<RequirementClause> clauses = new ArrayList<>();
    for (int i = 0; i < requirements.size(); i++) {
      ModelSource.Requirement req = requirements.get(i);
      if (req == null || req.guard == null) {
        throw new ElaborationException("Requirement without a guard", KIND, i);
      }
      if (req.targets.isEmpty()) {
        throw new ElaborationException("Requirement disables no event", KIND, i);
      }
      validateGuard(req.guard, table, i);
      for (EventRef target : req.targets) {
        int id = resolveTarget(target, table, i);
        clauses.add(new RequirementClause(req.guard, id, i));
        if (logger.isDebugEnabled()) {
          logger.debug("requirement invariant " + GuardExpr.render(req.guard) + " disables " + table.event(id).qualifiedName());
        }
      }
    }
    return clauses;
  }

  /**
   * Returns the location an atom denotes: the location itself, or for an event atom the single
   * location all of that event's edges lead to.
   */
  public static String denotedLocation(GuardExpr.Atom atom, SymbolTable table) {
    AutomatonInstance instance = table.instance(atom.instance());
    if (instance == null) {
      return null;
    }
    if (instance.hasLocation(atom.name())) {
      return atom.name();
    }
    Integer id = instance.events().get(atom.name());
    if (id == null) {
      return null;
    }
    Set<String> targets = new LinkedHashSet<>();
    for (AutomatonInstance.Edge edge : instance.edges()) {
      if (edge.event() == id && edge.target() != null) {
        targets.add(edge.target());
      }
    }
    return targets.size() == 1 ? targets.iterator().next() : null;
  }

  private void validateGuard(GuardExpr guard, SymbolTable table, int index) {
    for (GuardExpr.Atom atom : GuardExpr.atoms(guard)) {
      AutomatonInstance instance = table.instance(atom.instance());
      if (instance == null) {
        throw new UnknownReferenceException(
            "Guard refers to unknown instance '" + atom.instance() + "'", KIND, index);
      }
      if (denotedLocation(atom, table) != null) {
        continue;
      }
      if (instance.events().containsKey(atom.name())) {
        throw new UnknownReferenceException(
            "Guard atom '" + atom.instance() + "." + atom.name()
                + "' does not denote a single location of instance '" + atom.instance() + "'",
            KIND, index);
      }
      throw new UnknownReferenceException(
          "Instance '" + atom.instance() + "' has no location or event '" + atom.name() + "'", KIND, index);
    }
  }

  private int resolveTarget(EventRef target, SymbolTable table, int index) {
    if (!target.isQualified()) {
      throw new UnknownReferenceException("Disabled event '" + target + "' is not instance-qualified", KIND, index);
    }
    AutomatonInstance instance = table.instance(target.instance());
    if (instance == null) {
      throw new UnknownReferenceException(
          "Disabled event '" + target + "' refers to unknown instance '" + target.instance() + "'", KIND, index);
    }
    Integer id = instance.events().get(target.event());
    if (id == null) {
      throw new UnknownReferenceException(
          "Instance '" + target.instance() + "' declares no event '" + target.event() + "'", KIND, index);
    }
    Event event = table.event(id);
    if (!event.isControllable()) {
      throw new SemanticsViolationException(
          "Cannot disable uncontrollable event '" + event.qualifiedName() + "'", KIND, index);
    }
    return id;
  }
}
