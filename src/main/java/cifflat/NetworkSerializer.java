package cifflat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link FlatNetwork} in canonical text: requirement invariants, then ungrouped plants,
 * then groups. The output is accepted by {@link FlatModelReader} and renders back unchanged.
 */
public class NetworkSerializer {
  private static final String INDENT = "  ";

  public String render(FlatNetwork network) {
    List<String> sections = new ArrayList<>();

    if (!network.requirements().isEmpty()) {
      StringBuilder sb = new StringBuilder();
      for (RequirementClause clause : network.requirements()) {
        sb.append("requirement invariant ")
          .append(GuardExpr.render(clause.guard()))
          .append(" disables ")
          .append(network.event(clause.disabledEvent()).qualifiedName())
          .append(";\n");
      }
      sections.add(sb.toString());
    }

    for (AutomatonInstance instance : network.ungrouped()) {
      StringBuilder sb = new StringBuilder();
      renderPlant(network, instance, "", sb);
      sections.add(sb.toString());
    }

    for (Map.Entry<String, List<AutomatonInstance>> group : network.grouped().entrySet()) {
      StringBuilder sb = new StringBuilder();
      sb.append("group ").append(group.getKey()).append(":\n");
      for (AutomatonInstance instance : group.getValue()) {
        renderPlant(network, instance, INDENT, sb);
      }
      sb.append("end\n");
      sections.add(sb.toString());
    }

    return String.join("\n", sections);
  }

  private void renderPlant(FlatNetwork network, AutomatonInstance instance, String indent, StringBuilder sb) {
    sb.append(indent).append("plant automaton ").append(instance.name()).append(":\n");

    renderEventDecls(network, instance, Controllability.UNCONTROLLABLE, indent + INDENT, sb);
    renderEventDecls(network, instance, Controllability.CONTROLLABLE, indent + INDENT, sb);

    for (AutomatonInstance.Location loc : instance.locations()) {
      List<AutomatonInstance.Edge> edges = instance.edgesFrom(loc.name());
      String locIndent = indent + INDENT;
      if (!loc.initial() && !loc.marked() && edges.isEmpty()) {
        sb.append(locIndent).append("location ").append(loc.name()).append(";\n");
        continue;
      }
      sb.append(locIndent).append("location ").append(loc.name()).append(":\n");
      String bodyIndent = locIndent + INDENT;
      if (loc.initial()) sb.append(bodyIndent).append("initial;\n");
      if (loc.marked()) sb.append(bodyIndent).append("marked;\n");
      for (AutomatonInstance.Edge edge : edges) {
        sb.append(bodyIndent).append("edge ").append(eventName(network, instance, edge.event()));
        if (edge.target() != null) {
          sb.append(" goto ").append(edge.target());
        }
        sb.append(";\n");
      }
    }

    sb.append(indent).append("end\n");
  }

  private void renderEventDecls(
      FlatNetwork network, AutomatonInstance instance, Controllability kind, String indent, StringBuilder sb) {
    List<String> names = new ArrayList<>();
    for (Map.Entry<String, Integer> owned : instance.events().entrySet()) {
      if (network.event(owned.getValue()).controllability() == kind) {
        names.add(owned.getKey());
      }
    }
    if (names.isEmpty()) return;
    sb.append(indent).append(kind.keyword()).append(' ').append(String.join(", ", names)).append(";\n");
  }

  private static String eventName(FlatNetwork network, AutomatonInstance instance, int eventId) {
    Event event = network.event(eventId);
    return instance.name().equals(event.owner()) ? event.name() : event.qualifiedName();
  }
}
