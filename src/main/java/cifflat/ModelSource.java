package cifflat;

import java.util.*;

/**
 * Raw input of one elaboration run: template library, instantiation statements and requirement
 * statements, in source order. Built once by a parser (or by hand) and only read afterwards.
 */
public class ModelSource {
  public String name = "Model";
  public final List<Template> templates = new ArrayList<>();
  public final List<Instantiation> instantiations = new ArrayList<>();
  public final List<Requirement> requirements = new ArrayList<>();

  public static class Template {
    public String name;
    public final List<EventDecl> parameters = new ArrayList<>();
    public final List<EventDecl> events = new ArrayList<>();
    public final List<Location> locations = new ArrayList<>();
    public final List<Edge> edges = new ArrayList<>();

    public Template() {}

    public Template(String name) {
      this.name = name;
    }

    public Template parameter(String name, Controllability controllability) {
      parameters.add(new EventDecl(name, controllability));
      return this;
    }

    public Template event(String name, Controllability controllability) {
      events.add(new EventDecl(name, controllability));
      return this;
    }

    public Template location(String name, boolean initial, boolean marked) {
      Location loc = new Location();
      loc.name = name;
      loc.initial = initial;
      loc.marked = marked;
      locations.add(loc);
      return this;
    }

    public Template edge(String source, String event, String target) {
      Edge e = new Edge();
      e.source = source;
      e.event = event;
      e.target = target;
      edges.add(e);
      return this;
    }
  }

  public static class EventDecl {
    public String name;
    public Controllability controllability;

    public EventDecl() {}

    public EventDecl(String name, Controllability controllability) {
      this.name = name;
      this.controllability = controllability;
    }
  }

  public static class Location {
    public String name;
    public boolean initial;
    public boolean marked;
  }

  public static class Edge {
    public String source;
    public String event;
    /** {@code null} for a self-loop. */
    public String target;
  }

  public static class Instantiation {
    public String instanceName;
    public String templateName;
    public final List<EventRef> arguments = new ArrayList<>();

    public Instantiation() {}

    public Instantiation(String instanceName, String templateName, String... arguments) {
      this.instanceName = instanceName;
      this.templateName = templateName;
      for (String arg : arguments) {
        this.arguments.add(EventRef.parse(arg));
      }
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append(instanceName).append(" : ").append(templateName).append("(");
      for (int i = 0; i < arguments.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(arguments.get(i));
      }
      return sb.append(")").toString();
    }
  }

  public static class Requirement {
    public GuardExpr guard;
    public final List<EventRef> targets = new ArrayList<>();
    /** Whether the targets were written as a brace-delimited set. */
    public boolean setLiteral;

    public Requirement() {}

    public Requirement(GuardExpr guard, String... targets) {
      this.guard = guard;
      this.setLiteral = targets.length > 1;
      for (String t : targets) {
        this.targets.add(EventRef.parse(t));
      }
    }
  }

  public ModelSource template(Template template) {
    templates.add(template);
    return this;
  }

  public ModelSource instantiate(String instanceName, String templateName, String... arguments) {
    instantiations.add(new Instantiation(instanceName, templateName, arguments));
    return this;
  }

  public ModelSource require(GuardExpr guard, String... targets) {
    requirements.add(new Requirement(guard, targets));
    return this;
  }
}
