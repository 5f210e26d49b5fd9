package cifflat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Guard of a requirement invariant: atoms {@code instance.name} combined with {@code not},
 * {@code and} and {@code or}. Trees are kept exactly as written; nothing is simplified.
 */
public interface GuardExpr {

  /** {@code instance.name}, where name is a location or a state-denoting event of the instance. */
  record Atom(String instance, String name) implements GuardExpr {
    public Atom {
      Objects.requireNonNull(instance, "instance");
      Objects.requireNonNull(name, "name");
    }
  }

  record Not(GuardExpr operand) implements GuardExpr {
    public Not {
      Objects.requireNonNull(operand, "operand");
    }
  }

  record And(GuardExpr left, GuardExpr right) implements GuardExpr {
    public And {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }
  }

  record Or(GuardExpr left, GuardExpr right) implements GuardExpr {
    public Or {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }
  }

  static GuardExpr atom(String instance, String name) {
    return new Atom(instance, name);
  }

  static GuardExpr not(GuardExpr operand) {
    return new Not(operand);
  }

  static GuardExpr and(GuardExpr left, GuardExpr right) {
    return new And(left, right);
  }

  static GuardExpr or(GuardExpr left, GuardExpr right) {
    return new Or(left, right);
  }

  /** All atoms, left to right. */
  static List<Atom> atoms(GuardExpr expr) {
    List<Atom> out = new ArrayList<>();
    collectAtoms(expr, out);
    return out;
  }

  /**
   * Canonical text. Binary operators associate to the left; precedence is {@code or} below
   * {@code and} below {@code not}. Parentheses appear only where the tree needs them.
   */
  static String render(GuardExpr expr) {
    StringBuilder sb = new StringBuilder();
    render(expr, sb);
    return sb.toString();
  }

  private static void collectAtoms(GuardExpr expr, List<Atom> out) {
    if (expr instanceof Atom a) {
      out.add(a);
    } else if (expr instanceof Not n) {
      collectAtoms(n.operand(), out);
    } else if (expr instanceof And a) {
      collectAtoms(a.left(), out);
      collectAtoms(a.right(), out);
    } else if (expr instanceof Or o) {
      collectAtoms(o.left(), out);
      collectAtoms(o.right(), out);
    } else {
      throw new IllegalArgumentException("Unsupported guard node " + expr);
    }
  }

  private static void render(GuardExpr expr, StringBuilder sb) {
    if (expr instanceof Atom a) {
      sb.append(a.instance()).append('.').append(a.name());
    } else if (expr instanceof Not n) {
      sb.append("not ");
      operand(n.operand(), 3, sb);
    } else if (expr instanceof And a) {
      operand(a.left(), 2, sb);
      sb.append(" and ");
      operand(a.right(), 3, sb);
    } else if (expr instanceof Or o) {
      operand(o.left(), 1, sb);
      sb.append(" or ");
      operand(o.right(), 2, sb);
    } else {
      throw new IllegalArgumentException("Unsupported guard node " + expr);
    }
  }

  private static void operand(GuardExpr expr, int minPrecedence, StringBuilder sb) {
    if (precedence(expr) < minPrecedence) {
      sb.append('(');
      render(expr, sb);
      sb.append(')');
    } else {
      render(expr, sb);
    }
  }

  private static int precedence(GuardExpr expr) {
    if (expr instanceof Or) return 1;
    if (expr instanceof And) return 2;
    if (expr instanceof Not) return 3;
    return 4;
  }
}
