package cifflat;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import cifflat.ModelLexer.Kind;
import cifflat.ModelLexer.Token;

/**
 * Recursive-descent parser for requirement guards and disables targets.
 *
 * <pre>
 * guard   := and ('or' and)*
 * and     := unary ('and' unary)*
 * unary   := 'not' unary | '(' guard ')' | IDENT '.' IDENT
 * targets := ref | '{' ref (',' ref)* '}'
 * ref     := IDENT '.' IDENT
 * </pre>
 */
public final class GuardParser {

  static final Set<String> KEYWORDS = Set.of("not", "and", "or", "disables");

  public record Targets(List<EventRef> refs, boolean setLiteral) {}

  private GuardParser() {}

  public static GuardExpr parse(String text) {
    TokenCursor cursor = TokenCursor.of(text);
    GuardExpr expr = parseGuard(cursor);
    cursor.expectEnd();
    return expr;
  }

  public static Targets parseTargets(String text) {
    TokenCursor cursor = TokenCursor.of(text);
    Targets targets = parseTargets(cursor);
    cursor.expectEnd();
    return targets;
  }

  public static GuardExpr parseGuard(TokenCursor c) {
    GuardExpr left = parseAnd(c);
    while (c.acceptKeyword("or")) {
      left = GuardExpr.or(left, parseAnd(c));
    }
    return left;
  }

  public static Targets parseTargets(TokenCursor c) {
    if (!c.accept(Kind.LBRACE)) {
      return new Targets(List.of(parseQualifiedRef(c)), false);
    }
    List<EventRef> refs = new ArrayList<>();
    if (c.peek().is(Kind.RBRACE)) {
      throw c.error("Empty disables set");
    }
    do {
      refs.add(parseQualifiedRef(c));
    } while (c.accept(Kind.COMMA));
    c.expect(Kind.RBRACE, "'}'");
    return new Targets(List.copyOf(refs), true);
  }

  static EventRef parseQualifiedRef(TokenCursor c) {
    String instance = name(c, "instance name");
    c.expect(Kind.DOT, "'.'");
    String event = name(c, "event name");
    return EventRef.qualified(instance, event);
  }

  private static GuardExpr parseAnd(TokenCursor c) {
    GuardExpr left = parseUnary(c);
    while (c.acceptKeyword("and")) {
      left = GuardExpr.and(left, parseUnary(c));
    }
    return left;
  }

  private static GuardExpr parseUnary(TokenCursor c) {
    if (c.acceptKeyword("not")) {
      return GuardExpr.not(parseUnary(c));
    }
    if (c.accept(Kind.LPAREN)) {
      GuardExpr inner = parseGuard(c);
      c.expect(Kind.RPAREN, "')'");
      return inner;
    }
    String instance = name(c, "guard atom");
    c.expect(Kind.DOT, "'.'");
    String name = name(c, "location or event name");
    return GuardExpr.atom(instance, name);
  }

  private static String name(TokenCursor c, String what) {
    Token t = c.peek();
    if (!t.is(Kind.IDENT) || KEYWORDS.contains(t.text())) {
      throw c.error("Expected " + what + " but found " + t);
    }
    return c.next().text();
  }
}
