package cifflat;

import java.util.List;

import cifflat.ModelLexer.Kind;
import cifflat.ModelLexer.Token;

/** Forward-only cursor over lexer output with the usual expect/accept helpers. */
public final class TokenCursor {
  private final List<Token> tokens;
  private int pos;

  public TokenCursor(List<Token> tokens) {
    if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(Kind.EOF)) {
      throw new IllegalArgumentException("Token list must end with EOF");
    }
    this.tokens = tokens;
  }

  public static TokenCursor of(String text) {
    return new TokenCursor(ModelLexer.tokenize(text));
  }

  public Token peek() {
    return tokens.get(pos);
  }

  public Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  public Token next() {
    Token t = tokens.get(pos);
    if (!t.is(Kind.EOF)) pos++;
    return t;
  }

  public boolean atEnd() {
    return peek().is(Kind.EOF);
  }

  public boolean accept(Kind kind) {
    if (peek().is(kind)) {
      next();
      return true;
    }
    return false;
  }

  public boolean acceptKeyword(String keyword) {
    if (peek().isKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  public Token expect(Kind kind, String what) {
    Token t = peek();
    if (!t.is(kind)) {
      throw error("Expected " + what + " but found " + t);
    }
    return next();
  }

  public void expectKeyword(String keyword) {
    Token t = peek();
    if (!t.isKeyword(keyword)) {
      throw error("Expected '" + keyword + "' but found " + t);
    }
    next();
  }

  public void expectEnd() {
    if (!atEnd()) {
      throw error("Unexpected " + peek());
    }
  }

  public ModelSyntaxException error(String message) {
    Token t = peek();
    return new ModelSyntaxException(message, t.line(), t.column());
  }
}
