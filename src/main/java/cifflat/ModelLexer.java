package cifflat;

import java.util.ArrayList;
import java.util.List;

/** Splits flattened-model text (or a single guard/disables attribute) into tokens. */
public final class ModelLexer {

  public enum Kind { IDENT, COLON, SEMI, COMMA, DOT, LBRACE, RBRACE, LPAREN, RPAREN, EOF }

  public record Token(Kind kind, String text, int line, int column) {
    public boolean is(Kind k) {
      return kind == k;
    }

    public boolean isKeyword(String keyword) {
      return kind == Kind.IDENT && text.equals(keyword);
    }

    @Override
    public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private ModelLexer() {}

  public static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    int line = 1;
    int col = 1;
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == '\n') {
        line++;
        col = 1;
        i++;
        continue;
      }
      if (Character.isWhitespace(c)) {
        col++;
        i++;
        continue;
      }
      if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
        while (i < n && text.charAt(i) != '\n') i++;
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
        tokens.add(new Token(Kind.IDENT, text.substring(start, i), line, col));
        col += i - start;
        continue;
      }
      Kind kind = switch (c) {
        case ':' -> Kind.COLON;
        case ';' -> Kind.SEMI;
        case ',' -> Kind.COMMA;
        case '.' -> Kind.DOT;
        case '{' -> Kind.LBRACE;
        case '}' -> Kind.RBRACE;
        case '(' -> Kind.LPAREN;
        case ')' -> Kind.RPAREN;
        default -> throw new ModelSyntaxException("Unexpected character '" + c + "'", line, col);
      };
      tokens.add(new Token(kind, String.valueOf(c), line, col));
      col++;
      i++;
    }
    tokens.add(new Token(Kind.EOF, "", line, col));
    return tokens;
  }
}
