package cifflat;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import cifflat.ModelLexer.Kind;
import cifflat.ModelLexer.Token;

public class ModelLexerTest {

  @Test
  public void tracksLinesAndColumns() {
    List<Token> tokens = ModelLexer.tokenize("plant P: // note\n  edge S.u_on;");
    assertThat(tokens.size(), is(9));
    assertThat(tokens.get(3).text(), is("edge"));
    assertThat(tokens.get(3).line(), is(2));
    assertThat(tokens.get(3).column(), is(3));
    assertThat(tokens.get(5).kind(), is(Kind.DOT));
    assertThat(tokens.get(8).kind(), is(Kind.EOF));
  }

  @Test
  public void rejectsStrayCharacter() {
    try {
      ModelLexer.tokenize("A.x &\nB.y");
      fail("expected ModelSyntaxException");
    } catch (ModelSyntaxException e) {
      assertThat(e.getLine(), is(1));
      assertThat(e.getColumn(), is(5));
    }
  }

  @Test
  public void cursorStopsAtEnd() {
    TokenCursor cursor = TokenCursor.of("a");
    assertThat(cursor.next().text(), is("a"));
    assertThat(cursor.atEnd(), is(true));
    assertThat(cursor.next().is(Kind.EOF), is(true));
    assertThat(cursor.peek(5).is(Kind.EOF), is(true));
  }
}
