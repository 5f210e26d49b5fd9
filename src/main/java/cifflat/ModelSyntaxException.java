package cifflat;

/** Malformed model text or document. */
public class ModelSyntaxException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  private final int line;
  private final int column;

  public ModelSyntaxException(String reason) {
    super(reason);
    this.line = -1;
    this.column = -1;
  }

  public ModelSyntaxException(String reason, int line, int column) {
    super(reason + " at line " + line + ", column " + column);
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
