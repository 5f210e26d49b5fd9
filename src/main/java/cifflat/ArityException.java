package cifflat;

/** Actual and formal event counts differ at an instantiation. */
public class ArityException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public ArityException(String reason) {
    super(reason);
  }

  public ArityException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
