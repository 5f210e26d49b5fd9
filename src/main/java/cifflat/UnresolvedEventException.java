package cifflat;

/** A dotted event reference names an instance or event that is not available. */
public class UnresolvedEventException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public UnresolvedEventException(String reason) {
    super(reason);
  }

  public UnresolvedEventException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
