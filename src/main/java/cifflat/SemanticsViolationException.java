package cifflat;

/** A requirement disables an event the supervisor is not allowed to disable. */
public class SemanticsViolationException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public SemanticsViolationException(String reason) {
    super(reason);
  }

  public SemanticsViolationException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
