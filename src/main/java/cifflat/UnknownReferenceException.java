package cifflat;

/** A template, guard, disables target or group table names something that does not exist. */
public class UnknownReferenceException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public UnknownReferenceException(String reason) {
    super(reason);
  }

  public UnknownReferenceException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
