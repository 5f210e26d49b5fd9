package cifflat;

/** Two templates, instances, locations, events or groups share a name. */
public class DuplicateNameException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public DuplicateNameException(String reason) {
    super(reason);
  }

  public DuplicateNameException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
