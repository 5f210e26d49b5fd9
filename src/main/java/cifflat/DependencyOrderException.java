package cifflat;

/** A dotted argument references an instance that is only declared further down the list. */
public class DependencyOrderException extends UnresolvedEventException {
  private static final long serialVersionUID = 1L;

  public DependencyOrderException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
