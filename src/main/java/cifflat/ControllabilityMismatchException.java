package cifflat;

/** An actual event does not have the controllability its formal parameter requires. */
public class ControllabilityMismatchException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public ControllabilityMismatchException(String reason) {
    super(reason);
  }

  public ControllabilityMismatchException(String reason, String statementKind, int statementIndex) {
    super(reason, statementKind, statementIndex);
  }
}
