package cifflat;

/**
 * Base class of all errors that abort an elaboration run. Carries the kind and index of the
 * source statement that triggered it so callers can point at the offending input.
 */
public class ElaborationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String reason;
  private final String statementKind;
  private final int statementIndex;

  public ElaborationException(String reason) {
    this(reason, null, -1);
  }

  public ElaborationException(String reason, String statementKind, int statementIndex) {
    super(locate(reason, statementKind, statementIndex));
    this.reason = reason;
    this.statementKind = statementKind;
    this.statementIndex = statementIndex;
  }

  /** The message without the statement prefix. */
  public String getReason() {
    return reason;
  }

  /** {@code template}, {@code instantiation}, {@code requirement}, ... or {@code null}. */
  public String getStatementKind() {
    return statementKind;
  }

  /** Zero-based statement index, or -1 when not tied to a statement. */
  public int getStatementIndex() {
    return statementIndex;
  }

  private static String locate(String reason, String kind, int index) {
    if (kind == null) return reason;
    if (index < 0) return kind + ": " + reason;
    return kind + " #" + (index + 1) + ": " + reason;
  }
}
