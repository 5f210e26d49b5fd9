package cifflat;

/** A node or matrix CSV file does not have the expected layout. */
public class CsvStructureException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public CsvStructureException(String message) {
    super(message);
  }
}
