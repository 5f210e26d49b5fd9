package cifflat;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import au.com.bytecode.opencsv.CSVReader;

/**
 * Reads node CSV files: a header row with at least a {@code name} column, one node per row.
 * A {@code group} column, when present, assigns nodes to groups of the flattened output.
 */
public class NodeCsvReader {
  public static final String DEFAULT_DELIMITER = ";";

  private static final String NAME_COLUMN = "name";
  private static final String GROUP_COLUMN = "group";

  private final char separator;

  public NodeCsvReader() {
    this(DEFAULT_DELIMITER);
  }

  public NodeCsvReader(String delimiter) {
    this.separator = separator(delimiter);
  }

  /** Checks for a non-empty, duplicate-free {@code name} column. */
  public void validate(Path csvPath) throws IOException {
    readNames(csvPath);
  }

  public List<String> readNames(Path csvPath) throws IOException {
    List<String> names = new ArrayList<>();
    for (Map<String, String> row : readRows(csvPath, NAME_COLUMN)) {
      names.add(row.get(NAME_COLUMN));
    }
    return names;
  }

  /** Node name to group name; rows with an empty group cell are left out. */
  public Map<String, String> readGroups(Path csvPath) throws IOException {
    Map<String, String> groups = new LinkedHashMap<>();
    for (Map<String, String> row : readRows(csvPath, GROUP_COLUMN)) {
      String group = row.getOrDefault(GROUP_COLUMN, "");
      if (!group.isEmpty()) {
        groups.put(row.get(NAME_COLUMN), group);
      }
    }
    return groups;
  }

  private List<Map<String, String>> readRows(Path csvPath, String requiredColumn) throws IOException {
    List<String[]> records = readRecords(csvPath, separator);
    if (records.isEmpty()) {
      throw new CsvStructureException("'" + csvPath + "' should have a header with a 'name' column.");
    }
    List<String> header = Arrays.asList(records.get(0));
    if (!header.contains(NAME_COLUMN)) {
      throw new CsvStructureException("'" + csvPath + "' should have a header with a 'name' column.");
    }
    if (!header.contains(requiredColumn)) {
      throw new CsvStructureException("'" + csvPath + "' should have a header with a '" + requiredColumn + "' column.");
    }

    Set<String> seen = new HashSet<>();
    List<Map<String, String>> rows = new ArrayList<>();
    for (String[] cells : records.subList(1, records.size())) {
      Map<String, String> row = new LinkedHashMap<>();
      for (int c = 0; c < header.size(); c++) {
        row.put(header.get(c), c < cells.length ? cells[c] : "");
      }
      String name = row.get(NAME_COLUMN);
      if (name.isEmpty()) {
        throw new CsvStructureException("'" + csvPath + "' contains an empty value in the 'name' column.");
      }
      if (!seen.add(name)) {
        throw new CsvStructureException("'" + csvPath + "' contains duplicate names in the 'name' column.");
      }
      rows.add(row);
    }
    return rows;
  }

  /** All non-blank records of a CSV file, cells trimmed, byte order mark removed. */
  static List<String[]> readRecords(Path csvPath, char separator) throws IOException {
    String content = stripBom(Files.readString(csvPath, StandardCharsets.UTF_8));
    List<String[]> records = new ArrayList<>();
    try (CSVReader reader = new CSVReader(new StringReader(content), separator)) {
      String[] next;
      while ((next = reader.readNext()) != null) {
        boolean blank = true;
        for (int i = 0; i < next.length; i++) {
          next[i] = next[i].trim();
          if (!next[i].isEmpty()) blank = false;
        }
        if (!blank) records.add(next);
      }
    }
    return records;
  }

  /** Names are written unquoted, so the separator must not be able to occur in one. */
  static char separator(String delimiter) {
    if (delimiter == null || delimiter.length() != 1) {
      throw new IllegalArgumentException("CSV delimiter must be a single character, not '" + delimiter + "'");
    }
    char c = delimiter.charAt(0);
    if (Character.isLetterOrDigit(c) || c == '_' || c == '"' || (Character.isWhitespace(c) && c != '\t')) {
      throw new IllegalArgumentException("'" + delimiter + "' cannot be used as CSV delimiter");
    }
    return c;
  }

  static String stripBom(String text) {
    return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
  }
}
