package cifflat;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import au.com.bytecode.opencsv.CSVWriter;

/**
 * Dependency structure matrix over the instances of a flattened network. Cell {@code (i, j)} is
 * set when instance {@code i} depends on instance {@code j}: it synchronizes on an event owned by
 * {@code j}, or a requirement restricting one of its events reads the state of {@code j}.
 */
public final class DependencyMatrix {
  private final List<String> nodes;
  private final boolean[][] cells;

  public DependencyMatrix(List<String> nodes, boolean[][] cells) {
    if (cells.length != nodes.size()) {
      throw new IllegalArgumentException("Matrix has " + cells.length + " rows for " + nodes.size() + " nodes");
    }
    for (boolean[] row : cells) {
      if (row.length != nodes.size()) {
        throw new IllegalArgumentException("Matrix is not square");
      }
    }
    this.nodes = List.copyOf(nodes);
    this.cells = new boolean[cells.length][];
    for (int i = 0; i < cells.length; i++) {
      this.cells[i] = cells[i].clone();
    }
  }

  public static DependencyMatrix of(FlatNetwork network) {
    List<String> nodes = new ArrayList<>(network.instances().keySet());
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      index.put(nodes.get(i), i);
    }
    boolean[][] cells = new boolean[nodes.size()][nodes.size()];

    for (AutomatonInstance instance : network.instances().values()) {
      int row = index.get(instance.name());
      for (AutomatonInstance.Edge edge : instance.edges()) {
        int col = index.get(network.event(edge.event()).owner());
        if (col != row) cells[row][col] = true;
      }
    }
    for (RequirementClause clause : network.requirements()) {
      int row = index.get(network.event(clause.disabledEvent()).owner());
      for (GuardExpr.Atom atom : GuardExpr.atoms(clause.guard())) {
        int col = index.get(atom.instance());
        if (col != row) cells[row][col] = true;
      }
    }
    return new DependencyMatrix(nodes, cells);
  }

  public List<String> nodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  public boolean dependsOn(String node, String other) {
    int i = nodes.indexOf(node);
    int j = nodes.indexOf(other);
    if (i < 0 || j < 0) {
      throw new IllegalArgumentException("Unknown node '" + (i < 0 ? node : other) + "'");
    }
    return cells[i][j];
  }

  /** Set cells as (source, target) pairs, row by row. */
  public List<Map.Entry<String, String>> edges() {
    List<Map.Entry<String, String>> out = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      for (int j = 0; j < nodes.size(); j++) {
        if (cells[i][j]) out.add(Map.entry(nodes.get(i), nodes.get(j)));
      }
    }
    return out;
  }

  /** Writes {@code <stem>.nodes.csv}, {@code <stem>.matrix.csv} and {@code <stem>.edges.csv}. */
  public List<Path> write(Path directory, String stem, String delimiter) throws IOException {
    char separator = NodeCsvReader.separator(delimiter);
    Files.createDirectories(directory);

    List<String[]> nodeRows = new ArrayList<>();
    nodeRows.add(new String[] {"name"});
    for (String node : nodes) {
      nodeRows.add(new String[] {node});
    }

    List<String[]> matrixRows = new ArrayList<>();
    for (boolean[] row : cells) {
      String[] cellsOut = new String[row.length];
      for (int j = 0; j < row.length; j++) {
        cellsOut[j] = row[j] ? "1" : "0";
      }
      matrixRows.add(cellsOut);
    }

    List<String[]> edgeRows = new ArrayList<>();
    edgeRows.add(new String[] {"source", "target"});
    for (Map.Entry<String, String> edge : edges()) {
      edgeRows.add(new String[] {edge.getKey(), edge.getValue()});
    }

    Path nodesPath = directory.resolve(stem + ".nodes.csv");
    Path matrixPath = directory.resolve(stem + ".matrix.csv");
    Path edgesPath = directory.resolve(stem + ".edges.csv");
    writeCsv(nodesPath, nodeRows, separator);
    writeCsv(matrixPath, matrixRows, separator);
    writeCsv(edgesPath, edgeRows, separator);
    return List.of(nodesPath, matrixPath, edgesPath);
  }

  /** Reads a matrix CSV and its node CSV, checking that the matrix is square and binary. */
  public static DependencyMatrix read(Path matrixPath, Path nodesPath, String delimiter) throws IOException {
    List<String> nodes = new NodeCsvReader(delimiter).readNames(nodesPath);

    List<String[]> rows = NodeCsvReader.readRecords(matrixPath, NodeCsvReader.separator(delimiter));
    int rowCount = rows.size();
    boolean[][] cells = new boolean[rowCount][rowCount];
    for (int i = 0; i < rowCount; i++) {
      String[] row = rows.get(i);
      if (row.length != rowCount) {
        throw new CsvStructureException("The matrix in '" + matrixPath + "' is not square. Each row should have "
            + "the same number of elements as the number of rows.");
      }
      for (int j = 0; j < row.length; j++) {
        String element = row[j];
        if (!"0".equals(element) && !"1".equals(element)) {
          throw new CsvStructureException("The matrix in '" + matrixPath + "' is not binary. Found '" + element
              + "' at row " + (i + 1) + ", column " + (j + 1) + ".");
        }
        cells[i][j] = "1".equals(element);
      }
    }
    if (rowCount != nodes.size()) {
      throw new CsvStructureException("The matrix in '" + matrixPath + "' has " + rowCount + " rows but '"
          + nodesPath + "' lists " + nodes.size() + " nodes.");
    }
    return new DependencyMatrix(nodes, cells);
  }

  private static void writeCsv(Path path, List<String[]> rows, char separator) throws IOException {
    StringWriter out = new StringWriter();
    try (CSVWriter writer = new CSVWriter(out, separator, CSVWriter.NO_QUOTE_CHARACTER, "\n")) {
      writer.writeAll(rows);
    }
    Files.writeString(path, out.toString(), StandardCharsets.UTF_8);
  }
}
