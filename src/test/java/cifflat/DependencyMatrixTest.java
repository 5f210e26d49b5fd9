package cifflat;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DependencyMatrixTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final DependencyMatrix lampMatrix =
      DependencyMatrix.of(new ElaborationService().elaborate(Models.lampSystem()));

  @Test
  public void derivesDependenciesFromEdgesAndRequirements() {
    assertThat(lampMatrix.nodes(), contains("S", "L1", "L2"));
    assertThat(lampMatrix.edges(), contains(
        Map.entry("L1", "S"),
        Map.entry("L1", "L2"),
        Map.entry("L2", "S"),
        Map.entry("L2", "L1")));
    assertThat(lampMatrix.dependsOn("S", "L1"), is(false));
    assertThat(lampMatrix.dependsOn("L1", "L1"), is(false));
  }

  @Test
  public void writesAndReadsBack() throws Exception {
    Path dir = tmp.getRoot().toPath().resolve("dsm");
    List<Path> written = lampMatrix.write(dir, "lamp", ";");

    assertThat(written, hasSize(3));
    assertThat(Files.readString(dir.resolve("lamp.matrix.csv"), StandardCharsets.UTF_8), is("0;0;0\n1;0;1\n1;1;0\n"));
    assertThat(Files.readString(dir.resolve("lamp.nodes.csv"), StandardCharsets.UTF_8), is("name\nS\nL1\nL2\n"));
    assertThat(Files.readString(dir.resolve("lamp.edges.csv"), StandardCharsets.UTF_8),
        is("source;target\nL1;S\nL1;L2\nL2;S\nL2;L1\n"));

    DependencyMatrix read = DependencyMatrix.read(dir.resolve("lamp.matrix.csv"), dir.resolve("lamp.nodes.csv"), ";");
    assertThat(read.edges(), is(lampMatrix.edges()));
  }

  private Path file(String content) throws Exception {
    Path path = tmp.newFile().toPath();
    Files.writeString(path, content, StandardCharsets.UTF_8);
    return path;
  }

  @Test
  public void nonSquareMatrixIsRejected() throws Exception {
    try {
      DependencyMatrix.read(file("0;1\n1;0;0\n"), file("name\nA\nB\n"), ";");
      fail("expected CsvStructureException");
    } catch (CsvStructureException e) {
      assertThat(e.getMessage(), containsString("not square"));
    }
  }

  @Test
  public void nonBinaryMatrixIsRejected() throws Exception {
    try {
      DependencyMatrix.read(file("0;2\n1;0\n"), file("name\nA\nB\n"), ";");
      fail("expected CsvStructureException");
    } catch (CsvStructureException e) {
      assertThat(e.getMessage(), containsString("Found '2' at row 1, column 2"));
    }
  }

  @Test
  public void readsQuotedMatrix() throws Exception {
    DependencyMatrix read = DependencyMatrix.read(
        file("\"0\",\"1\"\n\"0\",\"0\"\n"), file("\"name\"\n\"A\"\n\"B\"\n"), ",");
    assertThat(read.dependsOn("A", "B"), is(true));
    assertThat(read.dependsOn("B", "A"), is(false));
  }

  @Test(expected = CsvStructureException.class)
  public void nodeCountMustMatch() throws Exception {
    DependencyMatrix.read(file("0;1\n1;0\n"), file("name\nA\nB\nC\n"), ";");
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownNodeIsRejected() {
    lampMatrix.dependsOn("S", "L9");
  }
}
