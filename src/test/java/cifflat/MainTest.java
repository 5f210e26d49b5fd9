package cifflat;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;
import org.apache.log4j.SimpleLayout;
import org.apache.log4j.WriterAppender;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private Path copy(String resource) throws Exception {
    Path path = tmp.getRoot().toPath().resolve(Path.of(resource).getFileName());
    Files.writeString(path, Models.resource(resource), StandardCharsets.UTF_8);
    return path;
  }

  @Test
  public void elaboratesToOutputFileWithGroupsAndMatrix() throws Exception {
    Path xml = copy("models/lamp_system.xml");
    Path groups = copy("models/lamp_system.groups.csv");
    Path out = tmp.getRoot().toPath().resolve("out/lamps.cif");
    Path dsm = tmp.getRoot().toPath().resolve("dsm");

    int status = Main.run(new String[] {
        "-i", xml.toString(), "-g", groups.toString(), "-o", out.toString(), "--dsm", dsm.toString()});

    assertThat(status, is(0));
    assertThat(Files.readString(out, StandardCharsets.UTF_8), is(Models.resource("models/lamp_system_grouped.cif")));
    assertThat(Files.exists(dsm.resolve("lamps.matrix.csv")), is(true));
    assertThat(Files.exists(dsm.resolve("lamps.nodes.csv")), is(true));
  }

  @Test
  public void normalizesFlatFile() throws Exception {
    Path cif = copy("models/lamp_system.cif");
    Path out = tmp.getRoot().toPath().resolve("normalized.cif");

    assertThat(Main.run(new String[] {"-f", cif.toString(), "-o", out.toString()}), is(0));
    assertThat(Files.readString(out, StandardCharsets.UTF_8), is(Models.resource("models/lamp_system.cif")));
  }

  @Test
  public void elaborationErrorExitsWithOneAndWritesNothing() throws Exception {
    Path xml = copy("models/bad_arity.xml");
    Path out = tmp.getRoot().toPath().resolve("bad.cif");

    assertThat(Main.run(new String[] {"-i", xml.toString(), "-o", out.toString()}), is(1));
    assertThat(Files.exists(out), is(false));
  }

  @Test
  public void missingInputFileExitsWithOne() {
    Path missing = tmp.getRoot().toPath().resolve("missing.xml");
    assertThat(Main.run(new String[] {"-i", missing.toString()}), is(1));
  }

  @Test
  public void usageErrorsExitWithTwo() throws Exception {
    Path xml = copy("models/lamp_system.xml");
    assertThat(Main.run(new String[] {}), is(2));
    assertThat(Main.run(new String[] {"-i"}), is(2));
    assertThat(Main.run(new String[] {"-i", xml.toString(), "-f", xml.toString()}), is(2));
    assertThat(Main.run(new String[] {"--server", "--port", "eighty"}), is(2));
  }

  @Test
  public void groupTableIsIgnoredWithWarningForFlatInput() throws Exception {
    Path cif = copy("models/lamp_system.cif");
    Path groups = copy("models/lamp_system.groups.csv");
    Path out = tmp.getRoot().toPath().resolve("normalized.cif");
    StringWriter log = new StringWriter();
    WriterAppender appender = new WriterAppender(new SimpleLayout(), log);
    Logger logger = Logger.getLogger(Main.class);
    logger.addAppender(appender);
    try {
      assertThat(Main.run(new String[] {"-f", cif.toString(), "-g", groups.toString(), "-o", out.toString()}), is(0));
    } finally {
      logger.removeAppender(appender);
    }
    assertThat(log.toString(), containsString("WARN - Ignoring -g"));
    assertThat(Files.readString(out, StandardCharsets.UTF_8), is(Models.resource("models/lamp_system.cif")));
  }

  @Test
  public void badDelimiterIsAUsageError() throws Exception {
    Path xml = copy("models/lamp_system.xml");
    assertThat(Main.run(new String[] {"-i", xml.toString(), "-d", "::"}), is(2));
  }
}
