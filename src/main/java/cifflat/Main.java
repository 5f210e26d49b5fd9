package cifflat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.log4j.Logger;

public class Main {
  private static final Logger logger = Logger.getLogger(Main.class);

  /** Returned by {@link #run} when the HTTP server keeps the JVM alive. */
  static final int SERVING = -1;

  public static void main(String[] args) {
    int status = run(args);
    if (status != SERVING) {
      System.exit(status);
    }
  }

  static int run(String[] args) {
    Path modelXml = null;
    Path flatInput = null;
    Path output = null;
    Path groupsCsv = null;
    Path dsmDir = null;
    String delimiter = NodeCsvReader.DEFAULT_DELIMITER;
    boolean startServer = false;
    int port = 8080;
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "-i" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          modelXml = Paths.get(args[++i]);
        }
        case "-f" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          flatInput = Paths.get(args[++i]);
        }
        case "-o" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          output = Paths.get(args[++i]);
        }
        case "-g" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          groupsCsv = Paths.get(args[++i]);
        }
        case "-d" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          delimiter = args[++i];
          try {
            NodeCsvReader.separator(delimiter);
          } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            usage();
            return 2;
          }
        }
        case "--dsm" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          dsmDir = Paths.get(args[++i]);
        }
        case "--server" -> startServer = true;
        case "--port" -> {
          if (i + 1 >= args.length) {
            usage();
            return 2;
          }
          try {
            port = Integer.parseInt(args[++i]);
          } catch (NumberFormatException e) {
            usage();
            return 2;
          }
        }
        default -> logger.warn("Ignoring unknown switch " + args[i]);
      }
    }

    ElaborationService service = new ElaborationService();
    if (startServer) {
      WebServer server = new WebServer(service);
      try {
        int bound = server.start(port);
        logger.info("Web server started at http://localhost:" + bound);
        return SERVING;
      } catch (IOException e) {
        logger.error("Failed to start web server: " + e.getMessage(), e);
        return 1;
      }
    }
    if ((modelXml == null) == (flatInput == null)) {
      usage();
      return 2;
    }

    try {
      FlatNetwork network;
      String stem;
      if (modelXml != null) {
        GroupingStrategy grouping = groupsCsv == null
            ? GroupingStrategy.NONE
            : GroupingStrategy.fromTable(new NodeCsvReader(delimiter).readGroups(groupsCsv));
        network = service.elaborate(modelXml, grouping);
        stem = stem(modelXml);
      } else {
        if (groupsCsv != null) {
          logger.warn("Ignoring -g " + groupsCsv + ": groups of a flattened model are taken from its text");
        }
        network = service.normalize(Files.readString(flatInput, StandardCharsets.UTF_8));
        stem = stem(flatInput);
      }

      if (output != null) {
        service.write(output, network);
        stem = stem(output);
      } else {
        System.out.print(service.render(network));
      }
      if (dsmDir != null) {
        for (Path p : DependencyMatrix.of(network).write(dsmDir, stem, delimiter)) {
          logger.info("Wrote " + p);
        }
      }
      return 0;
    } catch (ElaborationException | CsvStructureException e) {
      logger.debug("Elaboration aborted", e);
      System.err.println("error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.error("I/O failure: " + e.getMessage(), e);
      return 1;
    }
  }

  private static String stem(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static void usage() {
    System.out.println("Usage:");
    System.out.println("  Elaborate:   -i <model.xml> [-o <out.cif>] [-g <groups.csv>] [-d <delimiter>] [--dsm <dir>]");
    System.out.println("  Normalize:   -f <model.cif> [-o <out.cif>] [--dsm <dir>]");
    System.out.println("  Server mode: --server [--port <Port>]");
  }
}
