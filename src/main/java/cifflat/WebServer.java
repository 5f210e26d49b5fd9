package cifflat;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.log4j.Logger;

/**
 * Embedded HTTP host. {@code POST /api/elaborate} takes a model XML document,
 * {@code POST /api/normalize} takes flattened text; both answer with the canonical flattened
 * model, or {@code 422} and the error message.
 */
public class WebServer {
  private static final Logger logger = Logger.getLogger(WebServer.class);

  private final ElaborationService elaborationService;
  private HttpServer server;
  private ExecutorService executor;

  public WebServer(ElaborationService elaborationService) {
    this.elaborationService = elaborationService;
  }

  /** Starts listening; port 0 picks a free port. Returns the bound port. */
  public int start(int port) throws IOException {
    server = HttpServer.create(new InetSocketAddress(port), 0);
    server.createContext("/api/elaborate", this::handleElaborate);
    server.createContext("/api/normalize", this::handleNormalize);
    executor = Executors.newCachedThreadPool();
    server.setExecutor(executor);
    server.start();
    return server.getAddress().getPort();
  }

  public void stop() {
    if (server != null) {
      server.stop(0);
      server = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }

  private void handleElaborate(HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      send(exchange, 405, "Method Not Allowed", "text/plain");
      return;
    }
    byte[] body = exchange.getRequestBody().readAllBytes();
    String text;
    try {
      ModelSource source = elaborationService.parser().parse(new ByteArrayInputStream(body));
      text = elaborationService.render(elaborationService.elaborate(source, GroupingStrategy.NONE));
    } catch (ElaborationException e) {
      logger.info("Rejected model: " + e.getMessage());
      send(exchange, 422, e.getMessage(), "text/plain");
      return;
    } catch (IOException e) {
      logger.info("Unreadable model: " + e.getMessage());
      send(exchange, 400, "Unreadable model document: " + e.getMessage(), "text/plain");
      return;
    }
    send(exchange, 200, text, "text/plain");
  }

  private void handleNormalize(HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      send(exchange, 405, "Method Not Allowed", "text/plain");
      return;
    }
    String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    String text;
    try {
      text = elaborationService.render(elaborationService.normalize(body));
    } catch (ElaborationException e) {
      logger.info("Rejected flattened model: " + e.getMessage());
      send(exchange, 422, e.getMessage(), "text/plain");
      return;
    }
    send(exchange, 200, text, "text/plain");
  }

  private void send(HttpExchange exchange, int status, String body, String contentType) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", contentType + "; charset=utf-8");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
