package cifflat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public class NetworkWriter {
  private final NetworkSerializer serializer;

  public NetworkWriter(NetworkSerializer serializer) {
    this.serializer = serializer;
  }

  public Path write(Path target, FlatNetwork network) throws IOException {
    String text = serializer.render(network);
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    Files.writeString(target, text, StandardCharsets.UTF_8);
    return target;
  }
}
