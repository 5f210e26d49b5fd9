package cifflat;

import static cifflat.Controllability.CONTROLLABLE;
import static cifflat.Controllability.UNCONTROLLABLE;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Shared fixtures: the lamp/sensor model used across the tests. */
final class Models {

  private Models() {}

  static ModelSource.Template sensor() {
    return new ModelSource.Template("Sensor")
        .event("u_on", UNCONTROLLABLE)
        .event("u_off", UNCONTROLLABLE)
        .location("Off", true, true)
        .location("On", false, false)
        .edge("Off", "u_on", "On")
        .edge("On", "u_off", "Off");
  }

  /** The plain lamp: controllable c_green/c_red, no parameters. */
  static ModelSource.Template lamp() {
    return new ModelSource.Template("Lamp")
        .event("c_green", CONTROLLABLE)
        .event("c_red", CONTROLLABLE)
        .location("Red", true, true)
        .location("Green", false, false)
        .edge("Red", "c_green", "Green")
        .edge("Green", "c_red", "Red");
  }

  /** A lamp that also synchronizes on an uncontrollable {@code on} event passed in. */
  static ModelSource.Template coupledLamp() {
    return new ModelSource.Template("CoupledLamp")
        .parameter("on", UNCONTROLLABLE)
        .event("c_green", CONTROLLABLE)
        .event("c_red", CONTROLLABLE)
        .location("Red", true, true)
        .location("Green", false, false)
        .edge("Red", "c_green", "Green")
        .edge("Red", "on", null)
        .edge("Green", "c_red", "Red");
  }

  /** Same content as {@code models/lamp_system.xml}. */
  static ModelSource lampSystem() {
    return new ModelSource()
        .template(sensor())
        .template(coupledLamp())
        .instantiate("S", "Sensor")
        .instantiate("L1", "CoupledLamp", "S.u_on")
        .instantiate("L2", "CoupledLamp", "S.u_on")
        .require(GuardParser.parse("S.Off"), "L1.c_green", "L2.c_green")
        .require(GuardParser.parse("not S.On or L1.Green"), "L2.c_red")
        .require(GuardParser.parse("S.u_on and not L2.Green"), "L1.c_red");
  }

  static String resource(String name) throws IOException {
    try (InputStream in = Models.class.getResourceAsStream("/" + name)) {
      if (in == null) {
        throw new IOException("Missing test resource " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
