package cifflat;

import static cifflat.Controllability.CONTROLLABLE;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

public class TemplateRegistryTest {

  @Test
  public void registersTemplatesInOrder() {
    TemplateRegistry registry = TemplateRegistry.of(List.of(Models.sensor(), Models.lamp()));
    assertThat(registry.size(), is(2));
    assertThat(registry.template("Lamp").name, is("Lamp"));
    assertThat(registry.templates().iterator().next().name, is("Sensor"));
  }

  @Test(expected = DuplicateNameException.class)
  public void rejectsDuplicateTemplateName() {
    TemplateRegistry.of(List.of(Models.lamp(), Models.lamp()));
  }

  @Test
  public void rejectsDuplicateLocation() {
    ModelSource.Template t = Models.lamp().location("Red", false, false);
    try {
      TemplateRegistry.of(List.of(Models.sensor(), t));
      fail("expected DuplicateNameException");
    } catch (DuplicateNameException e) {
      assertThat(e.getStatementKind(), is("template"));
      assertThat(e.getStatementIndex(), is(1));
      assertThat(e.getMessage(), containsString("template #2"));
      assertThat(e.getMessage(), containsString("'Red'"));
    }
  }

  @Test(expected = DuplicateNameException.class)
  public void rejectsEventDeclaredAsParameterAndLocal() {
    TemplateRegistry.of(List.of(Models.lamp().parameter("c_red", CONTROLLABLE)));
  }

  @Test
  public void requiresExactlyOneInitialLocation() {
    ModelSource.Template none = new ModelSource.Template("None").location("A", false, true);
    ModelSource.Template two = new ModelSource.Template("Two").location("A", true, false).location("B", true, false);
    for (ModelSource.Template t : List.of(none, two)) {
      try {
        TemplateRegistry.of(List.of(t));
        fail("expected ElaborationException for " + t.name);
      } catch (ElaborationException e) {
        assertThat(e.getReason(), containsString("exactly one initial location"));
      }
    }
  }

  @Test(expected = UnknownReferenceException.class)
  public void rejectsEdgeToUnknownLocation() {
    TemplateRegistry.of(List.of(Models.lamp().edge("Green", "c_green", "Blue")));
  }

  @Test(expected = UnknownReferenceException.class)
  public void rejectsEdgeWithUndeclaredEvent() {
    TemplateRegistry.of(List.of(Models.lamp().edge("Green", "c_blue", null)));
  }

  @Test
  public void lookupOfUnknownTemplateIsNull() {
    TemplateRegistry registry = TemplateRegistry.of(List.of(Models.lamp()));
    assertThat(registry.template("Nope"), is((ModelSource.Template) null));
    assertThat(registry.contains("Lamp"), is(true));
    assertThat(registry.template("Lamp"), is(sameInstance(registry.template("Lamp"))));
  }

  @Test
  public void rejectsNamesTheFlatTextCannotCarry() {
    List<ModelSource.Template> bad = List.of(
        new ModelSource.Template("plant").location("A", true, true),
        new ModelSource.Template("T").location("initial", true, true),
        new ModelSource.Template("T").event("goto", CONTROLLABLE).location("A", true, true),
        new ModelSource.Template("T").parameter("2x", CONTROLLABLE).location("A", true, true),
        new ModelSource.Template("My Lamp").location("A", true, true));
    for (ModelSource.Template t : bad) {
      try {
        TemplateRegistry.of(List.of(t));
        fail("expected ElaborationException for template " + t.name);
      } catch (ElaborationException e) {
        assertThat(e.getReason(), containsString("is not an identifier or is reserved"));
        assertThat(e.getStatementKind(), is("template"));
      }
    }
  }
}
