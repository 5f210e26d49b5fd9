package cifflat;

import static cifflat.Controllability.CONTROLLABLE;
import static cifflat.Controllability.UNCONTROLLABLE;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

public class InstantiationResolverTest {

  private final InstantiationResolver resolver = new InstantiationResolver();

  private SymbolTable resolve(ModelSource model) {
    return resolver.resolve(TemplateRegistry.of(model.templates), model.instantiations);
  }

  @Test
  public void lampInstanceMirrorsItsTemplate() {
    SymbolTable table = resolve(new ModelSource().template(Models.lamp()).instantiate("L1", "Lamp"));

    assertThat(table.instances().size(), is(1));
    AutomatonInstance l1 = table.instance("L1");
    assertThat(l1.templateName(), is("Lamp"));
    assertThat(l1.locations(), is(List.of(
        new AutomatonInstance.Location("Red", true, true),
        new AutomatonInstance.Location("Green", false, false))));
    assertThat(l1.edges().size(), is(2));
    assertThat(table.event(l1.edges().get(0).event()).qualifiedName(), is("L1.c_green"));
    assertThat(l1.edges().get(0).target(), is("Green"));
    assertThat(table.event(l1.edges().get(1).event()).qualifiedName(), is("L1.c_red"));
    assertThat(l1.edges().get(1).target(), is("Red"));
    for (AutomatonInstance.Edge edge : l1.edges()) {
      assertThat(l1.owns(edge.event()), is(true));
    }
    assertThat(table.isFrozen(), is(true));
  }

  @Test
  public void borrowedEventIsTheSameEvent() {
    SymbolTable table = resolve(Models.lampSystem());

    int sensorOn = table.instance("S").events().get("u_on");
    AutomatonInstance l1 = table.instance("L1");
    AutomatonInstance l2 = table.instance("L2");
    assertThat(l1.bindings().get("on"), is(sensorOn));
    assertThat(l2.bindings().get("on"), is(sensorOn));
    assertThat(l1.owns(sensorOn), is(false));
    assertThat(l1.events().containsKey("on"), is(false));

    AutomatonInstance.Edge selfLoop = l1.edges().get(1);
    assertThat(selfLoop.event(), is(sensorOn));
    assertThat(selfLoop.isSelfLoop(), is(true));
    assertThat(table.event(sensorOn).owner(), is("S"));
    assertThat(table.events().events(), hasSize(6));
  }

  @Test
  public void instancesKeepDeclarationOrder() {
    ModelSource model = new ModelSource()
        .template(Models.lamp())
        .template(Models.sensor())
        .instantiate("Z", "Lamp")
        .instantiate("A", "Sensor")
        .instantiate("M", "Lamp");
    assertThat(resolve(model).instances().keySet(), contains("Z", "A", "M"));
  }

  @Test
  public void bareArgumentCreatesLocalEventWithParameterControllability() {
    ModelSource model = new ModelSource()
        .template(Models.coupledLamp())
        .instantiate("L1", "CoupledLamp", "u_power");
    SymbolTable table = resolve(model);
    int id = table.instance("L1").events().get("u_power");
    assertThat(table.event(id).controllability(), is(UNCONTROLLABLE));
    assertThat(table.instance("L1").bindings().get("on"), is(id));
  }

  @Test
  public void arityMismatchIsRejected() {
    ModelSource model = new ModelSource()
        .template(Models.sensor())
        .template(Models.coupledLamp())
        .instantiate("S", "Sensor")
        .instantiate("L1", "CoupledLamp");
    try {
      resolve(model);
      fail("expected ArityException");
    } catch (ArityException e) {
      assertThat(e.getStatementIndex(), is(1));
      assertThat(e.getReason(), containsString("expects 1 event argument(s)"));
    }
  }

  @Test(expected = ArityException.class)
  public void tooManyArgumentsAreRejected() {
    resolve(new ModelSource().template(Models.lamp()).instantiate("L1", "Lamp", "x"));
  }

  @Test
  public void controllableActualForUncontrollableParameterIsRejected() {
    ModelSource model = new ModelSource()
        .template(Models.lamp())
        .template(Models.coupledLamp())
        .instantiate("A", "Lamp")
        .instantiate("B", "CoupledLamp", "A.c_green");
    try {
      resolve(model);
      fail("expected ControllabilityMismatchException");
    } catch (ControllabilityMismatchException e) {
      assertThat(e.getReason(), containsString("'A.c_green' is controllable"));
    }
  }

  @Test(expected = ControllabilityMismatchException.class)
  public void controllableParameterCannotBorrow() {
    ModelSource.Template relay = new ModelSource.Template("Relay")
        .parameter("c_go", CONTROLLABLE)
        .location("Idle", true, true)
        .edge("Idle", "c_go", null);
    ModelSource model = new ModelSource()
        .template(Models.lamp())
        .template(relay)
        .instantiate("A", "Lamp")
        .instantiate("R", "Relay", "A.c_green");
    resolve(model);
  }

  @Test
  public void forwardReferenceIsADependencyOrderError() {
    ModelSource model = new ModelSource()
        .template(Models.sensor())
        .template(Models.coupledLamp())
        .instantiate("L1", "CoupledLamp", "S.u_on")
        .instantiate("S", "Sensor");
    try {
      resolve(model);
      fail("expected DependencyOrderException");
    } catch (UnresolvedEventException e) {
      assertThat(e, instanceOf(DependencyOrderException.class));
      assertThat(e.getStatementIndex(), is(0));
    }
  }

  @Test
  public void unknownInstanceOrEventIsUnresolved() {
    ModelSource unknownInstance = new ModelSource()
        .template(Models.coupledLamp())
        .instantiate("L1", "CoupledLamp", "X.u_on");
    ModelSource unknownEvent = new ModelSource()
        .template(Models.sensor())
        .template(Models.coupledLamp())
        .instantiate("S", "Sensor")
        .instantiate("L1", "CoupledLamp", "S.u_maybe");
    for (ModelSource model : List.of(unknownInstance, unknownEvent)) {
      try {
        resolve(model);
        fail("expected UnresolvedEventException");
      } catch (UnresolvedEventException e) {
        assertThat(e instanceof DependencyOrderException, is(false));
      }
    }
  }

  @Test(expected = DuplicateNameException.class)
  public void duplicateInstanceNameIsRejected() {
    resolve(new ModelSource().template(Models.lamp()).instantiate("L1", "Lamp").instantiate("L1", "Lamp"));
  }

  @Test(expected = DuplicateNameException.class)
  public void bareArgumentCollidingWithLocalEventIsRejected() {
    resolve(new ModelSource().template(Models.coupledLamp()).instantiate("L1", "CoupledLamp", "c_red"));
  }

  @Test(expected = UnknownReferenceException.class)
  public void unknownTemplateIsRejected() {
    resolve(new ModelSource().instantiate("L1", "Lamp"));
  }

  @Test
  public void frozenTableRejectsNewInstances() {
    SymbolTable table = resolve(new ModelSource().template(Models.lamp()).instantiate("L1", "Lamp"));
    try {
      table.add(table.instance("L1"));
      fail("expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), containsString("frozen"));
    }
    try {
      table.events().declare("L1", "late", CONTROLLABLE);
      fail("expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertThat(table.instance("L9"), is(nullValue()));
    }
  }

  @Test
  public void rejectsReservedInstanceName() {
    try {
      resolve(new ModelSource().template(Models.lamp()).instantiate("group", "Lamp"));
      fail("expected ElaborationException");
    } catch (ElaborationException e) {
      assertThat(e.getReason(), containsString("'group'"));
      assertThat(e.getStatementIndex(), is(0));
    }
  }

  @Test(expected = ElaborationException.class)
  public void rejectsReservedBareArgument() {
    resolve(new ModelSource().template(Models.coupledLamp()).instantiate("L1", "CoupledLamp", "marked"));
  }
}
