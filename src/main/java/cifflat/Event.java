package cifflat;

/** A concrete event owned by one instance; shared by id with the instances that borrow it. */
public record Event(int id, String owner, String name, Controllability controllability) {

  public boolean isControllable() {
    return controllability == Controllability.CONTROLLABLE;
  }

  public String qualifiedName() {
    return owner + "." + name;
  }
}
