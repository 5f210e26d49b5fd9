package cifflat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only table of all events of one elaboration run. An event id is its position in the
 * arena; instances that synchronize on an event hold the same id.
 */
public final class EventArena {
  private final List<Event> events = new ArrayList<>();
  private boolean frozen;

  public int declare(String owner, String name, Controllability controllability) {
    if (frozen) {
      throw new IllegalStateException("Event arena is frozen");
    }
    int id = events.size();
    events.add(new Event(id, owner, name, controllability));
    return id;
  }

  public Event get(int id) {
    if (id < 0 || id >= events.size()) {
      throw new IllegalArgumentException("No event with id " + id);
    }
    return events.get(id);
  }

  public int size() {
    return events.size();
  }

  public List<Event> events() {
    return Collections.unmodifiableList(events);
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }
}
