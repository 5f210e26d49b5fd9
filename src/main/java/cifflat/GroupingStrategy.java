package cifflat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns instances to named groups of the flattened output. Instances missing from the returned
 * map stay at top level. {@link ElaborationService} checks every partition: keys must be known
 * instances, values identifiers that are not instance names.
 */
public interface GroupingStrategy {

  GroupingStrategy NONE = instances -> Map.of();

  Map<String, String> partition(List<AutomatonInstance> instances);

  /** Uses an explicit instance-to-group table, e.g. one read by {@link NodeCsvReader#readGroups}. */
  static GroupingStrategy fromTable(Map<String, String> table) {
    Map<String, String> copy = new LinkedHashMap<>(table);
    return instances -> copy;
  }
}
