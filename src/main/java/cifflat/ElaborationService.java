package cifflat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Runs the passes in order: template registry, instantiation resolver, requirement expander,
 * grouping. The first failure aborts the run; nothing is returned or written for a failed run.
 */
public class ElaborationService {
  private static final Logger logger = Logger.getLogger(ElaborationService.class);

  private final ModelDomParser parser;
  private final InstantiationResolver resolver;
  private final RequirementExpander expander;
  private final NetworkSerializer serializer;
  private final NetworkWriter writer;
  private final FlatModelReader reader;

  public ElaborationService() {
    this(new ModelDomParser(), new InstantiationResolver(), new RequirementExpander(), new NetworkSerializer());
  }

  public ElaborationService(
      ModelDomParser parser, InstantiationResolver resolver, RequirementExpander expander, NetworkSerializer serializer) {
    this.parser = parser;
    this.resolver = resolver;
    this.expander = expander;
    this.serializer = serializer;
    this.writer = new NetworkWriter(serializer);
    this.reader = new FlatModelReader(expander);
  }

  public FlatNetwork elaborate(ModelSource source) {
    return elaborate(source, GroupingStrategy.NONE);
  }

  public FlatNetwork elaborate(ModelSource source, GroupingStrategy grouping) {
    if (source == null) {
      throw new IllegalArgumentException("No model provided");
    }
    TemplateRegistry registry = TemplateRegistry.of(source.templates);
    SymbolTable table = resolver.resolve(registry, source.instantiations);
    List<RequirementClause> clauses = expander.expand(source.requirements, table);
    List<AutomatonInstance> instances = List.copyOf(table.instances().values());
    Map<String, String> groups = checkGroups(grouping.partition(instances), table);

    logger.info("Elaborated model '" + source.name + "': " + registry.size() + " template(s), "
        + instances.size() + " instance(s), " + table.events().size() + " event(s), "
        + clauses.size() + " requirement clause(s), " + groups.size() + " grouped instance(s)");
    return new FlatNetwork(table, clauses, groups);
  }

  public FlatNetwork elaborate(Path modelXml, GroupingStrategy grouping) throws IOException {
    ModelSource source = parser.parse(modelXml);
    return elaborate(source, grouping);
  }

  /** Reads flattened text and returns it as a network, validated like an elaborated one. */
  public FlatNetwork normalize(String flatText) {
    FlatNetwork network = reader.read(flatText);
    logger.info("Read flattened model: " + network.instances().size() + " plant(s), "
        + network.requirements().size() + " requirement clause(s)");
    return network;
  }

  public String render(FlatNetwork network) {
    return serializer.render(network);
  }

  public Path write(Path target, FlatNetwork network) throws IOException {
    Path written = writer.write(target, network);
    logger.info("Wrote flattened model to " + written);
    return written;
  }

  private static Map<String, String> checkGroups(Map<String, String> partition, SymbolTable table) {
    Map<String, String> groups = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : partition.entrySet()) {
      String instance = entry.getKey();
      String group = entry.getValue();
      if (table.instance(instance) == null) {
        throw new UnknownReferenceException("Grouping assigns unknown instance '" + instance + "'", "group", -1);
      }
      if (group == null || group.isBlank()) continue;
      if (!Identifiers.isIdentifier(group)) {
        throw new ElaborationException("Group name '" + group + "' is not an identifier or is reserved", "group", -1);
      }
      if (table.instance(group) != null) {
        throw new DuplicateNameException("Group '" + group + "' has the same name as an instance", "group", -1);
      }
      groups.put(instance, group);
    }
    return groups;
  }

  public ModelDomParser parser() {
    return parser;
  }
}
