package ladder;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * The top of the project model: controller-scoped tags, programs and add-on instructions.
 *
 * <p>The names of the add-on instructions form the catalog of user-defined instruction types used
 * when classifying instructions.
 */
public final class Controller implements HasTags {
  private static final AliasResolver DEFAULT_ALIAS_RESOLVER =
      EngineConfig.defaults().aliasResolver();

  private final String name;
  private final ControllerType type;
  private final EngineConfig config;
  private final AliasResolver aliasResolver;
  private final NamedCollection<Tag> tags = new NamedCollection<>();
  private final NamedCollection<Program> programs = new NamedCollection<>();
  private final NamedCollection<AddOnInstruction> aois = new NamedCollection<>();

  Controller(String name, ControllerType type, EngineConfig config) {
    this.name = name;
    this.type = type;
    this.config = config;
    this.aliasResolver = config.aliasResolver();
  }

  static AliasResolver defaultAliasResolver() {
    return DEFAULT_ALIAS_RESOLVER;
  }

  @Override
  public String name() {
    return name;
  }

  public ControllerType type() {
    return type;
  }

  public EngineConfig config() {
    return config;
  }

  public AliasResolver aliasResolver() {
    return aliasResolver;
  }

  @Override
  public NamedCollection<Tag> tags() {
    return tags;
  }

  @Override
  public TagScope tagScope() {
    return TagScope.CONTROLLER;
  }

  @Override
  public Optional<Controller> controller() {
    return Optional.of(this);
  }

  public NamedCollection<Program> programs() {
    return programs;
  }

  public NamedCollection<AddOnInstruction> aois() {
    return aois;
  }

  public Program addProgram(String name) {
    return programs.add(new Program(name, this));
  }

  public AddOnInstruction addAddOnInstruction(String name) {
    return aois.add(new AddOnInstruction(name, this));
  }

  // Programs first, then add-on instructions.
  public ImmutableList<LogicContainer> logicContainers() {
    return ImmutableList.<LogicContainer>builder().addAll(programs).addAll(aois).build();
  }

  public ImmutableList<Rung> rungs() {
    return logicContainers()
        .stream()
        .flatMap(c -> c.rungs().stream())
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Instruction> instructions() {
    return logicContainers()
        .stream()
        .flatMap(c -> c.instructions().stream())
        .collect(ImmutableList.toImmutableList());
  }

  public UnpairedInputDetector.Result findUnpairedInputs() {
    return new UnpairedInputDetector(this).run();
  }

  public RedundantOutputDetector.Result findRedundantOutputs() {
    return new RedundantOutputDetector(this).run();
  }

  public DiagnosticReport extractDiagnostics() {
    return new DiagnosticExtractor(this).run();
  }

  @Override
  public String toString() {
    return name + " (" + type + ")";
  }
}
