package ladder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** One instruction call of a rung, e.g. {@code MOV(Source,Dest)}. */
public final class Instruction {

  /** Flat record of where an instruction lives, for controller-level reports. */
  @AutoValue
  public abstract static class Report {
    public abstract String instruction();

    public abstract Optional<String> program();

    public abstract Optional<String> routine();

    public abstract Optional<Integer> rung();

    static Report create(
        String instruction,
        Optional<String> program,
        Optional<String> routine,
        Optional<Integer> rung) {
      return new AutoValue_Instruction_Report(instruction, program, routine, rung);
    }
  }

  private final String metaData;
  private final String name;
  private final ImmutableList<String> arguments;
  private final ImmutableList<Operand> operands;
  private final Optional<Rung> rung;

  private InstructionType type = null;

  private Instruction(String metaData, InstructionParser.Call call, Optional<Rung> rung) {
    this.metaData = metaData;
    this.name = call.name();
    this.arguments = call.arguments();
    this.rung = rung;

    ImmutableList.Builder<Operand> operandsBuilder = ImmutableList.builder();
    for (int i = 0; i < arguments.size(); i++) {
      if (!arguments.get(i).isEmpty()) operandsBuilder.add(new Operand(arguments.get(i), i, this));
    }
    this.operands = operandsBuilder.build();
  }

  public static Instruction parse(String text) throws LadderException {
    return new Instruction(text, InstructionParser.parse(text), Optional.empty());
  }

  static Instruction parse(String text, Optional<Rung> rung) throws LadderException {
    return new Instruction(text, InstructionParser.parse(text), rung);
  }

  public String name() {
    return name;
  }

  public String metaData() {
    return metaData;
  }

  public ImmutableList<String> arguments() {
    return arguments;
  }

  public int argumentCount() {
    return arguments.size();
  }

  // Non-empty arguments only; positions still count the empty ones.
  public ImmutableList<Operand> operands() {
    return operands;
  }

  public Optional<Operand> operandAt(int argPosition) {
    return operands.stream().filter(o -> o.argPosition() == argPosition).findFirst();
  }

  public Optional<Rung> rung() {
    return rung;
  }

  public Optional<Routine> routine() {
    return rung.flatMap(Rung::routine);
  }

  public Optional<LogicContainer> container() {
    return routine().map(Routine::container);
  }

  public Optional<Controller> controller() {
    return container().flatMap(HasTags::controller);
  }

  ImmutableSet<String> addOnInstructionNames() {
    return controller().map(c -> c.aois().names()).orElse(ImmutableSet.of());
  }

  AliasResolver aliasResolver() {
    return controller().map(Controller::aliasResolver).orElseGet(Controller::defaultAliasResolver);
  }

  public boolean isAddOnInstruction() {
    return addOnInstructionNames().contains(name);
  }

  public InstructionType type() {
    if (type == null) type = InstructionCatalog.instructionType(name, addOnInstructionNames());
    return type;
  }

  /** This instruction with every operand written through its alias chain. */
  public String aliasedMetaData() throws LadderException {
    List<String> rewritten = new ArrayList<>(arguments);
    for (Operand operand : operands) {
      rewritten.set(operand.argPosition(), operand.asAliased());
    }
    return name + "(" + String.join(",", rewritten) + ")";
  }

  /** Like {@link #aliasedMetaData()}, with program-scoped operands prefixed by their program. */
  public String qualifiedMetaData() throws LadderException {
    List<String> rewritten = new ArrayList<>(arguments);
    for (Operand operand : operands) {
      rewritten.set(operand.argPosition(), operand.asQualified());
    }
    return name + "(" + String.join(",", rewritten) + ")";
  }

  public Report report() {
    return Report.create(
        metaData,
        container().map(Named::name),
        routine().map(Routine::name),
        rung.map(Rung::number));
  }

  @Override
  public String toString() {
    return metaData;
  }
}
