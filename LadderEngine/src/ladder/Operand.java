package ladder;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * One non-empty argument of an {@link Instruction}.
 *
 * <p>Tag lookups and alias resolution happen lazily and are cached for the life of the operand; a
 * rung rebuilds its operands whenever its text changes, so the caches never outlive the text.
 */
public final class Operand {

  @AutoValue
  public abstract static class Report {
    public abstract String baseOperand();

    public abstract String aliasedOperand();

    public abstract String qualifiedOperand();

    public abstract int argPosition();

    public abstract String instruction();

    public abstract InstructionType instructionType();

    public abstract Optional<String> program();

    public abstract Optional<String> routine();

    public abstract Optional<Integer> rung();
  }

  private final String metaData;
  private final int argPosition;
  private final Instruction instruction;

  private Optional<Tag> firstTag = null;
  private Optional<Tag> baseTag = null;
  private String asAliased = null;
  private InstructionType instructionType = null;

  Operand(String metaData, int argPosition, Instruction instruction) {
    this.metaData = metaData;
    this.argPosition = argPosition;
    this.instruction = instruction;
  }

  public String metaData() {
    return metaData;
  }

  public int argPosition() {
    return argPosition;
  }

  public Instruction instruction() {
    return instruction;
  }

  public Optional<LogicContainer> container() {
    return instruction.container();
  }

  // "Array" for "Array[2].Member".
  public String baseName() {
    return Tag.baseNameOf(metaData);
  }

  // ".Member" for "Tag.Member", "[2].Member" for "Array[2].Member".
  public String trailingName() {
    return metaData.substring(baseName().length());
  }

  public InstructionType instructionType() {
    if (instructionType == null) {
      instructionType =
          InstructionCatalog.operandType(
              instruction.name(),
              argPosition,
              instruction.argumentCount(),
              instruction.addOnInstructionNames());
    }
    return instructionType;
  }

  /** The tag named by this operand, looked up in its program first and then the controller. */
  public Optional<Tag> firstTag() {
    if (firstTag == null) firstTag = instruction.aliasResolver().lookup(baseName(), container());
    return firstTag;
  }

  /** The tag at the end of the alias chain starting at {@link #firstTag()}. */
  public Optional<Tag> baseTag() throws AliasDepthExceededException {
    if (baseTag == null) {
      Optional<Tag> first = firstTag();
      baseTag =
          first.isPresent()
              ? Optional.of(instruction.aliasResolver().baseTag(first.get()))
              : Optional.empty();
    }
    return baseTag;
  }

  public String asAliased() throws AliasDepthExceededException {
    if (asAliased == null) {
      Optional<Tag> first = firstTag();
      asAliased =
          first.isPresent() && first.get().isAlias()
              ? instruction.aliasResolver().aliasString(first.get(), trailingName())
              : metaData;
    }
    return asAliased;
  }

  public String asQualified() throws AliasDepthExceededException {
    String aliased = asAliased();
    return qualifier().map(q -> q + aliased).orElse(aliased);
  }

  public ImmutableList<String> parents() {
    return prefixes(metaData);
  }

  public ImmutableList<String> aliasedParents() throws AliasDepthExceededException {
    return prefixes(asAliased());
  }

  public ImmutableList<String> qualifiedParents() throws AliasDepthExceededException {
    Optional<String> qualifier = qualifier();
    ImmutableList<String> aliased = aliasedParents();
    if (!qualifier.isPresent()) return aliased;

    return aliased.stream().map(p -> qualifier.get() + p).collect(ImmutableList.toImmutableList());
  }

  public Report report() throws AliasDepthExceededException {
    return new AutoValue_Operand_Report(
        metaData,
        asAliased(),
        asQualified(),
        argPosition,
        instruction.metaData(),
        instructionType(),
        container().map(Named::name),
        instruction.routine().map(Routine::name),
        instruction.rung().map(Rung::number));
  }

  @Override
  public String toString() {
    return metaData;
  }

  // "Program:<name>." for operands whose base tag is program scoped.
  private Optional<String> qualifier() throws AliasDepthExceededException {
    return baseTag()
        .filter(t -> t.scope() == TagScope.PROGRAM)
        .map(t -> "Program:" + t.container().name() + ".");
  }

  // Successively shorter dotted prefixes, longest first: "A.B.C", "A.B", "A".
  private static ImmutableList<String> prefixes(String reference) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    String current = reference;
    builder.add(current);
    for (int dot = current.lastIndexOf('.'); dot != -1; dot = current.lastIndexOf('.')) {
      current = current.substring(0, dot);
      builder.add(current);
    }
    return builder.build();
  }
}
