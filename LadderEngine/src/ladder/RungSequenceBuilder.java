package ladder;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Turns a rung's tokens into its positional sequence and branch table.
 *
 * <p>Positions are indices into the token list. Branch ids are assigned in textual order, so the
 * same text always yields the same ids. Unbalanced delimiters are recorded as they are and never
 * rejected; see {@link Rung#validateBranchStructure()}.
 */
final class RungSequenceBuilder {

  @AutoValue
  abstract static class Structure {
    abstract ImmutableList<RungToken> tokens();

    abstract ImmutableList<RungElement> sequence();

    abstract ImmutableList<Instruction> instructions();

    abstract ImmutableMap<String, Branch> branches();

    static Structure empty() {
      return new AutoValue_RungSequenceBuilder_Structure(
          ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), ImmutableMap.of());
    }
  }

  private final Optional<Rung> rung;
  private final ImmutableList.Builder<RungElement> sequenceBuilder = ImmutableList.builder();
  private final ImmutableList.Builder<Instruction> instructionsBuilder = ImmutableList.builder();
  private final Map<String, Branch.Builder> branchBuilders = new LinkedHashMap<>();
  private final Deque<Branch.Builder> open = new ArrayDeque<>();
  private int position = 0;

  private RungSequenceBuilder(Optional<Rung> rung) {
    this.rung = rung;
  }

  static Structure build(List<RungToken> tokens, Optional<Rung> rung) {
    RungSequenceBuilder builder = new RungSequenceBuilder(rung);
    for (RungToken token : tokens) {
      builder.consume(token);
    }
    return builder.build(tokens);
  }

  private void consume(RungToken token) {
    Optional<String> enclosing = Optional.ofNullable(open.peek()).map(Branch.Builder::id);
    switch (token.type()) {
      case INSTRUCTION:
        {
          Instruction instruction = parseInstruction(token);
          sequenceBuilder.add(RungElement.instruction(position, instruction, enclosing));
          instructionsBuilder.add(instruction);
          if (!open.isEmpty()) open.peek().consumeInstruction(instruction);
          break;
        }
      case BRANCH_START:
        {
          String id = "branch_" + branchBuilders.size();
          Branch.Builder branch = new Branch.Builder(id, position, enclosing);
          if (!open.isEmpty()) open.peek().consumeNestedBranch(id);
          branchBuilders.put(id, branch);
          open.push(branch);
          sequenceBuilder.add(RungElement.branchMarker(token.type(), position, Optional.of(id)));
          break;
        }
      case BRANCH_NEXT:
        if (!open.isEmpty()) open.peek().consumeNext(position);
        sequenceBuilder.add(RungElement.branchMarker(token.type(), position, enclosing));
        break;
      case BRANCH_END:
        if (!open.isEmpty()) open.pop().close(position);
        sequenceBuilder.add(RungElement.branchMarker(token.type(), position, enclosing));
        break;
    }
    position++;
  }

  private Instruction parseInstruction(RungToken token) {
    try {
      return Instruction.parse(token.text(), rung);
    } catch (LadderException e) {
      throw new AssertionError("tokenizer produced an unparseable instruction: " + token, e);
    }
  }

  private Structure build(List<RungToken> tokens) {
    ImmutableMap.Builder<String, Branch> branches = ImmutableMap.builder();
    branchBuilders.forEach((id, builder) -> branches.put(id, builder.build()));
    return new AutoValue_RungSequenceBuilder_Structure(
        ImmutableList.copyOf(tokens),
        sequenceBuilder.build(),
        instructionsBuilder.build(),
        branches.build());
  }
}
