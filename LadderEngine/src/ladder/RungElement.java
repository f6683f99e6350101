package ladder;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/**
 * One position of a rung's sequence: an instruction or a branch delimiter.
 *
 * <p>For delimiters {@link #branchId()} names the branch the delimiter belongs to; for
 * instructions it names the innermost branch enclosing the instruction. Delimiters that match no
 * open branch, and instructions on the main line, have none.
 */
@AutoValue
public abstract class RungElement {
  public abstract RungToken.Type type();

  public abstract int position();

  public abstract Optional<Instruction> instruction();

  public abstract Optional<String> branchId();

  public boolean isInstruction() {
    return type() == RungToken.Type.INSTRUCTION;
  }

  static RungElement instruction(int position, Instruction instruction, Optional<String> branchId) {
    return new AutoValue_RungElement(
        RungToken.Type.INSTRUCTION, position, Optional.of(instruction), branchId);
  }

  static RungElement branchMarker(RungToken.Type type, int position, Optional<String> branchId) {
    return new AutoValue_RungElement(type, position, Optional.empty(), branchId);
  }

  @Override
  public final String toString() {
    return instruction().map(Instruction::metaData).orElse(type().delimiter());
  }
}
