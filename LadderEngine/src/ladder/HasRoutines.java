package ladder;

import com.google.common.collect.ImmutableList;

public interface HasRoutines extends Named {
  NamedCollection<Routine> routines();

  default ImmutableList<Rung> rungs() {
    return routines()
        .stream()
        .flatMap(r -> r.rungs().stream())
        .collect(ImmutableList.toImmutableList());
  }

  default ImmutableList<Instruction> instructions() {
    return routines()
        .stream()
        .flatMap(r -> r.instructions().stream())
        .collect(ImmutableList.toImmutableList());
  }

  default ImmutableList<Instruction> inputInstructions() {
    return instructions()
        .stream()
        .filter(i -> i.type() == InstructionType.INPUT)
        .collect(ImmutableList.toImmutableList());
  }

  default ImmutableList<Instruction> outputInstructions() {
    return instructions()
        .stream()
        .filter(i -> i.type() == InstructionType.OUTPUT)
        .collect(ImmutableList.toImmutableList());
  }
}
