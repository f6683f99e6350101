package ladder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** An ordered list of rungs inside a program or add-on instruction. */
public final class Routine implements Named {
  private final String name;
  private final LogicContainer container;
  private final List<Rung> rungs = new ArrayList<>();

  Routine(String name, LogicContainer container) {
    this.name = name;
    this.container = container;
  }

  @Override
  public String name() {
    return name;
  }

  public LogicContainer container() {
    return container;
  }

  public ImmutableList<Rung> rungs() {
    return ImmutableList.copyOf(rungs);
  }

  public Rung addRung(String text) {
    return addRung(new Rung(text));
  }

  public Rung addRung(Rung rung) {
    return addRung(rung, rungs.size());
  }

  /** Inserts {@code rung} at {@code index}; rungs are renumbered 0..n-1 afterwards. */
  public Rung addRung(Rung rung, int index) {
    Preconditions.checkArgument(
        !rung.routine().isPresent(), "rung already belongs to %s", rung.routine());
    Preconditions.checkPositionIndex(index, rungs.size());

    rungs.add(index, rung);
    rung.setRoutine(Optional.of(this));
    renumber();
    return rung;
  }

  public boolean removeRung(Rung rung) {
    if (!rungs.remove(rung)) return false;

    rung.setRoutine(Optional.empty());
    renumber();
    return true;
  }

  public Rung removeRung(int index) {
    Preconditions.checkElementIndex(index, rungs.size());
    Rung rung = rungs.get(index);
    removeRung(rung);
    return rung;
  }

  private void renumber() {
    for (int i = 0; i < rungs.size(); i++) {
      rungs.get(i).setNumber(i);
    }
  }

  public ImmutableList<Instruction> instructions() {
    return rungs
        .stream()
        .flatMap(r -> r.instructions().stream())
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Instruction> instructions(
      Optional<String> name, Optional<String> operandFragment) {
    return rungs
        .stream()
        .flatMap(r -> r.instructions(name, operandFragment).stream())
        .collect(ImmutableList.toImmutableList());
  }

  // Whether any rung of this routine calls the routine named {@code routineName}.
  public boolean checkForJsr(String routineName) {
    return rungs.stream().anyMatch(r -> r.hasJsrTo(routineName));
  }

  @Override
  public String toString() {
    return container.name() + "/" + name;
  }
}
