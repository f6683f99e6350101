package ladder;

// Programs and add-on instructions: local tags plus routines of ladder logic.
public interface LogicContainer extends HasTags, HasRoutines {
  @Override
  default TagScope tagScope() {
    return TagScope.PROGRAM;
  }

  default Routine addRoutine(String name) {
    return routines().add(new Routine(name, this));
  }
}
