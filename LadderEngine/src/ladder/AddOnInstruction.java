package ladder;

import java.util.Optional;

// A user-defined instruction type. Its name is what calls to it look like in rung text.
public final class AddOnInstruction implements LogicContainer {
  private final String name;
  private final Controller controller;
  private final NamedCollection<Tag> tags = new NamedCollection<>();
  private final NamedCollection<Routine> routines = new NamedCollection<>();

  AddOnInstruction(String name, Controller controller) {
    this.name = name;
    this.controller = controller;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public NamedCollection<Tag> tags() {
    return tags;
  }

  @Override
  public NamedCollection<Routine> routines() {
    return routines;
  }

  @Override
  public Optional<Controller> controller() {
    return Optional.of(controller);
  }

  @Override
  public String toString() {
    return name;
  }
}
