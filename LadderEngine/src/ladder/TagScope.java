package ladder;

public enum TagScope {
  CONTROLLER,
  // Local to a program or an add-on instruction.
  PROGRAM;
}
