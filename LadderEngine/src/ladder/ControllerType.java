package ladder;

public enum ControllerType {
  GENERIC,
  GM;
}
