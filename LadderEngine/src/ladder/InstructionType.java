package ladder;

public enum InstructionType {
  INPUT,
  OUTPUT,
  // Subroutine jump; neither reads nor drives a tag on its own.
  JSR,
  UNKNOWN;
}
