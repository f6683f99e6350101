package ladder;

import java.util.Optional;

public class LadderException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    GRAMMAR,
    RANGE,
    LOOKUP,
    ALIAS_DEPTH,
    CONFIGURATION;
  }

  private final Kind kind;
  private final String errorMsg;
  private final Optional<Integer> offset;

  public LadderException(Kind kind, String errorMsg) {
    this(kind, errorMsg, Optional.empty());
  }

  public LadderException(Kind kind, String errorMsg, int offset) {
    this(kind, errorMsg, Optional.of(offset));
  }

  private LadderException(Kind kind, String errorMsg, Optional<Integer> offset) {
    super(errorMsg);
    this.kind = kind;
    this.errorMsg = errorMsg;
    this.offset = offset;
  }

  public static LadderException grammar(String format, Object... args) {
    return new LadderException(Kind.GRAMMAR, String.format(format, args));
  }

  /** A grammar error located at {@code offset} in the rung text. */
  public static LadderException grammarAt(int offset, String format, Object... args) {
    return new LadderException(Kind.GRAMMAR, String.format(format, args), offset);
  }

  public static LadderException range(String format, Object... args) {
    return new LadderException(Kind.RANGE, String.format(format, args));
  }

  public static LadderException lookup(String format, Object... args) {
    return new LadderException(Kind.LOOKUP, String.format(format, args));
  }

  public static LadderException configuration(String format, Object... args) {
    return new LadderException(Kind.CONFIGURATION, String.format(format, args));
  }

  public Kind kind() {
    return kind;
  }

  /** Offset into the rung text the error refers to, when there is one. */
  public Optional<Integer> offset() {
    return offset;
  }

  public void print() {
    if (offset.isPresent()) {
      System.out.println(String.format("ERROR: %s@%d %s", kind, offset.get(), errorMsg));
    } else {
      System.out.println(String.format("ERROR: %s %s", kind, errorMsg));
    }
  }
}
