package ladder;

import java.util.List;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;

// A complete instruction call or one of the branch delimiters '[', ',' and ']'.
@AutoValue
public abstract class RungToken {
  public enum Type {
    INSTRUCTION,
    BRANCH_START('['),
    BRANCH_NEXT(','),
    BRANCH_END(']');

    private final char delimiter;

    Type() {
      this.delimiter = 0;
    }

    Type(char delimiter) {
      this.delimiter = delimiter;
    }

    public boolean isBranchMarker() {
      return this != INSTRUCTION;
    }

    public static Type forDelimiter(char ch) {
      for (Type type : values()) {
        if (type.delimiter == ch && type.isBranchMarker()) return type;
      }
      throw new IllegalArgumentException("not a branch delimiter: " + ch);
    }

    public String delimiter() {
      return Character.toString(delimiter);
    }
  }

  public abstract Type type();

  public abstract String text();

  // Character offset of the token within the rung text it was read from.
  public abstract int offset();

  public boolean isInstruction() {
    return type() == Type.INSTRUCTION;
  }

  public static RungToken instruction(String text, int offset) {
    return new AutoValue_RungToken(Type.INSTRUCTION, text, offset);
  }

  public static RungToken branchMarker(char ch, int offset) {
    Type type = Type.forDelimiter(ch);
    return new AutoValue_RungToken(type, type.delimiter(), offset);
  }

  public static String join(List<String> tokenTexts) {
    return String.join("", tokenTexts);
  }

  public static List<String> texts(List<RungToken> tokens) {
    return tokens.stream().map(RungToken::text).collect(Collectors.toList());
  }

  @Override
  public final String toString() {
    return text();
  }
}
