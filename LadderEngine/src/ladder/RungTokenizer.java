package ladder;

import com.google.common.collect.ImmutableList;

/**
 * Splits rung text into instruction calls and branch delimiters.
 *
 * <p>Brackets and commas only count as branch delimiters outside of an instruction's parentheses,
 * so array indices such as {@code Tag[0]} stay part of the instruction. Text that is neither an
 * instruction call nor a delimiter (whitespace, the trailing ';', stray characters) is skipped.
 * Tokenizing never fails: a rung without any complete instruction yields no tokens at all.
 */
public class RungTokenizer {

  private enum State {
    BETWEEN,
    NAME,
    OPERANDS;
  }

  private final String text;
  private int index = -1;
  private char ch = ' ';
  private State state = State.BETWEEN;

  private int nameStart = -1;
  private int depth = 0;
  private boolean sawInstruction = false;

  private final ImmutableList.Builder<RungToken> tokensBuilder = ImmutableList.builder();

  public RungTokenizer(String text) {
    this.text = text == null ? "" : text;
  }

  public static ImmutableList<RungToken> tokenize(String text) {
    return new RungTokenizer(text).tokenize();
  }

  public static boolean isNameChar(char ch) {
    return (ch >= 'A' && ch <= 'Z')
        || (ch >= 'a' && ch <= 'z')
        || (ch >= '0' && ch <= '9')
        || ch == '_';
  }

  public ImmutableList<RungToken> tokenize() {
    ImmutableList<RungToken> tokens = scan();

    // An unterminated call at the end of the text is dropped.
    if (!sawInstruction) return ImmutableList.of();
    return tokens;
  }

  /**
   * The branch delimiters of {@code text} in order, read the same way {@link #tokenize()} reads
   * them but kept even when the text holds no complete instruction.
   */
  public static ImmutableList<RungToken> branchMarkers(String text) {
    return new RungTokenizer(text)
        .scan()
        .stream()
        .filter(token -> token.type().isBranchMarker())
        .collect(ImmutableList.toImmutableList());
  }

  private ImmutableList<RungToken> scan() {
    while (advance()) {
      switch (state) {
        case BETWEEN:
          consumeBetween();
          break;
        case NAME:
          {
            if (isNameChar(ch)) break;
            if (ch == '(') {
              depth = 1;
              state = State.OPERANDS;
              break;
            }

            // Not a call after all; the name was stray text.
            nameStart = -1;
            state = State.BETWEEN;
            consumeBetween();
            break;
          }
        case OPERANDS:
          {
            if (ch == '(') {
              depth++;
            } else if (ch == ')' && --depth == 0) {
              tokensBuilder.add(
                  RungToken.instruction(text.substring(nameStart, index + 1), nameStart));
              sawInstruction = true;
              nameStart = -1;
              state = State.BETWEEN;
            }
            break;
          }
      }
    }

    return tokensBuilder.build();
  }

  private void consumeBetween() {
    if (ch == '[' || ch == ',' || ch == ']') {
      tokensBuilder.add(RungToken.branchMarker(ch, index));
    } else if (isNameChar(ch)) {
      nameStart = index;
      state = State.NAME;
    }
  }

  private boolean advance() {
    if (++index >= text.length()) return false;
    ch = text.charAt(index);
    return true;
  }
}
