package ladder;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Splits a single instruction call into its name and raw argument texts. */
public final class InstructionParser {

  @AutoValue
  public abstract static class Call {
    public abstract String name();

    // Raw argument texts in order, empty arguments included.
    public abstract ImmutableList<String> arguments();

    static Call create(String name, List<String> arguments) {
      return new AutoValue_InstructionParser_Call(name, ImmutableList.copyOf(arguments));
    }
  }

  public static Call parse(String text) throws LadderException {
    int nameEnd = 0;
    while (nameEnd < text.length() && RungTokenizer.isNameChar(text.charAt(nameEnd))) nameEnd++;

    if (nameEnd == 0) throw LadderException.grammar("no instruction name in '%s'", text);
    if (nameEnd >= text.length() || text.charAt(nameEnd) != '(')
      throw LadderException.grammar("instruction '%s' has no operand parenthesis", text);

    int close = matchingParenthesis(text, nameEnd);
    if (close < 0) throw LadderException.grammar("unbalanced parenthesis in '%s'", text);

    return Call.create(
        text.substring(0, nameEnd), splitArguments(text.substring(nameEnd + 1, close)));
  }

  /** Requires {@code text} to be exactly one instruction call and nothing else. */
  public static Call validate(String text) throws LadderException {
    if (text == null || text.isEmpty())
      throw LadderException.grammar("instruction text must be a non-empty string");

    ImmutableList<RungToken> tokens = RungTokenizer.tokenize(text);
    if (tokens.size() != 1 || !tokens.get(0).isInstruction() || !tokens.get(0).text().equals(text))
      throw LadderException.grammar("invalid instruction format: %s", text);

    return parse(text);
  }

  private static int matchingParenthesis(String text, int open) {
    int depth = 0;
    for (int i = open; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (ch == '(') {
        depth++;
      } else if (ch == ')' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }

  // Splits on commas that are not nested inside parentheses or array brackets.
  static ImmutableList<String> splitArguments(String operands) {
    if (operands.isEmpty()) return ImmutableList.of();

    List<String> arguments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int depth = 0;
    for (int i = 0; i < operands.length(); i++) {
      char ch = operands.charAt(i);
      if (ch == '(' || ch == '[') {
        depth++;
      } else if ((ch == ')' || ch == ']') && depth > 0) {
        depth--;
      } else if (ch == ',' && depth == 0) {
        arguments.add(current.toString());
        current = new StringBuilder();
        continue;
      }
      current.append(ch);
    }
    arguments.add(current.toString());
    return ImmutableList.copyOf(arguments);
  }

  private InstructionParser() {}
}
