package ladder;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;

/**
 * A text-list entry written into a rung comment, e.g. {@code <Alarm[12]: Motor overload>}. The
 * colon after the entry number may be left out.
 */
@AutoValue
public abstract class DiagnosticMessage {
  public enum Type {
    ALARM,
    PROMPT,
    VALUE;

    static Type forTextListId(String textListId) {
      if (textListId.equalsIgnoreCase("Alarm")) return ALARM;
      if (textListId.equalsIgnoreCase("Prompt")) return PROMPT;
      return VALUE;
    }
  }

  // Entry numbers longer than nine digits are not entries; they would not fit an int.
  private static final Pattern ENTRY =
      Pattern.compile("<\\s*([^<>\\[\\]]+?)\\s*\\[(\\d{1,9})\\]\\s*:?\\s*([^>]*)>");

  // The whole "<Id[n]: message>" entry.
  public abstract String text();

  public abstract String textListId();

  public abstract int number();

  public abstract String message();

  public abstract Type type();

  public abstract Rung rung();

  /** Reads the first text-list entry on {@code commentLine}, if it has one. */
  public static Optional<DiagnosticMessage> parse(String commentLine, Rung rung) {
    Matcher matcher = ENTRY.matcher(commentLine);
    if (!matcher.find()) return Optional.empty();

    String textListId = matcher.group(1);
    return Optional.of(
        new AutoValue_DiagnosticMessage(
            matcher.group(),
            textListId,
            Integer.parseInt(matcher.group(2)),
            matcher.group(3).trim(),
            Type.forTextListId(textListId),
            rung));
  }

  // Two messages collide when they claim the same entry of the same text list.
  boolean sameEntryAs(DiagnosticMessage other) {
    return textListId().equals(other.textListId()) && number() == other.number();
  }
}
