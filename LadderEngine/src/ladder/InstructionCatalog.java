package ladder;

import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Static shapes of the known instructions, used to decide which operands an instruction reads and
 * which it drives.
 */
public final class InstructionCatalog {

  public static final String JSR = "JSR";

  // Last operand, whatever the argument count.
  public static final int LAST_OPERAND = -1;

  // Every operand of these instructions is read.
  public static final ImmutableSet<String> INPUT_INSTRUCTIONS =
      ImmutableSet.of(
          "XIC", "XIO", "LIM", "MEQ", "EQU", "NEQ", "LES", "GRT", "LEQ", "GEQ", "IsINF", "IsNAN");

  // Instruction name to the position of its single output operand.
  public static final ImmutableMap<String, Integer> OUTPUT_INSTRUCTIONS =
      ImmutableMap.<String, Integer>builder()
          .put("OTE", LAST_OPERAND)
          .put("OTU", LAST_OPERAND)
          .put("OTL", LAST_OPERAND)
          .put("TON", 0)
          .put("TOF", 0)
          .put("RTO", 0)
          .put("CTU", 0)
          .put("CTD", 0)
          .put("RES", LAST_OPERAND)
          .put("MSG", LAST_OPERAND)
          .put("GSV", LAST_OPERAND)
          .put("ONS", LAST_OPERAND)
          .put("OSR", LAST_OPERAND)
          .put("OSF", LAST_OPERAND)
          .put("IOT", LAST_OPERAND)
          .put("CPT", 0)
          .put("ADD", LAST_OPERAND)
          .put("SUB", LAST_OPERAND)
          .put("MUL", LAST_OPERAND)
          .put("DIV", LAST_OPERAND)
          .put("MOD", LAST_OPERAND)
          .put("SQR", LAST_OPERAND)
          .put("NEG", LAST_OPERAND)
          .put("ABS", LAST_OPERAND)
          .put("MOV", LAST_OPERAND)
          .put("MVM", LAST_OPERAND)
          .put("AND", LAST_OPERAND)
          .put("OR", LAST_OPERAND)
          .put("XOR", LAST_OPERAND)
          .put("NOT", LAST_OPERAND)
          .put("SWPB", LAST_OPERAND)
          .put("CLR", LAST_OPERAND)
          .put("BTD", 2)
          .put("FAL", 4)
          .put("COP", 1)
          .put("FLL", 1)
          .put("AVE", 2)
          .put("SIZE", LAST_OPERAND)
          .put("CPS", 1)
          .build();

  /**
   * Classifies a whole instruction. Calls to add-on instructions count as outputs since their
   * operands are all treated as driven.
   */
  public static InstructionType instructionType(String name, Set<String> addOnInstructionNames) {
    if (INPUT_INSTRUCTIONS.contains(name)) return InstructionType.INPUT;
    if (OUTPUT_INSTRUCTIONS.containsKey(name)) return InstructionType.OUTPUT;
    if (name.equals(JSR)) return InstructionType.JSR;
    if (addOnInstructionNames.contains(name)) return InstructionType.OUTPUT;
    return InstructionType.UNKNOWN;
  }

  /**
   * Classifies the operand at {@code position} of an instruction with {@code argumentCount}
   * arguments.
   */
  public static InstructionType operandType(
      String name, int position, int argumentCount, Set<String> addOnInstructionNames) {
    if (name.equals(JSR)) return InstructionType.JSR;
    if (INPUT_INSTRUCTIONS.contains(name)) return InstructionType.INPUT;

    Integer outputPosition = OUTPUT_INSTRUCTIONS.get(name);
    if (outputPosition != null) {
      boolean isOutput =
          position == outputPosition
              || (outputPosition == LAST_OPERAND && position + 1 == argumentCount);
      return isOutput ? InstructionType.OUTPUT : InstructionType.INPUT;
    }

    // Add-on instruction internals are not inspected.
    if (addOnInstructionNames.contains(name)) return InstructionType.OUTPUT;
    return InstructionType.UNKNOWN;
  }

  private InstructionCatalog() {}
}
