package ladder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/**
 * Finds inputs that no output anywhere in the controller drives.
 *
 * <p>Inputs and outputs are compared by their qualified names. An input also counts as driven when
 * one of its parent structures is written as a whole, e.g. {@code COP(Src,Motor,1)} drives {@code
 * Motor.Run}. Configured system flags are never reported.
 */
public final class UnpairedInputDetector extends ErrorCollectingAnalysis {
  private static final Logger logger = Logger.getLogger(UnpairedInputDetector.class.getName());

  @AutoValue
  public abstract static class Result {
    // Qualified input name to every place it is read.
    public abstract ImmutableListMultimap<String, Operand.Report> unpairedInputs();

    public abstract ImmutableList<LadderException> errors();
  }

  public UnpairedInputDetector(Controller controller) {
    super(controller);
  }

  public Result run() {
    logger.info("Finding unpaired controller inputs...");

    Map<String, List<Operand>> inputs = new LinkedHashMap<>();
    Set<String> outputs = new HashSet<>();
    for (Instruction instruction : controller.instructions()) {
      for (Operand operand : instruction.operands()) {
        try {
          if (instruction.type() == InstructionType.INPUT) {
            inputs.computeIfAbsent(operand.asQualified(), k -> new ArrayList<>()).add(operand);
          } else if (operand.instructionType() == InstructionType.OUTPUT) {
            outputs.add(operand.asQualified());
          }
        } catch (LadderException ex) {
          logError(ex);
        }
      }
    }

    ImmutableListMultimap.Builder<String, Operand.Report> unpaired =
        ImmutableListMultimap.builder();
    for (Map.Entry<String, List<Operand>> entry : inputs.entrySet()) {
      if (outputs.contains(entry.getKey())) continue;
      if (controller.config().ignoredInputs().contains(entry.getKey())) continue;

      try {
        if (!Collections.disjoint(entry.getValue().get(0).qualifiedParents(), outputs)) continue;
        for (Operand operand : entry.getValue()) {
          unpaired.put(entry.getKey(), operand.report());
        }
      } catch (LadderException ex) {
        logError(ex);
      }
    }

    Result result = new AutoValue_UnpairedInputDetector_Result(unpaired.build(), errors());
    logger.log(
        Level.FINE,
        "{0} unpaired inputs out of {1} distinct inputs",
        new Object[] {result.unpairedInputs().keySet().size(), inputs.size()});
    return result;
  }
}
