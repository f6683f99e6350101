package ladder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/** Finds OTE instructions that drive the same qualified operand from more than one place. */
public final class RedundantOutputDetector extends ErrorCollectingAnalysis {
  private static final Logger logger = Logger.getLogger(RedundantOutputDetector.class.getName());

  static final String OTE = "OTE";

  @AutoValue
  public abstract static class Result {
    // Qualified instruction text to each place it occurs; only texts seen at least twice.
    public abstract ImmutableListMultimap<String, Instruction.Report> redundantOutputs();

    public abstract ImmutableList<LadderException> errors();
  }

  public RedundantOutputDetector(Controller controller) {
    super(controller);
  }

  public Result run() {
    logger.info("Finding redundant OTEs...");

    Map<String, List<Instruction>> byQualifiedText = new LinkedHashMap<>();
    for (Instruction instruction : controller.instructions()) {
      if (!instruction.name().equals(OTE)) continue;
      try {
        byQualifiedText
            .computeIfAbsent(instruction.qualifiedMetaData(), k -> new ArrayList<>())
            .add(instruction);
      } catch (LadderException ex) {
        logError(ex);
      }
    }

    ImmutableListMultimap.Builder<String, Instruction.Report> redundant =
        ImmutableListMultimap.builder();
    byQualifiedText.forEach(
        (text, instructions) -> {
          if (instructions.size() < 2) return;
          instructions.forEach(i -> redundant.put(text, i.report()));
        });

    Result result = new AutoValue_RedundantOutputDetector_Result(redundant.build(), errors());
    logger.log(
        Level.FINE, "{0} outputs driven more than once", result.redundantOutputs().keySet().size());
    return result;
  }
}
