package ladder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.io.Files;

/**
 * Reads a file of rung texts, one rung per line, into a single-program controller and prints its
 * structure and the controller-level reports.
 */
public class LadderMain {
  private static final Logger logger = Logger.getLogger(LadderMain.class.getName());

  static final String PROGRAM_NAME = "MainProgram";
  static final String ROUTINE_NAME = "MainRoutine";

  public static void main(String[] args) {
    EngineConfig config = EngineConfig.defaults();
    String rungFile;
    if (args.length == 3 && args[0].equals("-c")) {
      try {
        config = EngineConfig.load(new File(args[1]));
      } catch (LadderException ex) {
        ex.print();
        System.exit(1);
        return;
      } catch (IOException ex) {
        System.err.println("Could not read configuration: " + ex.getMessage());
        System.exit(1);
        return;
      }
      rungFile = args[2];
    } else if (args.length == 1) {
      rungFile = args[0];
    } else {
      System.err.println("Usage: $LADDER [-c config.json] rungs_file");
      System.exit(1);
      return;
    }

    List<String> lines;
    try {
      lines = Files.asCharSource(new File(rungFile), StandardCharsets.UTF_8).readLines();
    } catch (IOException ex) {
      System.err.println("Could not read rungs: " + ex.getMessage());
      System.exit(1);
      return;
    }

    Controller controller = load(config, lines);
    logger.info("Loaded " + controller.rungs().size() + " rungs from " + rungFile);

    for (Rung rung : controller.rungs()) {
      System.out.println(
          String.format(
              "Rung %d: %d instructions, %d branches, max depth %d%s",
              rung.number(),
              rung.instructionCount(),
              rung.branchCount(),
              rung.maxBranchDepth(),
              rung.validateBranchStructure() ? "" : ", UNBALANCED BRANCHES"));
    }

    UnpairedInputDetector.Result unpaired = controller.findUnpairedInputs();
    printReport("Unpaired inputs", unpaired.unpairedInputs().asMap());
    unpaired.errors().forEach(LadderException::print);

    RedundantOutputDetector.Result redundant = controller.findRedundantOutputs();
    printReport("Redundant outputs", redundant.redundantOutputs().asMap());
    redundant.errors().forEach(LadderException::print);
  }

  static Controller load(EngineConfig config, List<String> lines) {
    Controller controller = ControllerFactory.create(ControllerType.GENERIC, "Controller", config);
    Routine routine = controller.addProgram(PROGRAM_NAME).addRoutine(ROUTINE_NAME);
    lines.stream().map(String::trim).filter(l -> !l.isEmpty()).forEach(routine::addRung);
    return controller;
  }

  private static <T> void printReport(String title, Map<String, ? extends Collection<T>> report) {
    System.out.println(title + ": " + report.size());
    report.forEach(
        (key, entries) -> {
          System.out.println("  " + key);
          entries.forEach(e -> System.out.println("    " + e));
        });
  }
}
