package ladder;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Base of the controller-wide analyses. A failure on one operand is recorded and the analysis goes
 * on with the next one.
 */
abstract class ErrorCollectingAnalysis {
  private final List<LadderException> errors = new ArrayList<>();

  protected final Controller controller;

  protected ErrorCollectingAnalysis(Controller controller) {
    this.controller = controller;
  }

  public ImmutableList<LadderException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(LadderException ex) {
    errors.add(ex);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public void printErrors() {
    errors.stream().forEach(LadderException::print);
  }
}
