package ladder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/**
 * Collects the diagnostic messages kept in rung comments.
 *
 * <p>A rung is diagnostic when its comment carries the configured marker, or, when a diagnostic
 * routine is configured, when it calls that routine.
 */
public final class DiagnosticExtractor {
  private static final Logger logger = Logger.getLogger(DiagnosticExtractor.class.getName());

  private final Controller controller;

  public DiagnosticExtractor(Controller controller) {
    this.controller = controller;
  }

  public ImmutableList<Rung> findDiagnosticRungs() {
    logger.info("Finding diagnostic rungs...");
    EngineConfig config = controller.config();
    Optional<String> routineName = config.diagnosticRoutineName();

    ImmutableList<Rung> rungs =
        controller
            .programs()
            .stream()
            .flatMap(p -> p.rungs().stream())
            .filter(
                r ->
                    r.comment().contains(config.diagnosticMarker())
                        || (routineName.isPresent() && r.hasJsrTo(routineName.get())))
            .collect(ImmutableList.toImmutableList());
    logger.log(Level.FINE, "{0} diagnostic rungs", rungs.size());
    return rungs;
  }

  public ImmutableList<DiagnosticMessage> extractMessages(Rung rung) {
    ImmutableList.Builder<DiagnosticMessage> messages = ImmutableList.builder();
    for (String line : rung.commentLines()) {
      DiagnosticMessage.parse(line, rung).ifPresent(messages::add);
    }
    return messages.build();
  }

  public DiagnosticReport run() {
    ImmutableList<Rung> rungs = findDiagnosticRungs();

    ImmutableListMultimap.Builder<String, DiagnosticMessage> byTextList =
        ImmutableListMultimap.builder();
    List<DiagnosticMessage> seen = new ArrayList<>();
    ImmutableList.Builder<DiagnosticMessage> duplicates = ImmutableList.builder();
    for (Rung rung : rungs) {
      for (DiagnosticMessage message : extractMessages(rung)) {
        byTextList.put(message.textListId(), message);
        if (seen.stream().anyMatch(message::sameEntryAs)) {
          duplicates.add(message);
        } else {
          seen.add(message);
        }
      }
    }

    DiagnosticReport report =
        DiagnosticReport.create(rungs, byTextList.build(), duplicates.build());
    logger.log(
        Level.FINE,
        "{0} diagnostic messages, {1} duplicates",
        new Object[] {report.messages().size(), report.duplicates().size()});
    return report;
  }
}
