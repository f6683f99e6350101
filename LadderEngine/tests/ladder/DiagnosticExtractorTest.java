package ladder;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class DiagnosticExtractorTest {

  private static Routine routine(Controller controller) {
    return controller.addProgram("Station").addRoutine("Diag");
  }

  private static Rung addRung(Routine routine, String text, String comment) {
    return routine.addRung(new Rung(text, comment));
  }

  @Test
  public void parseEntry() {
    Rung rung = new Rung("XIC(A)");

    DiagnosticMessage alarm =
        DiagnosticMessage.parse("prefix <Alarm[12]: Motor overload> suffix", rung).get();
    assertThat(alarm.text()).isEqualTo("<Alarm[12]: Motor overload>");
    assertThat(alarm.textListId()).isEqualTo("Alarm");
    assertThat(alarm.number()).isEqualTo(12);
    assertThat(alarm.message()).isEqualTo("Motor overload");
    assertThat(alarm.type()).isEqualTo(DiagnosticMessage.Type.ALARM);
    assertThat(alarm.rung()).isSameInstanceAs(rung);

    DiagnosticMessage value = DiagnosticMessage.parse("<Speed[1] Value is @V1>", rung).get();
    assertThat(value.type()).isEqualTo(DiagnosticMessage.Type.VALUE);
    assertThat(value.message()).isEqualTo("Value is @V1");

    assertThat(DiagnosticMessage.parse("no entry here", rung).isPresent()).isFalse();
    assertThat(DiagnosticMessage.parse("<Alarm[]: missing number>", rung).isPresent()).isFalse();
  }

  @Test
  public void gmControllerFindsMarkedAndCallingRungs() {
    Controller controller = ControllerFactory.create(ControllerType.GM, "PLC");
    Routine routine = routine(controller);
    Rung marked =
        addRung(
            routine,
            "XIC(A)OTE(B)",
            "<@DIAG>\n<Alarm[12]: Motor overload>\n<Prompt[3]: Press start>");
    Rung calling =
        addRung(routine, "JSR(zZ999_Diagnostics,0)", "<Alarm[12]: Motor overload again>");
    addRung(routine, "XIC(C)OTE(D)", "<Alarm[13]: Not diagnostic>");
    Rung value = addRung(routine, "XIC(E)", "<@DIAG>\n<Speed[1] Value is @V1>");

    DiagnosticReport report = controller.extractDiagnostics();

    assertThat(report.diagnosticRungs()).containsExactly(marked, calling, value).inOrder();
    assertThat(report.messagesByTextList().keySet())
        .containsExactly("Alarm", "Prompt", "Speed")
        .inOrder();
    assertThat(report.messagesByTextList().get("Alarm")).hasSize(2);
    assertThat(report.messagesByTextList().get("Prompt").get(0).type())
        .isEqualTo(DiagnosticMessage.Type.PROMPT);
    assertThat(report.messages()).hasSize(4);

    assertThat(report.hasDuplicates()).isTrue();
    assertThat(report.duplicates()).hasSize(1);
    assertThat(report.duplicates().get(0).message()).isEqualTo("Motor overload again");
    assertThat(report.duplicates().get(0).rung()).isSameInstanceAs(calling);
  }

  @Test
  public void genericControllerOnlyUsesMarker() {
    Controller controller = ControllerFactory.create(ControllerType.GENERIC, "PLC");
    Routine routine = routine(controller);
    Rung marked = addRung(routine, "XIC(A)OTE(B)", "<@DIAG>");
    addRung(routine, "JSR(zZ999_Diagnostics,0)", "<Alarm[1]: Not collected>");

    DiagnosticExtractor extractor = new DiagnosticExtractor(controller);

    assertThat(extractor.findDiagnosticRungs()).containsExactly(marked);
    assertThat(extractor.run().messages()).isEmpty();
  }

  @Test
  public void customMarker() {
    Controller controller =
        ControllerFactory.create(
            ControllerType.GENERIC,
            "PLC",
            EngineConfig.builder().setDiagnosticMarker("#diag").build());
    Routine routine = routine(controller);
    addRung(routine, "XIC(A)", "<@DIAG>");
    Rung marked = addRung(routine, "XIC(B)", "#diag\n<Alarm[2]: Door open>");

    DiagnosticReport report = controller.extractDiagnostics();

    assertThat(report.diagnosticRungs()).containsExactly(marked);
    assertThat(report.messages()).hasSize(1);
    assertThat(report.hasDuplicates()).isFalse();
  }

  @Test
  public void oversizedEntryNumberIsNotAnEntry() {
    Controller controller = ControllerFactory.create(ControllerType.GENERIC, "PLC");
    Routine routine = routine(controller);
    Rung rung =
        addRung(routine, "XIC(A)", "<@DIAG>\n<Alarm[99999999999]: overflow>\n<Alarm[7]: ok>");

    DiagnosticReport report = controller.extractDiagnostics();

    assertThat(report.diagnosticRungs()).containsExactly(rung);
    assertThat(report.messages()).hasSize(1);
    assertThat(report.messages().get(0).number()).isEqualTo(7);
    assertThat(DiagnosticMessage.parse("<Alarm[999999999]: max>", rung).get().number())
        .isEqualTo(999999999);
  }

  @Test
  public void extractMessagesPerRung() {
    Rung rung = new Rung("XIC(A)", "<Alarm[1]: One>\nplain text\n<Alarm[2]: Two>");

    ImmutableList<DiagnosticMessage> messages =
        new DiagnosticExtractor(ControllerFactory.create(ControllerType.GENERIC, "PLC"))
            .extractMessages(rung);

    assertThat(messages).hasSize(2);
    assertThat(messages.get(1).number()).isEqualTo(2);
  }
}
