package ladder;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class OperandTest {

  private Controller controller;
  private Program program;
  private Routine routine;

  @BeforeEach
  public void setUp() {
    controller = ControllerFactory.create(ControllerType.GENERIC, "PLC");
    controller.addTag("A");
    controller.addAlias("B", "A.Sub");
    controller.addAlias("Dangling", "Nowhere.Member");

    program = controller.addProgram("Prog");
    program.addTag("Local");
    program.addAlias("LocalAlias", "B.Deep");
    routine = program.addRoutine("Main");
  }

  private Operand operand(String instructionText) {
    return routine.addRung(instructionText).instructions().get(0).operands().get(0);
  }

  @Test
  public void baseAndTrailingNames() {
    Operand operand = operand("XIC(Array[2].Member)");

    assertThat(operand.baseName()).isEqualTo("Array");
    assertThat(operand.trailingName()).isEqualTo("[2].Member");
    assertThat(operand.parents()).containsExactly("Array[2].Member", "Array[2]").inOrder();
  }

  @Test
  public void unknownTagIsLeftAlone() throws LadderException {
    Operand operand = operand("XIC(Ghost.X)");

    assertThat(operand.firstTag().isPresent()).isFalse();
    assertThat(operand.baseTag().isPresent()).isFalse();
    assertThat(operand.asAliased()).isEqualTo("Ghost.X");
    assertThat(operand.asQualified()).isEqualTo("Ghost.X");
    assertThat(operand.qualifiedParents()).containsExactly("Ghost.X", "Ghost").inOrder();
  }

  @Test
  public void aliasWithMemberPath() throws LadderException {
    Operand operand = operand("XIC(B.Field)");

    assertThat(operand.firstTag().get().name()).isEqualTo("B");
    assertThat(operand.baseTag().get().name()).isEqualTo("A");
    assertThat(operand.asAliased()).isEqualTo("A.Sub.Field");
    assertThat(operand.asQualified()).isEqualTo("A.Sub.Field");
    assertThat(operand.aliasedParents()).containsExactly("A.Sub.Field", "A.Sub", "A").inOrder();
  }

  @Test
  public void programTagIsQualified() throws LadderException {
    Operand operand = operand("OTE(Local.Bit)");

    assertThat(operand.firstTag().get().scope()).isEqualTo(TagScope.PROGRAM);
    assertThat(operand.asAliased()).isEqualTo("Local.Bit");
    assertThat(operand.asQualified()).isEqualTo("Program:Prog.Local.Bit");
    assertThat(operand.qualifiedParents())
        .containsExactly("Program:Prog.Local.Bit", "Program:Prog.Local")
        .inOrder();
  }

  @Test
  public void programAliasResolvesThroughControllerScope() throws LadderException {
    Operand operand = operand("XIC(LocalAlias.X)");

    assertThat(operand.baseTag().get().name()).isEqualTo("A");
    assertThat(operand.asAliased()).isEqualTo("A.Sub.Deep.X");
    // The base tag is controller scoped, so no program prefix.
    assertThat(operand.asQualified()).isEqualTo("A.Sub.Deep.X");
  }

  @Test
  public void programTagShadowsControllerTag() throws LadderException {
    program.addTag("A");
    Operand operand = operand("XIC(A.Bit)");

    assertThat(operand.firstTag().get().container()).isSameInstanceAs(program);
    assertThat(operand.asQualified()).isEqualTo("Program:Prog.A.Bit");
  }

  @Test
  public void missingAliasTargetEndsTheChain() throws LadderException {
    Operand operand = operand("XIC(Dangling.Bit)");

    assertThat(operand.baseTag().get().name()).isEqualTo("Dangling");
    assertThat(operand.asAliased()).isEqualTo("Nowhere.Member.Bit");
  }

  @Test
  public void aliasChainWithinHopLimit() throws LadderException {
    for (int i = 0; i < 5; i++) {
      controller.addAlias("L" + i, "L" + (i + 1));
    }
    controller.addTag("L5");

    assertThat(operand("XIC(L0.Bit)").asAliased()).isEqualTo("L5.Bit");
  }

  @Test
  public void aliasChainBeyondHopLimit() {
    Controller limited =
        ControllerFactory.create(
            ControllerType.GENERIC, "PLC", EngineConfig.builder().setAliasHopLimit(3).build());
    for (int i = 0; i < 5; i++) {
      limited.addAlias("L" + i, "L" + (i + 1));
    }
    limited.addTag("L5");
    Operand operand =
        limited
            .addProgram("Prog")
            .addRoutine("Main")
            .addRung("XIC(L0)")
            .instructions()
            .get(0)
            .operands()
            .get(0);

    AliasDepthExceededException ex =
        assertThrows(AliasDepthExceededException.class, operand::asAliased);
    assertThat(ex.kind()).isEqualTo(LadderException.Kind.ALIAS_DEPTH);
    assertThat(ex.tagName()).isEqualTo("L0");
    assertThat(ex.hopLimit()).isEqualTo(3);
    assertThrows(AliasDepthExceededException.class, operand::baseTag);
  }

  @Test
  public void aliasCycleTerminates() {
    controller.addAlias("X", "Y.Member");
    controller.addAlias("Y", "X");
    Operand operand = operand("XIC(X)");

    assertThrows(AliasDepthExceededException.class, operand::asQualified);
    assertThrows(AliasDepthExceededException.class, operand::qualifiedParents);
  }

  @Test
  public void reportRecord() throws LadderException {
    routine.addRung("XIC(Start)");
    Operand operand = operand("MOV(B.Field,Local)");

    Operand.Report report = operand.report();

    assertThat(report.baseOperand()).isEqualTo("B.Field");
    assertThat(report.aliasedOperand()).isEqualTo("A.Sub.Field");
    assertThat(report.qualifiedOperand()).isEqualTo("A.Sub.Field");
    assertThat(report.argPosition()).isEqualTo(0);
    assertThat(report.instruction()).isEqualTo("MOV(B.Field,Local)");
    assertThat(report.instructionType()).isEqualTo(InstructionType.INPUT);
    assertThat(report.program()).isEqualTo(Optional.of("Prog"));
    assertThat(report.routine()).isEqualTo(Optional.of("Main"));
    assertThat(report.rung()).isEqualTo(Optional.of(1));
  }

  @Test
  public void qualifiedInstructionText() throws LadderException {
    Instruction instruction = routine.addRung("MOV(B.Field,Local)").instructions().get(0);

    assertThat(instruction.aliasedMetaData()).isEqualTo("MOV(A.Sub.Field,Local)");
    assertThat(instruction.qualifiedMetaData()).isEqualTo("MOV(A.Sub.Field,Program:Prog.Local)");
  }

  @Test
  public void operandWithoutRungUsesDefaults() throws LadderException {
    Operand operand = Instruction.parse("XIC(A.B.C)").operands().get(0);

    assertThat(operand.container().isPresent()).isFalse();
    assertThat(operand.asQualified()).isEqualTo("A.B.C");
    assertThat(operand.parents()).containsExactly("A.B.C", "A.B", "A").inOrder();
  }
}
