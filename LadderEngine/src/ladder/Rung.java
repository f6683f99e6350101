package ladder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Splitter;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;

/**
 * One line of ladder logic.
 *
 * <p>The text is the source of truth. Tokens, sequence, instructions and branches are derived from
 * it on first use and thrown away whenever the text changes. Every mutation builds the complete new
 * token list first and assigns the text once, so a mutation that fails leaves the rung untouched.
 */
public final class Rung {
  public static final String DEFAULT_TYPE = "N";

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private int number = 0;
  private String type = DEFAULT_TYPE;
  private String comment;
  private String text;
  private Optional<Routine> routine = Optional.empty();

  private RungSequenceBuilder.Structure structure = null;

  public Rung(String text) {
    this(text, "");
  }

  public Rung(String text, String comment) {
    this.text = text == null ? "" : text;
    this.comment = comment == null ? "" : comment;
  }

  public int number() {
    return number;
  }

  void setNumber(int number) {
    this.number = number;
  }

  public String type() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String comment() {
    return comment;
  }

  public void setComment(String comment) {
    this.comment = comment == null ? "" : comment;
  }

  public ImmutableList<String> commentLines() {
    if (comment.isEmpty()) return ImmutableList.of();
    return ImmutableList.copyOf(LINE_SPLITTER.split(comment));
  }

  public String text() {
    return text;
  }

  public void setText(String text) {
    this.text = text == null ? "" : text;
    this.structure = null;
  }

  public Optional<Routine> routine() {
    return routine;
  }

  void setRoutine(Optional<Routine> routine) {
    this.routine = routine;
    this.structure = null;
  }

  public Optional<LogicContainer> container() {
    return routine.map(Routine::container);
  }

  public Optional<Controller> controller() {
    return container().flatMap(HasTags::controller);
  }

  private RungSequenceBuilder.Structure structure() {
    if (structure == null) {
      ImmutableList<RungToken> tokens = RungTokenizer.tokenize(text);
      structure =
          tokens.isEmpty()
              ? RungSequenceBuilder.Structure.empty()
              : RungSequenceBuilder.build(tokens, Optional.of(this));
    }
    return structure;
  }

  // ---------------------------------------------------------------------------------------------
  // Reading

  public ImmutableList<RungToken> tokens() {
    return structure().tokens();
  }

  public ImmutableList<RungElement> sequence() {
    return structure().sequence();
  }

  public ImmutableList<Instruction> instructions() {
    return structure().instructions();
  }

  /** Branches by id, in the order their '[' appears. */
  public ImmutableMap<String, Branch> branches() {
    return structure().branches();
  }

  public int instructionCount() {
    return instructions().size();
  }

  public int branchCount() {
    return branches().size();
  }

  public boolean hasBranches() {
    return !branches().isEmpty();
  }

  public boolean hasInstruction(String instructionText) {
    return !findInstructionPositions(instructionText).isEmpty();
  }

  /** Sequence positions of every instruction whose text is exactly {@code instructionText}. */
  public ImmutableList<Integer> findInstructionPositions(String instructionText) {
    return sequence()
        .stream()
        .filter(e -> e.instruction().map(i -> i.metaData().equals(instructionText)).orElse(false))
        .map(RungElement::position)
        .collect(ImmutableList.toImmutableList());
  }

  public Instruction instructionAt(int index) throws LadderException {
    if (index < 0 || index >= instructionCount())
      throw LadderException.range(
          "instruction index %d out of range 0..%d", index, instructionCount() - 1);
    return instructions().get(index);
  }

  public RungElement elementAt(int position) throws LadderException {
    checkPosition(position);
    return sequence().get(position);
  }

  public Branch branch(String branchId) throws LadderException {
    Branch branch = branches().get(branchId);
    if (branch == null) throw LadderException.lookup("branch '%s' not found in rung", branchId);
    return branch;
  }

  /** Every instruction between the branch's brackets, nested branches included. */
  public ImmutableList<Instruction> branchInstructions(String branchId) throws LadderException {
    Branch branch = branch(branchId);
    return sequence()
        .stream()
        .filter(e -> e.isInstruction() && branch.encloses(e.position(), sequence().size()))
        .map(e -> e.instruction().get())
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Instruction> mainLineInstructions() {
    return sequence()
        .stream()
        .filter(e -> e.isInstruction() && !e.branchId().isPresent())
        .map(e -> e.instruction().get())
        .collect(ImmutableList.toImmutableList());
  }

  // Instruction names with how often each is used, in order of first use.
  public ImmutableMultiset<String> instructionSummary() {
    return instructions()
        .stream()
        .map(Instruction::name)
        .collect(ImmutableMultiset.toImmutableMultiset());
  }

  /**
   * Instructions named {@code name} (if given) having an operand whose text contains {@code
   * operandFragment} (if given).
   */
  public ImmutableList<Instruction> instructions(
      Optional<String> name, Optional<String> operandFragment) {
    return instructions()
        .stream()
        .filter(i -> !name.isPresent() || i.name().equals(name.get()))
        .filter(
            i ->
                !operandFragment.isPresent()
                    || i.operands()
                        .stream()
                        .anyMatch(o -> o.metaData().contains(operandFragment.get())))
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Instruction> inputInstructions() {
    return instructions()
        .stream()
        .filter(i -> i.type() == InstructionType.INPUT)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Instruction> outputInstructions() {
    return instructions()
        .stream()
        .filter(i -> i.type() == InstructionType.OUTPUT)
        .collect(ImmutableList.toImmutableList());
  }

  /** Whether this rung calls {@code JSR(<routineName>,...)}. */
  public boolean hasJsrTo(String routineName) {
    return instructions()
        .stream()
        .anyMatch(
            i ->
                i.type() == InstructionType.JSR
                    && !i.arguments().isEmpty()
                    && i.arguments().get(0).trim().equals(routineName));
  }

  // ---------------------------------------------------------------------------------------------
  // Structure

  /** Whether every '[' is closed by a later ']' and no ']' closes nothing. */
  public boolean validateBranchStructure() {
    int depth = 0;
    for (RungToken token : RungTokenizer.branchMarkers(text)) {
      if (token.type() == RungToken.Type.BRANCH_START) {
        depth++;
      } else if (token.type() == RungToken.Type.BRANCH_END && --depth < 0) {
        return false;
      }
    }
    return depth == 0;
  }

  /** How many branches enclose the element at {@code position}; 0 on the main line. */
  public int branchNestingLevel(int position) throws LadderException {
    checkPosition(position);
    int size = sequence().size();
    return (int) branches().values().stream().filter(b -> b.encloses(position, size)).count();
  }

  public int maxBranchDepth() {
    int max = 0;
    for (Branch branch : branches().values()) {
      int depth = 1;
      for (Optional<String> parent = branch.parentBranchId();
          parent.isPresent();
          parent = branches().get(parent.get()).parentBranchId()) {
        depth++;
      }
      max = Math.max(max, depth);
    }
    return max;
  }

  /** The position of the ']' matching the '[' at {@code startPosition}, if there is one. */
  public Optional<Integer> findMatchingBranchEnd(int startPosition) throws LadderException {
    checkPosition(startPosition);
    ImmutableList<RungToken> tokens = tokens();
    if (tokens.get(startPosition).type() != RungToken.Type.BRANCH_START)
      throw LadderException.range("position %d is not a branch start", startPosition);

    int depth = 0;
    for (int i = startPosition; i < tokens.size(); i++) {
      RungToken.Type type = tokens.get(i).type();
      if (type == RungToken.Type.BRANCH_START) {
        depth++;
      } else if (type == RungToken.Type.BRANCH_END && --depth == 0) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  // ---------------------------------------------------------------------------------------------
  // Instruction mutations

  public void addInstruction(String instructionText) throws LadderException {
    addInstruction(instructionText, tokens().size());
  }

  /** Inserts {@code instructionText} so that it ends up at sequence {@code position}. */
  public void addInstruction(String instructionText, int position) throws LadderException {
    InstructionParser.validate(instructionText);
    List<String> tokens = tokenTexts();
    if (position < 0 || position > tokens.size())
      throw LadderException.range("position %d out of range 0..%d", position, tokens.size());

    tokens.add(position, instructionText);
    assign(tokens);
  }

  public void removeInstruction(Instruction instruction) throws LadderException {
    removeAt(locate(instruction));
  }

  public void removeInstruction(String instructionText) throws LadderException {
    removeInstruction(instructionText, 0);
  }

  // Occurrences count from 0 in text order.
  public void removeInstruction(String instructionText, int occurrence) throws LadderException {
    removeAt(locate(instructionText, occurrence));
  }

  public void removeInstruction(int position) throws LadderException {
    removeAt(locate(position));
  }

  public void replaceInstruction(Instruction instruction, String newText) throws LadderException {
    InstructionParser.validate(newText);
    replaceAt(locate(instruction), newText);
  }

  public void replaceInstruction(String instructionText, String newText) throws LadderException {
    replaceInstruction(instructionText, 0, newText);
  }

  public void replaceInstruction(String instructionText, int occurrence, String newText)
      throws LadderException {
    InstructionParser.validate(newText);
    replaceAt(locate(instructionText, occurrence), newText);
  }

  public void replaceInstruction(int position, String newText) throws LadderException {
    InstructionParser.validate(newText);
    replaceAt(locate(position), newText);
  }

  public void moveInstruction(Instruction instruction, int newPosition) throws LadderException {
    moveTo(locate(instruction), newPosition);
  }

  public void moveInstruction(String instructionText, int newPosition) throws LadderException {
    moveInstruction(instructionText, 0, newPosition);
  }

  public void moveInstruction(String instructionText, int occurrence, int newPosition)
      throws LadderException {
    moveTo(locate(instructionText, occurrence), newPosition);
  }

  public void moveInstruction(int position, int newPosition) throws LadderException {
    moveTo(locate(position), newPosition);
  }

  private void removeAt(int position) {
    List<String> tokens = tokenTexts();
    tokens.remove(position);
    assign(tokens);
  }

  private void replaceAt(int position, String newText) {
    List<String> tokens = tokenTexts();
    tokens.set(position, newText);
    assign(tokens);
  }

  private void moveTo(int position, int newPosition) throws LadderException {
    List<String> tokens = tokenTexts();
    if (newPosition < 0 || newPosition >= tokens.size())
      throw LadderException.range(
          "new position %d out of range 0..%d", newPosition, tokens.size() - 1);
    if (position == newPosition) return;

    String moved = tokens.remove(position);
    tokens.add(newPosition, moved);
    assign(tokens);
  }

  // Identity first, so that duplicates resolve to the instruction actually passed in.
  private int locate(Instruction instruction) throws LadderException {
    checkHasInstructions();
    for (RungElement element : sequence()) {
      if (element.instruction().filter(i -> i == instruction).isPresent()) {
        return element.position();
      }
    }
    return locate(instruction.metaData(), 0);
  }

  private int locate(String instructionText, int occurrence) throws LadderException {
    checkHasInstructions();
    ImmutableList<Integer> positions = findInstructionPositions(instructionText);
    if (occurrence < 0 || occurrence >= positions.size())
      throw LadderException.lookup(
          "instruction '%s' (occurrence %d) not found in rung", instructionText, occurrence);
    return positions.get(occurrence);
  }

  private int locate(int position) throws LadderException {
    checkHasInstructions();
    if (!elementAt(position).isInstruction())
      throw LadderException.lookup("no instruction at position %d", position);
    return position;
  }

  private void checkHasInstructions() throws LadderException {
    if (instructions().isEmpty()) throw LadderException.lookup("rung has no instructions");
  }

  // ---------------------------------------------------------------------------------------------
  // Branch mutations

  /** Wraps the elements at positions {@code start..end} (inclusive) in a new two-leg branch. */
  public String insertBranch(int start, int end) throws LadderException {
    return insertBranch(start, end, ImmutableList.of());
  }

  /**
   * Wraps the elements at positions {@code start..end} (inclusive) in a new branch whose second leg
   * holds {@code legInstructions}. Returns the new branch's id.
   */
  public String insertBranch(int start, int end, List<String> legInstructions)
      throws LadderException {
    for (String instruction : legInstructions) {
      InstructionParser.validate(instruction);
    }
    assign(wrap(tokenTexts(), start, end, legInstructions));
    return branchIdAt(start);
  }

  /** Wraps the instructions with indices {@code startIndex..endIndex} (inclusive) in a branch. */
  public String wrapInstructionsInBranch(int startIndex, int endIndex) throws LadderException {
    if (startIndex > endIndex)
      throw LadderException.range("start index %d is after end index %d", startIndex, endIndex);
    int start = positionOf(instructionAt(startIndex));
    int end = positionOf(instructionAt(endIndex));
    return insertBranch(start, end);
  }

  /**
   * Deletes a branch. With {@code keepInstructions} only the branch's own delimiters go and its
   * contents join the enclosing line; otherwise everything between and including the brackets goes.
   */
  public void removeBranch(String branchId, boolean keepInstructions) throws LadderException {
    assign(withoutBranch(branch(branchId), keepInstructions));
  }

  /**
   * Moves a branch to wrap {@code newStart..newEnd}, positions counted after the branch has been
   * taken out. The branch's direct instructions go into the new branch's second leg; nested
   * branches are dropped.
   */
  public String moveBranch(String branchId, int newStart, int newEnd) throws LadderException {
    Branch branch = branch(branchId);
    ImmutableList<String> captured =
        branch
            .instructions()
            .stream()
            .map(Instruction::metaData)
            .collect(ImmutableList.toImmutableList());

    assign(wrap(withoutBranch(branch, false), newStart, newEnd, captured));
    return branchIdAt(newStart);
  }

  /**
   * Adds an empty leg to the branch whose '[' or ',' sits at {@code position}: a ',' goes in front
   * of the next delimiter of the same branch.
   */
  public void insertBranchLevel(int position) throws LadderException {
    checkPosition(position);
    List<String> tokens = tokenTexts();
    RungToken.Type type = tokens().get(position).type();
    if (type != RungToken.Type.BRANCH_START && type != RungToken.Type.BRANCH_NEXT)
      throw LadderException.lookup("position %d is not a branch start or branch next", position);

    int depth = 0;
    for (int i = position + 1; i < tokens.size(); i++) {
      RungToken.Type current = tokens().get(i).type();
      if (current == RungToken.Type.BRANCH_START) {
        depth++;
      } else if (current == RungToken.Type.BRANCH_END && depth > 0) {
        depth--;
      } else if (current.isBranchMarker() && depth == 0) {
        tokens.add(i, RungToken.Type.BRANCH_NEXT.delimiter());
        assign(tokens);
        return;
      }
    }
    throw LadderException.grammarAt(
        tokens().get(position).offset(), "branch at position %d is never closed", position);
  }

  private List<String> wrap(List<String> tokens, int start, int end, List<String> legInstructions)
      throws LadderException {
    if (start < 0 || end < 0)
      throw LadderException.range("branch positions must be non-negative: %d..%d", start, end);
    if (start > end) throw LadderException.range("branch start %d is after end %d", start, end);
    if (end >= tokens.size())
      throw LadderException.range("branch end %d out of range 0..%d", end, tokens.size() - 1);
    checkSelfContained(tokens.subList(start, end + 1), start, end);

    List<String> wrapped = new ArrayList<>(tokens.subList(0, start));
    wrapped.add(RungToken.Type.BRANCH_START.delimiter());
    wrapped.addAll(tokens.subList(start, end + 1));
    wrapped.add(RungToken.Type.BRANCH_NEXT.delimiter());
    wrapped.addAll(legInstructions);
    wrapped.add(RungToken.Type.BRANCH_END.delimiter());
    wrapped.addAll(tokens.subList(end + 1, tokens.size()));
    return wrapped;
  }

  // A range can only be wrapped if it neither splits a branch nor spans legs of one.
  private static void checkSelfContained(List<String> range, int start, int end)
      throws LadderException {
    int depth = 0;
    for (String token : range) {
      if (token.equals(RungToken.Type.BRANCH_START.delimiter())) {
        depth++;
      } else if (token.equals(RungToken.Type.BRANCH_END.delimiter())) {
        depth--;
      } else if (token.equals(RungToken.Type.BRANCH_NEXT.delimiter()) && depth == 0) {
        depth = -1;
      }
      if (depth < 0) break;
    }
    if (depth != 0)
      throw LadderException.grammar("positions %d..%d cut across a branch", start, end);
  }

  private List<String> withoutBranch(Branch branch, boolean keepInstructions)
      throws LadderException {
    if (!branch.isClosed())
      throw LadderException.grammarAt(
          tokens().get(branch.startPosition()).offset(),
          "branch '%s' is never closed",
          branch.id());

    int start = branch.startPosition();
    int end = branch.endPosition().get();
    Set<Integer> dropped = new HashSet<>();
    if (keepInstructions) {
      dropped.add(start);
      dropped.add(end);
      dropped.addAll(branch.nextPositions());
    } else {
      for (int i = start; i <= end; i++) dropped.add(i);
    }

    List<String> tokens = tokenTexts();
    List<String> remaining = new ArrayList<>();
    for (int i = 0; i < tokens.size(); i++) {
      if (!dropped.contains(i)) remaining.add(tokens.get(i));
    }
    return remaining;
  }

  private String branchIdAt(int position) {
    RungElement element = sequence().get(position);
    Verify.verify(element.type() == RungToken.Type.BRANCH_START, "expected '[' at %s", position);
    return element.branchId().get();
  }

  private int positionOf(Instruction instruction) {
    for (RungElement element : sequence()) {
      if (element.instruction().filter(i -> i == instruction).isPresent()) {
        return element.position();
      }
    }
    throw new AssertionError("instruction not in its own rung: " + instruction);
  }

  private void checkPosition(int position) throws LadderException {
    int size = sequence().size();
    if (position < 0 || position >= size)
      throw LadderException.range("position %d out of range 0..%d", position, size - 1);
  }

  private List<String> tokenTexts() {
    return new ArrayList<>(RungToken.texts(tokens()));
  }

  private void assign(List<String> tokens) {
    setText(RungToken.join(tokens));
  }

  @Override
  public String toString() {
    return number + ": " + text;
  }
}
