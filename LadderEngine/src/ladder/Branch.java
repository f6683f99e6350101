package ladder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** A bracketed set of parallel legs within a rung. */
public final class Branch {
  private final String id;
  private final int startPosition;
  private final Optional<Integer> endPosition;
  private final Optional<String> parentBranchId;
  private final ImmutableList<String> nestedBranchIds;
  private final ImmutableList<Integer> nextPositions;
  private final ImmutableList<ImmutableList<Instruction>> legs;

  private Branch(Builder builder) {
    this.id = builder.id;
    this.startPosition = builder.startPosition;
    this.endPosition = builder.endPosition;
    this.parentBranchId = builder.parentBranchId;
    this.nestedBranchIds = ImmutableList.copyOf(builder.nestedBranchIds);
    this.nextPositions = ImmutableList.copyOf(builder.nextPositions);
    this.legs =
        builder.legs.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList());
  }

  public String id() {
    return id;
  }

  // Position of the '['.
  public int startPosition() {
    return startPosition;
  }

  // Position of the matching ']', absent if the branch is never closed.
  public Optional<Integer> endPosition() {
    return endPosition;
  }

  public boolean isClosed() {
    return endPosition.isPresent();
  }

  public Optional<String> parentBranchId() {
    return parentBranchId;
  }

  public ImmutableList<String> nestedBranchIds() {
    return nestedBranchIds;
  }

  // Positions of this branch's own ',' delimiters.
  public ImmutableList<Integer> nextPositions() {
    return nextPositions;
  }

  /** Instructions directly on one of the legs; instructions of nested branches are excluded. */
  public ImmutableList<Instruction> instructions() {
    return legs.stream().flatMap(List::stream).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<ImmutableList<Instruction>> legs() {
    return legs;
  }

  /** Whether {@code position} lies strictly between this branch's brackets. */
  public boolean encloses(int position, int sequenceSize) {
    return position > startPosition && position < endPosition.orElse(sequenceSize);
  }

  @Override
  public String toString() {
    return id + "@" + startPosition + ".." + endPosition.map(String::valueOf).orElse("?");
  }

  static final class Builder {
    private final String id;
    private final int startPosition;
    private final Optional<String> parentBranchId;
    private final List<String> nestedBranchIds = new ArrayList<>();
    private final List<Integer> nextPositions = new ArrayList<>();
    private final List<List<Instruction>> legs = new ArrayList<>();
    private Optional<Integer> endPosition = Optional.empty();

    Builder(String id, int startPosition, Optional<String> parentBranchId) {
      this.id = id;
      this.startPosition = startPosition;
      this.parentBranchId = parentBranchId;
      this.legs.add(new ArrayList<>());
    }

    String id() {
      return id;
    }

    void consumeInstruction(Instruction instruction) {
      legs.get(legs.size() - 1).add(instruction);
    }

    void consumeNestedBranch(String nestedId) {
      nestedBranchIds.add(nestedId);
    }

    void consumeNext(int position) {
      nextPositions.add(position);
      legs.add(new ArrayList<>());
    }

    void close(int position) {
      endPosition = Optional.of(position);
    }

    Branch build() {
      return new Branch(this);
    }
  }
}
