package ladder;

/**
 * Raised when following a tag's alias chain takes more hops than the configured limit. This points
 * at a cyclic or corrupt alias definition in the project, not at a missing tag.
 */
public class AliasDepthExceededException extends LadderException {
  private static final long serialVersionUID = 1L;

  private final String tagName;
  private final int hopLimit;

  public AliasDepthExceededException(String tagName, int hopLimit) {
    super(
        Kind.ALIAS_DEPTH,
        String.format("alias chain of '%s' exceeds %d hops; is it cyclic?", tagName, hopLimit));
    this.tagName = tagName;
    this.hopLimit = hopLimit;
  }

  public String tagName() {
    return tagName;
  }

  public int hopLimit() {
    return hopLimit;
  }
}
