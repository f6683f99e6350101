package ladder;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Follows alias chains from a tag to the tag that actually holds the data.
 *
 * <p>Names resolve in the scope that asks first and fall back to controller scope. Every chain is
 * bounded by a hop limit so that a cyclic alias definition fails instead of looping.
 */
public final class AliasResolver {
  private final int hopLimit;

  public AliasResolver(int hopLimit) {
    Preconditions.checkArgument(hopLimit > 0, "hop limit must be positive: %s", hopLimit);
    this.hopLimit = hopLimit;
  }

  public int hopLimit() {
    return hopLimit;
  }

  public Optional<Tag> lookup(String name, Optional<? extends HasTags> scope) {
    Optional<Tag> local = scope.flatMap(s -> s.lookupTag(name));
    if (local.isPresent()) return local;

    return scope.flatMap(HasTags::controller).flatMap(c -> c.lookupTag(name));
  }

  // The tag an alias points at directly, if it can be found.
  public Optional<Tag> parentTag(Tag tag) {
    if (!tag.isAlias()) return Optional.empty();
    return lookup(tag.aliasForBaseName().get(), Optional.of(tag.container()));
  }

  /**
   * The last tag of the alias chain starting at {@code tag}. A chain whose next link cannot be
   * found ends at the last tag that was found.
   */
  public Tag baseTag(Tag tag) throws AliasDepthExceededException {
    Tag current = tag;
    int hops = 0;
    while (current.isAlias()) {
      Optional<Tag> parent = parentTag(current);
      if (!parent.isPresent()) return current;

      if (++hops > hopLimit) throw new AliasDepthExceededException(tag.name(), hopLimit);
      current = parent.get();
    }
    return current;
  }

  /**
   * Spells out {@code tag} followed by {@code path} in terms of the base tag, collecting the member
   * path of every alias on the way.
   */
  public String aliasString(Tag tag, String path) throws AliasDepthExceededException {
    Tag current = tag;
    String collected = path;
    int hops = 0;
    while (current.isAlias()) {
      Optional<Tag> parent = parentTag(current);
      if (!parent.isPresent()) return current.aliasFor().get() + collected;

      collected = current.aliasForPath() + collected;
      if (++hops > hopLimit) throw new AliasDepthExceededException(tag.name(), hopLimit);
      current = parent.get();
    }
    return current.name() + collected;
  }
}
