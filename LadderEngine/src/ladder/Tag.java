package ladder;

import java.util.Optional;

/** A named tag, possibly an alias for another tag with an optional member path. */
public final class Tag implements Named {
  private final String name;
  private final Optional<String> aliasFor;
  private final HasTags container;

  Tag(String name, Optional<String> aliasFor, HasTags container) {
    this.name = name;
    this.aliasFor = aliasFor.filter(a -> !a.isEmpty());
    this.container = container;
  }

  @Override
  public String name() {
    return name;
  }

  public Optional<String> aliasFor() {
    return aliasFor;
  }

  public boolean isAlias() {
    return aliasFor.isPresent();
  }

  // The tag name an alias points at, without member path or array index.
  public Optional<String> aliasForBaseName() {
    return aliasFor.map(Tag::baseNameOf);
  }

  // Whatever follows the base name in the alias target, e.g. ".Sub" for "A.Sub".
  public String aliasForPath() {
    return aliasFor.map(a -> a.substring(baseNameOf(a).length())).orElse("");
  }

  public HasTags container() {
    return container;
  }

  public TagScope scope() {
    return container.tagScope();
  }

  // Text before the first member separator or array index.
  static String baseNameOf(String reference) {
    int end = reference.length();
    for (char delimiter : new char[] {'.', '['}) {
      int i = reference.indexOf(delimiter);
      if (i != -1 && i < end) end = i;
    }
    return reference.substring(0, end);
  }

  @Override
  public String toString() {
    return aliasFor.map(a -> name + " -> " + a).orElse(name);
  }
}
