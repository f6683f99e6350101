package ladder;

import java.util.Optional;

/** Something that owns a tag table: the controller, a program or an add-on instruction. */
public interface HasTags extends Named {
  NamedCollection<Tag> tags();

  TagScope tagScope();

  Optional<Controller> controller();

  default Optional<Tag> lookupTag(String name) {
    return tags().get(name);
  }

  default Tag addTag(String name) {
    return tags().add(new Tag(name, Optional.empty(), this));
  }

  default Tag addAlias(String name, String aliasFor) {
    return tags().add(new Tag(name, Optional.of(aliasFor), this));
  }
}
