package ladder;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** Objects keyed by name, iterated in insertion order. */
public final class NamedCollection<T extends Named> implements Iterable<T> {
  private final Map<String, T> byName = new LinkedHashMap<>();

  public T add(T item) {
    Preconditions.checkArgument(
        byName.putIfAbsent(item.name(), item) == null, "duplicate name: %s", item.name());
    return item;
  }

  public Optional<T> get(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  public boolean contains(String name) {
    return byName.containsKey(name);
  }

  public Optional<T> remove(String name) {
    return Optional.ofNullable(byName.remove(name));
  }

  public int size() {
    return byName.size();
  }

  public boolean isEmpty() {
    return byName.isEmpty();
  }

  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(byName.keySet());
  }

  public ImmutableList<T> values() {
    return ImmutableList.copyOf(byName.values());
  }

  public Collection<T> view() {
    return Collections.unmodifiableCollection(byName.values());
  }

  public Stream<T> stream() {
    return byName.values().stream();
  }

  @Override
  public Iterator<T> iterator() {
    return view().iterator();
  }
}
