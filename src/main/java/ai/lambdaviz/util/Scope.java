package ai.lambdaviz.util;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

/**
 * An immutable chain of name bindings. Binding a name returns a new scope that
 * shadows any outer binding of the same name; the outer scope is untouched, so
 * sibling descents can never observe each other's bindings.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Scope<V> {
  private static final Scope<?> EMPTY = new Scope<>(null, null, null);

  private final String name;
  private final V value;
  private final Scope<V> parent;

  @SuppressWarnings("unchecked")
  public static <V> Scope<V> empty() {
    return (Scope<V>) EMPTY;
  }

  public Scope<V> bind(final String name, final V value) {
    return new Scope<>(name, value, this);
  }

  public Optional<V> lookup(final String name) {
    for (Scope<V> scope = this; scope.parent != null; scope = scope.parent) {
      if (scope.name.equals(name)) {
        return Optional.of(scope.value);
      }
    }
    return Optional.empty();
  }

  public boolean isBound(final String name) {
    return lookup(name).isPresent();
  }
}
