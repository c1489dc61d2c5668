package ai.lambdaviz;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import lombok.val;

/**
 * Built-in named terms followed by user-defined ones. Lookups are by exact
 * name. Registration rejects collisions and definitions that could expand
 * forever.
 */
public class NamedTermRegistry {
  public static final ImmutableList<NamedTerm> BUILTINS = ImmutableList.of(
      new NamedTerm("ID", "λx.x", "Identity function (I)"),
      new NamedTerm("TRUE", "λx.λy.x", "Church Boolean True (Kestrel)"),
      new NamedTerm("FALSE", "λx.λy.y", "Church Boolean False (Kite)"),
      new NamedTerm("NOT", "λp.p (λx.λy.y) (λx.λy.x)", "Boolean NOT (λp.p FALSE TRUE)"),
      new NamedTerm("AND", "λp.λq.p q (λx.λy.y)", "Boolean AND (λp.λq.p q FALSE)"),
      new NamedTerm("OR", "λp.λq.p (λx.λy.x) q", "Boolean OR (λp.λq.p TRUE q)"),
      new NamedTerm("ZERO", "λf.λx.x", "Church Numeral 0"),
      new NamedTerm("ONE", "λf.λx.f x", "Church Numeral 1"),
      new NamedTerm("TWO", "λf.λx.f (f x)", "Church Numeral 2"),
      new NamedTerm("THREE", "λf.λx.f (f (f x))", "Church Numeral 3"),
      new NamedTerm("SUCC", "λn.λf.λx.f (n f x)", "Successor: λn.λf.λx.f (n f x)"),
      new NamedTerm("PLUS", "λm.λn.λf.λx.m f (n f x)", "Addition: λm.λn.λf.λx.m f (n f x)"),
      new NamedTerm("MULT", "λm.λn.λf.m (n f)", "Multiplication: λm.λn.λf.m (n f)"),
      new NamedTerm("POW", "λb.λe.e b", "Exponentiation (b^e): λb.λe.e b (base, exponent)"),
      new NamedTerm("Y_COMB", "λf.(λx.f (x x)) (λx.f (x x))", "Y Combinator (fixed-point combinator)"));

  private final ImmutableList<NamedTerm> builtins;
  private final List<NamedTerm> custom = new ArrayList<>();

  public NamedTermRegistry() {
    this(BUILTINS);
  }

  public NamedTermRegistry(final Iterable<NamedTerm> builtins) {
    this.builtins = ImmutableList.copyOf(builtins);
  }

  public ImmutableList<NamedTerm> builtins() {
    return builtins;
  }

  public ImmutableList<NamedTerm> custom() {
    return ImmutableList.copyOf(custom);
  }

  /**
   * Built-ins first, then custom terms in definition order.
   */
  public ImmutableList<NamedTerm> all() {
    return ImmutableList.<NamedTerm>builder().addAll(builtins).addAll(custom).build();
  }

  public Optional<NamedTerm> lookup(final String name) {
    for (val term : Iterables.concat(builtins, custom)) {
      if (term.name().equals(name)) {
        return Optional.of(term);
      }
    }
    return Optional.empty();
  }

  /**
   * Registers a custom term.
   * 
   * @throws IllegalArgumentException if the name is taken or the definition
   *                                  refers back to itself through other named
   *                                  terms
   * @throws ParseException           if the definition is not valid syntax
   */
  public void define(final NamedTerm term) {
    if (lookup(term.name()).isPresent()) {
      throw new IllegalArgumentException(String.format("A term named %s already exists.", term.name()));
    }
    if (reachesName(term.lambda(), term.name(), new HashSet<>())) {
      throw new IllegalArgumentException(
          String.format("Definition of %s refers back to itself: %s", term.name(), term.lambda()));
    }
    // Validate in a registry that can resolve the new term's dependencies.
    Parser.parse(term.lambda(), this);
    custom.add(term);
  }

  public boolean remove(final String name) {
    return custom.removeIf(term -> term.name().equals(name));
  }

  private boolean reachesName(final String lambda, final String target, final Set<String> visited) {
    for (val reference : NamedTermExpander.references(lambda)) {
      if (reference.equals(target)) {
        return true;
      }
      if (visited.add(reference)) {
        val next = lookup(reference);
        if (next.isPresent() && reachesName(next.get().lambda(), target, visited)) {
          return true;
        }
      }
    }
    return false;
  }
}
