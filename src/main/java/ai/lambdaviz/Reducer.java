package ai.lambdaviz;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import lombok.val;

/**
 * Leftmost-outermost beta reduction with capture-avoiding substitution.
 * <p>
 * All operations are pure: inputs are never modified and every result is built
 * from fresh nodes.
 */
public final class Reducer {
  public static final int DEFAULT_STEP_LIMIT = 1000;

  /**
   * Fresh-name state for a single reduction step. Suffix counters restart with
   * each step since each step produces an entirely new tree.
   */
  private final Set<String> tried = new HashSet<>();
  private int suffix;
  private Long redexId;

  private Reducer() {
  }

  public static ReductionStep reduceStep(final Term term) {
    val reducer = new Reducer();
    val reduced = reducer.contractNext(term);
    return reduced == null
        ? new ReductionStep(term.copy(), false, Optional.empty())
        : new ReductionStep(reduced, true, Optional.of(reducer.redexId));
  }

  /**
   * Reduces until normal form or until {@code maxSteps} steps have been taken.
   */
  public static Normalization normalize(final Term term, final int maxSteps) {
    Preconditions.checkArgument(maxSteps >= 0, "maxSteps must be nonnegative.");

    Term current = term.copy();
    for (int steps = 0; steps < maxSteps; ++steps) {
      val step = reduceStep(current);
      if (!step.changed()) {
        return new Normalization(step.result(), steps, Normalization.Status.NORMAL_FORM);
      }
      current = step.result();
    }

    return locateNextRedex(current).isPresent()
        ? new Normalization(current, maxSteps, Normalization.Status.STEP_LIMIT_EXCEEDED)
        : new Normalization(current, maxSteps, Normalization.Status.NORMAL_FORM);
  }

  public static Normalization normalize(final Term term) {
    return normalize(term, DEFAULT_STEP_LIMIT);
  }

  /**
   * Returns the id of the application that {@link #reduceStep(Term)} would
   * contract next, without rewriting anything.
   */
  public static Optional<Long> locateNextRedex(final Term term) {
    if (term instanceof Application app) {
      if (app.isRedex()) {
        return Optional.of(app.getId());
      }
      val inFunc = locateNextRedex(app.getFunc());
      return inFunc.isPresent() ? inFunc : locateNextRedex(app.getArg());
    } else if (term instanceof Lambda lambda) {
      return locateNextRedex(lambda.getBody());
    } else if (term instanceof Variable) {
      return Optional.empty();
    }
    throw ReductionException.unknownVariant(term);
  }

  /**
   * Returns a fresh copy of the term in which the next redex and the abstraction
   * in its function position carry the redex marker.
   */
  public static Term markNextRedex(final Term term) {
    val marked = mark(term);
    return marked == null ? term.copy() : marked;
  }

  private static Term mark(final Term term) {
    if (term instanceof Application app) {
      if (app.getFunc() instanceof Lambda func) {
        return new Application(func.copy().withRedexMarker(), app.getArg().copy(),
            app.getOriginTag().orElse(null)).withRedexMarker();
      }
      val markedFunc = mark(app.getFunc());
      if (markedFunc != null) {
        return new Application(markedFunc, app.getArg().copy(), app.getOriginTag().orElse(null));
      }
      val arg = mark(app.getArg());
      return arg == null ? null : new Application(app.getFunc().copy(), arg, app.getOriginTag().orElse(null));
    } else if (term instanceof Lambda lambda) {
      val body = mark(lambda.getBody());
      return body == null ? null : lambda.withBody(body);
    } else if (term instanceof Variable) {
      return null;
    }
    throw ReductionException.unknownVariant(term);
  }

  /**
   * Contracts the leftmost-outermost redex, or returns null if there is none.
   * Nodes rebuilt around a contraction lose their origin tag since they no
   * longer denote the tagged term.
   */
  private Term contractNext(final Term term) {
    if (term instanceof Application app) {
      if (app.getFunc() instanceof Lambda func) {
        redexId = app.getId();
        return substitute(func.getBody(), func.getParam(), app.getArg(), freeVariables(app.getArg()));
      }
      val reducedFunc = contractNext(app.getFunc());
      if (reducedFunc != null) {
        return new Application(reducedFunc, app.getArg().copy());
      }
      val arg = contractNext(app.getArg());
      return arg == null ? null : new Application(app.getFunc().copy(), arg);
    } else if (term instanceof Lambda lambda) {
      val body = contractNext(lambda.getBody());
      return body == null ? null : new Lambda(lambda.getParam(), body);
    } else if (term instanceof Variable) {
      return null;
    }
    throw ReductionException.unknownVariant(term);
  }

  /**
   * Replaces free occurrences of {@code name} in {@code body} with copies of
   * {@code replacement}, renaming binders in {@code body} that would capture a
   * free variable of the replacement.
   */
  public static Term substitute(final Term body, final String name, final Term replacement) {
    return new Reducer().substitute(body, name, replacement, freeVariables(replacement));
  }

  private Term substitute(final Term node, final String name, final Term replacement,
      final Set<String> replacementFree) {
    if (node instanceof Variable variable) {
      return variable.getName().equals(name) ? replacement.copy() : variable.copy();
    } else if (node instanceof Lambda lambda) {
      if (lambda.getParam().equals(name)) {
        return lambda.copy();
      }

      Lambda target = lambda;
      if (replacementFree.contains(lambda.getParam())) {
        val avoid = Sets.union(Sets.union(names(lambda.getBody()), replacementFree), ImmutableSet.of(name));
        target = alphaConvert(lambda, freshName(lambda.getParam(), avoid));
      }
      return new Lambda(target.getParam(), substitute(target.getBody(), name, replacement, replacementFree),
          lambda.getOriginTag().orElse(null));
    } else if (node instanceof Application app) {
      return new Application(
          substitute(app.getFunc(), name, replacement, replacementFree),
          substitute(app.getArg(), name, replacement, replacementFree),
          app.getOriginTag().orElse(null));
    }
    throw ReductionException.unknownVariant(node);
  }

  private String freshName(final String base, final Set<String> avoid) {
    String candidate;
    do {
      candidate = base + suffix++;
    } while (avoid.contains(candidate) || !tried.add(candidate));
    return candidate;
  }

  /**
   * Renames the parameter of {@code lambda} and its free occurrences in the
   * body. The new name must not occur anywhere in the body.
   */
  public static Lambda alphaConvert(final Lambda lambda, final String newParam) {
    Preconditions.checkArgument(Parser.IDENTIFIER.matcher(newParam).matches(),
        "Invalid parameter name \"%s\".", newParam);
    Preconditions.checkArgument(!names(lambda.getBody()).contains(newParam),
        "Renaming %s to %s would capture an occurrence in %s.", lambda.getParam(), newParam, lambda);
    return new Lambda(newParam, rename(lambda.getBody(), lambda.getParam(), newParam),
        lambda.getOriginTag().orElse(null));
  }

  private static Term rename(final Term node, final String from, final String to) {
    if (node instanceof Variable variable) {
      return variable.getName().equals(from) ? variable.rename(to) : variable.copy();
    } else if (node instanceof Lambda lambda) {
      return lambda.getParam().equals(from)
          ? lambda.copy()
          : new Lambda(lambda.getParam(), rename(lambda.getBody(), from, to), lambda.getOriginTag().orElse(null));
    } else if (node instanceof Application app) {
      return new Application(rename(app.getFunc(), from, to), rename(app.getArg(), from, to),
          app.getOriginTag().orElse(null));
    }
    throw ReductionException.unknownVariant(node);
  }

  public static ImmutableSet<String> freeVariables(final Term term) {
    val free = ImmutableSet.<String>builder();
    collectFree(term, ImmutableSet.of(), free);
    return free.build();
  }

  private static void collectFree(final Term term, final Set<String> bound, final ImmutableSet.Builder<String> free) {
    if (term instanceof Variable variable) {
      if (!bound.contains(variable.getName())) {
        free.add(variable.getName());
      }
    } else if (term instanceof Lambda lambda) {
      collectFree(lambda.getBody(), Sets.union(bound, ImmutableSet.of(lambda.getParam())), free);
    } else if (term instanceof Application app) {
      collectFree(app.getFunc(), bound, free);
      collectFree(app.getArg(), bound, free);
    } else {
      throw ReductionException.unknownVariant(term);
    }
  }

  /**
   * Every variable and parameter name occurring in the term, bound or free.
   */
  public static ImmutableSet<String> names(final Term term) {
    val names = ImmutableSet.<String>builder();
    collectNames(term, names);
    return names.build();
  }

  private static void collectNames(final Term term, final ImmutableSet.Builder<String> names) {
    if (term instanceof Variable variable) {
      names.add(variable.getName());
    } else if (term instanceof Lambda lambda) {
      names.add(lambda.getParam());
      collectNames(lambda.getBody(), names);
    } else if (term instanceof Application app) {
      collectNames(app.getFunc(), names);
      collectNames(app.getArg(), names);
    } else {
      throw ReductionException.unknownVariant(term);
    }
  }
}
