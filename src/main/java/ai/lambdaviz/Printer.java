package ai.lambdaviz;

import java.util.Optional;
import java.util.function.Function;

import ai.lambdaviz.util.Scope;
import lombok.val;

/**
 * Renders terms back to surface syntax. Abstractions and applications are
 * parenthesized in function and argument position, and nowhere else.
 * <p>
 * In {@link Mode#CANONICAL} mode every abstraction gets the next name from
 * {@code @a, @b, ..., @z, @26, @27, ...}, numbered across the whole print, so
 * alpha-equivalent terms print identically.
 */
public final class Printer {
  public static final char BINDER = 'λ';

  public enum Mode {
    AS_WRITTEN, CANONICAL
  }

  /**
   * Syntactic position of the node being printed.
   */
  public enum Context {
    TOP, FUNCTION, ARGUMENT, BODY
  }

  private final Mode mode;
  private final Function<Term, Optional<String>> atoms;
  private int canonicalIndex;

  private Printer(final Mode mode, final Function<Term, Optional<String>> atoms) {
    this.mode = mode;
    this.atoms = atoms;
  }

  public static String print(final Term term) {
    return print(term, Mode.AS_WRITTEN, Context.TOP);
  }

  public static String canonical(final Term term) {
    return print(term, Mode.CANONICAL, Context.TOP);
  }

  public static String print(final Term term, final Mode mode, final Context context) {
    return print(term, mode, context, __ -> Optional.empty());
  }

  /**
   * Prints with an override hook: any subterm for which {@code atoms} yields a
   * string is printed as that string instead of being descended into, still
   * parenthesized as the subterm would be.
   */
  static String print(final Term term, final Mode mode, final Context context,
      final Function<Term, Optional<String>> atoms) {
    return new Printer(mode, atoms).print(term, context, Scope.empty());
  }

  public static boolean needsParentheses(final Term term, final Context context) {
    if (term instanceof Lambda || term instanceof Application) {
      return context == Context.FUNCTION || context == Context.ARGUMENT;
    }
    return false;
  }

  public static String canonicalName(final int index) {
    return index < 26 ? "@" + (char) ('a' + index) : "@" + index;
  }

  private String print(final Term term, final Context context, final Scope<String> names) {
    val atom = term.hasNumeralTag() ? term.getOriginTag() : atoms.apply(term);
    if (atom.isPresent()) {
      return parenthesize(term, context, atom.get());
    }

    if (term instanceof Variable variable) {
      return names.lookup(variable.getName()).orElse(variable.getName());
    } else if (term instanceof Lambda lambda) {
      String param = lambda.getParam();
      Scope<String> bodyNames = names;
      if (mode == Mode.CANONICAL) {
        param = canonicalName(canonicalIndex++);
        bodyNames = names.bind(lambda.getParam(), param);
      }
      return parenthesize(term, context,
          BINDER + param + "." + print(lambda.getBody(), Context.BODY, bodyNames));
    } else if (term instanceof Application app) {
      return parenthesize(term, context,
          print(app.getFunc(), Context.FUNCTION, names) + " " + print(app.getArg(), Context.ARGUMENT, names));
    }
    throw ReductionException.unknownVariant(term);
  }

  private static String parenthesize(final Term term, final Context context, final String text) {
    return needsParentheses(term, context) ? "(" + text + ")" : text;
  }
}
