package ai.lambdaviz;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

import io.reactivex.Observable;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import lombok.RequiredArgsConstructor;
import lombok.val;

/**
 * Best-effort rendering of a term in terms of the named terms it contains.
 * Priority order:
 * <ol>
 * <li>the whole term read as a Church numeral, {@code _N};
 * <li>the term's own numeral origin tag;
 * <li>named-term replacement, longest canonical form first.
 * </ol>
 * Named-term matching compares the canonical print of each subterm, taken in
 * isolation, against the canonical print of each registry entry. Matching on
 * whole subterms rather than on substrings of the whole print keeps an entry
 * like {@code λx.x} from matching inside {@code λx.x y}.
 */
@RequiredArgsConstructor
public class Prettifier {
  /**
   * Bound on the applications walked when reading a Church numeral.
   */
  public static final int MAX_NUMERAL = 1000;

  /**
   * Names whose canonical forms are kept in the match table even when trivial.
   */
  private static final Pattern ALWAYS_ALLOWED = Pattern.compile("(?i)[0-9]+|TRUE|FALSE");
  private static final int TRIVIAL_LENGTH = 5;

  private final NamedTermRegistry registry;
  private final Subject<String> rxDiagnostics = PublishSubject.create();

  public Observable<String> rxDiagnostics() {
    return rxDiagnostics;
  }

  public String prettify(final Term term) {
    val numeral = churchNumeralValue(term);
    if (numeral.isPresent()) {
      return "_" + numeral.getAsInt();
    }

    if (term.hasNumeralTag()) {
      return term.getOriginTag().get();
    }

    val table = matchTable();
    return Printer.print(term, Printer.Mode.CANONICAL, Printer.Context.TOP,
        subterm -> Optional.ofNullable(table.get(Printer.canonical(subterm))));
  }

  /**
   * Reads {@code λf.λx.f (f (... (f x)))} as its numeral value. Any other shape,
   * or a chain longer than {@link #MAX_NUMERAL}, is not a numeral.
   */
  public static OptionalInt churchNumeralValue(final Term term) {
    if (!(term instanceof Lambda outer) || !(outer.getBody() instanceof Lambda inner)) {
      return OptionalInt.empty();
    }

    val f = outer.getParam();
    val x = inner.getParam();
    if (f.equals(x)) {
      // λf.λf.f binds both positions to the inner parameter.
      return x.equals(nameOf(inner.getBody())) ? OptionalInt.of(0) : OptionalInt.empty();
    }

    Term current = inner.getBody();
    for (int count = 0; count <= MAX_NUMERAL; ++count) {
      if (current instanceof Variable variable && variable.getName().equals(x)) {
        return OptionalInt.of(count);
      }
      if (current instanceof Application app && f.equals(nameOf(app.getFunc()))) {
        current = app.getArg();
      } else {
        return OptionalInt.empty();
      }
    }
    return OptionalInt.empty();
  }

  private static String nameOf(final Term term) {
    return term instanceof Variable variable ? variable.getName() : null;
  }

  /**
   * Canonical form to reference, built from the registry with longer canonical
   * forms first. Among entries with the same canonical form, the first in
   * registry order wins.
   */
  Map<String, String> matchTable() {
    record Entry(String name, String canonical) {
    }

    final ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    for (val named : registry.all()) {
      final Term parsed;
      try {
        parsed = Parser.parse(named.lambda());
      } catch (final ParseException e) {
        rxDiagnostics.onNext(String.format("Could not parse named term %s for prettifying: %s",
            named.name(), e.getMessage()));
        continue;
      }

      val canonical = Printer.canonical(parsed);
      if (!isTrivial(parsed, canonical) || ALWAYS_ALLOWED.matcher(named.name()).matches()) {
        entries.add(new Entry(named.name(), canonical));
      }
    }

    val table = new LinkedHashMap<String, String>();
    entries.build().stream()
        .sorted(Comparator.comparingInt((Entry entry) -> entry.canonical().length()).reversed())
        .forEachOrdered(entry -> table.putIfAbsent(entry.canonical(), "_" + entry.name()));
    return table;
  }

  private static boolean isTrivial(final Term parsed, final String canonical) {
    return parsed instanceof Variable
        || canonical.indexOf(Printer.BINDER) < 0 && canonical.indexOf('(') < 0 && canonical.length() <= TRIVIAL_LENGTH;
  }
}
