package ai.lambdaviz;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import lombok.RequiredArgsConstructor;
import lombok.val;

/**
 * Textual expansion of {@code _NAME} and {@code _N} references into
 * parenthesized surface syntax.
 */
@RequiredArgsConstructor
public class NamedTermExpander {
  /**
   * Bound on expansion passes. Registration already rejects cyclic definitions;
   * this only guards against a registry assembled some other way.
   */
  public static final int MAX_PASSES = 10;
  /**
   * Largest numeral literal that expands. Larger literals are rejected with
   * {@link ParseException.Reason#NUMERAL_TOO_LARGE}.
   */
  public static final int MAX_NUMERAL = 1000;

  /**
   * A reference starts at an underscore that does not continue an identifier.
   */
  private static final Pattern REFERENCE = Pattern.compile("(?<![A-Za-z0-9_'])_([A-Za-z0-9_']+)");
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern LEADING_ZEROS = Pattern.compile("^0+(?=\\d)");

  private final NamedTermRegistry registry;

  public static String churchNumeral(final int n) {
    Preconditions.checkArgument(n >= 0, "Church numerals are non-negative: %s", n);
    if (n == 0) {
      return "λf.λx.x";
    }
    return "λf.λx." + Strings.repeat("f (", n - 1) + "f x" + Strings.repeat(")", n - 1);
  }

  /**
   * Resolves a single reference, without its leading underscore, to the surface
   * syntax it stands for.
   *
   * @throws ParseException if the reference is a numeral literal above
   *                        {@link #MAX_NUMERAL}
   */
  public Optional<String> resolve(final String reference) {
    if (DIGITS.matcher(reference).matches()) {
      return Optional.of(churchNumeral(numeral(reference)));
    }
    return registry.lookup(reference).map(NamedTerm::lambda);
  }

  private static int numeral(final String digits) {
    // Anything past nine significant digits is over the limit and would overflow an int.
    val significant = LEADING_ZEROS.matcher(digits).replaceFirst("");
    final int n = significant.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(significant);
    if (n > MAX_NUMERAL) {
      throw new ParseException(ParseException.Reason.NUMERAL_TOO_LARGE, "_" + digits, -1,
          String.format("Numeral _%s exceeds the largest expandable numeral, %s.", digits, MAX_NUMERAL));
    }
    return n;
  }

  /**
   * @throws ParseException if the text contains a numeral literal above
   *                        {@link #MAX_NUMERAL}
   */
  public String expand(final String text) {
    String current = text;
    for (int pass = 0; pass < MAX_PASSES; ++pass) {
      val expanded = expandOnce(current);
      if (expanded.equals(current)) {
        break;
      }
      current = expanded;
    }
    return current;
  }

  private String expandOnce(final String text) {
    val matcher = REFERENCE.matcher(text);
    val sb = new StringBuilder();
    while (matcher.find()) {
      val replacement = resolve(matcher.group(1)).map(lambda -> "(" + lambda + ")").orElse(matcher.group());
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  /**
   * Names referenced by {@code _NAME} in the given text, in order of first
   * appearance. Numeral literals are not included.
   */
  public static Set<String> references(final String text) {
    val names = new LinkedHashSet<String>();
    val matcher = REFERENCE.matcher(text);
    while (matcher.find()) {
      if (!DIGITS.matcher(matcher.group(1)).matches()) {
        names.add(matcher.group(1));
      }
    }
    return names;
  }
}
