package ai.lambdaviz;

import java.util.List;
import java.util.regex.Pattern;

import org.petitparser.parser.Parser;
import org.petitparser.parser.primitive.CharacterParser;

import com.google.common.collect.ImmutableList;

import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Splits normalized surface syntax into tokens. Input containing any character
 * outside the token classes produces no tokens at all.
 */
@UtilityClass
class Lexer {
  public final char BINDER = '\\';

  public enum Kind {
    BINDER, OPEN, CLOSE, DOT, IDENTIFIER
  }

  public record Token(Kind kind, String text, int position) {
    @Override
    public String toString() {
      return String.format("\"%s\" at position %s", text, position);
    }
  }

  /**
   * An {@code L} only spells the binder where it does not continue an
   * identifier.
   */
  private final Pattern L_BINDER = Pattern.compile("(?<![A-Za-z0-9_'])L");

  private final Parser IDENTIFIER = CharacterParser.pattern("A-Za-z_")
      .seq(CharacterParser.pattern("A-Za-z0-9_'").star())
      .flatten(),
      SYMBOL = CharacterParser.anyOf("\\().").flatten(),
      TOKENS = IDENTIFIER.or(SYMBOL).token().trim().star().end();

  /**
   * Rewrites every spelling of the binder ({@code λ}, {@code \}, {@code L}) to
   * {@link #BINDER}. Offsets are preserved.
   */
  public String normalize(final String text) {
    return L_BINDER.matcher(text.replace('λ', BINDER)).replaceAll("\\\\");
  }

  public ImmutableList<Token> tokenize(final String text) {
    val normalized = normalize(text);
    val result = TOKENS.parse(normalized);
    if (result.isFailure()) {
      final int position = result.getPosition();
      final String offending = position < normalized.length()
          ? text.substring(position, position + 1)
          : "";
      throw new ParseException(ParseException.Reason.UNRECOGNIZED_CHARACTER, offending, position,
          String.format("Unrecognized character \"%s\" at position %s.", offending, position));
    }

    @SuppressWarnings("unchecked")
    final List<org.petitparser.context.Token> raw = (List<org.petitparser.context.Token>) result.get();
    val tokens = ImmutableList.<Token>builder();
    for (val token : raw) {
      final String value = (String) token.getValue();
      tokens.add(new Token(kindOf(value), value, token.getStart()));
    }
    return tokens.build();
  }

  private Kind kindOf(final String value) {
    switch (value) {
      case "\\":
        return Kind.BINDER;
      case "(":
        return Kind.OPEN;
      case ")":
        return Kind.CLOSE;
      case ".":
        return Kind.DOT;
      default:
        return Kind.IDENTIFIER;
    }
  }
}
