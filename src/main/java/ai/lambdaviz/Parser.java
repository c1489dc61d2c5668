package ai.lambdaviz;

import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

import ai.lambdaviz.Lexer.Kind;
import ai.lambdaviz.Lexer.Token;
import lombok.val;

/**
 * Recursive descent parser for lambda terms:
 *
 * <pre>
 * term     := binder IDENT '.' sequence | '(' sequence ')' | IDENT
 * sequence := term+
 * </pre>
 *
 * Sequences associate to the left and stop at {@code )}, {@code .} or the end
 * of input.
 * <p>
 * When given a registry, identifiers of the form {@code _NAME} or {@code _N}
 * are resolved the same way {@link NamedTermExpander} resolves them, and the
 * root of each resolved subterm is tagged with the reference.
 */
public final class Parser {
  public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_']*");

  private final ImmutableList<Token> tokens;
  private final NamedTermExpander resolver;
  private final int depth;
  private int index;

  private Parser(final ImmutableList<Token> tokens, final NamedTermExpander resolver, final int depth) {
    this.tokens = tokens;
    this.resolver = resolver;
    this.depth = depth;
  }

  /**
   * Parses without resolving references; {@code _NAME} is an ordinary free
   * variable.
   */
  public static Term parse(final String text) {
    return parse(text, null, 0);
  }

  public static Term parse(final String text, final NamedTermRegistry registry) {
    return parse(text, registry == null ? null : new NamedTermExpander(registry), 0);
  }

  private static Term parse(final String text, final NamedTermExpander resolver, final int depth) {
    if (text == null || text.isBlank()) {
      throw new ParseException(ParseException.Reason.EMPTY_INPUT, null, -1, "Input expression cannot be empty.");
    }

    val parser = new Parser(Lexer.tokenize(text), resolver, depth);
    val term = parser.parseSequence();
    if (parser.index < parser.tokens.size()) {
      val trailing = parser.peek();
      throw new ParseException(ParseException.Reason.TRAILING_TOKENS, trailing.text(), trailing.position(),
          String.format("Unexpected token %s after a complete expression.", trailing));
    }
    return term;
  }

  private Token peek() {
    return index < tokens.size() ? tokens.get(index) : null;
  }

  private Token expect(final Kind kind, final String spelling) {
    val token = peek();
    if (token == null) {
      throw new ParseException(ParseException.Reason.UNEXPECTED_END, null, -1,
          String.format("Unexpected end of input; expected \"%s\".", spelling));
    }
    if (token.kind() != kind) {
      throw new ParseException(ParseException.Reason.UNEXPECTED_TOKEN, token.text(), token.position(),
          String.format("Expected \"%s\" but found %s.", spelling, token));
    }
    ++index;
    return token;
  }

  private Term parseSequence() {
    Term left = parseTerm();
    for (Token next = peek(); next != null && next.kind() != Kind.CLOSE && next.kind() != Kind.DOT; next = peek()) {
      left = new Application(left, parseTerm());
    }
    return left;
  }

  private Term parseTerm() {
    val token = peek();
    if (token == null) {
      throw new ParseException(ParseException.Reason.UNEXPECTED_END, null, -1,
          "Unexpected end of input; expected a variable, lambda or parenthesized expression.");
    }

    switch (token.kind()) {
      case BINDER:
        return parseLambda();
      case OPEN: {
        ++index;
        val inner = parseSequence();
        expect(Kind.CLOSE, ")");
        return inner;
      }
      case IDENTIFIER:
        ++index;
        return parseIdentifier(token);
      default:
        throw new ParseException(ParseException.Reason.UNEXPECTED_TOKEN, token.text(), token.position(),
            String.format("Unexpected token %s when expecting a variable, lambda or parenthesized expression.",
                token));
    }
  }

  private Lambda parseLambda() {
    val binder = expect(Kind.BINDER, "λ");
    val param = peek();
    if (param == null) {
      throw new ParseException(ParseException.Reason.INVALID_PARAMETER, null, binder.position(),
          "Invalid parameter name: expected a variable after λ but found end of input.");
    }
    if (param.kind() != Kind.IDENTIFIER || !IDENTIFIER.matcher(param.text()).matches()) {
      throw new ParseException(ParseException.Reason.INVALID_PARAMETER, param.text(), param.position(),
          String.format("Invalid parameter name: expected a variable after λ but found %s.", param));
    }
    ++index;
    expect(Kind.DOT, ".");
    return new Lambda(param.text(), parseSequence());
  }

  private Term parseIdentifier(final Token token) {
    val name = token.text();
    if (resolver == null || depth >= NamedTermExpander.MAX_PASSES || name.length() < 2 || name.charAt(0) != '_') {
      return new Variable(name);
    }

    final Optional<String> definition;
    try {
      definition = resolver.resolve(name.substring(1));
    } catch (final ParseException e) {
      throw new ParseException(e.getReason(), name, token.position(), e.getMessage());
    }
    if (definition.isEmpty()) {
      return new Variable(name);
    }
    try {
      return parse(definition.get(), resolver, depth + 1).withOriginTag(name);
    } catch (final ParseException e) {
      throw new ParseException(e, String.format("In definition of %s", token));
    }
  }
}
