package ai.lambdaviz;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import lombok.val;

public class ParserTest {
  private static ParseException parseFailure(final String text) {
    try {
      Parser.parse(text);
    } catch (final ParseException e) {
      return e;
    }
    throw new AssertionError("Expected " + text + " not to parse.");
  }

  @Test
  public void testVariable() {
    val term = Parser.parse("x");
    assertThat(term).isInstanceOf(Variable.class);
    assertThat(((Variable) term).getName()).isEqualTo("x");
  }

  @Test
  public void testPrimedIdentifier() {
    assertThat(((Variable) Parser.parse("x'")).getName()).isEqualTo("x'");
  }

  @Test
  public void testBinderSpellings() {
    for (val text : ImmutableList.of("λx.x", "\\x.x", "Lx.x", "  λ x . x  ")) {
      val term = Parser.parse(text);
      assertThat(term).isInstanceOf(Lambda.class);
      assertThat(Printer.print(term)).isEqualTo("λx.x");
    }
  }

  @Test
  public void testLInsideIdentifier() {
    val term = Parser.parse("λxL.xL");
    assertThat(((Lambda) term).getParam()).isEqualTo("xL");
  }

  @Test
  public void testApplicationAssociatesLeft() {
    val term = (Application) Parser.parse("a b c");
    assertThat(term.getFunc()).isInstanceOf(Application.class);
    assertThat(((Variable) term.getArg()).getName()).isEqualTo("c");
  }

  @Test
  public void testParenthesizedArgument() {
    val term = (Application) Parser.parse("a (b c)");
    assertThat(((Variable) term.getFunc()).getName()).isEqualTo("a");
    assertThat(term.getArg()).isInstanceOf(Application.class);
  }

  @Test
  public void testLambdaBodyExtendsRight() {
    val term = (Lambda) Parser.parse("λx.x y λz.z");
    assertThat(term.getBody()).isInstanceOf(Application.class);
    assertThat(Printer.print(term)).isEqualTo("λx.(x y) (λz.z)");
  }

  @Test
  public void testEmpty() {
    assertThat(parseFailure("   ").getReason()).isEqualTo(ParseException.Reason.EMPTY_INPUT);
    assertThat(parseFailure("").getPosition()).isEqualTo(-1);
  }

  @Test
  public void testUnrecognizedCharacter() {
    val e = parseFailure("x $");
    assertThat(e.getReason()).isEqualTo(ParseException.Reason.UNRECOGNIZED_CHARACTER);
    assertThat(e.getPosition()).isEqualTo(2);
    assertThat(e.getToken()).contains("$");
  }

  @Test
  public void testUnclosedParenthesis() {
    assertThat(parseFailure("(x y").getReason()).isEqualTo(ParseException.Reason.UNEXPECTED_END);
  }

  @Test
  public void testMissingDot() {
    val e = parseFailure("λx x");
    assertThat(e.getReason()).isEqualTo(ParseException.Reason.UNEXPECTED_TOKEN);
    assertThat(e.getToken()).contains("x");
    assertThat(e.getPosition()).isEqualTo(3);
  }

  @Test
  public void testInvalidParameter() {
    assertThat(parseFailure("λ.x").getReason()).isEqualTo(ParseException.Reason.INVALID_PARAMETER);
    assertThat(parseFailure("λ(x).x").getReason()).isEqualTo(ParseException.Reason.INVALID_PARAMETER);
    assertThat(parseFailure("λ").getReason()).isEqualTo(ParseException.Reason.INVALID_PARAMETER);
  }

  @Test
  public void testUnexpectedClose() {
    assertThat(parseFailure(")").getReason()).isEqualTo(ParseException.Reason.UNEXPECTED_TOKEN);
    assertThat(parseFailure("()").getReason()).isEqualTo(ParseException.Reason.UNEXPECTED_TOKEN);
  }

  @Test
  public void testTrailingTokens() {
    val e = parseFailure("x y)");
    assertThat(e.getReason()).isEqualTo(ParseException.Reason.TRAILING_TOKENS);
    assertThat(e.getToken()).contains(")");
  }

  @Test
  public void testReferencesUnresolvedWithoutRegistry() {
    val term = Parser.parse("_ID");
    assertThat(term).isInstanceOf(Variable.class);
    assertThat(term.getOriginTag()).isEmpty();
  }

  @Test
  public void testReferenceTagsRoot() {
    val registry = new NamedTermRegistry();
    val term = (Application) Parser.parse("_ID y", registry);
    assertThat(term.getOriginTag()).isEmpty();
    assertThat(term.getFunc()).isInstanceOf(Lambda.class);
    assertThat(term.getFunc().getOriginTag()).contains("_ID");
    assertThat(((Lambda) term.getFunc()).getBody().getOriginTag()).isEmpty();
  }

  @Test
  public void testNumeralReference() {
    val term = Parser.parse("_5", new NamedTermRegistry());
    assertThat(term.getOriginTag()).contains("_5");
    assertThat(term.hasNumeralTag()).isTrue();
    assertThat(Prettifier.churchNumeralValue(term)).hasValue(5);
  }

  @Test
  public void testUnknownReferenceStaysFree() {
    val registry = new NamedTermRegistry();
    assertThat(((Variable) Parser.parse("_NOPE", registry)).getName()).isEqualTo("_NOPE");
    assertThat(((Variable) Parser.parse("_1001")).getName()).isEqualTo("_1001");
  }

  @Test
  public void testNestedReference() {
    val registry = new NamedTermRegistry();
    registry.define(new NamedTerm("TWICE_ID", "_ID _ID"));
    val term = Parser.parse("_TWICE_ID", registry);
    assertThat(term.getOriginTag()).contains("_TWICE_ID");
    assertThat(Printer.print(term)).isEqualTo("(λx.x) (λx.x)");
    assertThat(((Application) term).getArg().getOriginTag()).contains("_ID");
  }

  @Test
  public void testInvalidDefinition() {
    val registry = new NamedTermRegistry(ImmutableList.of(new NamedTerm("BAD", "λx.")));
    assertThatThrownBy(() -> Parser.parse("_BAD y", registry))
        .isInstanceOf(ParseException.class)
        .hasMessageStartingWith("In definition of \"_BAD\"");
  }

  @Test
  public void testCyclicRegistryTerminates() {
    val registry = new NamedTermRegistry(ImmutableList.of(new NamedTerm("A", "_A")));
    val term = Parser.parse("_A", registry);
    assertThat(term).isInstanceOf(Variable.class);
    assertThat(term.getOriginTag()).contains("_A");
  }

  @Test
  public void testNumeralTags() {
    assertThat(Term.isChurchNumeralTag("_12")).isTrue();
    assertThat(Term.isChurchNumeralTag("_PLUS")).isFalse();
    assertThat(Term.isChurchNumeralTag("_")).isFalse();

    val term = Parser.parse("_3", new NamedTermRegistry());
    assertThat(term.hasNumeralTag()).isTrue();
    val copy = term.copy();
    assertThat(copy.getId()).isNotEqualTo(term.getId());
    assertThat(copy.getOriginTag()).contains("_3");
    assertThat(copy.withOriginTag("_X").hasNumeralTag()).isFalse();
  }

  @Test
  public void testNumeralTooLarge() {
    val registry = new NamedTermRegistry();
    try {
      Parser.parse("x _1001", registry);
    } catch (final ParseException e) {
      assertThat(e.getReason()).isEqualTo(ParseException.Reason.NUMERAL_TOO_LARGE);
      assertThat(e.getToken()).contains("_1001");
      assertThat(e.getPosition()).isEqualTo(2);
      return;
    }
    throw new AssertionError("Expected _1001 to be rejected.");
  }
}
