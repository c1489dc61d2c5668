package ai.lambdaviz;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import lombok.val;

public class NamedTermRegistryTest {
  @Test
  public void testBuiltins() {
    val registry = new NamedTermRegistry();
    assertThat(registry.builtins()).hasSize(15);
    assertThat(registry.custom()).isEmpty();
    assertThat(registry.lookup("PLUS").map(NamedTerm::lambda)).contains("λm.λn.λf.λx.m f (n f x)");
    assertThat(registry.lookup("plus")).isEmpty();
  }

  @Test
  public void testBuiltinsParse() {
    for (val named : NamedTermRegistry.BUILTINS) {
      assertThat(Reducer.freeVariables(Parser.parse(named.lambda()))).as(named.name()).isEmpty();
    }
  }

  @Test
  public void testDefine() {
    val registry = new NamedTermRegistry();
    val swap = new NamedTerm("SWAP", "λf.λa.λb.f b a", "Argument swap");
    registry.define(swap);
    assertThat(registry.custom()).containsExactly(swap);
    assertThat(registry.all()).endsWith(swap).startsWith(NamedTermRegistry.BUILTINS.get(0));
    assertThat(registry.lookup("SWAP")).contains(swap);
    assertThat(swap.reference()).isEqualTo("_SWAP");
  }

  @Test
  public void testInvalidName() {
    assertThatThrownBy(() -> new NamedTerm("1X", "x")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new NamedTerm("_X", "x")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new NamedTerm("Y-COMB", "x")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new NamedTerm("X", " ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testCollision() {
    val registry = new NamedTermRegistry();
    assertThatThrownBy(() -> registry.define(new NamedTerm("ID", "λy.y")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("already exists");
  }

  @Test
  public void testSelfReference() {
    val registry = new NamedTermRegistry();
    assertThatThrownBy(() -> registry.define(new NamedTerm("LOOP", "λx._LOOP x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("refers back to itself");
    assertThat(registry.lookup("LOOP")).isEmpty();
  }

  @Test
  public void testMutualReference() {
    val registry = new NamedTermRegistry();
    registry.define(new NamedTerm("A", "λx._B x"));
    assertThatThrownBy(() -> registry.define(new NamedTerm("B", "λy._A y")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testInvalidSyntax() {
    val registry = new NamedTermRegistry();
    assertThatThrownBy(() -> registry.define(new NamedTerm("BAD", "λx.")))
        .isInstanceOf(ParseException.class);
    assertThat(registry.custom()).isEmpty();
  }

  @Test
  public void testRemove() {
    val registry = new NamedTermRegistry();
    registry.define(new NamedTerm("K", "λa.λb.a"));
    assertThat(registry.remove("ID")).isFalse();
    assertThat(registry.remove("K")).isTrue();
    assertThat(registry.lookup("K")).isEmpty();
  }

  @Test
  public void testReferenceRoundTrip() {
    val registry = new NamedTermRegistry();
    val swap = new NamedTerm("SWAP", "λf.λa.λb.f b a");
    registry.define(swap);

    assertThat(Printer.canonical(Parser.parse(swap.reference(), registry)))
        .isEqualTo(Printer.canonical(Parser.parse(swap.lambda())));
    assertThat(Printer.canonical(Parser.parse("_SWAP g (λz.z)", registry)))
        .isEqualTo(Printer.canonical(Parser.parse("(λf.λa.λb.f b a) g (λz.z)")));
  }
}
