package ai.lambdaviz.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import ai.lambdaviz.Application;
import ai.lambdaviz.NamedTermRegistry;
import ai.lambdaviz.Parser;
import ai.lambdaviz.Reducer;
import ai.lambdaviz.TestTerm;
import ai.lambdaviz.layout.TreeLayoutResult.Node;
import ai.lambdaviz.layout.TreeLayoutResult.NodeType;
import lombok.val;

public class TreeLayoutTest {
  private final TreeLayout layout = new TreeLayout();

  private static double centerX(final Node node) {
    return node.x() + node.width() / 2;
  }

  @Test
  public void testVariable() {
    val result = layout.layout(Parser.parse("x"));
    assertThat(result.error()).isEmpty();
    assertThat(result.nodes()).singleElement().satisfies(node -> {
      assertThat(node.type()).isEqualTo(NodeType.VARIABLE);
      assertThat(node.label()).isEqualTo("x");
      assertThat(node.x()).isEqualTo(30);
      assertThat(node.y()).isEqualTo(30);
      assertThat(node.width()).isEqualTo(30);
      assertThat(node.height()).isEqualTo(40);
    });
    assertThat(result.connectors()).isEmpty();
    assertThat(result.canvasWidth()).isEqualTo(200);
    assertThat(result.canvasHeight()).isEqualTo(100);
  }

  @Test
  public void testWidthFromLabel() {
    assertThat(layout.layout(Parser.parse("abcdefgh")).nodes().get(0).width()).isEqualTo(74);
    assertThat(layout.layout(Parser.parse("λlongname.x")).nodes().get(0).width()).isEqualTo(90);
  }

  @Test
  public void testLambdaCenteredOverBody() {
    val term = Parser.parse("λx.x");
    val result = layout.layout(term);
    val lambda = result.nodes().get(0);
    val body = result.nodes().get(1);

    assertThat(lambda.type()).isEqualTo(NodeType.LAMBDA);
    assertThat(lambda.label()).isEqualTo("λx.");
    assertThat(lambda.width()).isEqualTo(50);
    assertThat(lambda.x()).isEqualTo(30);
    assertThat(body.x()).isEqualTo(40);
    assertThat(centerX(body)).isEqualTo(centerX(lambda));
    assertThat(body.y()).isEqualTo(130);

    assertThat(result.connectors()).singleElement().satisfies(connector -> {
      assertThat(connector.fromId()).isEqualTo(term.getId());
      assertThat(connector.from()).isEqualTo(new Point(55, 70));
      assertThat(connector.to()).isEqualTo(new Point(55, 130));
      assertThat(connector.highlighted()).isFalse();
    });
    assertThat(result.canvasHeight()).isEqualTo(200);
  }

  @Test
  public void testApplicationCenteredOverChildren() {
    val result = layout.layout(Parser.parse("f x"));
    val app = result.nodes().get(0);
    val func = result.nodes().get(1);
    val arg = result.nodes().get(2);

    assertThat(app.label()).isEqualTo(TreeLayout.APPLICATION_LABEL);
    assertThat(func.x()).isEqualTo(30);
    assertThat(arg.x()).isEqualTo(func.x() + func.width() + 25);
    assertThat(centerX(app)).isEqualTo((func.x() + arg.x() + arg.width()) / 2);
    assertThat(result.connectors()).hasSize(2);
  }

  @Test
  public void testNoOverlap() {
    val result = layout.layout(Parser.parse("(λm.λn.λf.λx.m f (n f x)) (λf.λx.f (f x)) (λabcdefghij.abcdefghij)"));
    for (val a : result.nodes()) {
      assertThat(a.x()).isGreaterThanOrEqualTo(30);
      assertThat(a.x() + a.width()).isLessThanOrEqualTo(result.canvasWidth() - 30);
      assertThat(a.y() + a.height()).isLessThanOrEqualTo(result.canvasHeight() - 30);
      for (val b : result.nodes()) {
        if (a != b && a.y() == b.y()) {
          assertThat(a.x() + a.width() <= b.x() || b.x() + b.width() <= a.x())
              .as("%s overlaps %s", a, b).isTrue();
        }
      }
    }
  }

  @Test
  public void testConnectorsJoinBoxes() {
    val result = layout.layout(Parser.parse("λf.λx.f (f x)"));
    for (val connector : result.connectors()) {
      val parent = result.node(connector.fromId()).get();
      val child = result.node(connector.toId()).get();
      assertThat(connector.from()).isEqualTo(parent.bottomCenter());
      assertThat(connector.to()).isEqualTo(child.topCenter());
    }
  }

  @Test
  public void testHighlightById() {
    val term = (Application) Parser.parse("(λx.x) y");
    val result = layout.layout(term, Optional.of(term.getId()));
    assertThat(result.node(term.getId()).get().highlighted()).isTrue();
    assertThat(result.node(term.getFunc().getId()).get().highlighted()).isFalse();
    assertThat(result.connectors()).noneMatch(TreeLayoutResult.Connector::highlighted);
  }

  @Test
  public void testHighlightMarkedRedex() {
    val marked = (Application) Reducer.markNextRedex(Parser.parse("a ((λx.x) b)"));
    val redex = (Application) marked.getArg();
    val result = layout.layout(marked);

    assertThat(result.node(marked.getId()).get().highlighted()).isFalse();
    assertThat(result.node(redex.getId()).get().highlighted()).isTrue();
    assertThat(result.node(redex.getFunc().getId()).get().highlighted()).isTrue();
    assertThat(result.node(redex.getArg().getId()).get().highlighted()).isFalse();

    val highlighted = result.connectors().stream().filter(TreeLayoutResult.Connector::highlighted)
        .collect(ImmutableList.toImmutableList());
    assertThat(highlighted).singleElement().satisfies(connector -> {
      assertThat(connector.fromId()).isEqualTo(redex.getId());
      assertThat(connector.toId()).isEqualTo(redex.getFunc().getId());
    });
  }

  @Test
  public void testOriginTags() {
    val term = Parser.parse("_ID y", new NamedTermRegistry());
    val result = layout.layout(term);
    assertThat(result.nodes()).filteredOn(node -> node.type() == NodeType.LAMBDA)
        .singleElement().satisfies(node -> assertThat(node.originTag()).contains("_ID"));
  }

  @Test
  public void testError() {
    val result = layout.layout(new TestTerm());
    assertThat(result.error()).hasValueSatisfying(error -> assertThat(error).startsWith("Layout Error: "));
    assertThat(result.nodes()).isEmpty();
    assertThat(result.canvasWidth()).isEqualTo(300);
    assertThat(result.canvasHeight()).isEqualTo(100);
  }

  @Test
  public void testConfig() {
    assertThatThrownBy(() -> new TreeLayout.Config(0, 30, 50, 25, 60, 5, 8, 30, 200, 100, 300, 100))
        .isInstanceOf(IllegalArgumentException.class);

    val compact = new TreeLayout(new TreeLayout.Config(20, 10, 10, 5, 10, 1, 4, 0, 0, 0, 0, 0));
    val result = compact.layout(Parser.parse("x"));
    assertThat(result.canvasWidth()).isEqualTo(10);
    assertThat(result.canvasHeight()).isEqualTo(20);
  }
}
