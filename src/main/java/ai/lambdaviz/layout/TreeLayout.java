package ai.lambdaviz.layout;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import ai.lambdaviz.Application;
import ai.lambdaviz.Lambda;
import ai.lambdaviz.Printer;
import ai.lambdaviz.ReductionException;
import ai.lambdaviz.Term;
import ai.lambdaviz.Variable;
import ai.lambdaviz.layout.TreeLayoutResult.Connector;
import ai.lambdaviz.layout.TreeLayoutResult.Node;
import ai.lambdaviz.layout.TreeLayoutResult.NodeType;
import lombok.val;

/**
 * Lays out a term as a top-down syntax tree. Each subtree is laid out in its
 * own block starting at x = 0 and then shifted rigidly into its parent's
 * coordinates once the parent knows where its children go.
 */
public class TreeLayout {
  public static record Config(double nodeHeight, double minNodeWidth, double lambdaNodeWidth, double horizontalGap,
      double verticalGap, double textPadding, double charWidth, double canvasPadding, double minCanvasWidth,
      double minCanvasHeight, double errorCanvasWidth, double errorCanvasHeight) {
    public Config {
      Preconditions.checkArgument(nodeHeight > 0, "nodeHeight must be positive.");
      Preconditions.checkArgument(minNodeWidth > 0, "minNodeWidth must be positive.");
      Preconditions.checkArgument(lambdaNodeWidth > 0, "lambdaNodeWidth must be positive.");
      Preconditions.checkArgument(horizontalGap >= 0, "horizontalGap must be nonnegative.");
      Preconditions.checkArgument(verticalGap >= 0, "verticalGap must be nonnegative.");
      Preconditions.checkArgument(textPadding >= 0, "textPadding must be nonnegative.");
      Preconditions.checkArgument(charWidth > 0, "charWidth must be positive.");
      Preconditions.checkArgument(canvasPadding >= 0, "canvasPadding must be nonnegative.");
      Preconditions.checkArgument(minCanvasWidth >= 0 && minCanvasHeight >= 0, "Minimum canvas must be nonnegative.");
      Preconditions.checkArgument(errorCanvasWidth >= 0 && errorCanvasHeight >= 0, "Error canvas must be nonnegative.");
    }
  }

  public static final Config DEFAULT_CONFIG = new Config(40, 30, 50, 25, 60, 5, 8, 30, 200, 100, 300, 100);

  public static final String APPLICATION_LABEL = "@";

  /**
   * A laid out subtree. Blocks are normalized so that their leftmost extent is
   * at x = 0.
   */
  private static record Block(ImmutableList<Node> nodes, ImmutableList<Connector> connectors, double width,
      double bottom, Node root) {
    Block shifted(final double dx) {
      return new Block(
          nodes.stream().map(node -> node.shifted(dx, 0)).collect(ImmutableList.toImmutableList()),
          connectors.stream().map(connector -> connector.shifted(dx, 0)).collect(ImmutableList.toImmutableList()),
          width, bottom, root.shifted(dx, 0));
    }
  }

  public final Config config;

  public TreeLayout() {
    this(DEFAULT_CONFIG);
  }

  public TreeLayout(final Config config) {
    this.config = config;
  }

  /**
   * Lays out the term. A node is highlighted if it is {@code highlightId} or
   * carries the redex marker. Failures do not propagate; they are reported in
   * an empty result with {@link TreeLayoutResult#error()} set.
   */
  public TreeLayoutResult layout(final Term term, final Optional<Long> highlightId) {
    if (term == null) {
      return new TreeLayoutResult(ImmutableList.of(), ImmutableList.of(), 0, 0, Optional.empty());
    }

    try {
      val block = layout(term, 0, highlightId);
      val pad = config.canvasPadding();
      return new TreeLayoutResult(
          block.nodes().stream().map(node -> node.shifted(pad, pad)).collect(ImmutableList.toImmutableList()),
          block.connectors().stream().map(connector -> connector.shifted(pad, pad))
              .collect(ImmutableList.toImmutableList()),
          Math.max(config.minCanvasWidth(), block.width() + 2 * pad),
          Math.max(config.minCanvasHeight(), block.bottom() + 2 * pad),
          Optional.empty());
    } catch (final RuntimeException e) {
      return TreeLayoutResult.error("Layout Error: " + e.getMessage(), config.errorCanvasWidth(),
          config.errorCanvasHeight());
    }
  }

  public TreeLayoutResult layout(final Term term) {
    return layout(term, Optional.empty());
  }

  /**
   * Box width for a variable or lambda header of the given label.
   */
  public double labelWidth(final String label, final double minimum) {
    return Math.max(minimum, label.length() * config.charWidth() + 2 * config.textPadding());
  }

  private Block layout(final Term term, final double y, final Optional<Long> highlightId) {
    val highlighted = highlightId.map(id -> id == term.getId()).orElse(false) || term.isRedexMarked();
    val childY = y + config.nodeHeight() + config.verticalGap();

    if (term instanceof Variable variable) {
      val width = labelWidth(variable.getName(), config.minNodeWidth());
      val node = node(term, NodeType.VARIABLE, variable.getName(), 0, y, width, highlighted);
      return new Block(ImmutableList.of(node), ImmutableList.of(), width, y + config.nodeHeight(), node);
    } else if (term instanceof Lambda lambda) {
      val label = Printer.BINDER + lambda.getParam() + ".";
      val width = labelWidth(label, config.lambdaNodeWidth());
      val body = layout(lambda.getBody(), childY, highlightId);

      val x = body.root().topCenter().x() - width / 2;
      val left = Math.min(0, x);
      val right = Math.max(body.width(), x + width);
      val node = node(term, NodeType.LAMBDA, label, x - left, y, width, highlighted);
      return assemble(node, ImmutableList.of(body.shifted(-left)), ImmutableList.of(lambda.getBody()), highlighted,
          right - left);
    } else if (term instanceof Application app) {
      val width = labelWidth(APPLICATION_LABEL, config.minNodeWidth());
      val func = layout(app.getFunc(), childY, highlightId);
      val arg = layout(app.getArg(), childY, highlightId).shifted(func.width() + config.horizontalGap());

      val span = func.width() + config.horizontalGap() + arg.width();
      val x = span / 2 - width / 2;
      val left = Math.min(0, x);
      val right = Math.max(span, x + width);
      val node = node(term, NodeType.APPLICATION, APPLICATION_LABEL, x - left, y, width, highlighted);
      return assemble(node, ImmutableList.of(func.shifted(-left), arg.shifted(-left)),
          ImmutableList.of(app.getFunc(), app.getArg()), highlighted, right - left);
    }
    throw ReductionException.unknownVariant(term);
  }

  private Node node(final Term term, final NodeType type, final String label, final double x, final double y,
      final double width, final boolean highlighted) {
    return new Node(term.getId(), type, label, x, y, width, config.nodeHeight(), highlighted, term.getOriginTag());
  }

  private static Block assemble(final Node node, final ImmutableList<Block> children,
      final ImmutableList<Term> childTerms, final boolean highlighted, final double width) {
    val nodes = ImmutableList.<Node>builder().add(node);
    val connectors = ImmutableList.<Connector>builder();
    double bottom = node.y() + node.height();
    for (int i = 0; i < children.size(); ++i) {
      val child = children.get(i);
      nodes.addAll(child.nodes());
      connectors.add(new Connector(node.id(), child.root().id(), node.bottomCenter(), child.root().topCenter(),
          highlighted && childTerms.get(i).isRedexMarked()));
      connectors.addAll(child.connectors());
      bottom = Math.max(bottom, child.bottom());
    }
    return new Block(nodes.build(), connectors.build(), width, bottom, node);
  }
}
