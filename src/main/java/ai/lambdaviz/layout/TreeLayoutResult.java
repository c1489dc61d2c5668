package ai.lambdaviz.layout;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Positioned boxes and connectors for a syntax tree. Coordinates are in pixels
 * with the origin at the top left of the canvas; a node's {@code x} and
 * {@code y} are the top left corner of its box.
 */
public record TreeLayoutResult(ImmutableList<Node> nodes, ImmutableList<Connector> connectors, double canvasWidth,
    double canvasHeight, Optional<String> error) {
  public enum NodeType {
    VARIABLE, LAMBDA, APPLICATION
  }

  public static record Node(long id, NodeType type, String label, double x, double y, double width, double height,
      boolean highlighted, Optional<String> originTag) {
    public Node shifted(final double dx, final double dy) {
      return new Node(id, type, label, x + dx, y + dy, width, height, highlighted, originTag);
    }

    public Point topCenter() {
      return new Point(x + width / 2, y);
    }

    public Point bottomCenter() {
      return new Point(x + width / 2, y + height);
    }
  }

  /**
   * A straight edge from a parent's bottom center to a child's top center.
   */
  public static record Connector(long fromId, long toId, Point from, Point to, boolean highlighted) {
    public Connector shifted(final double dx, final double dy) {
      return new Connector(fromId, toId, from.shifted(dx, dy), to.shifted(dx, dy), highlighted);
    }
  }

  public static TreeLayoutResult error(final String message, final double canvasWidth, final double canvasHeight) {
    return new TreeLayoutResult(ImmutableList.of(), ImmutableList.of(), canvasWidth, canvasHeight,
        Optional.of(message));
  }

  public Optional<Node> node(final long id) {
    return nodes.stream().filter(node -> node.id() == id).findFirst();
  }
}
