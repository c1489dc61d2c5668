package ai.lambdaviz.layout.tromp;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

import ai.lambdaviz.layout.Point;

/**
 * A polyline in grid units.
 */
public record Stroke(Type type, String key, ImmutableList<Point> points, Optional<String> title,
    Optional<String> originTag, boolean primary, boolean secondary) {
  public enum Type {
    /**
     * Horizontal bar of an abstraction.
     */
    LAMBDA,
    /**
     * Vertical line from a binder down to a variable occurrence.
     */
    VARIABLE,
    /**
     * ┌
     */
    FORWARD_ELBOW,
    /**
     * ┐
     */
    BACKWARD_ELBOW,
    /**
     * ┌┐
     */
    U_ELBOW
  }

  /**
   * Coloring and highlight shared by the strokes a single draw call produces.
   */
  public static record Style(Optional<String> originTag, boolean primary, boolean secondary) {
  }
}
