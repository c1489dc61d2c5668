package ai.lambdaviz.layout.tromp;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * A Tromp diagram: strokes in grid units plus the grid and pixel dimensions to
 * render them at. A diagram that could not be drawn has no strokes, a 1 × 1
 * grid and its failure in {@link #error()}.
 */
public record CircuitLayout(ImmutableList<Stroke> strokes, int gridWidth, int gridHeight, double pixelWidth,
    double pixelHeight, String viewBox, Optional<String> error) {
  public static CircuitLayout error(final String message, final double scale) {
    return new CircuitLayout(ImmutableList.of(), 1, 1, scale, scale, "0 0 1 1", Optional.of(message));
  }
}
