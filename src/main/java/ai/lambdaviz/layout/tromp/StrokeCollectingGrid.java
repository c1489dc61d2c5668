package ai.lambdaviz.layout.tromp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import ai.lambdaviz.layout.Point;
import lombok.val;

/**
 * Records strokes with points at cell centers, so a diagram of
 * {@code width × height} cells fits in {@code [0, width] × [0, height]}.
 * Stroke keys are numbered from zero per grid.
 */
public class StrokeCollectingGrid implements Grid {
  /**
   * Half the length of a lambda bar beyond the centers of its end cells.
   */
  public static final double BAR_OVERHANG = 1.0 / 3;

  private final List<Stroke> strokes = new ArrayList<>();
  private int nextKey;

  public ImmutableList<Stroke> getStrokes() {
    return ImmutableList.copyOf(strokes);
  }

  private static Point cell(final int row, final int col) {
    return new Point(col + .5, row + .5);
  }

  private void add(final Stroke.Type type, final ImmutableList<Point> points, final Optional<String> title,
      final Stroke.Style style) {
    strokes.add(new Stroke(type, "tromp-" + nextKey++, points, title, style.originTag(), style.primary(),
        style.secondary()));
  }

  @Override
  public void drawLambda(final int row, final int startCol, final int endCol, final String param,
      final Stroke.Style style) {
    val start = cell(row, startCol);
    val end = cell(row, Math.max(startCol, endCol));
    add(Stroke.Type.LAMBDA,
        ImmutableList.of(start.shifted(-BAR_OVERHANG, 0), end.shifted(BAR_OVERHANG, 0)),
        Optional.of(param), style);
  }

  @Override
  public void drawVariable(final int startRow, final int endRow, final int col, final Stroke.Style style) {
    add(Stroke.Type.VARIABLE, ImmutableList.of(cell(startRow, col), cell(endRow, col)), Optional.empty(), style);
  }

  @Override
  public void drawForwardElbow(final int startRow, final int endRow, final int startCol, final int endCol,
      final Stroke.Style style) {
    add(Stroke.Type.FORWARD_ELBOW,
        ImmutableList.of(cell(startRow, startCol), cell(endRow, startCol), cell(endRow, endCol)),
        Optional.empty(), style);
  }

  @Override
  public void drawBackwardElbow(final int startRow, final int endRow, final int startCol, final int endCol,
      final Stroke.Style style) {
    add(Stroke.Type.BACKWARD_ELBOW,
        ImmutableList.of(cell(endRow, startCol), cell(endRow, endCol), cell(startRow, endCol)),
        Optional.empty(), style);
  }

  @Override
  public void drawU(final int startRow, final int endRow, final int backRow, final int startCol, final int endCol,
      final Stroke.Style style) {
    add(Stroke.Type.U_ELBOW,
        ImmutableList.of(cell(startRow, startCol), cell(endRow, startCol), cell(endRow, endCol),
            cell(backRow, endCol)),
        Optional.empty(), style);
  }
}
