package ai.lambdaviz.layout.tromp;

/**
 * Discards everything. Used for the sizing pass.
 */
public class NullGrid implements Grid {
  @Override
  public void drawLambda(final int row, final int startCol, final int endCol, final String param,
      final Stroke.Style style) {
  }

  @Override
  public void drawVariable(final int startRow, final int endRow, final int col, final Stroke.Style style) {
  }

  @Override
  public void drawForwardElbow(final int startRow, final int endRow, final int startCol, final int endCol,
      final Stroke.Style style) {
  }

  @Override
  public void drawBackwardElbow(final int startRow, final int endRow, final int startCol, final int endCol,
      final Stroke.Style style) {
  }

  @Override
  public void drawU(final int startRow, final int endRow, final int backRow, final int startCol, final int endCol,
      final Stroke.Style style) {
  }
}
