package ai.lambdaviz.layout.tromp;

/**
 * Sink for circuit diagram strokes. Rows and columns are integral cell
 * indices; implementations decide where within a cell a stroke is drawn.
 */
public interface Grid {
  /**
   * An abstraction bar on {@code row} spanning columns {@code startCol} through
   * {@code endCol} inclusive.
   */
  void drawLambda(int row, int startCol, int endCol, String param, Stroke.Style style);

  void drawVariable(int startRow, int endRow, int col, Stroke.Style style);

  /**
   * ┌: down from {@code (startRow, startCol)} to {@code endRow}, then across to
   * {@code endCol}.
   */
  void drawForwardElbow(int startRow, int endRow, int startCol, int endCol, Stroke.Style style);

  /**
   * ┐: across {@code endRow} from {@code startCol} to {@code endCol}, then up to
   * {@code startRow}.
   */
  void drawBackwardElbow(int startRow, int endRow, int startCol, int endCol, Stroke.Style style);

  /**
   * ┌┐: down from {@code (startRow, startCol)} to {@code endRow}, across to
   * {@code endCol}, then up to {@code backRow}.
   */
  void drawU(int startRow, int endRow, int backRow, int startCol, int endCol, Stroke.Style style);
}
