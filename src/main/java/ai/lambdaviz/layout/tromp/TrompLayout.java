package ai.lambdaviz.layout.tromp;

import java.util.Optional;

import com.google.common.base.Preconditions;

import ai.lambdaviz.Application;
import ai.lambdaviz.Lambda;
import ai.lambdaviz.ReductionException;
import ai.lambdaviz.Term;
import ai.lambdaviz.Variable;
import ai.lambdaviz.layout.LayoutException;
import ai.lambdaviz.util.Scope;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.val;

/**
 * Lays out a closed term as a Tromp diagram.
 * <p>
 * Abstractions are horizontal bars over the columns their bodies occupy.
 * Variable occurrences are vertical lines dropping from their binder's bar.
 * Applications join the lines of their function and argument with an elbow
 * at the bottom of the two, leaving one line to continue down to an enclosing
 * application.
 * <p>
 * Layout is done twice with the same recursion: once into a {@link NullGrid}
 * to find the grid size, then into a {@link StrokeCollectingGrid}.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TrompLayout {
  public static final double DEFAULT_SCALE = 20;

  /**
   * Where a subterm sits relative to the nearest enclosing application, which
   * determines which line it leaves open for that application to join.
   */
  private enum Position {
    TOP, FUNCTION, ARGUMENT
  }

  private static record Binding(int row, Optional<String> originTag, boolean primary) {
  }

  private static record Connection(int row, int col) {
  }

  /**
   * Rows and columns consumed, exclusive, and the open line for the enclosing
   * application to join, if any.
   */
  private static record Extent(int rows, int cols, Connection leftover) {
  }

  private final Grid grid;
  private final Optional<Long> highlightId;

  public static CircuitLayout layout(final Term term) {
    return layout(term, DEFAULT_SCALE, Optional.empty());
  }

  public static CircuitLayout layout(final Term term, final double scale) {
    return layout(term, scale, Optional.empty());
  }

  /**
   * Lays out a closed term. Failures, such as a free variable, do not propagate;
   * they are reported in an empty result with {@link CircuitLayout#error()} set.
   */
  public static CircuitLayout layout(final Term term, final double scale, final Optional<Long> highlightId) {
    Preconditions.checkNotNull(term);
    Preconditions.checkArgument(scale > 0, "scale must be positive.");

    try {
      return draw(term, scale, highlightId);
    } catch (final RuntimeException e) {
      return CircuitLayout.error("Layout Error: " + e.getMessage(), scale);
    }
  }

  private static CircuitLayout draw(final Term term, final double scale, final Optional<Long> highlightId) {
    val extent = new TrompLayout(new NullGrid(), highlightId).draw(term);
    val gridWidth = Math.max(1, extent.cols());
    val gridHeight = Math.max(1, extent.rows());

    val strokes = new StrokeCollectingGrid();
    new TrompLayout(strokes, highlightId).draw(term);

    return new CircuitLayout(strokes.getStrokes(), gridWidth, gridHeight, gridWidth * scale, gridHeight * scale,
        String.format("0 0 %s %s", gridWidth, gridHeight), Optional.empty());
  }

  private Extent draw(final Term term) {
    return draw(term, Position.TOP, 0, 0, Scope.empty(), term.getOriginTag(), false, false);
  }

  /**
   * @param inheritedTag     origin tag of the nearest tagged ancestor
   * @param secondary        whether this subterm is inside the argument of the
   *                         highlighted redex
   * @param redexAbstraction whether this is the abstraction of the highlighted
   *                         redex
   */
  private Extent draw(final Term term, final Position position, final int row, final int col,
      final Scope<Binding> bindings, final Optional<String> inheritedTag, final boolean secondary,
      final boolean redexAbstraction) {
    val tag = term.getOriginTag().or(() -> inheritedTag);

    if (term instanceof Variable variable) {
      val binding = bindings.lookup(variable.getName())
          .orElseThrow(() -> new LayoutException(String.format(
              "Free variable %s cannot be drawn; circuit diagrams require closed terms.", variable.getName())));
      grid.drawVariable(binding.row(), row, col,
          new Stroke.Style(binding.originTag().or(() -> tag), binding.primary(), secondary));
      return position == Position.TOP
          ? new Extent(row + 1, col + 1, null)
          : new Extent(row, col + 1, new Connection(row, col));
    } else if (term instanceof Lambda lambda) {
      val body = draw(lambda.getBody(), position, row + 1, col,
          bindings.bind(lambda.getParam(), new Binding(row, tag, redexAbstraction)), tag, secondary, false);
      grid.drawLambda(row, col, body.cols() - 1, lambda.getParam(),
          new Stroke.Style(tag, redexAbstraction, secondary));
      return body;
    } else if (term instanceof Application app) {
      val redex = app.isRedex() && highlightId.map(id -> id == app.getId()).orElse(false);
      val func = draw(app.getFunc(), Position.FUNCTION, row, col, bindings, tag, secondary, redex);
      val arg = draw(app.getArg(), Position.ARGUMENT, row, func.cols(), bindings, tag, secondary || redex, false);
      if (func.leftover() == null || arg.leftover() == null) {
        throw new LayoutException("Application operands did not leave a line to join.");
      }

      val bottom = Math.max(func.rows(), arg.rows());
      val style = new Stroke.Style(tag, redex, secondary);
      val left = func.leftover();
      val right = arg.leftover();
      switch (position) {
        case FUNCTION:
          grid.drawForwardElbow(left.row(), bottom, left.col(), right.col(), style);
          return new Extent(bottom + 1, arg.cols(), right);
        case ARGUMENT:
          grid.drawBackwardElbow(right.row(), bottom, left.col(), right.col(), style);
          return new Extent(bottom + 1, arg.cols(), left);
        default:
          grid.drawU(left.row(), bottom, right.row(), left.col(), right.col(), style);
          return new Extent(bottom + 1, arg.cols(), null);
      }
    }
    throw ReductionException.unknownVariant(term);
  }
}
