package ai.lambdaviz.layout;

/**
 * Thrown when a term cannot be laid out, such as a circuit diagram for a term
 * with free variables.
 */
public class LayoutException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public LayoutException(final String message) {
    super(message);
  }
}
