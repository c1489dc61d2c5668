package ai.lambdaviz;

/**
 * Thrown when a malformed term reaches the reducer.
 */
public class ReductionException extends IllegalStateException {
  private static final long serialVersionUID = -6017253395427093316L;

  public ReductionException(final String message) {
    super(message);
  }

  public static ReductionException unknownVariant(final Term term) {
    return new ReductionException(String.format("Unknown term variant %s.",
        term == null ? "null" : term.getClass().getName()));
  }
}
