package ai.lambdaviz;

public record Normalization(Term result, int steps, Status status) {
  public enum Status {
    NORMAL_FORM,
    /**
     * Reduction stopped at the step ceiling. The result is the last term reached,
     * which is not known to be in normal form.
     */
    STEP_LIMIT_EXCEEDED
  }

  public boolean reachedNormalForm() {
    return status == Status.NORMAL_FORM;
  }
}
