package ai.lambdaviz;

/**
 * A term variant that none of the term algorithms recognize.
 */
public class TestTerm extends Term {
  public TestTerm() {
    super(null, false);
  }

  @Override
  public Term copy() {
    return new TestTerm();
  }

  @Override
  public Term withOriginTag(final String originTag) {
    return new TestTerm();
  }

  @Override
  Term withRedexMarker() {
    return new TestTerm();
  }
}
