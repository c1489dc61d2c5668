package ai.lambdaviz;

import lombok.Getter;

public final class Application extends Term {
  @Getter
  private final Term func, arg;

  public Application(final Term func, final Term arg) {
    this(func, arg, null, false);
  }

  public Application(final Term func, final Term arg, final String originTag) {
    this(func, arg, originTag, false);
  }

  private Application(final Term func, final Term arg, final String originTag, final boolean redexMarked) {
    super(originTag, redexMarked);
    this.func = func;
    this.arg = arg;
  }

  /**
   * An application whose function position is an abstraction.
   */
  public boolean isRedex() {
    return func instanceof Lambda;
  }

  @Override
  public Application copy() {
    return new Application(func.copy(), arg.copy(), getOriginTag().orElse(null));
  }

  @Override
  public Application withOriginTag(final String originTag) {
    return new Application(func, arg, originTag);
  }

  @Override
  Application withRedexMarker() {
    return new Application(func, arg, getOriginTag().orElse(null), true);
  }
}
