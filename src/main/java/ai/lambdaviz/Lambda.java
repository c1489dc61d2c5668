package ai.lambdaviz;

import lombok.Getter;

public final class Lambda extends Term {
  @Getter
  private final String param;
  @Getter
  private final Term body;

  public Lambda(final String param, final Term body) {
    this(param, body, null, false);
  }

  public Lambda(final String param, final Term body, final String originTag) {
    this(param, body, originTag, false);
  }

  private Lambda(final String param, final Term body, final String originTag, final boolean redexMarked) {
    super(originTag, redexMarked);
    this.param = param;
    this.body = body;
  }

  /**
   * Rebuilds this abstraction around a new body, keeping the parameter and tag.
   */
  public Lambda withBody(final Term newBody) {
    return new Lambda(param, newBody, getOriginTag().orElse(null));
  }

  @Override
  public Lambda copy() {
    return new Lambda(param, body.copy(), getOriginTag().orElse(null));
  }

  @Override
  public Lambda withOriginTag(final String originTag) {
    return new Lambda(param, body, originTag);
  }

  @Override
  Lambda withRedexMarker() {
    return new Lambda(param, body, getOriginTag().orElse(null), true);
  }
}
