package ai.lambdaviz;

import lombok.Getter;

public final class Variable extends Term {
  @Getter
  private final String name;

  public Variable(final String name) {
    this(name, null, false);
  }

  public Variable(final String name, final String originTag) {
    this(name, originTag, false);
  }

  private Variable(final String name, final String originTag, final boolean redexMarked) {
    super(originTag, redexMarked);
    this.name = name;
  }

  public Variable rename(final String newName) {
    return new Variable(newName, getOriginTag().orElse(null));
  }

  @Override
  public Variable copy() {
    return new Variable(name, getOriginTag().orElse(null));
  }

  @Override
  public Variable withOriginTag(final String originTag) {
    return new Variable(name, originTag);
  }

  @Override
  Variable withRedexMarker() {
    return new Variable(name, getOriginTag().orElse(null), true);
  }
}
