package ai.lambdaviz;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import lombok.Getter;

/**
 * A node of an untyped lambda calculus term. Terms are immutable trees; every
 * transformation produces fresh nodes with fresh ids, so no subtree ever has
 * more than one parent.
 */
public abstract class Term {
  /**
   * Ids wrap past this threshold. They only need to be unique among the nodes of
   * a single render cycle.
   */
  public static final long ID_WRAP = 10_000_000;

  private static final AtomicLong ids = new AtomicLong();
  private static final Pattern NUMERAL_TAG = Pattern.compile("_\\d+");

  private static long nextId() {
    return ids.getAndUpdate(id -> id >= ID_WRAP ? 0 : id + 1);
  }

  @Getter
  private final long id = nextId();
  private final String originTag;
  /**
   * Transient highlight marker set by {@link Reducer#markNextRedex(Term)}.
   */
  @Getter
  private final boolean redexMarked;

  protected Term(final String originTag, final boolean redexMarked) {
    this.originTag = originTag;
    this.redexMarked = redexMarked;
  }

  /**
   * The registry reference (e.g. {@code _PLUS}, {@code _5}) this node was
   * expanded from, if any.
   */
  public Optional<String> getOriginTag() {
    return Optional.ofNullable(originTag);
  }

  public boolean hasNumeralTag() {
    return originTag != null && isChurchNumeralTag(originTag);
  }

  /**
   * Deep copy with fresh ids. Origin tags are kept; redex markers are cleared.
   */
  public abstract Term copy();

  /**
   * Shallow copy of this node with a new origin tag and a fresh id. Children
   * are shared, which is safe since nodes are never mutated.
   */
  public abstract Term withOriginTag(String originTag);

  abstract Term withRedexMarker();

  public static boolean isChurchNumeralTag(final String tag) {
    return NUMERAL_TAG.matcher(tag).matches();
  }

  @Override
  public String toString() {
    return Printer.print(this);
  }
}
