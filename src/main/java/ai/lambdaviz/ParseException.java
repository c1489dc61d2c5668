package ai.lambdaviz;

import java.util.Optional;

import lombok.Getter;

/**
 * Thrown when surface syntax cannot be parsed into a {@link Term}.
 */
public class ParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 2946611870211946302L;

  public enum Reason {
    EMPTY_INPUT,
    UNRECOGNIZED_CHARACTER,
    UNEXPECTED_TOKEN,
    UNEXPECTED_END,
    INVALID_PARAMETER,
    TRAILING_TOKENS,
    NUMERAL_TOO_LARGE
  }

  @Getter
  private final Reason reason;
  private final String token;
  /**
   * Character offset of the offending input, or -1 if unknown.
   */
  @Getter
  private final int position;

  public ParseException(final Reason reason, final String token, final int position, final String message) {
    super(message);
    this.reason = reason;
    this.token = token;
    this.position = position;
  }

  public ParseException(final ParseException cause, final String context) {
    super(String.format("%s: %s", context, cause.getMessage()), cause);
    reason = cause.reason;
    token = cause.token;
    position = cause.position;
  }

  public Optional<String> getToken() {
    return Optional.ofNullable(token);
  }
}
