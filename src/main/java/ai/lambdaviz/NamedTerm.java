package ai.lambdaviz;

import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * A registry entry mapping a name to the surface syntax it abbreviates. Names
 * are referenced in expressions as {@code _NAME}.
 */
public record NamedTerm(String name, String lambda, Optional<String> description) {
  public static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_']*");

  public NamedTerm {
    Preconditions.checkArgument(name != null && NAME_PATTERN.matcher(name).matches(),
        "Invalid term name \"%s\". Names must start with a letter followed by letters, digits, _ or '.", name);
    Preconditions.checkArgument(lambda != null && !lambda.isBlank(), "Term %s has an empty definition.", name);
    Preconditions.checkNotNull(description);
  }

  public NamedTerm(final String name, final String lambda) {
    this(name, lambda, Optional.empty());
  }

  public NamedTerm(final String name, final String lambda, final String description) {
    this(name, lambda, Optional.ofNullable(description));
  }

  /**
   * The reference spelling used in expressions.
   */
  public String reference() {
    return "_" + name;
  }
}
