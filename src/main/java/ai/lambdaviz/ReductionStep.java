package ai.lambdaviz;

import java.util.Optional;

/**
 * The outcome of contracting at most one redex. When nothing changed, the
 * result is a fresh copy of the input in normal form.
 *
 * @param redexId id of the contracted application in the input term
 */
public record ReductionStep(Term result, boolean changed, Optional<Long> redexId) {
}
