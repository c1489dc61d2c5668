package ai.lambdaviz;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import io.reactivex.Observable;
import io.reactivex.disposables.Disposable;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import lombok.Getter;
import lombok.val;

/**
 * A term being reduced interactively, with its reduction history. Every change
 * is published as a {@link Snapshot}; human-readable status messages are
 * published separately.
 */
public class ReductionSession implements AutoCloseable {
  public static final String INITIAL_EXPRESSION = "(λx.λy.x y) (λz.z)";

  public static record Snapshot(Optional<Term> term, String printed, String prettified, boolean reducible,
      Optional<Long> highlightId, Optional<String> error) {
  }

  @Getter
  private final NamedTermRegistry registry;
  private final Prettifier prettifier;
  private final Disposable prettifierDiagnostics;

  private final Subject<Snapshot> rxSnapshots = PublishSubject.create();
  private final Subject<String> rxDiagnostics = PublishSubject.create();

  @Getter
  private String expression;
  private Term current;
  private final List<Term> history = new ArrayList<>();
  @Getter
  private Optional<Long> highlightedRedexId = Optional.empty();
  @Getter
  private Optional<String> error = Optional.empty();

  public ReductionSession(final NamedTermRegistry registry) {
    this.registry = registry;
    prettifier = new Prettifier(registry);
    prettifierDiagnostics = prettifier.rxDiagnostics().subscribe(rxDiagnostics::onNext);
  }

  public Observable<Snapshot> rxSnapshots() {
    return rxSnapshots;
  }

  public Observable<String> rxDiagnostics() {
    return rxDiagnostics;
  }

  public Optional<Term> getCurrentTerm() {
    return Optional.ofNullable(current);
  }

  public ImmutableList<Term> getHistory() {
    return ImmutableList.copyOf(history);
  }

  public boolean isReducible() {
    return highlightedRedexId.isPresent();
  }

  /**
   * Parses an expression and makes it the start of a new history. On a parse
   * error the session is left without a term.
   */
  public void load(final String expression) {
    this.expression = expression;
    history.clear();
    try {
      setCurrent(Parser.parse(expression, registry));
    } catch (final ParseException e) {
      current = null;
      fail("Parse error: " + e.getMessage());
    }
  }

  public void reset() {
    load(INITIAL_EXPRESSION);
  }

  /**
   * Contracts one redex.
   *
   * @return whether the term changed
   */
  public boolean step() {
    if (current == null) {
      rxDiagnostics.onNext("Nothing to reduce.");
      return false;
    }

    try {
      val step = Reducer.reduceStep(current);
      if (!step.changed()) {
        rxDiagnostics.onNext("Expression is in normal form.");
        return false;
      }
      setCurrent(step.result());
      return true;
    } catch (final ReductionException e) {
      fail("Reduction error: " + e.getMessage());
      return false;
    }
  }

  /**
   * Reduces until normal form or the step ceiling, recording only the final
   * term in the history.
   */
  public Optional<Normalization> reduceFully(final int maxSteps) {
    if (current == null) {
      rxDiagnostics.onNext("Nothing to reduce.");
      return Optional.empty();
    }

    try {
      val normalization = Reducer.normalize(current, maxSteps);
      if (normalization.reachedNormalForm()) {
        rxDiagnostics.onNext(String.format("Reached normal form in %s steps.", normalization.steps()));
      } else {
        rxDiagnostics.onNext(String.format("Stopped after %s steps without reaching normal form.",
            normalization.steps()));
      }
      setCurrent(normalization.result());
      return Optional.of(normalization);
    } catch (final ReductionException e) {
      fail("Reduction error: " + e.getMessage());
      return Optional.empty();
    }
  }

  private void setCurrent(final Term term) {
    current = term;
    history.add(term);
    error = Optional.empty();
    highlightedRedexId = Reducer.locateNextRedex(term);
    rxSnapshots.onNext(new Snapshot(Optional.of(term), Printer.print(term), prettifier.prettify(term),
        highlightedRedexId.isPresent(), highlightedRedexId, error));
  }

  /**
   * Records an error. A term that failed to reduce stays current but is no
   * longer offered for reduction.
   */
  private void fail(final String message) {
    highlightedRedexId = Optional.empty();
    error = Optional.of(message);
    rxDiagnostics.onNext(message);
    rxSnapshots.onNext(new Snapshot(getCurrentTerm(), "Error", "Error", false, Optional.empty(), error));
  }

  @Override
  public void close() {
    prettifierDiagnostics.dispose();
    rxSnapshots.onComplete();
    rxDiagnostics.onComplete();
  }
}
