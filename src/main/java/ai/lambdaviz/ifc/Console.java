package ai.lambdaviz.ifc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.EnumMap;

import ai.lambdaviz.NamedTerm;
import ai.lambdaviz.NamedTermExpander;
import ai.lambdaviz.NamedTermRegistry;
import ai.lambdaviz.ParseException;
import ai.lambdaviz.ReductionSession;
import ai.lambdaviz.Reducer;
import ai.lambdaviz.layout.TreeLayout;
import ai.lambdaviz.layout.tromp.Stroke;
import ai.lambdaviz.layout.tromp.TrompLayout;
import io.reactivex.disposables.CompositeDisposable;
import lombok.val;

/**
 * Line-oriented front end over a {@link ReductionSession}. Any line that is not
 * a command is loaded as a new expression.
 */
public final class Console implements AutoCloseable {
  public static final String HELP = String.join(System.lineSeparator(),
      "<expr>               load an expression",
      ":step                contract the next redex",
      ":reduce [n]          reduce to normal form, at most n steps",
      ":tree                lay out the syntax tree",
      ":tromp               lay out the Tromp diagram",
      ":define NAME = expr  add a named term",
      ":names               list named terms",
      ":expand expr         expand named-term references",
      ":quit                exit");

  private final ReductionSession session;
  private final PrintStream out;
  private final CompositeDisposable subscriptions = new CompositeDisposable();

  public Console(final ReductionSession session, final PrintStream out) {
    this.session = session;
    this.out = out;

    subscriptions.add(session.rxDiagnostics().subscribe(out::println));
    subscriptions.add(session.rxSnapshots().subscribe(snapshot -> {
      if (snapshot.error().isEmpty()) {
        out.println(snapshot.printed());
        if (!snapshot.prettified().equals(snapshot.printed())) {
          out.println("  = " + snapshot.prettified());
        }
      }
    }));
  }

  public static void main(String[] mainArgs) throws IOException {
    try (final ReductionSession session = new ReductionSession(new NamedTermRegistry());
        final Console console = new Console(session, System.out)) {
      val in = new BufferedReader(new InputStreamReader(System.in));
      console.out.println(HELP);
      session.reset();

      while (true) {
        System.out.print("> ");
        final String input = in.readLine();
        if (input == null || !console.handle(input)) {
          break;
        }
      }
    }
  }

  /**
   * Runs one line of input.
   *
   * @return false if the console should exit
   */
  public boolean handle(final String line) {
    val input = line.strip();
    if (input.isEmpty()) {
      return true;
    }
    if (!input.startsWith(":")) {
      session.load(input);
      return true;
    }

    val split = input.indexOf(' ');
    val command = split < 0 ? input : input.substring(0, split);
    val argument = split < 0 ? "" : input.substring(split + 1).strip();

    switch (command) {
      case ":quit":
        return false;
      case ":step":
        session.step();
        break;
      case ":reduce":
        reduce(argument);
        break;
      case ":tree":
        tree();
        break;
      case ":tromp":
        tromp();
        break;
      case ":define":
        define(argument);
        break;
      case ":names":
        for (val named : session.getRegistry().all()) {
          out.println(String.format("%-8s %s%s", named.name(), named.lambda(),
              named.description().map(description -> "  -- " + description).orElse("")));
        }
        break;
      case ":expand":
        expand(argument);
        break;
      case ":help":
        out.println(HELP);
        break;
      default:
        out.println("Unknown command " + command);
        out.println(HELP);
    }
    return true;
  }

  private void reduce(final String argument) {
    final int maxSteps;
    try {
      maxSteps = argument.isEmpty() ? Reducer.DEFAULT_STEP_LIMIT : Integer.parseInt(argument);
    } catch (final NumberFormatException e) {
      out.println("Not a step count: " + argument);
      return;
    }
    if (maxSteps < 0) {
      out.println("Step count must be nonnegative.");
      return;
    }
    session.reduceFully(maxSteps);
  }

  private void define(final String argument) {
    val equals = argument.indexOf('=');
    if (equals < 0) {
      out.println("Usage: :define NAME = expr");
      return;
    }

    try {
      val named = new NamedTerm(argument.substring(0, equals).strip(), argument.substring(equals + 1).strip());
      session.getRegistry().define(named);
      out.println("Defined " + named.reference());
    } catch (final IllegalArgumentException e) {
      out.println("Could not define term: " + e.getMessage());
    }
  }

  private void tree() {
    val term = session.getCurrentTerm();
    if (term.isEmpty()) {
      out.println("Nothing to lay out.");
      return;
    }

    val layout = new TreeLayout().layout(Reducer.markNextRedex(term.get()));
    if (layout.error().isPresent()) {
      out.println(layout.error().get());
      return;
    }
    out.println(String.format("%s nodes on a %.0f × %.0f canvas", layout.nodes().size(), layout.canvasWidth(),
        layout.canvasHeight()));
    for (val node : layout.nodes()) {
      out.println(String.format("  %s%-6s at (%.1f, %.1f)", node.highlighted() ? "*" : " ", node.label(), node.x(),
          node.y()));
    }
  }

  private void expand(final String expression) {
    try {
      out.println(new NamedTermExpander(session.getRegistry()).expand(expression));
    } catch (final ParseException e) {
      out.println(e.getMessage());
    }
  }

  private void tromp() {
    val term = session.getCurrentTerm();
    if (term.isEmpty()) {
      out.println("Nothing to lay out.");
      return;
    }

    val layout = TrompLayout.layout(term.get(), TrompLayout.DEFAULT_SCALE, session.getHighlightedRedexId());
    if (layout.error().isPresent()) {
      out.println(layout.error().get());
      return;
    }
    val counts = new EnumMap<Stroke.Type, Integer>(Stroke.Type.class);
    for (val stroke : layout.strokes()) {
      counts.merge(stroke.type(), 1, Integer::sum);
    }
    out.println(String.format("%s × %s grid (%.0f × %.0f px): %s", layout.gridWidth(), layout.gridHeight(),
        layout.pixelWidth(), layout.pixelHeight(), counts));
  }

  @Override
  public void close() {
    subscriptions.dispose();
  }
}
