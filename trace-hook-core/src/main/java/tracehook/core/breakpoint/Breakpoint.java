package tracehook.core.breakpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.ConfigurationException;
import tracehook.api.DebuggerFactory;
import tracehook.api.ExecutionContext;
import tracehook.api.HookRuntime;
import tracehook.api.TraceEvent;
import tracehook.core.Registration;
import tracehook.core.TraceCallback;
import tracehook.core.TraceSession;
import tracehook.core.scope.Scope;

/**
 * Fires its scheduled actions, in the order they were scheduled, when a context matched by its
 * scope reaches the selected line and the guard, if any, holds.
 *
 * <p>A breakpoint is active from {@link #open} until {@link #close()}. Actions may be scheduled at
 * any time and take part from the next time the breakpoint fires.
 */
public final class Breakpoint implements TraceCallback, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Breakpoint.class);

  private final TraceSession session;
  private final Scope scope;
  private final LineSelector selector;
  @Nullable private final String guard;
  private final List<BreakpointAction> actions = new ArrayList<>();
  private Registration registration;

  private Breakpoint(
      TraceSession session, Scope scope, LineSelector selector, @Nullable String guard) {
    this.session = session;
    this.scope = scope;
    this.selector = selector;
    this.guard = guard;
  }

  /**
   * @param line where to break, {@code null} for the entry of the selected function.
   * @throws ConfigurationException if no line is given and the scope selects no function.
   */
  public static Breakpoint open(
      TraceSession session, Scope scope, @Nullable LineSelector line, @Nullable String guard) {
    if (line == null || line == LineSelector.entry()) {
      if (!scope.hasFunctionSelector()) {
        throw new ConfigurationException(
            "A breakpoint needs a line unless its scope selects a function");
      }
      line = LineSelector.entry();
    }
    Breakpoint breakpoint = new Breakpoint(session, scope, line, guard);
    breakpoint.registration = session.register(scope, breakpoint, EnumSet.of(line.event()));
    return breakpoint;
  }

  /**
   * Schedules an expression to be evaluated each time the breakpoint fires.
   *
   * @return a live list receiving one value per firing.
   */
  public List<Object> eval(String expression) {
    return eval(expression, Collections.<String, Object>emptyMap());
  }

  /** As {@link #eval(String)}, with extra bindings that shadow the context's variables. */
  public List<Object> eval(String expression, Map<String, Object> extras) {
    BreakpointAction.Evaluate action =
        new BreakpointAction.Evaluate(expression, new LinkedHashMap<>(extras));
    schedule(action);
    return action.results();
  }

  /**
   * Schedules statements to be executed each time the breakpoint fires. Locals the statements
   * assign are written back into the context.
   */
  public void exec(String statements) {
    exec(statements, Collections.<String, Object>emptyMap());
  }

  /**
   * As {@link #exec(String)}, with extra bindings visible to the statements only. An extra binding
   * must not have the name of one of the context's locals, which raises a {@link
   * tracehook.api.VariableConflictException} when the breakpoint fires.
   */
  public void exec(String statements, Map<String, Object> extras) {
    schedule(new BreakpointAction.Mutate(statements, new LinkedHashMap<>(extras)));
  }

  /** Schedules a handoff to the session's default interactive debugger. */
  public void debug() {
    schedule(new BreakpointAction.Handoff(null));
  }

  public void debug(DebuggerFactory factory) {
    schedule(new BreakpointAction.Handoff(factory));
  }

  private void schedule(BreakpointAction action) {
    actions.add(action);
    log.debug("Scheduled {} on {}", action, this);
  }

  @Override
  public void onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    HookRuntime runtime = session.runtime();
    if (event != selector.event() || !selector.matches(context, runtime.sources())) {
      return;
    }
    if (guard != null) {
      boolean holds;
      try (TraceSession.Suspension ignored = session.suspend()) {
        Object value = runtime.evaluator().evaluate(context, guard, context.locals());
        holds = runtime.evaluator().isTruthy(value);
      }
      if (!holds) {
        return;
      }
    }
    // actions scheduled by an action wait for the next firing
    for (BreakpointAction action : new ArrayList<>(actions)) {
      action.run(session, context, event, payload);
    }
  }

  public Scope scope() {
    return scope;
  }

  public boolean isClosed() {
    return registration == null || registration.isClosed();
  }

  @Override
  public void close() {
    if (registration != null) {
      registration.close();
    }
  }

  @Override
  public String toString() {
    return "Breakpoint{"
        + scope
        + ", "
        + selector
        + (guard != null ? ", if " + guard : "")
        + ", actions="
        + actions
        + '}';
  }
}
