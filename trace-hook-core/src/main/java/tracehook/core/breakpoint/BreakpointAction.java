package tracehook.core.breakpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;
import tracehook.api.DebuggerFactory;
import tracehook.api.ExecutionContext;
import tracehook.api.HookRuntime;
import tracehook.api.TraceEvent;
import tracehook.api.VariableConflictException;
import tracehook.core.TraceSession;
import tracehook.core.debugger.DebuggerHandoff;

/** An action scheduled on a {@link Breakpoint}, run each time the breakpoint fires. */
abstract class BreakpointAction {
  abstract void run(
      TraceSession session, ExecutionContext context, TraceEvent event, @Nullable Object payload);

  /** Evaluates an expression and appends the value to a result list. */
  static final class Evaluate extends BreakpointAction {
    private final String expression;
    private final Map<String, Object> extras;
    private final List<Object> results = new ArrayList<>();
    private final List<Object> view = Collections.unmodifiableList(results);

    Evaluate(String expression, Map<String, Object> extras) {
      this.expression = expression;
      this.extras = extras;
    }

    List<Object> results() {
      return view;
    }

    @Override
    void run(
        TraceSession session,
        ExecutionContext context,
        TraceEvent event,
        @Nullable Object payload) {
      Map<String, Object> bindings = new LinkedHashMap<>(context.locals());
      bindings.putAll(extras);
      try (TraceSession.Suspension ignored = session.suspend()) {
        results.add(session.runtime().evaluator().evaluate(context, expression, bindings));
      }
    }

    @Override
    public String toString() {
      return "Evaluate{" + expression + '}';
    }
  }

  /**
   * Executes statements against the context's locals and writes every added or rebound local back
   * into the context. Extra bindings are visible to the statements only.
   */
  static final class Mutate extends BreakpointAction {
    private final String statements;
    private final Map<String, Object> extras;

    Mutate(String statements, Map<String, Object> extras) {
      this.statements = statements;
      this.extras = extras;
    }

    @Override
    void run(
        TraceSession session,
        ExecutionContext context,
        TraceEvent event,
        @Nullable Object payload) {
      Map<String, Object> before = context.locals();
      Set<String> conflicts = new TreeSet<>(extras.keySet());
      conflicts.retainAll(before.keySet());
      if (!conflicts.isEmpty()) {
        throw new VariableConflictException(conflicts);
      }
      Map<String, Object> bindings = new LinkedHashMap<>(before);
      bindings.putAll(extras);
      try (TraceSession.Suspension ignored = session.suspend()) {
        session.runtime().evaluator().execute(context, statements, bindings);
      }
      bindings.keySet().removeAll(extras.keySet());
      for (Map.Entry<String, Object> binding : bindings.entrySet()) {
        String name = binding.getKey();
        // identity, values are live objects of the observed program
        if (!before.containsKey(name) || before.get(name) != binding.getValue()) {
          context.setLocal(name, binding.getValue());
        }
      }
    }

    @Override
    public String toString() {
      return "Mutate{" + statements + '}';
    }
  }

  /** Hands the context over to an interactive debugger. */
  static final class Handoff extends BreakpointAction {
    @Nullable private final DebuggerFactory factory;

    Handoff(@Nullable DebuggerFactory factory) {
      this.factory = factory;
    }

    @Override
    void run(
        TraceSession session,
        ExecutionContext context,
        TraceEvent event,
        @Nullable Object payload) {
      HookRuntime runtime = session.runtime();
      DebuggerFactory debuggers = factory != null ? factory : session.debuggerFactory();
      DebuggerHandoff.begin(runtime, debuggers, context, event, payload);
    }

    @Override
    public String toString() {
      return "Handoff{" + (factory != null ? factory : "default") + '}';
    }
  }
}
