package tracehook.core.debugger;

import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.DebuggerFactory;
import tracehook.api.DebuggerSignal;
import tracehook.api.ExecutionContext;
import tracehook.api.HookRuntime;
import tracehook.api.InteractiveDebugger;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;

/**
 * Hook standing in for an interactive debugger that took over a running context.
 *
 * <p>While installed it feeds every event to the debugger. When the debugger signals {@link
 * DebuggerSignal#CONTINUE} or {@link DebuggerSignal#QUIT} the hooks recorded at takeover, and those
 * of contexts first seen since, are put back.
 */
public final class DebuggerHandoff implements TraceHook {
  private static final Logger log = LoggerFactory.getLogger(DebuggerHandoff.class);

  private final HookRuntime runtime;
  private final InteractiveDebugger debugger;
  private final HandoffState state;
  private boolean dispatching;
  private boolean finished;

  private DebuggerHandoff(HookRuntime runtime, InteractiveDebugger debugger, HandoffState state) {
    this.runtime = runtime;
    this.debugger = debugger;
    this.state = state;
  }

  /**
   * Hands the context over to a debugger created by the factory and passes it the event being
   * dispatched. Returns once the debugger has handled that event; it keeps stepping through the
   * hooks this method installs.
   */
  public static DebuggerHandoff begin(
      HookRuntime runtime,
      DebuggerFactory factory,
      ExecutionContext context,
      TraceEvent event,
      @Nullable Object payload) {
    HandoffState state = HandoffState.capture(runtime, context);
    DebuggerHandoff handoff = new DebuggerHandoff(runtime, factory.create(runtime, context), state);
    log.debug("Handing {} over to {}", context.code(), handoff.debugger);
    for (ExecutionContext known : state.contexts()) {
      known.setLocalHook(handoff);
    }
    runtime.setHook(handoff);
    context.setLocalHook(handoff.onEvent(context, event, payload));
    return handoff;
  }

  public boolean isFinished() {
    return finished;
  }

  @Nullable
  @Override
  public TraceHook onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    if (finished || dispatching) {
      // code run by the debugger itself, or a context outliving the session
      return null;
    }
    state.remember(context);
    DebuggerSignal signal;
    dispatching = true;
    try {
      signal = debugger.dispatch(context, event, payload);
    } catch (RuntimeException | Error e) {
      finish();
      throw e;
    } finally {
      dispatching = false;
    }
    if (signal == DebuggerSignal.STEP) {
      return this;
    }
    finish();
    if (event == TraceEvent.ENTER) {
      // the restored global hook has not seen this context yet
      TraceHook global = runtime.getHook();
      return global == null ? null : global.onEvent(context, event, payload);
    }
    return context.localHook();
  }

  private void finish() {
    finished = true;
    state.restore();
    log.debug("Debugger session ended, restored hook {}", state.globalHook());
  }

  @Override
  public String toString() {
    return "DebuggerHandoff{" + debugger + (finished ? ", finished" : "") + '}';
  }
}
