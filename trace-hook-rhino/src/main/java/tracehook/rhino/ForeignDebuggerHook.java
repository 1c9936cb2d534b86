package tracehook.rhino;

import javax.annotation.Nullable;
import org.mozilla.javascript.debug.Debugger;
import tracehook.api.ExecutionContext;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;

/**
 * Stands for a Rhino {@link Debugger} installed by someone else, so that it can be saved and
 * restored like any other hook. Setting it as the runtime's hook reinstalls the debugger.
 */
public final class ForeignDebuggerHook implements TraceHook {
  private final Debugger debugger;
  @Nullable private final Object contextData;

  ForeignDebuggerHook(Debugger debugger, @Nullable Object contextData) {
    this.debugger = debugger;
    this.contextData = contextData;
  }

  public Debugger debugger() {
    return debugger;
  }

  @Nullable
  Object contextData() {
    return contextData;
  }

  /** Foreign debuggers observe through their own debug frames, not through hook events. */
  @Nullable
  @Override
  public TraceHook onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    return null;
  }

  @Override
  public String toString() {
    return "ForeignDebuggerHook{" + debugger + '}';
  }
}
