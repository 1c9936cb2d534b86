package tracehook.api;

import javax.annotation.Nullable;

/**
 * Interactive debugger taking over stepping from a live context.
 *
 * <p>The debugger is fed events synchronously and tells its caller after each one whether it wants
 * to keep observing execution.
 */
public interface InteractiveDebugger {
  DebuggerSignal dispatch(ExecutionContext context, TraceEvent event, @Nullable Object payload);
}
