package tracehook.api;

import javax.annotation.Nullable;

/**
 * Hook invoked synchronously by a {@link HookRuntime} on the thread executing the observed code.
 *
 * <p>The global hook receives {@link TraceEvent#ENTER} for every new context; its return value
 * becomes that context's local hook. Subsequent {@link TraceEvent#LINE}, {@link TraceEvent#RETURN}
 * and {@link TraceEvent#EXCEPTION} events of the context are delivered to its local hook, whose
 * return value replaces it. Returning {@code null} stops observing the context.
 */
@FunctionalInterface
public interface TraceHook {
  /**
   * @param context the context the event originates from, only valid during this call.
   * @param event the event kind.
   * @param payload the return value, {@link Unwind} marker or throwable, depending on the event.
   * @return the hook to keep observing the context with, or {@code null} to stop observing it.
   */
  @Nullable
  TraceHook onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload);
}
