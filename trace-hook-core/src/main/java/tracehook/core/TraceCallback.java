package tracehook.core;

import javax.annotation.Nullable;
import tracehook.api.ExecutionContext;
import tracehook.api.TraceEvent;

/** Observer registered with a {@link TraceSession} for the events of a scope. */
@FunctionalInterface
public interface TraceCallback {
  void onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload);
}
