package tracehook.core.debugger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import javax.annotation.Nullable;
import tracehook.api.ExecutionContext;
import tracehook.api.HookRuntime;
import tracehook.api.TraceHook;

/**
 * The hooks that were in effect when an interactive debugger took over: the global hook, and the
 * local hook of every context the debugger has touched.
 */
final class HandoffState {
  private final HookRuntime runtime;
  @Nullable private final TraceHook globalHook;
  private final Deque<SavedHook> saved = new ArrayDeque<>();
  private final Set<ExecutionContext> known =
      Collections.newSetFromMap(new IdentityHashMap<ExecutionContext, Boolean>());

  private HandoffState(HookRuntime runtime, @Nullable TraceHook globalHook) {
    this.runtime = runtime;
    this.globalHook = globalHook;
  }

  /** Records the global hook and the local hooks of the context and all its callers. */
  static HandoffState capture(HookRuntime runtime, ExecutionContext context) {
    HandoffState state = new HandoffState(runtime, runtime.getHook());
    for (ExecutionContext current = context; current != null; current = current.caller()) {
      state.remember(current);
    }
    return state;
  }

  /** Records the local hook of a context seen for the first time. */
  void remember(ExecutionContext context) {
    if (known.add(context)) {
      saved.push(new SavedHook(context, context.localHook()));
    }
  }

  Iterable<ExecutionContext> contexts() {
    return known;
  }

  @Nullable
  TraceHook globalHook() {
    return globalHook;
  }

  /** Puts back every recorded local hook, most recently recorded first, then the global hook. */
  void restore() {
    while (!saved.isEmpty()) {
      SavedHook entry = saved.pop();
      entry.context.setLocalHook(entry.hook);
    }
    known.clear();
    runtime.setHook(globalHook);
  }

  private static final class SavedHook {
    final ExecutionContext context;
    @Nullable final TraceHook hook;

    SavedHook(ExecutionContext context, @Nullable TraceHook hook) {
      this.context = context;
      this.hook = hook;
    }
  }
}
