package tracehook.api;

import java.util.Collections;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The single, mutable global hook slot of an interpreter, as seen from the current thread, and the
 * services the engine needs from that interpreter.
 */
public interface HookRuntime {
  /** Returns the hook currently installed in the global slot, {@code null} if there is none. */
  @Nullable
  TraceHook getHook();

  /**
   * Installs the given hook in the global slot, replacing whatever was there. Passing a value
   * previously returned by {@link #getHook()} restores that installation exactly.
   */
  void setHook(@Nullable TraceHook hook);

  CodeResolver resolver();

  ExpressionEvaluator evaluator();

  SourceProvider sources();

  /** Files holding code that the runtime itself executes on behalf of the engine. */
  default Set<String> internalFiles() {
    return Collections.emptySet();
  }
}
