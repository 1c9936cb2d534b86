package tracehook.api;

/** Creates an {@link InteractiveDebugger} bound to an already running context. */
@FunctionalInterface
public interface DebuggerFactory {
  InteractiveDebugger create(HookRuntime runtime, ExecutionContext context);
}
