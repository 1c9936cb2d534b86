package tracehook.rhino;

import java.util.Collections;
import java.util.Set;
import javax.annotation.Nullable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.debug.DebuggableScript;
import org.mozilla.javascript.debug.Debugger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.CodeResolver;
import tracehook.api.ExpressionEvaluator;
import tracehook.api.HookRuntime;
import tracehook.api.SourceProvider;
import tracehook.api.TraceHook;

/**
 * Hook runtime of a Rhino {@link Context}.
 *
 * <p>The context's debugger slot is the global hook slot. While a hook is set, a bridge debugger
 * occupies the slot and reports the events of every activation. A debugger installed on the
 * context by someone else is seen as a {@link ForeignDebuggerHook}.
 *
 * <p>Only code compiled after {@link #attach(Context)} is observed: attaching switches the context
 * to interpreted mode, and only interpreted code reports debug events.
 */
public final class RhinoHookRuntime implements HookRuntime {
  private static final Logger log = LoggerFactory.getLogger(RhinoHookRuntime.class);

  private static final Object KEY = RhinoHookRuntime.class;

  private final Context cx;
  private final RhinoDebugBridge bridge;
  private final RhinoCodeResolver resolver;
  private final RhinoExpressionEvaluator evaluator;
  private final RhinoSourceCache sourceCache = new RhinoSourceCache();
  @Nullable private TraceHook hook;
  @Nullable private ForeignDebuggerHook foreign;

  private RhinoHookRuntime(Context cx) {
    this.cx = cx;
    this.bridge = new RhinoDebugBridge(this);
    this.resolver = new RhinoCodeResolver(this);
    this.evaluator = new RhinoExpressionEvaluator(this);
  }

  /** Returns the runtime of the context, attaching one on first use. */
  public static RhinoHookRuntime attach(Context cx) {
    Object existing = cx.getThreadLocal(KEY);
    if (existing instanceof RhinoHookRuntime) {
      return (RhinoHookRuntime) existing;
    }
    RhinoHookRuntime runtime = new RhinoHookRuntime(cx);
    cx.putThreadLocal(KEY, runtime);
    cx.setOptimizationLevel(-1);
    if (cx.getDebugger() == null) {
      cx.setDebugger(runtime.bridge, null);
    }
    log.debug("Attached to {}", cx);
    return runtime;
  }

  public Context context() {
    return cx;
  }

  @Nullable
  @Override
  public TraceHook getHook() {
    Debugger installed = cx.getDebugger();
    if (installed == bridge) {
      return hook;
    }
    if (installed == null) {
      return null;
    }
    if (foreign == null || foreign.debugger() != installed) {
      foreign = new ForeignDebuggerHook(installed, cx.getDebuggerContextData());
    }
    return foreign;
  }

  @Override
  public void setHook(@Nullable TraceHook hook) {
    if (hook instanceof ForeignDebuggerHook) {
      ForeignDebuggerHook restored = (ForeignDebuggerHook) hook;
      cx.setDebugger(restored.debugger(), restored.contextData());
      this.hook = null;
      return;
    }
    if (cx.getDebugger() != bridge) {
      cx.setDebugger(bridge, null);
    }
    this.hook = hook;
  }

  /** The hook activations entering now report to, {@code null} if the bridge is not installed. */
  @Nullable
  TraceHook installedHook() {
    return cx.getDebugger() == bridge ? hook : null;
  }

  @Override
  public CodeResolver resolver() {
    return resolver;
  }

  @Override
  public ExpressionEvaluator evaluator() {
    return evaluator;
  }

  @Override
  public SourceProvider sources() {
    return sourceCache;
  }

  @Override
  public Set<String> internalFiles() {
    return Collections.singleton(RhinoExpressionEvaluator.SOURCE_NAME);
  }

  RhinoDebugBridge bridge() {
    return bridge;
  }

  RhinoSourceCache sourceCache() {
    return sourceCache;
  }

  RhinoCodeUnit codeUnit(DebuggableScript script) {
    return new RhinoCodeUnit(script);
  }

  @Override
  public String toString() {
    return "RhinoHookRuntime{hook=" + getHook() + '}';
  }
}
