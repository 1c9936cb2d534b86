package tracehook.rhino;

import javax.annotation.Nullable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.debug.DebugFrame;
import org.mozilla.javascript.debug.DebuggableScript;
import org.mozilla.javascript.debug.Debugger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Rhino {@link Debugger} installed while the runtime's hook is active. Creates an execution
 * context per activation and keeps track of the innermost one.
 */
final class RhinoDebugBridge implements Debugger {
  private static final Logger log = LoggerFactory.getLogger(RhinoDebugBridge.class);

  private final RhinoHookRuntime runtime;
  @Nullable private RhinoExecutionContext innermost;

  RhinoDebugBridge(RhinoHookRuntime runtime) {
    this.runtime = runtime;
  }

  @Override
  public void handleCompilationDone(Context cx, DebuggableScript fnOrScript, String source) {
    if (fnOrScript.isTopLevel() && !isInternal(fnOrScript)) {
      log.trace("Compiled {}", fnOrScript.getSourceName());
      runtime.sourceCache().put(fnOrScript.getSourceName(), source);
    }
  }

  @Nullable
  @Override
  public DebugFrame getFrame(Context cx, DebuggableScript fnOrScript) {
    if (isInternal(fnOrScript)) {
      return null;
    }
    return new RhinoExecutionContext(runtime, runtime.codeUnit(fnOrScript));
  }

  private static boolean isInternal(DebuggableScript script) {
    return RhinoExpressionEvaluator.SOURCE_NAME.equals(script.getSourceName());
  }

  /** Makes the context the innermost one, returning its caller. */
  @Nullable
  RhinoExecutionContext push(RhinoExecutionContext context) {
    RhinoExecutionContext caller = innermost;
    innermost = context;
    return caller;
  }

  void pop(RhinoExecutionContext context) {
    if (innermost == context) {
      innermost = (RhinoExecutionContext) context.caller();
    } else {
      log.debug("Exit of {} does not match the innermost context {}", context, innermost);
    }
  }

  @Nullable
  RhinoExecutionContext innermost() {
    return innermost;
  }
}
