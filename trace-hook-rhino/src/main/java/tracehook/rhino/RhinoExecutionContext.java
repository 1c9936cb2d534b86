package tracehook.rhino;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.debug.DebugFrame;
import org.mozilla.javascript.debug.DebuggableScript;
import tracehook.api.CodeUnit;
import tracehook.api.ExecutionContext;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;
import tracehook.api.Unwind;

/**
 * One activation of an interpreted script or function, and the Rhino debug frame reporting its
 * events.
 *
 * <p>The runtime keeps variables of frames with a debug frame in their activation object, so reads
 * and writes through the activation see the live values.
 */
final class RhinoExecutionContext implements ExecutionContext, DebugFrame {
  private final RhinoHookRuntime runtime;
  private final RhinoCodeUnit code;
  @Nullable private RhinoExecutionContext caller;
  @Nullable private Scriptable activation;
  @Nullable private Scriptable thisObj;
  private Object[] args = new Object[0];
  private int line;
  @Nullable private TraceHook localHook;

  RhinoExecutionContext(RhinoHookRuntime runtime, RhinoCodeUnit code) {
    this.runtime = runtime;
    this.code = code;
    this.line = code.firstLine();
  }

  @Override
  public void onEnter(Context cx, Scriptable activation, Scriptable thisObj, Object[] args) {
    this.activation = activation;
    this.thisObj = thisObj;
    this.args = args == null ? new Object[0] : args;
    this.caller = runtime.bridge().push(this);
    TraceHook hook = runtime.installedHook();
    if (hook != null) {
      localHook = hook.onEvent(this, TraceEvent.ENTER, null);
    }
  }

  @Override
  public void onLineChange(Context cx, int lineNumber) {
    line = lineNumber;
    if (localHook != null) {
      localHook = localHook.onEvent(this, TraceEvent.LINE, null);
    }
  }

  @Override
  public void onExceptionThrown(Context cx, Throwable ex) {
    if (localHook != null) {
      localHook = localHook.onEvent(this, TraceEvent.EXCEPTION, ex);
    }
  }

  @Override
  public void onExit(Context cx, boolean byThrow, Object resultOrException) {
    try {
      if (localHook != null) {
        Object payload =
            byThrow && resultOrException instanceof Throwable
                ? new Unwind((Throwable) resultOrException)
                : resultOrException;
        localHook = localHook.onEvent(this, TraceEvent.RETURN, payload);
      }
    } finally {
      runtime.bridge().pop(this);
    }
  }

  @Override
  public void onDebuggerStatement(Context cx) {
    // debugger statements carry no event of their own, the line event precedes them
  }

  @Override
  public CodeUnit code() {
    return code;
  }

  @Override
  public int line() {
    return line;
  }

  @Nullable
  @Override
  public Object receiver() {
    return thisObj;
  }

  @Override
  public Map<String, Object> arguments() {
    DebuggableScript script = code.script();
    Map<String, Object> arguments = new LinkedHashMap<>();
    for (int i = 0; i < script.getParamCount(); i++) {
      String name = script.getParamOrVarName(i);
      Object value = lookup(name);
      if (value == Scriptable.NOT_FOUND) {
        value = i < args.length ? args[i] : Undefined.instance;
      }
      arguments.put(name, value);
    }
    return arguments;
  }

  /** Parameters and declared variables of functions. The locals of a script are its globals. */
  @Override
  public Map<String, Object> locals() {
    DebuggableScript script = code.script();
    if (!script.isFunction()) {
      return globals();
    }
    Map<String, Object> locals = new LinkedHashMap<>();
    for (int i = 0; i < script.getParamAndVarCount(); i++) {
      String name = script.getParamOrVarName(i);
      Object value = lookup(name);
      if (value != Scriptable.NOT_FOUND) {
        locals.put(name, value);
      }
    }
    return locals;
  }

  @Override
  public Map<String, Object> globals() {
    if (activation == null) {
      return Collections.emptyMap();
    }
    Scriptable top = ScriptableObject.getTopLevelScope(activation);
    Map<String, Object> globals = new LinkedHashMap<>();
    for (Object id : top.getIds()) {
      if (id instanceof String) {
        globals.put((String) id, top.get((String) id, top));
      }
    }
    return globals;
  }

  @Nullable
  @Override
  public ExecutionContext caller() {
    return caller;
  }

  @Nullable
  @Override
  public TraceHook localHook() {
    return localHook;
  }

  @Override
  public void setLocalHook(@Nullable TraceHook hook) {
    this.localHook = hook;
  }

  @Override
  public void setLocal(String name, @Nullable Object value) {
    if (activation == null) {
      throw new IllegalStateException("Context of " + code + " has not been entered");
    }
    ScriptableObject.putProperty(activation, name, value);
  }

  @Nullable
  Scriptable activation() {
    return activation;
  }

  private Object lookup(String name) {
    if (activation == null) {
      return Scriptable.NOT_FOUND;
    }
    return activation.get(name, activation);
  }

  @Override
  public String toString() {
    return "RhinoExecutionContext{" + code + ", line=" + line + '}';
  }
}
