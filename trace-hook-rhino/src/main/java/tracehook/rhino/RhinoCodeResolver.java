package tracehook.rhino;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.NativeFunction;
import org.mozilla.javascript.Script;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.debug.DebuggableScript;
import tracehook.api.CodeResolver;
import tracehook.api.ConfigurationException;

/**
 * Resolves JavaScript functions and compiled scripts to their code units.
 *
 * <p>Only code compiled in interpreted mode can be resolved. When unwrapping, a function's {@code
 * __wrapped__} property is followed to the function a decorator wrapped.
 */
final class RhinoCodeResolver implements CodeResolver {
  static final String WRAPPED = "__wrapped__";

  private final RhinoHookRuntime runtime;

  RhinoCodeResolver(RhinoHookRuntime runtime) {
    this.runtime = runtime;
  }

  @Override
  public ResolvedCode resolve(Object callable, boolean unwrap) {
    if (callable instanceof DebuggableScript) {
      return new ResolvedCode(runtime.codeUnit((DebuggableScript) callable), null);
    }
    Object target = unwrap ? unwrap(callable) : callable;
    return new ResolvedCode(runtime.codeUnit(debuggableView(target)), null);
  }

  @Override
  public String moduleFile(Object module) {
    if (module instanceof String) {
      return (String) module;
    }
    if (module instanceof DebuggableScript) {
      return ((DebuggableScript) module).getSourceName();
    }
    return debuggableView(module).getSourceName();
  }

  private static Object unwrap(Object callable) {
    Object current = callable;
    // bounded, a wrapper may point back at itself
    for (int depth = 0; depth < 100 && current instanceof Function; depth++) {
      Object inner = ScriptableObject.getProperty((Function) current, WRAPPED);
      if (!(inner instanceof Function) || inner == current) {
        break;
      }
      current = inner;
    }
    return current;
  }

  private static DebuggableScript debuggableView(Object target) {
    DebuggableScript view = null;
    if (target instanceof NativeFunction) {
      view = ((NativeFunction) target).getDebuggableView();
    } else if (target instanceof Script) {
      view = Context.getDebuggableView((Script) target);
    } else {
      throw new ConfigurationException(
          "Cannot resolve the code of " + describe(target) + ", expected a function or script");
    }
    if (view == null) {
      throw new ConfigurationException(
          "The code of "
              + describe(target)
              + " is not available; it must be compiled in interpreted mode");
    }
    return view;
  }

  private static String describe(Object target) {
    return target == null ? "null" : target.getClass().getName();
  }
}
