package tracehook.rhino;

import java.util.Map;
import javax.annotation.Nullable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.NativeObject;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import tracehook.api.EvaluationException;
import tracehook.api.ExecutionContext;
import tracehook.api.ExpressionEvaluator;

/**
 * Evaluates JavaScript against the bindings of a context.
 *
 * <p>The bindings become properties of a scratch scope whose parent is the context's activation,
 * so unbound names resolve along the context's own scope chain: variables of enclosing functions,
 * then globals. Statements declaring new variables with {@code var} define them in the scratch
 * scope. Assignments to names bound further up the chain update them in place, as they would in
 * the context's own code.
 */
final class RhinoExpressionEvaluator implements ExpressionEvaluator {
  static final String SOURCE_NAME = "<tracehook>";

  private final RhinoHookRuntime runtime;

  RhinoExpressionEvaluator(RhinoHookRuntime runtime) {
    this.runtime = runtime;
  }

  @Nullable
  @Override
  public Object evaluate(
      ExecutionContext context, String expression, Map<String, Object> bindings) {
    return run(scratchScope(context, bindings), expression);
  }

  @Override
  public void execute(ExecutionContext context, String statements, Map<String, Object> bindings) {
    ScriptableObject scratch = scratchScope(context, bindings);
    run(scratch, statements);
    for (Object id : scratch.getAllIds()) {
      if (id instanceof String) {
        String name = (String) id;
        bindings.put(name, ScriptableObject.getProperty(scratch, name));
      }
    }
  }

  @Override
  public boolean isTruthy(@Nullable Object value) {
    return Context.toBoolean(value);
  }

  @Nullable
  private Object run(Scriptable scope, String source) {
    Context cx = runtime.context();
    try {
      return cx.evaluateString(scope, source, SOURCE_NAME, 1, null);
    } catch (RhinoException e) {
      throw new EvaluationException(source, e);
    }
  }

  private ScriptableObject scratchScope(ExecutionContext context, Map<String, Object> bindings) {
    NativeObject scratch = new NativeObject();
    scratch.setPrototype(null);
    scratch.setParentScope(enclosingScope(context));
    for (Map.Entry<String, Object> binding : bindings.entrySet()) {
      ScriptableObject.putProperty(scratch, binding.getKey(), binding.getValue());
    }
    return scratch;
  }

  private Scriptable enclosingScope(ExecutionContext context) {
    Scriptable activation =
        context instanceof RhinoExecutionContext
            ? ((RhinoExecutionContext) context).activation()
            : null;
    if (activation == null) {
      return runtime.context().initStandardObjects();
    }
    return activation;
  }
}
