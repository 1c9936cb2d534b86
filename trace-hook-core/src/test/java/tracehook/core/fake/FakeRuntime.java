package tracehook.core.fake;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.annotation.Nullable;
import tracehook.api.CodeResolver;
import tracehook.api.CodeUnit;
import tracehook.api.ConfigurationException;
import tracehook.api.EvaluationException;
import tracehook.api.ExecutionContext;
import tracehook.api.ExpressionEvaluator;
import tracehook.api.HookRuntime;
import tracehook.api.SourceProvider;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;
import tracehook.api.Unwind;

/**
 * In-memory runtime following the hook protocol: calls made through {@link #call} report their
 * entry to the global hook and every other event to the context's local hook.
 *
 * <p>Expressions are not parsed; tests define what each expression or statement does.
 */
public final class FakeRuntime
    implements HookRuntime, CodeResolver, ExpressionEvaluator, SourceProvider {

  /** Body of a fake call. */
  public interface Body {
    @Nullable
    Object run(FakeContext context);
  }

  private final Map<String, Object> globals = new LinkedHashMap<>();
  private final Map<String, List<String>> sources = new HashMap<>();
  private final Map<String, Function<Map<String, Object>, Object>> expressions = new HashMap<>();
  private final Map<String, Consumer<Map<String, Object>>> statements = new HashMap<>();
  private final Set<String> internalFiles = new LinkedHashSet<>();
  @Nullable private TraceHook hook;
  @Nullable private FakeContext current;

  /** Builds an insertion ordered map from alternating names and values. */
  public static Map<String, Object> bindings(Object... namesAndValues) {
    Map<String, Object> bindings = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      bindings.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return bindings;
  }

  /** Runs a call of the function's code, bound to the function's receiver if it has one. */
  @Nullable
  public Object call(FakeFunction function, Map<String, Object> arguments, Body body) {
    return call(function.code, function.receiver, arguments, body);
  }

  @Nullable
  public Object call(
      FakeCode code, @Nullable Object receiver, Map<String, Object> arguments, Body body) {
    FakeContext context = new FakeContext(this, code, current, receiver, arguments);
    current = context;
    try {
      TraceHook global = hook;
      if (global != null) {
        context.setLocalHook(global.onEvent(context, TraceEvent.ENTER, null));
      }
      Object result;
      try {
        result = body.run(context);
      } catch (RuntimeException e) {
        context.event(TraceEvent.EXCEPTION, e);
        context.event(TraceEvent.RETURN, new Unwind(e));
        throw e;
      }
      context.event(TraceEvent.RETURN, result);
      return result;
    } finally {
      current = context.caller();
    }
  }

  public Map<String, Object> globals() {
    return globals;
  }

  public FakeRuntime source(String file, String... lines) {
    sources.put(file, Arrays.asList(lines));
    return this;
  }

  public FakeRuntime expression(String source, Function<Map<String, Object>, Object> value) {
    expressions.put(source, value);
    return this;
  }

  public FakeRuntime statement(String source, Consumer<Map<String, Object>> effect) {
    statements.put(source, effect);
    return this;
  }

  public FakeRuntime internalFile(String file) {
    internalFiles.add(file);
    return this;
  }

  @Nullable
  @Override
  public TraceHook getHook() {
    return hook;
  }

  @Override
  public void setHook(@Nullable TraceHook hook) {
    this.hook = hook;
  }

  @Override
  public CodeResolver resolver() {
    return this;
  }

  @Override
  public ExpressionEvaluator evaluator() {
    return this;
  }

  @Override
  public SourceProvider sources() {
    return this;
  }

  @Override
  public Set<String> internalFiles() {
    return Collections.unmodifiableSet(internalFiles);
  }

  @Override
  public ResolvedCode resolve(Object callable, boolean unwrap) {
    if (callable instanceof FakeCode) {
      return new ResolvedCode((FakeCode) callable, null);
    }
    if (!(callable instanceof FakeFunction)) {
      throw new ConfigurationException("Not a function: " + callable);
    }
    FakeFunction function = (FakeFunction) callable;
    while (unwrap && function.wrapped != null) {
      function = function.wrapped;
    }
    return new ResolvedCode(function.code, function.receiver);
  }

  @Override
  public String moduleFile(Object module) {
    if (module instanceof CodeUnit) {
      return ((CodeUnit) module).file();
    }
    if (module instanceof String) {
      return (String) module;
    }
    throw new ConfigurationException("Not a module: " + module);
  }

  @Nullable
  @Override
  public Object evaluate(
      ExecutionContext context, String expression, Map<String, Object> bindings) {
    Function<Map<String, Object>, Object> value = expressions.get(expression);
    if (value == null) {
      throw new EvaluationException(expression, new IllegalArgumentException("undefined"));
    }
    Map<String, Object> scope = new HashMap<>(globals);
    scope.putAll(bindings);
    try {
      return value.apply(scope);
    } catch (RuntimeException e) {
      throw new EvaluationException(expression, e);
    }
  }

  @Override
  public void execute(ExecutionContext context, String source, Map<String, Object> bindings) {
    Consumer<Map<String, Object>> effect = statements.get(source);
    if (effect == null) {
      throw new EvaluationException(source, new IllegalArgumentException("undefined"));
    }
    effect.accept(bindings);
  }

  @Override
  public boolean isTruthy(@Nullable Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue() != 0;
    }
    return value != null;
  }

  @Nullable
  @Override
  public String sourceLine(CodeUnit code, int line) {
    List<String> lines = sources.get(code.file());
    if (lines == null || line < 1 || line > lines.size()) {
      return null;
    }
    return lines.get(line - 1);
  }

  /** A hook recording the events it receives, keeping itself installed as local hook. */
  public static final class RecordingHook implements TraceHook {
    private final String name;
    private final List<String> events = new ArrayList<>();

    public RecordingHook(String name) {
      this.name = name;
    }

    @Override
    public TraceHook onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
      events.add(event + " " + context.code().name());
      return this;
    }

    public List<String> events() {
      return events;
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
