package tracehook.core.fake;

import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import tracehook.api.CodeUnit;
import tracehook.api.ExecutionContext;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;

/** A running call of the fake runtime. */
public final class FakeContext implements ExecutionContext {
  private final FakeRuntime runtime;
  private final FakeCode code;
  @Nullable private final FakeContext caller;
  @Nullable private final Object receiver;
  private final Map<String, Object> arguments;
  private final Map<String, Object> locals;
  private int line;
  @Nullable private TraceHook localHook;

  FakeContext(
      FakeRuntime runtime,
      FakeCode code,
      @Nullable FakeContext caller,
      @Nullable Object receiver,
      Map<String, Object> arguments) {
    this.runtime = runtime;
    this.code = code;
    this.caller = caller;
    this.receiver = receiver;
    this.arguments = new LinkedHashMap<>(arguments);
    this.locals = new LinkedHashMap<>(arguments);
    this.line = code.firstLine();
  }

  /** Reports that the given line is about to run. */
  public void line(int line) {
    this.line = line;
    if (localHook != null) {
      localHook = localHook.onEvent(this, TraceEvent.LINE, null);
    }
  }

  void event(TraceEvent event, @Nullable Object payload) {
    if (localHook != null) {
      localHook = localHook.onEvent(this, event, payload);
    }
  }

  public Object get(String name) {
    return locals.get(name);
  }

  public void set(String name, Object value) {
    locals.put(name, value);
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
    return receiver;
  }

  @Override
  public Map<String, Object> arguments() {
    return new LinkedHashMap<>(arguments);
  }

  @Override
  public Map<String, Object> locals() {
    return new LinkedHashMap<>(locals);
  }

  @Override
  public Map<String, Object> globals() {
    return new LinkedHashMap<>(runtime.globals());
  }

  @Nullable
  @Override
  public FakeContext caller() {
    return caller;
  }

  @Nullable
  @Override
  public TraceHook localHook() {
    return localHook;
  }

  @Override
  public void setLocalHook(@Nullable TraceHook hook) {
    localHook = hook;
  }

  @Override
  public void setLocal(String name, @Nullable Object value) {
    locals.put(name, value);
  }

  @Override
  public String toString() {
    return "FakeContext{" + code + ":" + line + '}';
  }
}
