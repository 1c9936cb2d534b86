package tracehook.api;

import java.util.Map;
import javax.annotation.Nullable;

/**
 * Live view over one in-progress activation of a {@link CodeUnit}.
 *
 * <p>Instances are owned by the runtime and are only valid while the activation is in progress.
 * Maps returned by the binding accessors are copies: modifying them does not affect the activation.
 * Use {@link #setLocal(String, Object)} to write a binding back.
 */
public interface ExecutionContext {
  CodeUnit code();

  /** Source file of the executing code, as reported by the runtime. */
  default String file() {
    return code().file();
  }

  /** Current line number, or the first line of the code unit before any line event. */
  int line();

  /** The bound receiver of the activation, or {@code null} if there is none. */
  @Nullable
  Object receiver();

  /** Argument bindings in declaration order. */
  Map<String, Object> arguments();

  /** Local bindings, arguments included. */
  Map<String, Object> locals();

  /** Bindings of the enclosing global scope. */
  Map<String, Object> globals();

  /** The calling context, or {@code null} for the outermost one. */
  @Nullable
  ExecutionContext caller();

  @Nullable
  TraceHook localHook();

  void setLocalHook(@Nullable TraceHook hook);

  /** Writes a local binding into the live activation, defining it when absent. */
  void setLocal(String name, @Nullable Object value);
}
