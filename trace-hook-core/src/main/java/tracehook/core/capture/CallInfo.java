package tracehook.core.capture;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Record of one completed call.
 *
 * <p>The record published by {@link CallCapture.Single} is updated in place each time a matching
 * call completes, so a reference obtained before the call reads the call's data afterwards.
 */
public final class CallInfo {
  @Nullable private String name;
  @Nullable private String file;
  private List<StackElement> stack = Collections.emptyList();
  private Map<String, Object> arguments = Collections.emptyMap();
  private Map<String, Object> locals = Collections.emptyMap();
  private Map<String, Object> globals = Collections.emptyMap();
  @Nullable private Object returnValue;
  private boolean hasReturnValue;
  @Nullable private Throwable thrown;
  private boolean completed;

  CallInfo() {}

  /** Populated from the entry of a call. */
  void entered(
      String name, String file, List<StackElement> stack, Map<String, Object> arguments) {
    this.name = name;
    this.file = file;
    this.stack = stack;
    this.arguments = arguments;
    this.returnValue = null;
    this.hasReturnValue = false;
    this.thrown = null;
  }

  void returned(Map<String, Object> locals, Map<String, Object> globals, Object returnValue) {
    this.locals = locals;
    this.globals = globals;
    this.returnValue = returnValue;
    this.hasReturnValue = true;
    this.thrown = null;
    this.completed = true;
  }

  void unwound(Map<String, Object> locals, Map<String, Object> globals, Throwable thrown) {
    this.locals = locals;
    this.globals = globals;
    this.returnValue = null;
    this.hasReturnValue = false;
    this.thrown = thrown;
    this.completed = true;
  }

  void copyFrom(CallInfo other) {
    name = other.name;
    file = other.file;
    stack = other.stack;
    arguments = other.arguments;
    locals = other.locals;
    globals = other.globals;
    returnValue = other.returnValue;
    hasReturnValue = other.hasReturnValue;
    thrown = other.thrown;
    completed = other.completed;
  }

  @Nullable
  public String getName() {
    return name;
  }

  @Nullable
  public String getFile() {
    return file;
  }

  /** The call stack at entry, outermost call first, ending with this call. */
  public List<StackElement> getStack() {
    return stack;
  }

  /** Argument bindings at entry, in declaration order. */
  public Map<String, Object> getArguments() {
    return arguments;
  }

  /** Local bindings when the call returned. */
  public Map<String, Object> getLocals() {
    return locals;
  }

  public Map<String, Object> getGlobals() {
    return globals;
  }

  @Nullable
  public Object getReturnValue() {
    return returnValue;
  }

  /** {@code false} when the call was unwound by an exception, or has not completed yet. */
  public boolean hasReturnValue() {
    return hasReturnValue;
  }

  /** The exception that unwound the call, if it did not return normally. */
  @Nullable
  public Throwable getThrown() {
    return thrown;
  }

  public boolean isCompleted() {
    return completed;
  }

  /** Formats the stack like a traceback, one entry and its source line per line pair. */
  public String formatStack() {
    StringBuilder sb = new StringBuilder();
    for (StackElement element : stack) {
      sb.append("  ").append(element).append('\n');
      if (element.getSourceLine() != null) {
        sb.append("    ").append(element.getSourceLine()).append('\n');
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CallInfo(name=").append(name);
    sb.append(", args=").append(arguments);
    if (hasReturnValue) {
      sb.append(", returnValue=").append(returnValue);
    } else if (thrown != null) {
      sb.append(", thrown=").append(thrown);
    }
    return sb.append(')').toString();
  }
}
