package tracehook.rhino;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.mozilla.javascript.debug.DebuggableScript;
import tracehook.api.CodeUnit;

/** A compiled script or function, identified by its {@link DebuggableScript}. */
final class RhinoCodeUnit implements CodeUnit {
  private final DebuggableScript script;
  private final String name;
  private final int firstLine;
  private final List<String> parameterNames;

  RhinoCodeUnit(DebuggableScript script) {
    this.script = script;
    this.name = nameOf(script);
    this.firstLine = firstLineOf(script);
    List<String> params = new ArrayList<>(script.getParamCount());
    for (int i = 0; i < script.getParamCount(); i++) {
      params.add(script.getParamOrVarName(i));
    }
    this.parameterNames = Collections.unmodifiableList(params);
  }

  private static String nameOf(DebuggableScript script) {
    String name = script.getFunctionName();
    if (name != null && !name.isEmpty()) {
      return name;
    }
    return script.isFunction() ? "<anonymous>" : "<script>";
  }

  private static int firstLineOf(DebuggableScript script) {
    int[] lines = script.getLineNumbers();
    if (lines == null || lines.length == 0) {
      return 0;
    }
    int first = Integer.MAX_VALUE;
    for (int line : lines) {
      first = Math.min(first, line);
    }
    return first;
  }

  DebuggableScript script() {
    return script;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String file() {
    String sourceName = script.getSourceName();
    return sourceName == null ? "<unknown>" : sourceName;
  }

  @Override
  public int firstLine() {
    return firstLine;
  }

  @Override
  public List<String> parameterNames() {
    return parameterNames;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RhinoCodeUnit && ((RhinoCodeUnit) o).script == script;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(script);
  }

  @Override
  public String toString() {
    return name + " (" + file() + ":" + firstLine + ")";
  }
}
