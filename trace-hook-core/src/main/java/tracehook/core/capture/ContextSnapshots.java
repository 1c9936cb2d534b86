package tracehook.core.capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tracehook.api.ExecutionContext;
import tracehook.api.SourceProvider;

/** Copies what a call record needs out of a live context. */
final class ContextSnapshots {
  private ContextSnapshots() {}

  static Map<String, Object> copy(Map<String, Object> bindings) {
    if (bindings.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
  }

  /** The innermost {@code maxDepth} contexts of the caller chain, outermost first. */
  static List<StackElement> stack(ExecutionContext context, SourceProvider sources, int maxDepth) {
    List<StackElement> elements = new ArrayList<>();
    for (ExecutionContext current = context;
        current != null && elements.size() < maxDepth;
        current = current.caller()) {
      String source = sources.sourceLine(current.code(), current.line());
      elements.add(
          new StackElement(
              current.code().name(),
              current.file(),
              current.line(),
              source == null ? null : source.trim()));
    }
    Collections.reverse(elements);
    return Collections.unmodifiableList(elements);
  }
}
