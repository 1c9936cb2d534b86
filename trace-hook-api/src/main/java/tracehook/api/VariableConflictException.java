package tracehook.api;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Extra bindings supplied to a mutation would shadow existing locals. */
public class VariableConflictException extends TraceHookException {
  private final Set<String> names;

  public VariableConflictException(Set<String> names) {
    super("The following external variables conflict with local ones: " + new TreeSet<>(names));
    this.names = Collections.unmodifiableSet(new TreeSet<>(names));
  }

  public Set<String> getNames() {
    return names;
  }
}
