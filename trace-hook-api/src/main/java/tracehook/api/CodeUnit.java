package tracehook.api;

import java.util.List;

/**
 * Identity of a compiled function or script.
 *
 * <p>Two code units are equal only when they denote the same compiled code; sharing a name or a
 * file is not enough.
 */
public interface CodeUnit {
  /** Unqualified name of the code unit. */
  String name();

  String file();

  int firstLine();

  List<String> parameterNames();
}
