package tracehook.api;

import javax.annotation.Nullable;

/** Loads source text for line matching and display. */
public interface SourceProvider {
  /**
   * @return the text of the given 1-based line of the code unit's source, or {@code null} when the
   *     source is not available.
   */
  @Nullable
  String sourceLine(CodeUnit code, int line);
}
