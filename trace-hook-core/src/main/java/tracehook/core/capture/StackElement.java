package tracehook.core.capture;

import java.util.Objects;
import javax.annotation.Nullable;

/** One entry of a captured call stack summary. */
public final class StackElement {
  private final String name;
  private final String file;
  private final int line;
  @Nullable private final String sourceLine;

  StackElement(String name, String file, int line, @Nullable String sourceLine) {
    this.name = name;
    this.file = file;
    this.line = line;
    this.sourceLine = sourceLine;
  }

  public String getName() {
    return name;
  }

  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  /** The stripped text of the line, if the source is available. */
  @Nullable
  public String getSourceLine() {
    return sourceLine;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    StackElement that = (StackElement) o;
    return line == that.line
        && name.equals(that.name)
        && file.equals(that.file)
        && Objects.equals(sourceLine, that.sourceLine);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, file, line, sourceLine);
  }

  @Override
  public String toString() {
    return "File \"" + file + "\", line " + line + ", in " + name;
  }
}
