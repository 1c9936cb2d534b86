package tracehook.core.breakpoint;

import tracehook.api.ConfigurationException;
import tracehook.api.ExecutionContext;
import tracehook.api.SourceProvider;
import tracehook.api.TraceEvent;

/** Where in a matched context a breakpoint fires. */
public abstract class LineSelector {
  private static final LineSelector ENTRY = new Entry();

  private LineSelector() {}

  /** Fires once per call, on entry. */
  public static LineSelector entry() {
    return ENTRY;
  }

  /** Fires when the given line is about to execute. There is no nearest-line fallback. */
  public static LineSelector line(int line) {
    if (line <= 0) {
      throw new ConfigurationException("Line numbers start at 1, got " + line);
    }
    return new LineNumber(line);
  }

  /**
   * Fires when a line whose text equals the given text is about to execute. Leading and trailing
   * whitespace is ignored on both sides.
   */
  public static LineSelector text(String text) {
    if (text == null || text.trim().isEmpty()) {
      throw new ConfigurationException("Line text must not be blank");
    }
    return new Text(text.trim());
  }

  /** The event kind this selector needs to see. */
  abstract TraceEvent event();

  abstract boolean matches(ExecutionContext context, SourceProvider sources);

  private static final class Entry extends LineSelector {
    @Override
    TraceEvent event() {
      return TraceEvent.ENTER;
    }

    @Override
    boolean matches(ExecutionContext context, SourceProvider sources) {
      return true;
    }

    @Override
    public String toString() {
      return "entry";
    }
  }

  private static final class LineNumber extends LineSelector {
    private final int line;

    LineNumber(int line) {
      this.line = line;
    }

    @Override
    TraceEvent event() {
      return TraceEvent.LINE;
    }

    @Override
    boolean matches(ExecutionContext context, SourceProvider sources) {
      return context.line() == line;
    }

    @Override
    public String toString() {
      return "line " + line;
    }
  }

  private static final class Text extends LineSelector {
    private final String text;

    Text(String text) {
      this.text = text;
    }

    @Override
    TraceEvent event() {
      return TraceEvent.LINE;
    }

    @Override
    boolean matches(ExecutionContext context, SourceProvider sources) {
      String source = sources.sourceLine(context.code(), context.line());
      return source != null && text.equals(source.trim());
    }

    @Override
    public String toString() {
      return "line '" + text + "'";
    }
  }
}
