package tracehook.api;

import java.util.Locale;

/** Kinds of events a {@link HookRuntime} reports to the installed hooks. */
public enum TraceEvent {
  /** A code unit has been entered. Delivered to the global hook. */
  ENTER("enter"),
  /** The current context is about to execute a new source line. */
  LINE("line"),
  /**
   * The current context is returning or unwinding. The payload is the value or an {@link Unwind}.
   */
  RETURN("return"),
  /** An exception is propagating through the current context. The payload is the throwable. */
  EXCEPTION("exception");

  private final String eventName;

  TraceEvent(String eventName) {
    this.eventName = eventName;
  }

  public String eventName() {
    return eventName;
  }

  /**
   * Parses an event name. {@code call} is accepted as an alias of {@code enter}.
   *
   * @param name the event name, case insensitive.
   * @return the matching event kind.
   * @throws ConfigurationException if the name does not denote a known event kind.
   */
  public static TraceEvent parse(String name) {
    if (name == null) {
      throw new ConfigurationException("Event name must not be null");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if ("call".equals(normalized)) {
      return ENTER;
    }
    for (TraceEvent event : values()) {
      if (event.eventName.equals(normalized)) {
        return event;
      }
    }
    throw new ConfigurationException("Unknown trace event: '" + name + "'");
  }

  @Override
  public String toString() {
    return eventName;
  }
}
