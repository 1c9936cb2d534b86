package tracehook.api;

/** Base class of the errors raised by the tracing engine. */
public class TraceHookException extends RuntimeException {
  public TraceHookException(String message) {
    super(message);
  }

  public TraceHookException(String message, Throwable cause) {
    super(message, cause);
  }
}
