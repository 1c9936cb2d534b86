package tracehook.api;

/** A session lifecycle call made in the wrong state, such as starting it twice. */
public class SessionStateException extends TraceHookException {
  public SessionStateException(String message) {
    super(message);
  }
}
