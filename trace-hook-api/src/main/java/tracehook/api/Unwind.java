package tracehook.api;

/**
 * {@link TraceEvent#RETURN} payload of a context that is left because an exception propagates out
 * of it rather than because it returned a value.
 */
public final class Unwind {
  private final Throwable cause;

  public Unwind(Throwable cause) {
    this.cause = cause;
  }

  public Throwable cause() {
    return cause;
  }

  @Override
  public String toString() {
    return "Unwind{" + cause + '}';
  }
}
