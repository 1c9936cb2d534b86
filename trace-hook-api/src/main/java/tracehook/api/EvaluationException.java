package tracehook.api;

/** A guard, evaluated expression or executed statement failed. */
public class EvaluationException extends TraceHookException {
  private final String source;

  public EvaluationException(String source, Throwable cause) {
    super("Failed to evaluate '" + source + "': " + cause.getMessage(), cause);
    this.source = source;
  }

  /** The snippet that failed. */
  public String getSource() {
    return source;
  }
}
