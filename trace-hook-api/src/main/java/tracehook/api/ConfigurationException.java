package tracehook.api;

/**
 * Invalid registration: an ambiguous or empty scope, an unresolvable callable or an unknown event
 * kind. Always raised at registration time.
 */
public class ConfigurationException extends TraceHookException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
