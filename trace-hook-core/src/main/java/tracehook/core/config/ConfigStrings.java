package tracehook.core.config;

import java.util.Locale;
import javax.annotation.Nonnull;

public final class ConfigStrings {
  static final String PREFIX = "tracehook";

  private ConfigStrings() {}

  public static String toEnvVar(String string) {
    return string.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  /**
   * Converts the property name, e.g. 'stack.depth' into a public environment variable name, e.g.
   * `TRACEHOOK_STACK_DEPTH`.
   *
   * @param setting The setting name, e.g. `stack.depth`
   * @return The public facing environment variable name
   */
  @Nonnull
  public static String propertyNameToEnvironmentVariableName(final String setting) {
    return toEnvVar(PREFIX) + "_" + toEnvVar(setting);
  }

  /**
   * Converts the property name, e.g. 'stack.depth' into a public system property name, e.g.
   * `tracehook.stack.depth`.
   *
   * @param setting The setting name, e.g. `stack.depth`
   * @return The public facing system property name
   */
  @Nonnull
  public static String propertyNameToSystemPropertyName(final String setting) {
    return PREFIX + "." + setting;
  }
}
