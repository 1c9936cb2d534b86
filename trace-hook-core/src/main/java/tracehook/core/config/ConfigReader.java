package tracehook.core.config;

import static tracehook.core.config.ConfigStrings.propertyNameToEnvironmentVariableName;
import static tracehook.core.config.ConfigStrings.propertyNameToSystemPropertyName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads settings from system properties first, then from environment variables. */
final class ConfigReader {
  private static final Logger log = LoggerFactory.getLogger(ConfigReader.class);

  @Nullable
  String getString(String key) {
    String value = systemProperty(propertyNameToSystemPropertyName(key));
    if (value == null) {
      value = environmentVariable(propertyNameToEnvironmentVariableName(key));
    }
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value);
  }

  int getInteger(String key, int defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid integer value '{}' for setting {}, using {}", value, key, defaultValue);
      return defaultValue;
    }
  }

  List<String> getList(String key) {
    String value = getString(key);
    if (value == null) {
      return Collections.emptyList();
    }
    List<String> items = new ArrayList<>();
    for (String item : value.split(",")) {
      String trimmed = item.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }

  @Nullable
  private static String systemProperty(String name) {
    try {
      return System.getProperty(name);
    } catch (SecurityException e) {
      return null;
    }
  }

  @Nullable
  private static String environmentVariable(String name) {
    try {
      return System.getenv(name);
    } catch (SecurityException e) {
      return null;
    }
  }
}
