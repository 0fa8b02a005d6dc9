package com.github.lukaszbudnik.logroll;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Configuration of one named storage backend: a {@code type} plus backend-specific options. */
public final class BackendConfig {

  private final String type;
  private final Map<String, String> options;

  public BackendConfig(String type, Map<String, String> options) {
    this.type = Objects.requireNonNull(type, "type");
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
  }

  public String getType() {
    return type;
  }

  public Map<String, String> getOptions() {
    return options;
  }

  public String getOption(String key) {
    return options.get(key);
  }

  public String getOption(String key, String defaultValue) {
    return options.getOrDefault(key, defaultValue);
  }

  /**
   * Get an option that must be present.
   *
   * @throws ConfigurationException if the option is missing or blank
   */
  public String getRequiredOption(String key) throws ConfigurationException {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new ConfigurationException(
          "Storage backend of type " + type + " requires option: " + key);
    }
    return value;
  }

  @Override
  public String toString() {
    // options may carry credentials
    return "BackendConfig[type=" + type + ", options=" + options.keySet() + "]";
  }
}
