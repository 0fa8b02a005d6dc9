package com.github.lukaszbudnik.logroll;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotation engine configuration: named rotation policies, named storage backends, the archive
 * metadata directory, per-category log directories and retention windows.
 *
 * <p><b>File format:</b> JSON, parsed with Gson.
 *
 * <pre>{@code
 * {
 *   "policies": {
 *     "default": { "max_size": "10MB", "max_age": "1d", "max_files": 10,
 *                  "compression": true, "compression_level": 6, "archive_to": "local" }
 *   },
 *   "storage_backends": { "local": { "type": "local", "path": "/var/backups/logs" } },
 *   "archive_metadata": "/var/lib/logroll/archive",
 *   "log_directories": { "application": "/var/log/app" },
 *   "retention_policies": { "application": { "local_retention_days": 7,
 *                           "archive_retention_days": 90, "compliance_retention_days": 2555 } },
 *   "upload_timeout": "5m"
 * }
 * }</pre>
 */
public final class RotationConfig {
  private static final Logger logger = LoggerFactory.getLogger(RotationConfig.class);

  static final Duration DEFAULT_UPLOAD_TIMEOUT = Duration.ofMinutes(5);
  static final Path DEFAULT_ARCHIVE_METADATA_DIRECTORY =
      Path.of(System.getProperty("java.io.tmpdir"), "logroll-archive");

  private final Map<String, RotationPolicy> policies;
  private final Map<String, BackendConfig> storageBackends;
  private final Path archiveMetadataDirectory;
  private final Map<String, Path> logDirectories;
  private final Map<String, RetentionPolicy> retentionPolicies;
  private final Duration uploadTimeout;

  private RotationConfig(Builder builder) {
    this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.policies));
    this.storageBackends = Collections.unmodifiableMap(new LinkedHashMap<>(builder.storageBackends));
    this.archiveMetadataDirectory = builder.archiveMetadataDirectory;
    this.logDirectories = Collections.unmodifiableMap(new LinkedHashMap<>(builder.logDirectories));
    this.retentionPolicies =
        Collections.unmodifiableMap(new LinkedHashMap<>(builder.retentionPolicies));
    this.uploadTimeout = builder.uploadTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Load configuration from a JSON file.
   *
   * @param configFile path to the JSON document
   * @return parsed configuration
   * @throws ConfigurationException if the file cannot be read or is invalid
   */
  public static RotationConfig load(Path configFile) throws ConfigurationException {
    logger.info("Loading rotation configuration from {}", configFile);
    try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
      return parse(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read rotation configuration " + configFile, e);
    }
  }

  /**
   * Parse configuration from a JSON string.
   *
   * @throws ConfigurationException if the document is invalid
   */
  public static RotationConfig parse(String json) throws ConfigurationException {
    return parse(new StringReader(json));
  }

  private static RotationConfig parse(Reader reader) throws ConfigurationException {
    JsonObject root;
    try {
      JsonElement element = JsonParser.parseReader(reader);
      if (!element.isJsonObject()) {
        throw new ConfigurationException("Rotation configuration must be a JSON object");
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new ConfigurationException("Malformed rotation configuration", e);
    }

    Builder builder = builder();
    for (Map.Entry<String, JsonElement> entry : objectOrEmpty(root, "policies").entrySet()) {
      String name = entry.getKey();
      builder.policy(parsePolicy(name, asObject("policies." + name, entry.getValue())));
    }
    for (Map.Entry<String, JsonElement> entry :
        objectOrEmpty(root, "storage_backends").entrySet()) {
      String name = entry.getKey();
      JsonObject backend = asObject("storage_backends." + name, entry.getValue());
      builder.storageBackend(name, parseBackend(name, backend));
    }
    String archiveMetadata = string(root, "archive_metadata");
    if (archiveMetadata != null) {
      builder.archiveMetadataDirectory(path("archive_metadata", archiveMetadata));
    }
    for (Map.Entry<String, JsonElement> entry : objectOrEmpty(root, "log_directories").entrySet()) {
      String field = "log_directories." + entry.getKey();
      builder.logDirectory(entry.getKey(), path(field, primitive(field, entry.getValue())));
    }
    for (Map.Entry<String, JsonElement> entry :
        objectOrEmpty(root, "retention_policies").entrySet()) {
      String category = entry.getKey();
      JsonObject retention = asObject("retention_policies." + category, entry.getValue());
      builder.retentionPolicy(category, parseRetention(category, retention));
    }
    String uploadTimeout = string(root, "upload_timeout");
    if (uploadTimeout != null) {
      builder.uploadTimeout(Durations.parseDuration("upload_timeout", uploadTimeout));
    }

    RotationConfig config = builder.build();
    logger.debug(
        "Parsed rotation configuration: policies={}, backends={}, categories={}",
        config.policies.keySet(),
        config.storageBackends.keySet(),
        config.logDirectories.keySet());
    return config;
  }

  private static RotationPolicy parsePolicy(String name, JsonObject json)
      throws ConfigurationException {
    String field = "policies." + name;
    RotationPolicy.Builder policy = RotationPolicy.builder(name);
    String maxSize = string(json, "max_size");
    if (maxSize != null) {
      policy.maxSizeBytes(Durations.parseSize(field + ".max_size", maxSize));
    }
    String maxAge = string(json, "max_age");
    if (maxAge != null) {
      policy.maxAge(Durations.parseDuration(field + ".max_age", maxAge));
    }
    String minFreeSpace = string(json, "min_free_space");
    if (minFreeSpace != null) {
      policy.minFreeSpaceBytes(Durations.parseSize(field + ".min_free_space", minFreeSpace));
    }
    policy
        .maxFiles(integer(json, field, "max_files", RotationPolicy.DEFAULT_MAX_FILES))
        .compressionEnabled(bool(json, field, "compression", true))
        .compressionLevel(
            integer(json, field, "compression_level", RotationPolicy.DEFAULT_COMPRESSION_LEVEL))
        .archiveBackendName(string(json, "archive_to"))
        .retentionDays(
            integer(json, field, "retention_days", RotationPolicy.DEFAULT_RETENTION_DAYS))
        .deleteAfterArchive(bool(json, field, "delete_after_archive", false));
    try {
      return policy.build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid rotation policy " + name + ": " + e.getMessage(), e);
    }
  }

  private static BackendConfig parseBackend(String name, JsonObject json)
      throws ConfigurationException {
    String type = string(json, "type");
    if (type == null) {
      throw new ConfigurationException("Storage backend " + name + " has no type");
    }
    Map<String, String> options = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
      if (!"type".equals(entry.getKey()) && !entry.getValue().isJsonNull()) {
        options.put(entry.getKey(), primitive("storage_backends." + name, entry.getValue()));
      }
    }
    return new BackendConfig(type, options);
  }

  private static RetentionPolicy parseRetention(String category, JsonObject json)
      throws ConfigurationException {
    String field = "retention_policies." + category;
    RetentionPolicy fallback = RetentionPolicy.defaults().get(category);
    try {
      // Unset windows of a category without built-in defaults stay -1 and fail validation
      return new RetentionPolicy(
          integer(
              json,
              field,
              "local_retention_days",
              fallback != null ? fallback.getLocalRetentionDays() : -1),
          integer(
              json,
              field,
              "archive_retention_days",
              fallback != null ? fallback.getArchiveRetentionDays() : -1),
          integer(
              json,
              field,
              "compliance_retention_days",
              fallback != null ? fallback.getComplianceRetentionDays() : -1));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
          "Invalid retention policy " + category + ": all retention windows must be set and >= 0", e);
    }
  }

  private static JsonObject objectOrEmpty(JsonObject json, String member)
      throws ConfigurationException {
    JsonElement element = json.get(member);
    if (element == null || element.isJsonNull()) {
      return new JsonObject();
    }
    return asObject(member, element);
  }

  private static JsonObject asObject(String field, JsonElement element)
      throws ConfigurationException {
    if (!element.isJsonObject()) {
      throw new ConfigurationException("Expected a JSON object for " + field);
    }
    return element.getAsJsonObject();
  }

  private static String primitive(String field, JsonElement element) throws ConfigurationException {
    if (!element.isJsonPrimitive()) {
      throw new ConfigurationException("Expected a string or number for " + field);
    }
    return element.getAsString();
  }

  private static Path path(String field, String value) throws ConfigurationException {
    try {
      return Path.of(value);
    } catch (InvalidPathException e) {
      throw new ConfigurationException("Invalid path for " + field + ": " + e.getMessage(), e);
    }
  }

  private static String string(JsonObject json, String member) throws ConfigurationException {
    JsonElement element = json.get(member);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    return primitive(member, element);
  }

  private static int integer(JsonObject json, String field, String member, int defaultValue)
      throws ConfigurationException {
    String value = string(json, member);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Invalid integer for " + field + "." + member + ": " + value, e);
    }
  }

  private static boolean bool(JsonObject json, String field, String member, boolean defaultValue)
      throws ConfigurationException {
    String value = string(json, member);
    if (value == null) {
      return defaultValue;
    }
    if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
      return Boolean.parseBoolean(value);
    }
    throw new ConfigurationException("Invalid boolean for " + field + "." + member + ": " + value);
  }

  public Map<String, RotationPolicy> getPolicies() {
    return policies;
  }

  public Map<String, BackendConfig> getStorageBackends() {
    return storageBackends;
  }

  public Path getArchiveMetadataDirectory() {
    return archiveMetadataDirectory;
  }

  public Map<String, Path> getLogDirectories() {
    return logDirectories;
  }

  /** The built-in category table with configured overrides applied. */
  public Map<String, RetentionPolicy> getRetentionPolicies() {
    return retentionPolicies;
  }

  public Duration getUploadTimeout() {
    return uploadTimeout;
  }

  /** Builder for {@link RotationConfig}, used by the JSON loader and for programmatic setup. */
  public static final class Builder {
    private final Map<String, RotationPolicy> policies = new LinkedHashMap<>();
    private final Map<String, BackendConfig> storageBackends = new LinkedHashMap<>();
    private Path archiveMetadataDirectory = DEFAULT_ARCHIVE_METADATA_DIRECTORY;
    private final Map<String, Path> logDirectories = new LinkedHashMap<>();
    private final Map<String, RetentionPolicy> retentionPolicies =
        new LinkedHashMap<>(RetentionPolicy.defaults());
    private Duration uploadTimeout = DEFAULT_UPLOAD_TIMEOUT;

    private Builder() {}

    public Builder policy(RotationPolicy policy) {
      policies.put(policy.getName(), policy);
      return this;
    }

    public Builder storageBackend(String name, BackendConfig backend) {
      storageBackends.put(name, backend);
      return this;
    }

    public Builder archiveMetadataDirectory(Path directory) {
      this.archiveMetadataDirectory = directory;
      return this;
    }

    public Builder logDirectory(String category, Path directory) {
      logDirectories.put(category, directory);
      return this;
    }

    public Builder retentionPolicy(String category, RetentionPolicy policy) {
      retentionPolicies.put(category, policy);
      return this;
    }

    public Builder uploadTimeout(Duration uploadTimeout) {
      this.uploadTimeout = uploadTimeout;
      return this;
    }

    public RotationConfig build() {
      return new RotationConfig(this);
    }
  }
}
