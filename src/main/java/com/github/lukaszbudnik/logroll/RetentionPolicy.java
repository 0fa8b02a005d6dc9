package com.github.lukaszbudnik.logroll;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retention windows for one category of log files.
 *
 * <p>The local window bounds how long files stay in the category's log directory, the archive
 * window bounds how long archival records are kept. The compliance window documents the
 * regulator-driven hold and is never enforced by automatic deletion.
 */
public final class RetentionPolicy {

  public static final String APPLICATION = "application";
  public static final String SECURITY = "security";
  public static final String PERFORMANCE = "performance";

  private final int localRetentionDays;
  private final int archiveRetentionDays;
  private final int complianceRetentionDays;

  public RetentionPolicy(
      int localRetentionDays, int archiveRetentionDays, int complianceRetentionDays) {
    if (localRetentionDays < 0 || archiveRetentionDays < 0 || complianceRetentionDays < 0) {
      throw new IllegalArgumentException("Retention days must be >= 0.");
    }
    this.localRetentionDays = localRetentionDays;
    this.archiveRetentionDays = archiveRetentionDays;
    this.complianceRetentionDays = complianceRetentionDays;
  }

  /** The built-in category table. Security logs are kept longer than operational ones. */
  public static Map<String, RetentionPolicy> defaults() {
    Map<String, RetentionPolicy> policies = new LinkedHashMap<>();
    policies.put(APPLICATION, new RetentionPolicy(7, 90, 2555));
    policies.put(SECURITY, new RetentionPolicy(30, 365, 2555));
    policies.put(PERFORMANCE, new RetentionPolicy(3, 30, 365));
    return policies;
  }

  public int getLocalRetentionDays() {
    return localRetentionDays;
  }

  public int getArchiveRetentionDays() {
    return archiveRetentionDays;
  }

  public int getComplianceRetentionDays() {
    return complianceRetentionDays;
  }

  @Override
  public String toString() {
    return String.format(
        "RetentionPolicy[local=%dd, archive=%dd, compliance=%dd]",
        localRetentionDays, archiveRetentionDays, complianceRetentionDays);
  }
}
