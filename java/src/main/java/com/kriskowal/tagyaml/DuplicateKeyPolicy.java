package com.kriskowal.tagyaml;

import java.util.Locale;

/** What to do when a mapping repeats a key. */
public enum DuplicateKeyPolicy {
  /** Fail the load. */
  ERROR,
  /** Report a warning for each repeat and keep the last value. */
  WARN,
  /** Keep the last value silently. */
  IGNORE;

  /** Parse a setting value such as {@code "warn"}, ignoring case and surrounding space. */
  public static DuplicateKeyPolicy fromSetting(String setting) {
    if (setting == null) {
      throw new IllegalArgumentException("Duplicate key policy is not set");
    }
    String normalized = setting.trim().toUpperCase(Locale.ROOT);
    for (DuplicateKeyPolicy policy : values()) {
      if (policy.name().equals(normalized)) {
        return policy;
      }
    }
    throw new IllegalArgumentException(
        "Invalid duplicate key policy \"" + setting + "\", expected one of error, warn, ignore");
  }
}
