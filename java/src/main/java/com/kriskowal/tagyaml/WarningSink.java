package com.kriskowal.tagyaml;

/**
 * Receives the non-fatal findings of a load: duplicate keys under {@link
 * DuplicateKeyPolicy#WARN} and deprecated tags.
 */
public interface WarningSink {

  void warning(String message, Origin origin, String helpText);

  void deprecated(String message, String version, Origin origin, String helpText);
}
