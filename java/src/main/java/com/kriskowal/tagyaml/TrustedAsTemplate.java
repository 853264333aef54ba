package com.kriskowal.tagyaml;

/**
 * Marks a string as eligible for template expansion. Its absence is the safe default.
 */
public final class TrustedAsTemplate implements DataTag {

  public static final TrustedAsTemplate INSTANCE = new TrustedAsTemplate();

  private TrustedAsTemplate() {}

  @Override
  public String toString() {
    return "TrustedAsTemplate";
  }
}
