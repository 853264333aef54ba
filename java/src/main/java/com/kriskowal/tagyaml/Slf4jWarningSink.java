package com.kriskowal.tagyaml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link WarningSink}: logs each finding at WARN. */
public final class Slf4jWarningSink implements WarningSink {

  private static final Logger log = LoggerFactory.getLogger(Slf4jWarningSink.class);

  @Override
  public void warning(String message, Origin origin, String helpText) {
    if (helpText != null) {
      log.warn("{} Origin: {} {}", message, origin, helpText);
    } else {
      log.warn("{} Origin: {}", message, origin);
    }
  }

  @Override
  public void deprecated(String message, String version, Origin origin, String helpText) {
    log.warn(
        "[DEPRECATION] {} This feature will be removed in version {}. Origin: {}{}",
        message,
        version,
        origin,
        helpText != null ? " " + helpText : "");
  }
}
