package com.kriskowal.tagyaml;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration consumed by the constructors. There is no default duplicate key policy; the
 * embedding application chooses one.
 */
public final class LoaderSettings {

  private static final Logger log = LoggerFactory.getLogger(LoaderSettings.class);

  /** Property key read by {@link #fromProperties(Properties)}. */
  public static final String DUPLICATE_KEY_PROPERTY = "duplicate_yaml_dict_key";

  /** Environment variable read by {@link #fromEnvironment(Map)}. */
  public static final String DUPLICATE_KEY_ENV = "TAGYAML_DUPLICATE_YAML_DICT_KEY";

  private final DuplicateKeyPolicy duplicateKeyPolicy;

  private LoaderSettings(DuplicateKeyPolicy duplicateKeyPolicy) {
    this.duplicateKeyPolicy = Objects.requireNonNull(duplicateKeyPolicy, "duplicateKeyPolicy");
  }

  public static LoaderSettings of(DuplicateKeyPolicy duplicateKeyPolicy) {
    return new LoaderSettings(duplicateKeyPolicy);
  }

  public static LoaderSettings fromProperties(Properties properties) {
    return fromSetting(properties.getProperty(DUPLICATE_KEY_PROPERTY), DUPLICATE_KEY_PROPERTY);
  }

  /** Bind from an environment map, normally {@code System.getenv()}. */
  public static LoaderSettings fromEnvironment(Map<String, String> environment) {
    return fromSetting(environment.get(DUPLICATE_KEY_ENV), DUPLICATE_KEY_ENV);
  }

  private static LoaderSettings fromSetting(String value, String source) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException("Missing required setting " + source);
    }
    DuplicateKeyPolicy policy = DuplicateKeyPolicy.fromSetting(value);
    log.debug("Duplicate mapping key policy {} from {}", policy, source);
    return new LoaderSettings(policy);
  }

  public DuplicateKeyPolicy getDuplicateKeyPolicy() {
    return duplicateKeyPolicy;
  }

  @Override
  public String toString() {
    return "LoaderSettings{duplicateKeyPolicy=" + duplicateKeyPolicy + "}";
  }
}
