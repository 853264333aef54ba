package com.kriskowal.tagyaml;

import java.io.IOException;
import java.io.Reader;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.composer.Composer;
import org.yaml.snakeyaml.parser.ParserImpl;
import org.yaml.snakeyaml.reader.StreamReader;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * One parse of one input: SnakeYAML's reader, parser, composer and resolver feeding a {@link
 * TaggingConstructor}. Create a loader per input with a {@link Builder}; a loader loads once.
 *
 * <p>The input may carry an {@link Origin}, which then positions every value, and {@link
 * TrustedAsTemplate}, which makes loaded strings trusted unless the builder says otherwise.
 */
public final class YamlLoader {

  private static final Logger log = LoggerFactory.getLogger(YamlLoader.class);

  // aliases share the constructed value, so they cost no memory per reference
  static final int MAX_ALIASES_FOR_COLLECTIONS = Integer.MAX_VALUE;
  static final int NESTING_DEPTH_LIMIT = 1000;

  private final String text;
  private final Origin origin;
  private final Composer composer;
  private final TaggingConstructor constructor;
  private boolean consumed;

  private YamlLoader(Builder builder, Tagged<String> stream, String name) {
    this.text = Objects.requireNonNull(stream.value(), "stream text");
    this.origin = DataTags.getOrCreateOrigin(stream, name);

    boolean trusted =
        builder.trustedAsTemplate != null
            ? builder.trustedAsTemplate
            : stream.isTaggedOn(TrustedAsTemplate.class);

    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(true);
    options.setMaxAliasesForCollections(MAX_ALIASES_FOR_COLLECTIONS);
    options.setNestingDepthLimit(NESTING_DEPTH_LIMIT);
    // the whole text is in memory already
    options.setCodePointLimit(Integer.MAX_VALUE);
    Resolver resolver = new Resolver();
    this.composer = new Composer(new ParserImpl(new StreamReader(text), options), resolver, options);

    if (builder.customTags) {
      this.constructor =
          new CustomTagConstructor(
              options, builder.settings, origin, trusted, builder.warnings, resolver);
    } else {
      this.constructor =
          new TaggingConstructor(options, builder.settings, origin, trusted, builder.warnings);
    }
    constructor.registerTagHandlers();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Load the only document of the input. An empty input loads as null at the base origin.
   *
   * @throws YamlParserException if the input is not valid or holds more than one document
   */
  public Tagged<?> load() {
    begin();
    try {
      return constructor.constructRoot(composer.getSingleNode());
    } catch (RuntimeException e) {
      throw fail(e);
    }
  }

  /** Load every document of the input, in order. */
  public List<Tagged<?>> loadAll() {
    begin();
    List<Tagged<?>> documents = new ArrayList<>();
    try {
      while (composer.checkNode()) {
        documents.add(constructor.constructRoot(composer.getNode()));
      }
    } catch (RuntimeException e) {
      throw fail(e);
    }
    return documents;
  }

  public Origin getOrigin() {
    return origin;
  }

  TaggingConstructor getConstructor() {
    return constructor;
  }

  private void begin() {
    if (consumed) {
      throw new IllegalStateException("Loader for " + origin + " has already been used");
    }
    consumed = true;
    log.debug("Loading YAML from {}", origin);
  }

  private YamlParserException fail(RuntimeException e) {
    YamlParserException error = ErrorClassifier.classify(e, text, origin);
    log.debug("Failed to load {}: {}", error.getOrigin(), error.getMessage());
    return error;
  }

  /**
   * Loader configuration, reusable across inputs. Each {@code build} call creates an independent
   * loader.
   */
  public static final class Builder {

    private LoaderSettings settings;
    private WarningSink warnings = new Slf4jWarningSink();
    private Boolean trustedAsTemplate;
    private boolean customTags = true;

    private Builder() {}

    /** Required. */
    public Builder settings(LoaderSettings settings) {
      this.settings = Objects.requireNonNull(settings, "settings");
      return this;
    }

    public Builder warnings(WarningSink warnings) {
      this.warnings = Objects.requireNonNull(warnings, "warnings");
      return this;
    }

    /**
     * Force string trust on or off. When unset (null) strings are trusted exactly when the input
     * is tagged {@link TrustedAsTemplate}.
     */
    public Builder trustedAsTemplate(Boolean trustedAsTemplate) {
      this.trustedAsTemplate = trustedAsTemplate;
      return this;
    }

    /** Whether {@code !unsafe}, {@code !vault} and {@code !vault-encrypted} are understood. */
    public Builder customTags(boolean customTags) {
      this.customTags = customTags;
      return this;
    }

    public YamlLoader build(Tagged<String> stream) {
      return build(stream, null);
    }

    /** Loader for a possibly tagged input; {@code name} is used when it carries no origin. */
    public YamlLoader build(Tagged<String> stream, String name) {
      if (settings == null) {
        throw new IllegalStateException("Loader settings are required");
      }
      return new YamlLoader(this, Objects.requireNonNull(stream, "stream"), name);
    }

    public YamlLoader build(String text, String name) {
      return build(Tagged.of(text), name);
    }

    /** Reads the whole input up front; diagnostics need the text. */
    public YamlLoader build(Reader reader, String name) throws IOException {
      StringBuilder sb = new StringBuilder();
      char[] buffer = new char[8192];
      int n;
      while ((n = reader.read(buffer)) != -1) {
        sb.append(buffer, 0, n);
      }
      return build(sb.toString(), name);
    }
  }
}
