package com.kriskowal.tagyaml;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Tagging YAML loader - static entry points.
 *
 * <p>Every loaded value is a {@link Tagged} carrying its {@link Origin}. Strings are marked
 * {@link TrustedAsTemplate} when the input is, except below {@code !unsafe}. {@code !vault}
 * values load as {@link EncryptedString}. Failures surface as {@link YamlParserException}.
 */
public class TaggedYaml {

  /** Load a single YAML document. */
  public static Tagged<?> load(String source, LoaderSettings settings) {
    return load(source, null, settings);
  }

  /** Load a single YAML document with a name for origins and error messages. */
  public static Tagged<?> load(String source, String name, LoaderSettings settings) {
    return YamlLoader.builder().settings(settings).build(source, name).load();
  }

  /** Load a single YAML document from input that may carry an origin and trust. */
  public static Tagged<?> load(Tagged<String> source, LoaderSettings settings) {
    return YamlLoader.builder().settings(settings).build(source).load();
  }

  /** Load every document of a YAML stream. */
  public static List<Tagged<?>> loadAll(String source, String name, LoaderSettings settings) {
    return YamlLoader.builder().settings(settings).build(source, name).loadAll();
  }

  /** Read and load a single YAML document. */
  public static Tagged<?> read(Reader reader, String name, LoaderSettings settings)
      throws IOException {
    return YamlLoader.builder().settings(settings).build(reader, name).load();
  }
}
