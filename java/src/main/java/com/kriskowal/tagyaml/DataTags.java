package com.kriskowal.tagyaml;

import java.util.*;

/** Generic operations over tagged and untagged values. */
public final class DataTags {

  private DataTags() {}

  /**
   * Apply tags to a value. A {@link Tagged} input keeps its tags with the new ones laid over
   * them; any other input is wrapped.
   */
  public static Tagged<?> tag(Object value, DataTag... tags) {
    if (value instanceof Tagged) {
      return ((Tagged<?>) value).withTags(tags);
    }
    return Tagged.of(value, tags);
  }

  /** Copy every tag of {@code src} onto {@code dst}. Untagged sources copy nothing. */
  public static <T> Tagged<T> tagCopy(Object src, T dst) {
    Tagged<T> target = Tagged.of(dst);
    if (src instanceof Tagged) {
      return target.withTags(((Tagged<?>) src).getTags());
    }
    return target;
  }

  /** The raw value behind a single wrapper; nested values stay wrapped. */
  public static Object untag(Object value) {
    return value instanceof Tagged ? ((Tagged<?>) value).value() : value;
  }

  /** A plain Java tree with every {@link Tagged} wrapper removed. */
  public static Object untagDeep(Object value) {
    Object raw = untag(value);
    if (raw instanceof Map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
        copy.put(untagDeep(entry.getKey()), untagDeep(entry.getValue()));
      }
      return copy;
    }
    if (raw instanceof List) {
      List<Object> copy = new ArrayList<>();
      for (Object item : (List<?>) raw) {
        copy.add(untagDeep(item));
      }
      return copy;
    }
    if (raw instanceof Set) {
      Set<Object> copy = new LinkedHashSet<>();
      for (Object item : (Set<?>) raw) {
        copy.add(untagDeep(item));
      }
      return copy;
    }
    if (raw instanceof Map.Entry) {
      Map.Entry<?, ?> entry = (Map.Entry<?, ?>) raw;
      return new AbstractMap.SimpleImmutableEntry<>(
          untagDeep(entry.getKey()), untagDeep(entry.getValue()));
    }
    return raw;
  }

  public static boolean isTaggedOn(Object value, Class<? extends DataTag> type) {
    return value instanceof Tagged && ((Tagged<?>) value).isTaggedOn(type);
  }

  /** The origin of a value, or null when it has none. */
  public static Origin getOrigin(Object value) {
    return value instanceof Tagged ? ((Tagged<?>) value).origin() : null;
  }

  /**
   * The origin already attached to an input stream, else a new one naming the stream. The line
   * of a reused origin is kept so documents embedded in a larger file report file lines.
   */
  public static Origin getOrCreateOrigin(Object stream, String name) {
    Origin origin = getOrigin(stream);
    return origin != null ? origin : new Origin(name);
  }
}
