package com.kriskowal.tagyaml;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * A constructed value together with its out-of-band tags.
 *
 * <p>Equality and hash code consider the wrapped value only, so {@code Tagged.of("a")} finds the
 * key {@code "a"} of a loaded mapping whatever its origin. Use {@link #getTags()} to compare
 * tags. Numbers compare by numeric value, so the keys {@code 1} and {@code 1.0} of one mapping
 * are duplicates.
 *
 * <p>Type mapping of loaded documents: mapping -> {@code Map<Tagged<?>, Tagged<?>>} - sequence
 * -> {@code List<Tagged<?>>} - set -> {@code Set<Tagged<?>>} - omap/pairs -> {@code
 * List<Tagged<Map.Entry<Tagged<?>, Tagged<?>>>>} - scalars as constructed by SnakeYAML.
 */
public final class Tagged<T> {

  private final T value;
  private final Map<Class<? extends DataTag>, DataTag> tags;

  private Tagged(T value, Map<Class<? extends DataTag>, DataTag> tags) {
    this.value = value;
    this.tags = tags;
  }

  /** Wrap a value; a later tag replaces an earlier tag of the same type. */
  public static <T> Tagged<T> of(T value, DataTag... tags) {
    return new Tagged<>(value, Collections.emptyMap()).withTags(tags);
  }

  public T value() {
    return value;
  }

  /** The origin tag, or null when the value has none. */
  public Origin origin() {
    return getTag(Origin.class);
  }

  public <X extends DataTag> X getTag(Class<X> type) {
    return type.cast(tags.get(type));
  }

  public boolean isTaggedOn(Class<? extends DataTag> type) {
    return tags.containsKey(type);
  }

  public Collection<DataTag> getTags() {
    return tags.values();
  }

  /** Copy of this value with the given tags laid over the current ones. */
  public Tagged<T> withTags(DataTag... overlay) {
    return withTags(Arrays.asList(overlay));
  }

  public Tagged<T> withTags(Collection<? extends DataTag> overlay) {
    if (overlay.isEmpty()) {
      return this;
    }
    Map<Class<? extends DataTag>, DataTag> merged = new LinkedHashMap<>(tags);
    for (DataTag tag : overlay) {
      merged.put(Objects.requireNonNull(tag, "tag").getClass(), tag);
    }
    return new Tagged<>(value, Collections.unmodifiableMap(merged));
  }

  /** Copy of this value without the tag of the given type. */
  public Tagged<T> withoutTag(Class<? extends DataTag> type) {
    if (!tags.containsKey(type)) {
      return this;
    }
    Map<Class<? extends DataTag>, DataTag> remaining = new LinkedHashMap<>(tags);
    remaining.remove(type);
    return new Tagged<>(value, Collections.unmodifiableMap(remaining));
  }

  /** Look up a mapping entry by its raw key. Returns null when the key is absent. */
  public Tagged<?> get(Object key) {
    if (!(value instanceof Map)) {
      throw new IllegalStateException("Not a mapping: " + describeType());
    }
    Object lookup = key instanceof Tagged ? key : Tagged.of(key);
    return (Tagged<?>) ((Map<?, ?>) value).get(lookup);
  }

  /** Element of a sequence value. */
  public Tagged<?> get(int index) {
    if (!(value instanceof List)) {
      throw new IllegalStateException("Not a sequence: " + describeType());
    }
    return (Tagged<?>) ((List<?>) value).get(index);
  }

  private String describeType() {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Tagged)) return false;
    Object other = ((Tagged<?>) o).value;
    if (value instanceof Number && other instanceof Number) {
      return numericKey((Number) value).equals(numericKey((Number) other));
    }
    return Objects.deepEquals(value, other);
  }

  @Override
  public int hashCode() {
    if (value instanceof byte[]) {
      return Arrays.hashCode((byte[]) value);
    }
    if (value instanceof Number) {
      return numericKey((Number) value).hashCode();
    }
    return Objects.hashCode(value);
  }

  /** Exact decimal form of a number; NaN and infinities stay doubles. */
  private static Object numericKey(Number n) {
    BigDecimal decimal;
    if (n instanceof BigDecimal) {
      decimal = (BigDecimal) n;
    } else if (n instanceof BigInteger) {
      decimal = new BigDecimal((BigInteger) n);
    } else if (n instanceof Double || n instanceof Float) {
      double d = n.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return d;
      }
      decimal = new BigDecimal(d);
    } else {
      decimal = BigDecimal.valueOf(n.longValue());
    }
    return decimal.stripTrailingZeros();
  }

  @Override
  public String toString() {
    if (value instanceof byte[]) {
      return "bytes(" + ((byte[]) value).length + ")";
    }
    return String.valueOf(value);
  }
}
