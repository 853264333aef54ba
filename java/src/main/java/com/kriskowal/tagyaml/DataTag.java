package com.kriskowal.tagyaml;

/**
 * Out-of-band metadata attached to a constructed value by {@link Tagged}.
 *
 * <p>A value carries at most one tag of each concrete type. Not to be confused with the type
 * tag of a YAML node such as {@code !vault}.
 */
public interface DataTag {}
