package com.kriskowal.tagyaml;

/**
 * Counts how many {@code !unsafe} nodes enclose the node under construction. While the count is
 * above zero no string may be marked {@link TrustedAsTemplate}.
 *
 * <p>Not thread safe; one tracker belongs to one parse.
 */
public final class TrustTracker {

  private int depth;

  /** Enter an unsafe subtree. Close the returned scope when the subtree is done. */
  public Scope enter() {
    depth++;
    return new Scope();
  }

  public int depth() {
    return depth;
  }

  public boolean isSuppressed() {
    return depth > 0;
  }

  /** Releases one level of suppression, at most once. */
  public final class Scope implements AutoCloseable {

    private boolean closed;

    private Scope() {}

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      depth--;
    }
  }
}
