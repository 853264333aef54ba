package com.kriskowal.tagyaml;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TrustTrackerTest {

  @Test
  void testNesting() {
    TrustTracker tracker = new TrustTracker();
    assertFalse(tracker.isSuppressed());
    try (TrustTracker.Scope outer = tracker.enter()) {
      try (TrustTracker.Scope inner = tracker.enter()) {
        assertEquals(2, tracker.depth());
      }
      assertTrue(tracker.isSuppressed());
    }
    assertEquals(0, tracker.depth());
  }

  @Test
  void testCloseOnce() {
    TrustTracker tracker = new TrustTracker();
    TrustTracker.Scope first = tracker.enter();
    tracker.enter();
    first.close();
    first.close();
    assertEquals(1, tracker.depth());
  }

  @Test
  void testReleasedOnFailure() {
    TrustTracker tracker = new TrustTracker();
    assertThrows(
        IllegalStateException.class,
        () -> {
          try (TrustTracker.Scope scope = tracker.enter()) {
            throw new IllegalStateException("boom");
          }
        });
    assertFalse(tracker.isSuppressed());
  }
}
