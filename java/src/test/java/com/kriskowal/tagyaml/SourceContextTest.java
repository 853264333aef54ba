package com.kriskowal.tagyaml;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

public class SourceContextTest {

  private static String repeat(char c, int n) {
    return String.valueOf(c).repeat(n);
  }

  @Test
  void testLines() {
    assertArrayEquals(new String[] {"a", "b", ""}, SourceContext.lines("a\r\nb\n"));
    assertArrayEquals(new String[] {""}, SourceContext.lines(""));
  }

  @Test
  void testPrecedingLines() {
    SourceContext context = SourceContext.fromText("a\nb\nc\nd", 3, new Origin("f", 4, 1));
    assertEquals(Arrays.asList("2 b", "3 c", "4 d", "  ^ column 1"), context.getAnnotatedLines());
    assertEquals("d", context.getTargetLine());
  }

  @Test
  void testLabelsFollowOrigin() {
    SourceContext context = SourceContext.fromText("x\ny\nz", 2, new Origin("f", 10, 1));
    assertEquals(
        Arrays.asList(" 8 x", " 9 y", "10 z", "   ^ column 1"), context.getAnnotatedLines());
  }

  @Test
  void testWholeLineUnderline() {
    SourceContext context = SourceContext.fromText("abc", 0, new Origin("f", 1, null));
    assertEquals(Arrays.asList("1 abc", "  ^^^"), context.getAnnotatedLines());
  }

  @Test
  void testTabsAndBlankLines() {
    SourceContext context = SourceContext.fromText("\nx\n\ty", 2, new Origin("f", 3, 2));
    assertEquals(Arrays.asList("1", "2 x", "3  y", "   ^ column 2"), context.getAnnotatedLines());
    assertEquals("\ty", context.getTargetLine());
  }

  @Test
  void testTruncatedSource() {
    SourceContext context = SourceContext.fromText("a", 5, new Origin("f", 6, 1));
    assertEquals(
        Collections.singletonList("(source not shown: file truncated)"),
        context.getAnnotatedLines());
    assertNull(context.getTargetLine());
    assertEquals("Origin: f:6:1\n\n(source not shown: file truncated)", context.toString());
  }

  @Test
  void testLongLine() {
    SourceContext context = SourceContext.fromText(repeat('a', 200), 0, new Origin("f", 1, 1));
    assertEquals("1 " + repeat('a', 115) + "...", context.getAnnotatedLines().get(0));
    assertEquals("  ^ column 1", context.getAnnotatedLines().get(1));
  }

  @Test
  void testMarkerBeyondVisibleText() {
    SourceContext context = SourceContext.fromText(repeat('a', 200), 0, new Origin("f", 1, 117));
    assertEquals(1, context.getAnnotatedLines().size());
  }

  @Test
  void testRightAlignedMarker() {
    SourceContext context = SourceContext.fromText(repeat('a', 115), 0, new Origin("f", 1, 110));
    assertEquals(
        "  " + repeat(' ', 98) + "column 110 ^", context.getAnnotatedLines().get(1));
  }
}
