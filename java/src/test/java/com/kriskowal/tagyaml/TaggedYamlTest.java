package com.kriskowal.tagyaml;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

public class TaggedYamlTest {

  private static final LoaderSettings STRICT = LoaderSettings.of(DuplicateKeyPolicy.ERROR);
  private static final String FILE_NAME = "/some/test/path/myfile.yml";

  private static Object plain(String source) {
    return DataTags.untagDeep(TaggedYaml.load(source, FILE_NAME, STRICT));
  }

  @Test
  void testNull() {
    assertNull(plain("null"));
    assertNull(plain("~"));
  }

  @Test
  void testBooleans() {
    assertEquals(Boolean.TRUE, plain("true"));
    assertEquals(Boolean.FALSE, plain("false"));
  }

  @Test
  void testIntegers() {
    assertEquals(123, plain("123"));
    assertEquals(-7, plain("-7"));
    assertEquals(new BigInteger("123456789012345678901234567890"), plain("123456789012345678901234567890"));
  }

  @Test
  void testFloats() {
    assertEquals(1.234, plain("1.234"));
    assertEquals(Double.POSITIVE_INFINITY, plain(".inf"));
    assertTrue(Double.isNaN((Double) plain(".nan")));
  }

  @Test
  void testStrings() {
    assertEquals("test", plain("test"));
    assertEquals("Cafè Eñyei", plain("Cafè Eñyei"));
    assertEquals("123", plain("\"123\""));
  }

  @Test
  void testFlowCollections() {
    assertEquals(Arrays.asList(1, 2, 3), plain("[1, 2, 3]"));
    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("foo", "bar");
    assertEquals(expected, plain("{foo: bar}"));
  }

  @Test
  void testSet() {
    assertEquals(new LinkedHashSet<>(Arrays.asList("bar", "foo")), plain("!!set {bar: null, foo: null}"));
  }

  @Test
  void testTimestamp() {
    assertEquals(Date.from(Instant.parse("2024-01-01T00:00:00Z")), plain("2024-01-01"));
  }

  @Test
  void testBinary() {
    byte[] bytes = (byte[]) plain("!!binary |\n  aGVsbG8=");
    assertArrayEquals("hello".getBytes(StandardCharsets.US_ASCII), bytes);
  }

  @Test
  void testEveryValueHasOrigin() {
    String[] sources = {"test", "123", "1.5", "true", "null", "[1]", "{a: 1}", "!!binary aGVsbG8="};
    for (String source : sources) {
      Tagged<?> value = TaggedYaml.load(source, FILE_NAME, STRICT);
      assertEquals(new Origin(FILE_NAME, 1, 1), value.origin(), source);
    }
  }

  @Test
  void testEmptyDocument() {
    Tagged<?> value = TaggedYaml.load("", FILE_NAME, STRICT);
    assertNull(value.value());
    assertEquals(new Origin(FILE_NAME), value.origin());
  }

  @Test
  void testLoadAll() {
    List<Tagged<?>> documents = TaggedYaml.loadAll("a: 1\n---\nb: 2\n", "multi.yml", STRICT);
    assertEquals(2, documents.size());
    assertEquals(new Origin("multi.yml", 1, 1), documents.get(0).origin());
    assertEquals(new Origin("multi.yml", 3, 1), documents.get(1).origin());
    assertEquals(new Origin("multi.yml", 3, 4), documents.get(1).get("b").origin());
  }

  @Test
  void testSingleLoadRejectsSeveralDocuments() {
    YamlParserException e =
        assertThrows(
            YamlParserException.class, () -> TaggedYaml.load("a: 1\n---\nb: 2\n", "multi.yml", STRICT));
    assertTrue(e.getMessage().contains("single document"), e.getMessage());
  }

  @Test
  void testRead() throws IOException {
    Tagged<?> value = TaggedYaml.read(new StringReader("foo: bar"), "reader.yml", STRICT);
    assertEquals(new Origin("reader.yml", 1, 6), value.get("foo").origin());
  }

  @Test
  void testTaggedSourceOrigin() {
    Tagged<String> source = Tagged.of("a: b\nc: d\n", new Origin("/play.yml", 10, null));
    Tagged<?> value = TaggedYaml.load(source, STRICT);
    assertEquals(new Origin("/play.yml", 10, 1), value.origin());
    assertEquals(new Origin("/play.yml", 10, 4), value.get("a").origin());
    assertEquals(new Origin("/play.yml", 11, 4), value.get("c").origin());
  }

  @Test
  void testOriginlessName() {
    Tagged<?> value = TaggedYaml.load("foo", STRICT);
    assertEquals(new Origin(null, 1, 1), value.origin());
  }

  @Test
  void testWarningsAreLogged() {
    LoaderSettings warn = LoaderSettings.of(DuplicateKeyPolicy.WARN);
    Tagged<?> value = TaggedYaml.load("a: 1\na: !vault-encrypted abc\n", "warn.yml", warn);
    assertEquals(new EncryptedString("abc"), value.get("a").value());
  }

  // ========================================================================
  // Diagnostic fixtures
  // ========================================================================

  @TestFactory
  Stream<DynamicTest> testAllDiagnosticFixtures() throws Exception {
    URL resource = TaggedYamlTest.class.getResource("/diagnostics");
    if (resource == null) {
      return Stream.empty();
    }
    Path dir = Paths.get(resource.toURI());
    if (!Files.exists(dir)) {
      return Stream.empty();
    }

    return Files.list(dir)
        .filter(p -> p.toString().endsWith(".yml"))
        .sorted()
        .map(
            ymlPath -> {
              String name = ymlPath.getFileName().toString().replace(".yml", "");
              Path errorPath = ymlPath.resolveSibling(name + ".error");

              return DynamicTest.dynamicTest(
                  name,
                  () -> {
                    String source = Files.readString(ymlPath);
                    String expectedError = "";
                    if (Files.exists(errorPath)) {
                      expectedError = Files.readString(errorPath).trim();
                    }

                    try {
                      Tagged<?> result = TaggedYaml.load(source, name + ".yml", STRICT);
                      fail(
                          "Expected error for "
                              + name
                              + " but loading succeeded with: "
                              + formatValue(DataTags.untagDeep(result)));
                    } catch (YamlParserException e) {
                      Origin origin = e.getOrigin();
                      String actualError =
                          e.getMessage() + " at " + origin.getLineNum() + ":" + origin.getColNum();
                      assertTrue(
                          actualError.contains(expectedError),
                          "Error mismatch for "
                              + name
                              + "\nExpected to contain: "
                              + expectedError
                              + "\nActual: "
                              + actualError);
                      assertEquals(name + ".yml", origin.getPath());
                      assertNotNull(e.getFormattedSourceContext());
                    }
                  });
            });
  }

  // ========================================================================
  // Value Formatting for Error Messages
  // ========================================================================

  private String formatValue(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String) {
      return "\"" + value + "\"";
    }
    if (value instanceof byte[]) {
      return "bytes(" + ((byte[]) value).length + ")";
    }
    if (value instanceof Collection) {
      StringBuilder sb = new StringBuilder("list(");
      int i = 0;
      for (Object item : (Collection<?>) value) {
        if (i++ > 0) sb.append(", ");
        sb.append(formatValue(item));
      }
      return sb.append(")").toString();
    }
    if (value instanceof Map) {
      StringBuilder sb = new StringBuilder("map(");
      int i = 0;
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        if (i++ > 0) sb.append(", ");
        sb.append(formatValue(entry.getKey())).append(", ").append(formatValue(entry.getValue()));
      }
      return sb.append(")").toString();
    }
    return value.toString();
  }
}
