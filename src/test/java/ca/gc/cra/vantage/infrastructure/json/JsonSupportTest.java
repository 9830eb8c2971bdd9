package ca.gc.cra.vantage.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedValues() throws IOException {
    Map<String, Object> root = json.parseObject(new StringReader(
        "{\"a\": 1, \"b\": [true, null, \"x\"], \"c\": {\"d\": 2.5}}"));

    assertEquals(1, JsonSupport.requireInt(root, "a", "$"));
    List<Object> b = JsonSupport.optionalList(root, "b", "$");
    assertEquals(Boolean.TRUE, b.get(0));
    assertNull(b.get(1));
    assertEquals("x", b.get(2));
    assertEquals(2.5, ((Number) JsonSupport.asObject(root.get("c"), "$.c").get("d")).doubleValue());
  }

  @Test
  void emptyInputIsEmptyObject() throws IOException {
    assertTrue(json.parseObject(new StringReader("")).isEmpty());
  }

  @Test
  void rejectsNonObjectRootAndTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject(new StringReader("[1]")));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject(new StringReader("{} {}")));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject(new StringReader("{\"a\":")));
  }

  @Test
  void typedAccessorsReportPath() {
    Map<String, Object> node = Map.of("n", "text", "big", 10_000_000_000L, "f", 1.5, "s", 3);

    assertEquals("$.n must be an integer",
        assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireInt(node, "n", "$")).getMessage());
    assertTrue(assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireInt(node, "big", "$"))
        .getMessage().contains("out of range"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireInt(node, "f", "$"));
    assertEquals("$.missing is required",
        assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireInt(node, "missing", "$"))
            .getMessage());
    assertEquals(7, JsonSupport.optionalInt(node, "missing", "$", 7));
    assertEquals("", JsonSupport.optionalString(node, "missing", "$"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.optionalString(node, "s", "$"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.optionalList(node, "n", "$"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.asObject("x", "$.x"));
  }
}
