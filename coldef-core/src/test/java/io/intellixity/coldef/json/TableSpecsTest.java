package io.intellixity.coldef.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.coldef.model.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TableSpecsTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesTableWithDefaultsAndFlags() throws Exception {
    String s = """
        {
          "table": "User",
          "primaryKey": ["id"],
          "fields": [
            { "name": "id", "type": "Cuid", "required": true, "autoGenerated": true, "default": { "raw": "cuid()" } },
            { "name": "tags", "type": "String", "list": true },
            { "name": "age", "type": "Int", "default": { "value": 18 } },
            { "name": "nickname", "type": "String", "default": { "value": null } }
          ]
        }
        """;
    TableSpec t = JSON.readValue(s, TableSpec.class);

    assertEquals("User", t.table());
    assertEquals(List.of("id"), t.primaryKey());
    assertEquals(4, t.fields().size());

    FieldSpec id = t.field("id");
    assertTrue(id.required());
    assertTrue(id.autoGenerated());
    assertFalse(id.list());
    assertEquals(DefaultValue.raw("cuid()"), id.defaultValue());

    FieldSpec tags = t.field("tags");
    assertTrue(tags.list());
    assertFalse(tags.required());
    assertNull(tags.defaultValue());

    assertEquals(DefaultValue.literal(18), t.field("age").defaultValue());
    assertEquals(DefaultValue.literal(null), t.field("nickname").defaultValue());
  }

  @Test
  void floatDefaultsKeepAllDigits() throws Exception {
    String s = """
        { "table": "Product", "fields": [
            { "name": "price", "type": "Float", "default": { "value": 0.12345678901234567890123456789 } },
            { "name": "qty", "type": "Int", "default": { "value": 3 } }
        ] }
        """;
    TableSpec t = TableSpecs.readAll(s).get(0);

    Object price = ((DefaultValue.Literal) t.field("price").defaultValue()).value();
    assertTrue(price instanceof BigDecimal, String.valueOf(price));
    assertEquals("0.12345678901234567890123456789", ((BigDecimal) price).toPlainString());
    assertEquals(DefaultValue.literal(3), t.field("qty").defaultValue());
  }

  @Test
  void nullDefaultMeansNoDefault() throws Exception {
    String s = """
        { "table": "A", "fields": [ { "name": "x", "type": "Int", "default": null } ] }
        """;
    FieldSpec x = TableSpecs.readAll(s).get(0).field("x");
    assertNull(x.defaultValue());
    assertFalse(x.hasDefault());
  }

  @Test
  void readsArrayOfTables() throws Exception {
    String s = """
        [
          { "table": "A", "fields": [ { "name": "x", "type": "Boolean" } ] },
          { "table": "B", "primaryKey": "y", "fields": [ { "name": "y", "type": "UUID", "required": true } ] }
        ]
        """;
    List<TableSpec> all = TableSpecs.readAll(s);
    assertEquals(2, all.size());
    assertEquals("A", all.get(0).table());
    assertEquals(List.of("y"), all.get(1).primaryKey());
    assertSame(ScalarType.UUID, all.get(1).field("y").scalarType());
  }

  @Test
  void unknownTypeFailsFast() {
    String s = """
        { "table": "A", "fields": [ { "name": "owner", "type": "Relation" } ] }
        """;
    UnsupportedScalarTypeException ex = assertThrows(UnsupportedScalarTypeException.class, () -> TableSpecs.readAll(s));
    assertEquals("Relation", ex.typeId());
  }

  @Test
  void defaultNeedsRawOrValue() {
    String s = """
        { "table": "A", "fields": [ { "name": "x", "type": "Int", "default": { } } ] }
        """;
    assertThrows(IllegalArgumentException.class, () -> TableSpecs.readAll(s));
  }

  @Test
  void fieldsMustBeAnArray() {
    String s = """
        { "table": "A", "fields": { "name": "x", "type": "Int" } }
        """;
    assertThrows(IllegalArgumentException.class, () -> TableSpecs.readAll(s));
  }
}
