package io.intellixity.coldef.sqlite;

import io.intellixity.coldef.compile.ColumnDefinitionCompiler;
import io.intellixity.coldef.model.DefaultValue;
import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.spi.sql.DiscoveredDialectRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDialectTest {
  private final ColumnDefinitionCompiler c = new ColumnDefinitionCompiler(new SqliteDialect());

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "STRING    | text",
      "BOOLEAN   | boolean",
      "INT       | integer",
      "FLOAT     | real",
      "CUID      | varchar(25)",
      "ENUM      | text",
      "JSON      | text",
      "DATE_TIME | datetime",
      "UUID      | char(36)"
  })
  void mapsEveryScalarType(ScalarType type, String sqlType) {
    assertEquals(sqlType, c.sqlType(false, type));
  }

  @Test
  void defaults() {
    assertEquals("\"done\" boolean NOT NULL DEFAULT 1",
        c.compile("done", true, false, ScalarType.BOOLEAN, false, DefaultValue.literal(true)));
    assertEquals("\"tags\" text NULL DEFAULT '[\"a\"]'",
        c.compile("tags", false, true, ScalarType.STRING, false, DefaultValue.literal(List.of("a"))));
    assertEquals("\"at\" datetime NOT NULL DEFAULT CURRENT_TIMESTAMP",
        c.compile("at", true, false, ScalarType.DATE_TIME, false, DefaultValue.raw("CURRENT_TIMESTAMP")));
  }

  @Test
  void registeredForDiscovery() {
    assertEquals("sqlite", new DiscoveredDialectRegistry().get("sqlite").id());
  }
}
