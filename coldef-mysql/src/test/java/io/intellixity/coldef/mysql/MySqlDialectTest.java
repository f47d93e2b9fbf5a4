package io.intellixity.coldef.mysql;

import io.intellixity.coldef.compile.ColumnDefinitionCompiler;
import io.intellixity.coldef.ddl.TableDdlRenderer;
import io.intellixity.coldef.model.DefaultValue;
import io.intellixity.coldef.model.FieldSpec;
import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.spi.sql.DiscoveredDialectRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

final class MySqlDialectTest {
  private final ColumnDefinitionCompiler c = new ColumnDefinitionCompiler(new MySqlDialect());

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "STRING    | mediumtext",
      "BOOLEAN   | boolean",
      "INT       | int",
      "FLOAT     | Decimal(65,30)",
      "CUID      | char(25)",
      "ENUM      | varchar(191)",
      "JSON      | mediumtext",
      "DATE_TIME | datetime(3)",
      "UUID      | char(36)"
  })
  void mapsEveryScalarType(ScalarType type, String sqlType) {
    assertEquals(sqlType, c.sqlType(false, type));
  }

  @Test
  void usesBackticks() {
    assertEquals("`age` int NOT NULL", c.compile("age", true, false, ScalarType.INT));
    assertEquals("`a``b` mediumtext NULL", c.compile("a`b", false, true, ScalarType.INT));
  }

  @Test
  void escapesBackslashesAndQuotesInStrings() {
    assertEquals("`p` varchar(191) NULL DEFAULT 'A_B'",
        c.compile("p", false, false, ScalarType.ENUM, false, DefaultValue.literal("A_B")));
    assertEquals("`s` mediumtext NULL DEFAULT ('c:\\\\tmp\\\\x''y')",
        c.compile("s", false, false, ScalarType.STRING, false, DefaultValue.literal("c:\\tmp\\x'y")));
  }

  @Test
  void textColumnsTakeParenthesizedLiteralDefaults() {
    assertEquals("`s` mediumtext NULL DEFAULT ('x')",
        c.compile("s", false, false, ScalarType.STRING, false, DefaultValue.literal("x")));
    assertEquals("`meta` mediumtext NULL DEFAULT ('{\"k\":1}')",
        c.compile("meta", false, false, ScalarType.JSON, false, DefaultValue.literal(java.util.Map.of("k", 1))));
    assertEquals("`tags` mediumtext NULL DEFAULT ('[\"a\"]')",
        c.compile("tags", false, true, ScalarType.INT, false, DefaultValue.literal(java.util.List.of("a"))));
    assertEquals("`s` mediumtext NULL DEFAULT NULL",
        c.compile("s", false, false, ScalarType.STRING, false, DefaultValue.literal(null)));
    assertEquals("`s` mediumtext NULL DEFAULT concat('a', 'b')",
        c.compile("s", false, false, ScalarType.STRING, false, DefaultValue.raw("concat('a', 'b')")));
    assertEquals("`at` datetime(3) NOT NULL DEFAULT '2024-03-01 00:00:00.000'",
        c.compile("at", true, false, ScalarType.DATE_TIME, false, DefaultValue.literal("2024-03-01")));
  }

  @Test
  void booleansAreNumeric() {
    assertEquals("`on` boolean NOT NULL DEFAULT 0",
        c.compile("on", true, false, ScalarType.BOOLEAN, false, DefaultValue.literal(false)));
  }

  @Test
  void addColumnHasNoIfNotExists() {
    TableDdlRenderer r = new TableDdlRenderer(new MySqlDialect());
    assertEquals("ALTER TABLE `t` ADD COLUMN `x` int NULL",
        r.addColumn("t", FieldSpec.of("x", false, false, ScalarType.INT), true));
  }

  @Test
  void registeredForDiscovery() {
    assertTrue(new DiscoveredDialectRegistry().get("MySQL") instanceof MySqlDialect);
  }
}
