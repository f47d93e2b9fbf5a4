package io.intellixity.coldef.sqlite;

import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.spi.sql.AbstractSqlDialect;

/**
 * SQLite column types.
 *
 * SQLite applies type affinity rather than strict types, so these names mostly document intent;
 * booleans are stored as 0/1 and there is no native UUID.
 */
public final class SqliteDialect extends AbstractSqlDialect {
  @Override public String id() { return "sqlite"; }

  @Override
  protected String listSqlType() { return "text"; }

  @Override
  protected String scalarSqlType(ScalarType type) {
    return switch (type) {
      case STRING, ENUM, JSON -> "text";
      case BOOLEAN -> "boolean";
      case INT -> "integer";
      case FLOAT -> "real";
      case CUID -> "varchar(25)";
      case DATE_TIME -> "datetime";
      case UUID -> "char(36)";
    };
  }

  @Override
  protected String booleanLiteral(boolean b) {
    return b ? "1" : "0";
  }
}
