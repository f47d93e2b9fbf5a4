package io.intellixity.coldef.postgres;

import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.spi.sql.AbstractSqlDialect;

/**
 * Postgres column types.
 *
 * Floats use {@code Decimal(65,30)} to keep decimal rather than binary floating-point semantics.
 * Lists, enums and JSON are stored as text.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String listSqlType() { return "text"; }

  @Override
  protected String scalarSqlType(ScalarType type) {
    return switch (type) {
      case STRING -> "text";
      case BOOLEAN -> "boolean";
      case INT -> "int";
      case FLOAT -> "Decimal(65,30)";
      case CUID -> "varchar (25)";
      case ENUM -> "text";
      case JSON -> "text";
      case DATE_TIME -> "timestamp (3)";
      case UUID -> "uuid";
    };
  }

  @Override
  public boolean supportsAddColumnIfNotExists() { return true; }
}
