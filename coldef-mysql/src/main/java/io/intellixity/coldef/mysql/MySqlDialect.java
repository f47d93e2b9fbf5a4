package io.intellixity.coldef.mysql;

import io.intellixity.coldef.model.FieldSpec;
import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.spi.sql.AbstractSqlDialect;

/** MySQL column types (InnoDB, utf8mb4). */
public final class MySqlDialect extends AbstractSqlDialect {
  @Override public String id() { return "mysql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) throw new IllegalArgumentException("identifier is null");
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected String listSqlType() { return "mediumtext"; }

  @Override
  protected String scalarSqlType(ScalarType type) {
    return switch (type) {
      case STRING -> "mediumtext";
      case BOOLEAN -> "boolean";
      case INT -> "int";
      case FLOAT -> "Decimal(65,30)";
      case CUID -> "char(25)";
      // 191 chars keeps a utf8mb4 index under the 767-byte key prefix limit
      case ENUM -> "varchar(191)";
      case JSON -> "mediumtext";
      case DATE_TIME -> "datetime(3)";
      case UUID -> "char(36)";
    };
  }

  /** Backslash is an escape character under the default sql_mode. */
  @Override
  protected String quoteString(String s) {
    return "'" + s.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  /** TEXT columns only take expression defaults (8.0.13+), so literals are parenthesized. */
  @Override
  protected String literalDefault(FieldSpec field, String literal) {
    return sqlType(field.list(), field.scalarType()).endsWith("text") ? "(" + literal + ")" : literal;
  }

  @Override
  protected String booleanLiteral(boolean b) {
    return b ? "1" : "0";
  }
}
