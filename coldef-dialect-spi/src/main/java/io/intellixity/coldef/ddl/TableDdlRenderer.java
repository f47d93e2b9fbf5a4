package io.intellixity.coldef.ddl;

import io.intellixity.coldef.compile.ColumnDefinitionCompiler;
import io.intellixity.coldef.model.FieldSpec;
import io.intellixity.coldef.model.TableSpec;
import io.intellixity.coldef.spi.sql.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Embeds compiled column fragments into table-level DDL statements. */
public final class TableDdlRenderer {
  private final ColumnDefinitionCompiler columns;

  public TableDdlRenderer(ColumnDefinitionCompiler columns) {
    this.columns = Objects.requireNonNull(columns, "columns");
  }

  public TableDdlRenderer(SqlDialect dialect) {
    this(new ColumnDefinitionCompiler(dialect));
  }

  public String createTable(TableSpec table, boolean ifNotExists) {
    Objects.requireNonNull(table, "table");
    if (table.fields().isEmpty()) throw new IllegalArgumentException("Table has no fields: " + table.table());
    SqlDialect d = columns.dialect();

    List<String> defs = new ArrayList<>(table.fields().size() + 1);
    for (FieldSpec f : table.fields()) defs.add(columns.compile(f));
    if (!table.primaryKey().isEmpty()) {
      defs.add("PRIMARY KEY (" + String.join(", ", table.primaryKey().stream().map(d::quoteIdent).toList()) + ")");
    }

    return "CREATE TABLE" + (ifNotExists && d.supportsCreateIfNotExists() ? " IF NOT EXISTS" : "") + " " +
        d.quoteIdent(table.table()) + " (\n  " + String.join(",\n  ", defs) + "\n)";
  }

  public String addColumn(String table, FieldSpec field, boolean ifNotExists) {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table name is blank");
    SqlDialect d = columns.dialect();
    return "ALTER TABLE " + d.quoteIdent(table) + " ADD COLUMN" +
        (ifNotExists && d.supportsAddColumnIfNotExists() ? " IF NOT EXISTS" : "") + " " + columns.compile(field);
  }

  public String dropTable(String table, boolean ifExists) {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table name is blank");
    return "DROP TABLE" + (ifExists ? " IF EXISTS" : "") + " " + columns.dialect().quoteIdent(table);
  }
}
