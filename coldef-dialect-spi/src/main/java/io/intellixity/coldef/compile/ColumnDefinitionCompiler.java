package io.intellixity.coldef.compile;

import io.intellixity.coldef.model.DefaultValue;
import io.intellixity.coldef.model.FieldSpec;
import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.spi.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles a field into a column-definition fragment for the bound dialect:
 * {@code <quoted-name> <sql-type> NULL|NOT NULL [DEFAULT <value>]}.
 * <p>
 * Stateless apart from the dialect; safe for concurrent use. {@code autoGenerated} is accepted and
 * carried on {@link FieldSpec} but does not affect the fragment.
 */
public final class ColumnDefinitionCompiler {
  private static final Logger log = LoggerFactory.getLogger(ColumnDefinitionCompiler.class);

  private final SqlDialect dialect;

  public ColumnDefinitionCompiler(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public SqlDialect dialect() { return dialect; }

  public String compile(String name, boolean isRequired, boolean isList, ScalarType scalarType) {
    return compile(new FieldSpec(name, isRequired, isList, scalarType, false, null));
  }

  public String compile(String name, boolean isRequired, boolean isList, ScalarType scalarType,
                        boolean isAutoGenerated, DefaultValue defaultValue) {
    return compile(new FieldSpec(name, isRequired, isList, scalarType, isAutoGenerated, defaultValue));
  }

  /**
   * Variant for callers holding the schema type identifier.
   *
   * @throws io.intellixity.coldef.model.UnsupportedScalarTypeException for unknown identifiers
   */
  public String compile(String name, boolean isRequired, boolean isList, String scalarTypeId,
                        boolean isAutoGenerated, DefaultValue defaultValue) {
    return compile(name, isRequired, isList, ScalarType.fromId(scalarTypeId), isAutoGenerated, defaultValue);
  }

  public String compile(FieldSpec field) {
    Objects.requireNonNull(field, "field");
    String type = dialect.sqlType(field.list(), field.scalarType());

    StringBuilder sb = new StringBuilder(dialect.quoteIdent(field.name()))
        .append(' ').append(type)
        .append(' ').append(field.required() ? "NOT NULL" : "NULL");
    if (field.defaultValue() != null) {
      sb.append(" DEFAULT ").append(dialect.renderDefault(field, field.defaultValue()));
    }
    String out = sb.toString();

    if (log.isDebugEnabled()) {
      log.debug("coldef.compile dialect={} column={} scalarType={} list={} sqlType={} default={}",
          dialect.id(), field.name(), field.scalarType().id(), field.list(), type, defaultKind(field.defaultValue()));
    }
    return out;
  }

  /** Same resolution as {@link #compile(FieldSpec)} without the rest of the fragment. */
  public String sqlType(boolean isList, ScalarType scalarType) {
    return dialect.sqlType(isList, scalarType);
  }

  // default values may carry user data; log only their kind
  private static String defaultKind(DefaultValue d) {
    if (d == null) return "none";
    if (d instanceof DefaultValue.Raw) return "raw";
    return "literal";
  }
}
