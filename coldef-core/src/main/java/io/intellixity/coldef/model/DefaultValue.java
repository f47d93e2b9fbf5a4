package io.intellixity.coldef.model;

/**
 * Column default.
 * <p>
 * {@link Raw} is emitted verbatim and must already be valid SQL (e.g. {@code cuid()}, {@code now()});
 * only pass trusted input. {@link Literal} is rendered by the dialect as an escaped literal
 * matching the field's scalar type.
 */
public interface DefaultValue {

  static DefaultValue raw(String sql) {
    return new Raw(sql);
  }

  static DefaultValue literal(Object value) {
    return new Literal(value);
  }

  record Raw(String sql) implements DefaultValue {
    public Raw {
      if (sql == null || sql.isBlank()) throw new IllegalArgumentException("raw default SQL is blank");
    }
  }

  /** A null value renders as {@code NULL}. */
  record Literal(Object value) implements DefaultValue {}
}
