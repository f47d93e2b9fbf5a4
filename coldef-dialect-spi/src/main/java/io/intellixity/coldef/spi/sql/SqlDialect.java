package io.intellixity.coldef.spi.sql;

import io.intellixity.coldef.model.DefaultValue;
import io.intellixity.coldef.model.FieldSpec;
import io.intellixity.coldef.model.ScalarType;

/**
 * Dialect capabilities needed to render column definitions: type names, identifier quoting and
 * literal rendering.
 * <p>
 * Implementations are stateless and safe to share between threads. They are discovered through
 * {@code META-INF/coldef.factories} (see {@link DiscoveredDialectRegistry}).
 */
public interface SqlDialect {
  /** Stable id used for lookup, e.g. {@code postgres}. */
  String id();

  /** Quotes an identifier, doubling embedded quote characters. Deterministic for a given input. */
  String quoteIdent(String ident);

  /**
   * SQL type for a field. List fields resolve to the serialized-text type regardless of {@code type}.
   *
   * @throws io.intellixity.coldef.model.UnsupportedScalarTypeException if the dialect has no mapping
   */
  String sqlType(boolean list, ScalarType type);

  /** Renders the value part of a {@code DEFAULT} clause for the given field. */
  String renderDefault(FieldSpec field, DefaultValue value);

  boolean supportsCreateIfNotExists();

  boolean supportsAddColumnIfNotExists();
}
