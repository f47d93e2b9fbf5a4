package io.intellixity.coldef.model;

/**
 * Raised when a scalar type identifier has no SQL type mapping.
 * <p>
 * Either the identifier is outside {@link ScalarType}, or a dialect declined to map a known type.
 * Not retryable: the schema (or the dialect's mapping table) has to change.
 */
public final class UnsupportedScalarTypeException extends RuntimeException {
  private final String typeId;
  private final String dialectId;

  public UnsupportedScalarTypeException(String typeId) {
    super("Unsupported scalar type: " + typeId);
    this.typeId = typeId;
    this.dialectId = null;
  }

  public UnsupportedScalarTypeException(String typeId, String dialectId) {
    super("Unsupported scalar type: " + typeId + " (dialectId=" + dialectId + ")");
    this.typeId = typeId;
    this.dialectId = dialectId;
  }

  public String typeId() { return typeId; }

  /** Dialect that rejected the type, or null when the identifier itself is unknown. */
  public String dialectId() { return dialectId; }
}
