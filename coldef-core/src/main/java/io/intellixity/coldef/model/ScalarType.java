package io.intellixity.coldef.model;

import java.util.Locale;

/**
 * Closed set of logical, database-agnostic field types.
 *
 * Dialects map every constant explicitly; adding a constant breaks the exhaustive switches in
 * each dialect until it is mapped.
 */
public enum ScalarType {
  STRING("String"),
  BOOLEAN("Boolean"),
  INT("Int"),
  FLOAT("Float"),
  /** Collision-resistant identifier (cuid). */
  CUID("Cuid"),
  ENUM("Enum"),
  JSON("Json"),
  DATE_TIME("DateTime"),
  UUID("UUID");

  private final String id;

  ScalarType(String id) {
    this.id = id;
  }

  /** Schema-level identifier, e.g. {@code DateTime}. */
  public String id() { return id; }

  /**
   * Resolves a schema type identifier (case-insensitive).
   *
   * @throws UnsupportedScalarTypeException for anything outside the closed set
   */
  public static ScalarType fromId(String typeId) {
    if (typeId == null || typeId.isBlank()) throw new UnsupportedScalarTypeException(typeId);
    String s = typeId.trim();
    for (ScalarType t : values()) {
      if (t.id.equalsIgnoreCase(s)) return t;
    }
    String lower = s.toLowerCase(Locale.ROOT);
    if (lower.equals("identifier") || lower.equals("id")) return CUID;
    throw new UnsupportedScalarTypeException(typeId);
  }
}
