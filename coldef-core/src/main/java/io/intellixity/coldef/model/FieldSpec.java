package io.intellixity.coldef.model;

/**
 * One schema field as seen by the column compiler.
 *
 * @param autoGenerated carried for callers; does not change the emitted column definition
 * @param defaultValue  optional, may be null
 */
public record FieldSpec(
    String name,
    boolean required,
    boolean list,
    ScalarType scalarType,
    boolean autoGenerated,
    DefaultValue defaultValue
) {
  public FieldSpec {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is blank");
    if (scalarType == null) throw new IllegalArgumentException("scalarType is required for field: " + name);
  }

  public static FieldSpec of(String name, boolean required, boolean list, ScalarType scalarType) {
    return new FieldSpec(name, required, list, scalarType, false, null);
  }

  public FieldSpec withDefault(DefaultValue defaultValue) {
    return new FieldSpec(name, required, list, scalarType, autoGenerated, defaultValue);
  }

  public FieldSpec withAutoGenerated(boolean autoGenerated) {
    return new FieldSpec(name, required, list, scalarType, autoGenerated, defaultValue);
  }

  public boolean hasDefault() { return defaultValue != null; }
}
