package io.intellixity.coldef.model;

/** Raised when a literal default cannot be rendered for the field's type. */
public final class InvalidDefaultValueException extends IllegalArgumentException {
  private final String field;

  public InvalidDefaultValueException(String field, String message) {
    super("Invalid default for field '" + field + "': " + message);
    this.field = field;
  }

  public InvalidDefaultValueException(String field, String message, Throwable cause) {
    super("Invalid default for field '" + field + "': " + message, cause);
    this.field = field;
  }

  public String field() { return field; }
}
