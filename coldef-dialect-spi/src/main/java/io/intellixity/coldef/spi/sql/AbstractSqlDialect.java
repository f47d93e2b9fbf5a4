package io.intellixity.coldef.spi.sql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.coldef.model.DefaultValue;
import io.intellixity.coldef.model.FieldSpec;
import io.intellixity.coldef.model.InvalidDefaultValueException;
import io.intellixity.coldef.model.ScalarType;
import io.intellixity.coldef.model.UnsupportedScalarTypeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generic SQL dialect base.
 *
 * Provides type resolution order (list first, then scalar) and escaped literal rendering for
 * {@link DefaultValue.Literal}. DB-specific dialects supply the type table and override hooks for
 * quoting and boolean literals.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final ObjectMapper JSON = new ObjectMapper();

  /** Millisecond precision, matching the 3 fractional digits of the timestamp columns. */
  protected static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.ROOT);

  private static final Pattern ENUM_LABEL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Serialized-text type used for every list field. */
  protected abstract String listSqlType();

  /** Type for a non-list field; null means the dialect cannot store the type. */
  protected abstract String scalarSqlType(ScalarType type);

  @Override
  public final String sqlType(boolean list, ScalarType type) {
    if (type == null) throw new IllegalArgumentException("scalarType is required");
    String t = list ? listSqlType() : scalarSqlType(type);
    if (t == null || t.isBlank()) throw new UnsupportedScalarTypeException(type.id(), id());
    return t;
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) throw new IllegalArgumentException("identifier is null");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public boolean supportsCreateIfNotExists() { return true; }

  @Override
  public boolean supportsAddColumnIfNotExists() { return false; }

  @Override
  public final String renderDefault(FieldSpec field, DefaultValue value) {
    if (field == null) throw new IllegalArgumentException("field is required");
    if (value == null) throw new IllegalArgumentException("default value is required for field: " + field.name());
    if (value instanceof DefaultValue.Raw r) return r.sql();
    if (value instanceof DefaultValue.Literal l) {
      String rendered = renderLiteral(field, l.value());
      return l.value() == null ? rendered : literalDefault(field, rendered);
    }
    throw new IllegalArgumentException("Unknown DefaultValue: " + value);
  }

  protected String renderLiteral(FieldSpec field, Object v) {
    if (v == null) return "NULL";
    if (field.list()) return quoteString(listJson(field, v));
    return switch (field.scalarType()) {
      case STRING, CUID -> quoteString(textValue(field, v));
      case ENUM -> quoteString(enumLabel(field, v));
      case BOOLEAN -> booleanLiteral(booleanValue(field, v));
      case INT -> Integer.toString(intValue(field, v));
      case FLOAT -> decimalValue(field, v).toPlainString();
      case JSON -> quoteString(jsonText(field, v));
      case DATE_TIME -> timestampLiteral(timestampValue(field, v));
      case UUID -> quoteString(uuidValue(field, v).toString());
    };
  }

  // ---- dialect hooks ----

  /** Single-quoted string literal with embedded quotes doubled. */
  protected String quoteString(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  protected String booleanLiteral(boolean b) {
    return b ? "true" : "false";
  }

  /**
   * Final form of a non-null literal inside {@code DEFAULT}. Dialects that only accept expression
   * defaults on some column types wrap the literal here.
   */
  protected String literalDefault(FieldSpec field, String literal) {
    return literal;
  }

  /** Timestamp literal for a UTC wall-clock value. */
  protected String timestampLiteral(LocalDateTime utc) {
    return quoteString(TIMESTAMP_FORMAT.format(utc));
  }

  // ---- value coercion ----

  private static String textValue(FieldSpec f, Object v) {
    if (v instanceof CharSequence || v instanceof Number || v instanceof Boolean || v instanceof Character) {
      return String.valueOf(v);
    }
    if (v instanceof Enum<?> e) return e.name();
    throw new InvalidDefaultValueException(f.name(), "expected a text value for " + f.scalarType().id() +
        " but got " + v.getClass().getName());
  }

  private static String enumLabel(FieldSpec f, Object v) {
    String label = (v instanceof Enum<?> e) ? e.name() : textValue(f, v);
    if (!ENUM_LABEL.matcher(label).matches()) {
      throw new InvalidDefaultValueException(f.name(), "not a valid enum label: " + label);
    }
    return label;
  }

  private static boolean booleanValue(FieldSpec f, Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof CharSequence cs) {
      String s = cs.toString().trim();
      if (s.equalsIgnoreCase("true")) return true;
      if (s.equalsIgnoreCase("false")) return false;
    }
    if (v instanceof Integer i && (i == 0 || i == 1)) return i == 1;
    throw new InvalidDefaultValueException(f.name(), "not a boolean: " + v);
  }

  private static int intValue(FieldSpec f, Object v) {
    if (v instanceof Integer i) return i;
    if (v instanceof Short s) return s;
    if (v instanceof Byte b) return b;
    try {
      BigDecimal d = (v instanceof CharSequence cs) ? new BigDecimal(cs.toString().trim()) : toDecimal(v);
      if (d == null) throw new InvalidDefaultValueException(f.name(), "not an integer: " + v);
      return d.intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new InvalidDefaultValueException(f.name(), "not a 32-bit integer: " + v, e);
    }
  }

  private static BigDecimal decimalValue(FieldSpec f, Object v) {
    try {
      BigDecimal d = (v instanceof CharSequence cs) ? new BigDecimal(cs.toString().trim()) : toDecimal(v);
      if (d == null) throw new InvalidDefaultValueException(f.name(), "not a number: " + v);
      return d;
    } catch (NumberFormatException e) {
      throw new InvalidDefaultValueException(f.name(), "not a decimal number: " + v, e);
    }
  }

  private static BigDecimal toDecimal(Object v) {
    if (v instanceof BigDecimal d) return d;
    if (v instanceof BigInteger bi) return new BigDecimal(bi);
    if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
      return BigDecimal.valueOf(((Number) v).longValue());
    }
    // Double.toString keeps the shortest repr; NaN/Infinity fail in the constructor
    if (v instanceof Number n) return new BigDecimal(n.toString());
    return null;
  }

  private static String jsonText(FieldSpec f, Object v) {
    try {
      if (v instanceof CharSequence cs) {
        JsonNode parsed = JSON.readTree(cs.toString());
        return JSON.writeValueAsString(parsed);
      }
      return JSON.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new InvalidDefaultValueException(f.name(), "not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static String listJson(FieldSpec f, Object v) {
    try {
      if (v instanceof CharSequence cs) {
        JsonNode parsed = JSON.readTree(cs.toString());
        if (!parsed.isArray()) throw new InvalidDefaultValueException(f.name(), "list default must be a JSON array");
        return JSON.writeValueAsString(parsed);
      }
      if (v instanceof Collection<?> || v.getClass().isArray()) return JSON.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new InvalidDefaultValueException(f.name(), "not valid JSON: " + e.getOriginalMessage(), e);
    }
    throw new InvalidDefaultValueException(f.name(), "list default must be a collection or array, got " +
        v.getClass().getName());
  }

  private static LocalDateTime timestampValue(FieldSpec f, Object v) {
    if (v instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    if (v instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof ZonedDateTime zdt) return LocalDateTime.ofInstant(zdt.toInstant(), ZoneOffset.UTC);
    if (v instanceof LocalDateTime ldt) return ldt;
    if (v instanceof LocalDate ld) return ld.atStartOfDay();
    if (v instanceof java.sql.Date sd) return sd.toLocalDate().atStartOfDay();
    if (v instanceof java.sql.Time) {
      throw new InvalidDefaultValueException(f.name(), "java.sql.Time has no date part");
    }
    if (v instanceof Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
    if (v instanceof CharSequence cs) return parseTimestamp(f, cs.toString().trim());
    throw new InvalidDefaultValueException(f.name(), "not a timestamp: " + v.getClass().getName());
  }

  private static LocalDateTime parseTimestamp(FieldSpec f, String s) {
    try {
      if (s.indexOf('T') < 0 && s.indexOf(' ') < 0) return LocalDate.parse(s).atStartOfDay();
      TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(
          s.replace(' ', 'T'), OffsetDateTime::from, LocalDateTime::from);
      if (t instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      return (LocalDateTime) t;
    } catch (DateTimeParseException e) {
      throw new InvalidDefaultValueException(f.name(), "not an ISO-8601 timestamp: " + s, e);
    }
  }

  private static java.util.UUID uuidValue(FieldSpec f, Object v) {
    if (v instanceof java.util.UUID u) return u;
    if (v instanceof CharSequence cs) {
      try {
        return java.util.UUID.fromString(cs.toString().trim());
      } catch (IllegalArgumentException e) {
        throw new InvalidDefaultValueException(f.name(), "not a UUID: " + cs, e);
      }
    }
    throw new InvalidDefaultValueException(f.name(), "not a UUID: " + v.getClass().getName());
  }
}
