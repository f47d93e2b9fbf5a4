package io.intellixity.coldef.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.coldef.model.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON deserializer for {@link TableSpec}.
 *
 * <pre>
 * { "table": "User", "primaryKey": ["id"],
 *   "fields": [ { "name": "id", "type": "Cuid", "required": true, "default": { "raw": "cuid()" } } ] }
 * </pre>
 */
public final class TableSpecJsonDeserializer extends JsonDeserializer<TableSpec> {
  @Override
  public TableSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseTable(root, codec);
  }

  static TableSpec parseTable(JsonNode root, ObjectCodec codec) throws IOException {
    if (!root.isObject()) throw new IllegalArgumentException("Table JSON must be an object");

    String table = textOrNull(root.get("table"));

    List<FieldSpec> fields = new ArrayList<>();
    JsonNode fs = root.get("fields");
    if (fs != null && !fs.isNull()) {
      if (!fs.isArray()) throw new IllegalArgumentException("'fields' must be an array in table " + table);
      for (JsonNode f : fs) fields.add(parseField(f, codec));
    }

    List<String> pk = new ArrayList<>();
    JsonNode pkNode = root.get("primaryKey");
    if (pkNode != null && pkNode.isArray()) {
      for (JsonNode x : pkNode) if (x.isTextual()) pk.add(x.asText());
    } else if (pkNode != null && pkNode.isTextual()) {
      pk.add(pkNode.asText());
    }

    return new TableSpec(table, fields, pk);
  }

  static FieldSpec parseField(JsonNode f, ObjectCodec codec) throws IOException {
    if (!f.isObject()) throw new IllegalArgumentException("Field JSON must be an object");
    String name = textOrNull(f.get("name"));
    String typeId = textOrNull(f.get("type"));
    ScalarType type = ScalarType.fromId(typeId);

    return new FieldSpec(
        name,
        boolOrFalse(f.get("required")),
        boolOrFalse(f.get("list")),
        type,
        boolOrFalse(f.get("autoGenerated")),
        parseDefault(f.get("default"), codec)
    );
  }

  private static DefaultValue parseDefault(JsonNode d, ObjectCodec codec) throws IOException {
    if (d == null || d.isMissingNode() || d.isNull()) return null;
    if (!d.isObject()) throw new IllegalArgumentException("'default' must be an object with 'raw' or 'value'");
    JsonNode raw = d.get("raw");
    if (raw != null && !raw.isNull()) {
      if (!raw.isTextual()) throw new IllegalArgumentException("'default.raw' must be a string");
      return DefaultValue.raw(raw.asText());
    }
    if (d.has("value")) {
      JsonNode v = d.get("value");
      if (v.isNull()) return DefaultValue.literal(null);
      // numberValue() keeps BigDecimal when the tree was read with USE_BIG_DECIMAL_FOR_FLOATS
      if (v.isNumber()) return DefaultValue.literal(v.numberValue());
      return DefaultValue.literal(codec.treeToValue(v, Object.class));
    }
    throw new IllegalArgumentException("'default' must contain 'raw' or 'value'");
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static boolean boolOrFalse(JsonNode n) {
    return n != null && n.asBoolean(false);
  }
}
