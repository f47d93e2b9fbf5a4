package io.intellixity.coldef.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.coldef.json.TableSpecJsonDeserializer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** A table: ordered fields plus optional primary key (field names). */
@JsonDeserialize(using = TableSpecJsonDeserializer.class)
public record TableSpec(
    String table,
    List<FieldSpec> fields,
    List<String> primaryKey
) {
  public TableSpec {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table name is blank");
    fields = fields == null ? List.of() : List.copyOf(fields);
    primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);

    Set<String> names = new HashSet<>();
    for (FieldSpec f : fields) {
      if (!names.add(f.name())) throw new IllegalArgumentException("Duplicate field '" + f.name() + "' in table " + table);
    }
    for (String pk : primaryKey) {
      if (!names.contains(pk)) {
        throw new IllegalArgumentException("Primary key column '" + pk + "' is not a field of table " + table);
      }
    }
  }

  public FieldSpec field(String name) {
    for (FieldSpec f : fields) if (f.name().equals(name)) return f;
    return null;
  }
}
