package io.intellixity.coldef.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.coldef.model.TableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Reads table specs from JSON documents holding either one table object or an array of them. */
public final class TableSpecs {
  private static final Logger log = LoggerFactory.getLogger(TableSpecs.class);
  // Float defaults map to Decimal(65,30); doubles would drop digits
  private static final ObjectMapper JSON = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private TableSpecs() {}

  public static List<TableSpec> readAll(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      List<TableSpec> out = readAll(in);
      log.debug("coldef.json file={} tables={}", file, out.size());
      return out;
    }
  }

  public static List<TableSpec> readAll(InputStream in) throws IOException {
    return readAll(JSON.readTree(in));
  }

  public static List<TableSpec> readAll(String json) throws IOException {
    return readAll(JSON.readTree(json));
  }

  private static List<TableSpec> readAll(JsonNode root) throws IOException {
    if (root == null || root.isNull() || root.isMissingNode()) return List.of();
    List<TableSpec> out = new ArrayList<>();
    if (root.isArray()) {
      for (JsonNode t : root) out.add(TableSpecJsonDeserializer.parseTable(t, JSON));
    } else {
      out.add(TableSpecJsonDeserializer.parseTable(root, JSON));
    }
    return out;
  }
}
