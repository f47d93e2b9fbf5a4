package io.intellixity.coldef.spi.sql;

import io.intellixity.coldef.compile.ColumnDefinitionCompiler;
import io.intellixity.coldef.util.ColdefFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Dialect registry built via discovery (META-INF/coldef.factories).
 *
 * Ids match case-insensitively. When two registrations share an id the first discovered wins,
 * keeping resolution deterministic for a given classpath.
 */
public final class DiscoveredDialectRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredDialectRegistry.class);

  private final Map<String, SqlDialect> byId;

  public DiscoveredDialectRegistry() {
    this(ColdefFactoriesLoader.load(SqlDialect.class));
  }

  DiscoveredDialectRegistry(List<SqlDialect> dialects) {
    Map<String, SqlDialect> m = new LinkedHashMap<>();
    for (SqlDialect d : dialects) {
      if (d == null) continue;
      String id = normalize(d.id());
      if (id.isEmpty()) throw new IllegalArgumentException("Dialect has blank id: " + d.getClass().getName());
      SqlDialect prev = m.putIfAbsent(id, d);
      if (prev != null) {
        log.warn("coldef.dialect duplicate id={} kept={} ignored={}",
            id, prev.getClass().getName(), d.getClass().getName());
      }
    }
    this.byId = Collections.unmodifiableMap(m);
    log.debug("coldef.dialect discovered ids={}", byId.keySet());
  }

  public SqlDialect get(String dialectId) {
    SqlDialect d = byId.get(normalize(dialectId));
    if (d == null) throw new IllegalArgumentException("Unknown dialectId: " + dialectId + " (known=" + byId.keySet() + ")");
    return d;
  }

  public ColumnDefinitionCompiler compiler(String dialectId) {
    return new ColumnDefinitionCompiler(get(dialectId));
  }

  /** Known ids in discovery order. */
  public List<String> ids() {
    return List.copyOf(byId.keySet());
  }

  private static String normalize(String id) {
    return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
  }
}
