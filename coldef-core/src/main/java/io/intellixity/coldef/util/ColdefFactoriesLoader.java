package io.intellixity.coldef.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for coldef.
 *
 * Looks up all {@code META-INF/coldef.factories} resources on the classpath. Each resource is a
 * Java Properties file keyed by SPI interface name:
 *
 * <pre>
 * io.intellixity.coldef.spi.sql.SqlDialect=com.acme.MyDialect,com.acme.OtherDialect
 * </pre>
 *
 * Values may be comma-separated. Whitespace is ignored.
 */
public final class ColdefFactoriesLoader {
  public static final String RESOURCE = "META-INF/coldef.factories";

  private ColdefFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = ColdefFactoriesLoader.class.getClassLoader();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new RuntimeException("Failed to enumerate " + RESOURCE, e);
    }

    // insertion order = classpath order, duplicates dropped
    Set<String> implNames = new LinkedHashSet<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      implNames.addAll(implementationsIn(url, spiType.getName()));
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static List<String> implementationsIn(URL url, String key) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load " + RESOURCE + " from " + url, e);
    }
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return List.of();
    List<String> names = new ArrayList<>();
    for (String part : v.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) names.add(name);
    }
    return names;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new RuntimeException("Class " + implName + " listed in " + RESOURCE + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
