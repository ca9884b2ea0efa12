package io.intellixity.relata.persistence.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * Discovers plug-ins listed in {@code META-INF/relata.factories}.
 *
 * <p>Each resource is a properties file keyed by the SPI interface name; the value is a comma separated
 * list of implementation classes with public no-arg constructors:</p>
 * <pre>
 * io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect=io.intellixity.relata.persistence.jdbc.mssql.MssqlDialect
 * </pre>
 */
public final class RelataFactoriesLoader {
  public static final String RESOURCE = "META-INF/relata.factories";

  private RelataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader classLoader) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader cl = classLoader != null ? classLoader : RelataFactoriesLoader.class.getClassLoader();
    List<T> out = new ArrayList<>();
    for (String impl : implementationNames(spiType.getName(), cl)) {
      out.add(instantiate(impl, spiType, cl));
    }
    return List.copyOf(out);
  }

  /** Implementation class names for {@code key}, in classpath order, first occurrence kept. */
  static Set<String> implementationNames(String key, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String value = read(url).getProperty(key);
      if (value == null) continue;
      Arrays.stream(value.split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .forEach(names::add);
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new UncheckedIOException("cannot list " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties props = new Properties();
    try (InputStream in = url.openStream()) {
      props.load(in);
      return props;
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + url, e);
    }
  }

  private static <T> T instantiate(String impl, Class<T> spiType, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(impl, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(RESOURCE + " names missing class " + impl, e);
    }
    if (!spiType.isAssignableFrom(type)) {
      throw new IllegalArgumentException(impl + " is not a " + spiType.getSimpleName());
    }
    try {
      return spiType.cast(type.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("cannot instantiate " + impl, e);
    }
  }
}
