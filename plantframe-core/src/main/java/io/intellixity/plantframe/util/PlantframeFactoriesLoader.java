package io.intellixity.plantframe.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Discovers engine providers, toolkit contributors and method contributors listed in
 * {@code META-INF/plantframe.factories}.\n
 *
 * Every class-path copy of the resource is read as a Properties file keyed by SPI interface name:\n
 *
 * <pre>\n
 * io.intellixity.plantframe.exec.BackendEngineProvider=io.intellixity.plantframe.engine.local.LocalEngineProvider\n
 * io.intellixity.plantframe.toolkit.ToolkitContributor=com.acme.MyToolkits\n
 * </pre>\n
 *
 * Values are comma-separated class names. A name listed more than once, in one file or across jars, is
 * instantiated once, at its first position.\n
 */
public final class PlantframeFactoriesLoader {
  public static final String RESOURCE = "META-INF/plantframe.factories";

  private PlantframeFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = cl == null ? PlantframeFactoriesLoader.class.getClassLoader() : cl;
    List<T> out = new ArrayList<>();
    for (String implName : implementationNames(spiType, loader)) {
      out.add(newInstance(implName, spiType, loader));
    }
    return out;
  }

  /** Class names listed for {@code spiType}, in class-path order, without repeats. */
  public static Set<String> implementationNames(Class<?> spiType, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String listed = read(url).getProperty(spiType.getName());
      if (listed == null) continue;
      for (String part : listed.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(spiType.getSimpleName() + " " + implName + " is listed but not on the classpath", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException(implName + " is listed as " + spiType.getName() + " but does not implement it");
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + spiType.getSimpleName() + " " + implName, e);
    }
  }
}
