package com.flippercloud.flipper.export;

import com.google.common.collect.ImmutableMap;

import java.util.function.Supplier;

/**
 * Looks up the {@link Exporter} for a format and version.
 */
public abstract class Exporters {
  private Exporters() {}

  private static final ImmutableMap<String, ImmutableMap<Integer, Supplier<Exporter>>> EXPORTERS =
      ImmutableMap.of(
          JsonExport.FORMAT, ImmutableMap.<Integer, Supplier<Exporter>>of(JsonV1Exporter.VERSION, JsonV1Exporter::new)
          );

  /**
   * Returns an exporter.
   *
   * @param format the format, e.g. {@code "json"}
   * @param version the format version
   * @return the exporter
   * @throws IllegalArgumentException if the format or version is not supported
   */
  public static Exporter build(String format, int version) {
    ImmutableMap<Integer, Supplier<Exporter>> versions = EXPORTERS.get(format);
    if (versions == null) {
      throw new IllegalArgumentException("Unsupported export format: " + format);
    }
    Supplier<Exporter> factory = versions.get(version);
    if (factory == null) {
      throw new IllegalArgumentException("Unsupported " + format + " export version: " + version);
    }
    return factory.get();
  }
}
