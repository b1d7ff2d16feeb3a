package com.flippercloud.flipper.export;

import com.flippercloud.flipper.subsystems.Adapter;

import java.util.Map;
import java.util.Objects;

/**
 * An immutable snapshot of the state of every feature, serialized in some format.
 * <p>
 * {@link #features()} parses the contents into the same record shape that {@link Adapter#getAll()}
 * returns, and {@link #adapter()} exposes them as a read-only adapter so that an export can be
 * imported like any other source.
 */
public abstract class Export {
  private final String contents;
  private final String format;
  private final int version;
  private volatile Adapter adapter;

  /**
   * Constructor for subclasses.
   *
   * @param contents the serialized snapshot
   * @param format the format name
   * @param version the format version
   */
  protected Export(String contents, String format, int version) {
    this.contents = contents;
    this.format = format;
    this.version = version;
  }

  public String getContents() {
    return contents;
  }

  public String getFormat() {
    return format;
  }

  public int getVersion() {
    return version;
  }

  /**
   * Parses the contents.
   *
   * @return records keyed by feature key
   * @throws ExportException if the contents are malformed
   */
  public abstract Map<String, Map<String, Object>> features();

  /**
   * Returns a read-only adapter over the parsed contents.
   *
   * @return the adapter
   * @throws ExportException if the contents are malformed
   */
  public Adapter adapter() {
    Adapter result = adapter;
    if (result == null) {
      result = new ExportAdapter(features());
      adapter = result;
    }
    return result;
  }

  @Override
  public boolean equals(Object other) {
    if (other == null || other.getClass() != getClass()) {
      return false;
    }
    Export o = (Export)other;
    return Objects.equals(contents, o.contents) && format.equals(o.format) && version == o.version;
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), contents, format, version);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(format=" + format + ", version=" + version + ")";
  }
}
