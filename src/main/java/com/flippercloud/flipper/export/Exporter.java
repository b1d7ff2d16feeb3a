package com.flippercloud.flipper.export;

import com.flippercloud.flipper.subsystems.Adapter;

/**
 * Serializes the state of an adapter into one export format.
 */
public interface Exporter {
  /**
   * Takes a snapshot of every feature.
   *
   * @param adapter the adapter to read
   * @return the export
   */
  Export call(Adapter adapter);
}
