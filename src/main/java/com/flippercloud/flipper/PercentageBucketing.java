package com.flippercloud.flipper;

import org.apache.commons.codec.digest.PureJavaCrc32;

import java.nio.charset.StandardCharsets;

/**
 * Encapsulates the logic for deterministic percentage rollouts.
 * <p>
 * An actor's bucket is {@code crc32(prefix + id) mod 100000}; it is fixed for a given feature and
 * actor, so raising the percentage never removes an actor that was already included.
 */
public abstract class PercentageBucketing {
  private PercentageBucketing() {}

  /**
   * Percentages are honored to three decimal places.
   */
  public static final int SCALING_FACTOR = 1000;

  private static final long BUCKET_COUNT = 100L * SCALING_FACTOR;

  /**
   * Computes the unsigned CRC32 checksum of a string's UTF-8 bytes.
   *
   * @param input the string to hash
   * @return the checksum, between 0 and 2^32 - 1
   */
  public static long crc32(String input) {
    byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
    PureJavaCrc32 crc = new PureJavaCrc32();
    crc.update(bytes, 0, bytes.length);
    return crc.getValue();
  }

  /**
   * Returns the bucket, between 0 and 99999, that an identifier falls into.
   *
   * @param prefix the feature name
   * @param id the actor identifier
   * @return the bucket
   */
  public static long bucketFor(String prefix, String id) {
    return crc32(prefix + id) % BUCKET_COUNT;
  }

  /**
   * Decides whether an identifier falls inside a percentage rollout.
   *
   * @param prefix the feature name
   * @param id the actor identifier
   * @param percentage the rollout percentage, between 0 and 100
   * @return true if the identifier's bucket is below the scaled percentage
   */
  public static boolean isIncluded(String prefix, String id, double percentage) {
    return bucketFor(prefix, id) < percentage * SCALING_FACTOR;
  }
}
