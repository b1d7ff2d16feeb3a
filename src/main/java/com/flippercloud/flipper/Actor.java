package com.flippercloud.flipper;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;

import java.util.Map;
import java.util.Objects;

/**
 * Anything that can be individually enabled for a feature: a user, an organization, a device.
 * <p>
 * The identifier must be stable and unique across all actors of all types; a common convention is
 * {@code "User;42"}. Properties are only consulted by the expression gate.
 */
public interface Actor {
  /**
   * Returns the actor's unique identifier.
   *
   * @return the identifier; an actor with a null or empty identifier is treated as no actor at all
   */
  String getFlipperId();

  /**
   * Returns the properties that expressions may refer to via {@code Property}.
   *
   * @return a map of property names to values; never null
   */
  default Map<String, LDValue> getFlipperProperties() {
    return ImmutableMap.of();
  }

  /**
   * Creates a basic actor with no properties.
   *
   * @param flipperId the identifier
   * @return an actor
   */
  public static Actor of(String flipperId) {
    return new BasicActor(flipperId, ImmutableMap.of());
  }

  /**
   * Creates a basic actor with properties for expression evaluation.
   *
   * @param flipperId the identifier
   * @param properties the actor's properties
   * @return an actor
   */
  public static Actor of(String flipperId, Map<String, LDValue> properties) {
    return new BasicActor(flipperId, properties == null ? ImmutableMap.of() : ImmutableMap.copyOf(properties));
  }

  /**
   * Immutable implementation returned by the {@code of} factories.
   */
  static final class BasicActor implements Actor {
    private final String flipperId;
    private final Map<String, LDValue> properties;

    BasicActor(String flipperId, Map<String, LDValue> properties) {
      this.flipperId = flipperId;
      this.properties = properties;
    }

    @Override
    public String getFlipperId() {
      return flipperId;
    }

    @Override
    public Map<String, LDValue> getFlipperProperties() {
      return properties;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof BasicActor) {
        BasicActor o = (BasicActor)other;
        return Objects.equals(flipperId, o.flipperId) && properties.equals(o.properties);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(flipperId, properties);
    }

    @Override
    public String toString() {
      return "Actor(" + flipperId + ")";
    }
  }
}
