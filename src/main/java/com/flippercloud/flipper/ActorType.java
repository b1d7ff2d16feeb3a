package com.flippercloud.flipper;

/**
 * Wraps an {@link Actor} for the actor gate. The wrapped value is the actor's identifier.
 */
public final class ActorType implements TypedValue {
  private final Actor actor;

  private ActorType(Actor actor) {
    this.actor = actor;
  }

  /**
   * Wraps a candidate as an actor for enabling or disabling the actor gate.
   *
   * @param thing an {@link ActorType}, an {@link Actor}, or a non-empty identifier string
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate cannot be treated as an actor or has no
   *   usable identifier
   */
  public static ActorType wrap(Object thing) {
    ActorType actor = candidate(thing);
    if (!actor.hasValidId()) {
      throw new IllegalArgumentException("Actor must have a non-empty flipper id: " + thing);
    }
    return actor;
  }

  /**
   * Wraps a candidate that is being checked. Unlike {@link #wrap(Object)} this accepts an actor
   * without a usable identifier; the gates then treat it as no actor at all.
   */
  static ActorType candidate(Object thing) {
    if (thing instanceof ActorType) {
      return (ActorType)thing;
    }
    if (thing instanceof Actor) {
      return new ActorType((Actor)thing);
    }
    if (thing instanceof String && !((String)thing).isEmpty()) {
      return new ActorType(Actor.of((String)thing));
    }
    throw new IllegalArgumentException("Invalid actor type: " + thing);
  }

  /**
   * Returns the underlying actor object, which is what group callbacks receive.
   *
   * @return the actor
   */
  public Actor getActor() {
    return actor;
  }

  /**
   * Returns true if the actor carries a usable identifier.
   *
   * @return true if the identifier is a non-empty string
   */
  public boolean hasValidId() {
    String id = actor.getFlipperId();
    return id != null && !id.isEmpty();
  }

  @Override
  public GateKind getKind() {
    return GateKind.ACTOR;
  }

  @Override
  public String getValue() {
    return actor.getFlipperId();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ActorType && actor.equals(((ActorType)other).actor);
  }

  @Override
  public int hashCode() {
    return actor.hashCode();
  }

  @Override
  public String toString() {
    return "ActorType(" + getValue() + ")";
  }
}
