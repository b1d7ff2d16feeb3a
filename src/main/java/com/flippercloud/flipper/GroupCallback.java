package com.flippercloud.flipper;

/**
 * Decides whether an actor belongs to a registered group.
 *
 * @see Dsl#register(String, GroupCallback)
 */
@FunctionalInterface
public interface GroupCallback {
  /**
   * Tests group membership.
   *
   * @param actor the actor being checked; never null
   * @return true if the actor is a member
   */
  boolean isMember(Actor actor);
}
