package com.flippercloud.flipper;

/**
 * Wraps a group name for the group gate, optionally carrying the membership callback that was
 * registered for it.
 */
public final class GroupType implements TypedValue {
  private final String name;
  private final GroupCallback callback;

  /**
   * Creates a group.
   *
   * @param name the group name
   * @param callback the membership test; null if the group is only being referred to by name
   */
  public GroupType(String name, GroupCallback callback) {
    this.name = name;
    this.callback = callback;
  }

  /**
   * Wraps a candidate as a group.
   *
   * @param thing a {@link GroupType} or a group name
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate is neither
   */
  public static GroupType wrap(Object thing) {
    if (thing instanceof GroupType) {
      return (GroupType)thing;
    }
    if (thing instanceof String) {
      return new GroupType((String)thing, null);
    }
    throw new IllegalArgumentException("Invalid group type: " + thing);
  }

  /**
   * Evaluates the membership callback for an actor.
   *
   * @param actorType the wrapped actor
   * @return false if there is no callback, otherwise the callback's verdict
   */
  public boolean isMatch(ActorType actorType) {
    if (callback == null) {
      return false;
    }
    return callback.isMember(actorType.getActor());
  }

  @Override
  public GateKind getKind() {
    return GateKind.GROUP;
  }

  @Override
  public String getValue() {
    return name;
  }

  // Groups are identified by name; the callback does not take part in equality.
  @Override
  public boolean equals(Object other) {
    return other instanceof GroupType && name.equals(((GroupType)other).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "GroupType(" + name + ")";
  }
}
