package com.flippercloud.flipper;

/**
 * Open when the candidate actor belongs to any enabled group. Group names without a registered
 * callback never match.
 */
final class GroupGate extends Gate {
  private final GroupRegistry groups;

  GroupGate(GroupRegistry groups) {
    super(GateKind.GROUP);
    this.groups = groups;
  }

  @Override
  public boolean isOpen(FeatureCheckContext context) {
    ActorType actor = context.getActor();
    if (actor == null) {
      return false;
    }
    for (String name: context.getValues().getGroups()) {
      GroupType group = groups.get(name);
      if (group != null && group.isMatch(actor)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isEnabled(GateValues values) {
    return !values.getGroups().isEmpty();
  }

  // A bare string is a group name; actor ids are always passed as Actor or ActorType.
  @Override
  public boolean protectsThing(Object thing) {
    return thing instanceof GroupType || thing instanceof String;
  }

  @Override
  public TypedValue wrap(Object thing) {
    if (thing instanceof String) {
      GroupType registered = groups.get((String)thing);
      if (registered != null) {
        return registered;
      }
    }
    return GroupType.wrap(thing);
  }
}
