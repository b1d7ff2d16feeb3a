package com.flippercloud.flipper;

/**
 * Open when the candidate is an actor whose id has been enabled individually.
 */
final class ActorGate extends Gate {
  ActorGate() {
    super(GateKind.ACTOR);
  }

  @Override
  public boolean isOpen(FeatureCheckContext context) {
    ActorType actor = context.getActor();
    return actor != null && context.getValues().getActors().contains(actor.getValue());
  }

  @Override
  public boolean isEnabled(GateValues values) {
    return !values.getActors().isEmpty();
  }

  @Override
  public boolean protectsThing(Object thing) {
    return thing instanceof ActorType || thing instanceof Actor;
  }

  @Override
  public TypedValue wrap(Object thing) {
    return ActorType.wrap(thing);
  }
}
