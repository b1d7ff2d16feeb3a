package com.flippercloud.flipper;

/**
 * Open for a stable percentage of actors. See {@link PercentageBucketing}.
 */
final class PercentageOfActorsGate extends Gate {
  PercentageOfActorsGate() {
    super(GateKind.PERCENTAGE_OF_ACTORS);
  }

  @Override
  public boolean isOpen(FeatureCheckContext context) {
    ActorType actor = context.getActor();
    if (actor == null) {
      return false;
    }
    double percentage = context.getValues().getPercentageOfActors();
    return PercentageBucketing.isIncluded(context.getFeatureName(), actor.getValue(), percentage);
  }

  @Override
  public boolean isEnabled(GateValues values) {
    return values.getPercentageOfActors() > 0;
  }

  @Override
  public boolean protectsThing(Object thing) {
    return thing instanceof PercentageOfActorsType;
  }

  @Override
  public TypedValue wrap(Object thing) {
    return PercentageOfActorsType.wrap(thing);
  }
}
