package com.flippercloud.flipper;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Open for a random percentage of checks. Two checks for the same actor may disagree.
 */
final class PercentageOfTimeGate extends Gate {
  PercentageOfTimeGate() {
    super(GateKind.PERCENTAGE_OF_TIME);
  }

  @Override
  public boolean isOpen(FeatureCheckContext context) {
    double percentage = context.getValues().getPercentageOfTime();
    return percentage > 0 && ThreadLocalRandom.current().nextDouble() < percentage / 100;
  }

  @Override
  public boolean isEnabled(GateValues values) {
    return values.getPercentageOfTime() > 0;
  }

  @Override
  public boolean protectsThing(Object thing) {
    return thing instanceof PercentageOfTimeType;
  }

  @Override
  public TypedValue wrap(Object thing) {
    return PercentageOfTimeType.wrap(thing);
  }
}
