package com.flippercloud.flipper;

/**
 * Open for everyone when the boolean value is set; the candidate is ignored.
 */
final class BooleanGate extends Gate {
  BooleanGate() {
    super(GateKind.BOOLEAN);
  }

  @Override
  public boolean isOpen(FeatureCheckContext context) {
    return context.getValues().getBoolean();
  }

  @Override
  public boolean isEnabled(GateValues values) {
    return values.getBoolean();
  }

  @Override
  public boolean protectsThing(Object thing) {
    return thing instanceof BooleanType || thing instanceof Boolean;
  }

  @Override
  public TypedValue wrap(Object thing) {
    return BooleanType.wrap(thing);
  }
}
