package co.mango.core.fields;

import co.mango.core.errors.OutOfBounds;

/**
 * A number, integral or floating point, optionally constrained by inclusive
 * {@link Bounds}.
 *
 * <p>Booleans are accepted wherever a number is and compare as 1 and 0. This keeps
 * data that was produced by systems treating booleans as a numeric subtype valid.
 */
public class NumericField extends Field {
  private final Bounds bounds;

  public NumericField() {
    this(Bounds.UNBOUNDED, false);
  }

  public NumericField(boolean nullable) {
    this(Bounds.UNBOUNDED, nullable);
  }

  public NumericField(Bounds bounds) {
    this(bounds, false);
  }

  public NumericField(Bounds bounds, boolean nullable) {
    this(bounds, nullable, Number.class, Boolean.class);
  }

  protected NumericField(Bounds bounds, boolean nullable, Class<?>... expectedTypes) {
    super(nullable, expectedTypes);
    this.bounds = bounds == null ? Bounds.UNBOUNDED : bounds;
  }

  @Override
  public FieldType type() {
    return FieldType.NUMERIC;
  }

  public Bounds bounds() {
    return bounds;
  }

  @Override
  public void validate(Object value) {
    if (isPresentAndAccepted(value) && !bounds.contains(value)) {
      throw new OutOfBounds(name(), value, bounds);
    }
    super.validate(value);
  }
}
