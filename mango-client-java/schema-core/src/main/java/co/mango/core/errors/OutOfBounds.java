package co.mango.core.errors;

import co.mango.core.fields.Bounds;

/** A numeric value fell outside its field's inclusive bounds. */
public class OutOfBounds extends ValidationFailure {
  private final Object value;
  private final Bounds bounds;

  public OutOfBounds(String fieldName, Object value, Bounds bounds) {
    super(fieldName, value + " is outside of " + bounds);
    this.value = value;
    this.bounds = bounds;
  }

  public Object value() {
    return value;
  }

  public Bounds bounds() {
    return bounds;
  }
}
