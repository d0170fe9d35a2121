package co.mango.core.fields;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A whole number. Floating point and decimal values are rejected even when they are
 * numerically integral, so {@code 3.0} fails while {@code 3} passes. Booleans are
 * accepted, as for {@link NumericField}.
 */
public class IntegralField extends NumericField {

  public IntegralField() {
    this(Bounds.UNBOUNDED, false);
  }

  public IntegralField(boolean nullable) {
    this(Bounds.UNBOUNDED, nullable);
  }

  public IntegralField(Bounds bounds) {
    this(bounds, false);
  }

  public IntegralField(Bounds bounds, boolean nullable) {
    super(bounds, nullable,
        Integer.class, Long.class, Short.class, Byte.class, BigInteger.class,
        AtomicInteger.class, AtomicLong.class, Boolean.class);
  }

  @Override
  public FieldType type() {
    return FieldType.INTEGRAL;
  }
}
