package co.mango.core.fields;

/**
 * An inclusive {@code (lower, upper)} range for numeric fields. Either side may be
 * {@code null}, meaning that side is unbounded.
 */
public record Bounds(Number lower, Number upper) {

  public static final Bounds UNBOUNDED = new Bounds(null, null);

  public Bounds {
    if ((lower != null && Numbers.isNaN(lower)) || (upper != null && Numbers.isNaN(upper))) {
      throw new IllegalArgumentException("bounds cannot be NaN");
    }
    if (lower != null && upper != null && Numbers.greaterThan(lower, upper)) {
      throw new IllegalArgumentException("lower bound " + lower + " is greater than upper bound " + upper);
    }
  }

  public static Bounds of(Number lower, Number upper) {
    return new Bounds(lower, upper);
  }

  public static Bounds atLeast(Number lower) {
    return new Bounds(lower, null);
  }

  public static Bounds atMost(Number upper) {
    return new Bounds(null, upper);
  }

  public boolean isUnbounded() {
    return lower == null && upper == null;
  }

  /**
   * Whether a numeric (or boolean) value lies within these bounds.
   *
   * @throws IllegalArgumentException if {@code value} is neither a number nor a boolean
   */
  public boolean contains(Object value) {
    Number n = Numbers.asNumber(value);
    if (lower != null && Numbers.lessThan(n, lower)) return false;
    return upper == null || !Numbers.greaterThan(n, upper);
  }

  @Override
  public String toString() {
    return "(" + lower + ", " + upper + ")";
  }
}
