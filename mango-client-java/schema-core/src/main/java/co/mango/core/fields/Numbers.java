package co.mango.core.fields;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Exact ordering across the numeric representations found in loosely-typed data.
 * Booleans count as 1 and 0.
 */
final class Numbers {

  private Numbers() {
  }

  static Number asNumber(Object value) {
    if (value instanceof Boolean) return ((Boolean) value) ? 1 : 0;
    if (value instanceof Number) return (Number) value;
    throw new IllegalArgumentException("not a number: " + value);
  }

  static boolean isIntegral(Object value) {
    return value instanceof Byte || value instanceof Short || value instanceof Integer
        || value instanceof Long || value instanceof BigInteger
        || value instanceof AtomicInteger || value instanceof AtomicLong;
  }

  /** Integer types, {@code BigInteger} and {@code BigDecimal} hold only finite values. */
  static boolean isExact(Number n) {
    return isIntegral(n) || n instanceof BigDecimal;
  }

  static boolean isNaN(Number n) {
    return !isExact(n) && Double.isNaN(n.doubleValue());
  }

  /** {@code a < b}; false whenever either side is NaN. */
  static boolean lessThan(Number a, Number b) {
    if (isNaN(a) || isNaN(b)) return false;
    if (isInfinite(a) || isInfinite(b)) return a.doubleValue() < b.doubleValue();
    return toBigDecimal(a).compareTo(toBigDecimal(b)) < 0;
  }

  /** {@code a > b}; false whenever either side is NaN. */
  static boolean greaterThan(Number a, Number b) {
    return lessThan(b, a);
  }

  private static boolean isInfinite(Number n) {
    return !isExact(n) && Double.isInfinite(n.doubleValue());
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal) return (BigDecimal) n;
    if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
    if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
    if (n instanceof Double || n instanceof Float) return new BigDecimal(n.doubleValue());
    try {
      return new BigDecimal(n.toString());
    } catch (NumberFormatException e) {
      return new BigDecimal(n.doubleValue());
    }
  }
}
