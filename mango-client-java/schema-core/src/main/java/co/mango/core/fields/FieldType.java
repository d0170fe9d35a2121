package co.mango.core.fields;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of field kinds, each with the keyword used to declare it in a schema
 * definition document.
 *
 * <pre>
 *   string    → {@link StringField}
 *   numeric   → {@link NumericField}   (alias: number)
 *   integral  → {@link IntegralField}  (aliases: int, integer)
 *   list      → {@link ListField}
 *   dict      → {@link DictField}      (alias: map)
 *   model     → {@link ModelField}
 *   any       → {@link AnyField}
 * </pre>
 *
 * <p>Keywords are case-sensitive and lower case.
 */
public enum FieldType {
  STRING("string"),
  NUMERIC("numeric"),
  INTEGRAL("integral"),
  LIST("list"),
  DICT("dict"),
  MODEL("model"),
  ANY("any");

  private static final Map<String, FieldType> ALIASES = Map.of(
      "number", NUMERIC,
      "int", INTEGRAL,
      "integer", INTEGRAL,
      "map", DICT
  );

  private final String keyword;

  FieldType(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  /** True for the kinds whose fields carry {@link Bounds}. */
  public boolean isNumeric() {
    return this == NUMERIC || this == INTEGRAL;
  }

  /**
   * Look up a kind by keyword or alias.
   *
   * @param s the keyword from a schema definition
   * @return the kind, or empty if {@code s} is not a supported keyword
   */
  public static Optional<FieldType> fromKeyword(String s) {
    if (s == null || s.isEmpty()) return Optional.empty();
    for (FieldType t : values()) {
      if (t.keyword.equals(s)) return Optional.of(t);
    }
    return Optional.ofNullable(ALIASES.get(s));
  }

  public static boolean isValid(String s) {
    return fromKeyword(s).isPresent();
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
