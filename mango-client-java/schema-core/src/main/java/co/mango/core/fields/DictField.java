package co.mango.core.fields;

import java.util.Map;
import java.util.Optional;

/**
 * A key to value mapping.
 *
 * <p>{@code ofKey} is the field every key must satisfy and {@code ofValue} the field
 * every value must satisfy. Keys are checked first, then values, each in the map's
 * iteration order; the first failure aborts validation. The child fields are bound as
 * {@code name{key}} and {@code name{value}}.
 */
public class DictField extends Field {
  private final Field ofKey;
  private final Field ofValue;

  public DictField() {
    this(null, null, false);
  }

  public DictField(boolean nullable) {
    this(null, null, nullable);
  }

  public DictField(Field ofKey, Field ofValue) {
    this(ofKey, ofValue, false);
  }

  public DictField(Field ofKey, Field ofValue, boolean nullable) {
    super(nullable, Map.class);
    this.ofKey = ofKey;
    this.ofValue = ofValue;
  }

  @Override
  public FieldType type() {
    return FieldType.DICT;
  }

  public Optional<Field> ofKey() {
    return Optional.ofNullable(ofKey);
  }

  public Optional<Field> ofValue() {
    return Optional.ofNullable(ofValue);
  }

  @Override
  public void bind(String name) {
    super.bind(name);
    if (ofKey != null) ofKey.bind(name + "{key}");
    if (ofValue != null) ofValue.bind(name + "{value}");
  }

  @Override
  public void validate(Object value) {
    if (isPresentAndAccepted(value)) {
      Map<?, ?> map = (Map<?, ?>) value;
      if (ofKey != null) {
        for (Object k : map.keySet()) ofKey.validate(k);
      }
      if (ofValue != null) {
        for (Object v : map.values()) ofValue.validate(v);
      }
    }
    super.validate(value);
  }
}
