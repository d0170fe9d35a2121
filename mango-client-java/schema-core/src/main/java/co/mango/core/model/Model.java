package co.mango.core.model;

import co.mango.core.errors.UnknownAttribute;
import co.mango.core.errors.ValidationFailure;
import co.mango.core.fields.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An instance of a {@link ModelSchema}: an ordered map from attribute name to value.
 *
 * <p>Every declared field is present from construction on, holding {@code null} until set.
 * Names the schema does not declare may also be held; they are reported by
 * {@link #validate(Boolean)} only when unknown data is disallowed. Values are not
 * checked when stored, so an instance may hold invalid data until it is validated.
 *
 * <p>Instances are not thread-safe.
 */
public final class Model {
  private static final Logger LOGGER = LoggerFactory.getLogger(Model.class);

  private final ModelSchema schema;
  private final Map<String, Object> values = new LinkedHashMap<>();

  Model(ModelSchema schema) {
    this.schema = schema;
    for (String n : schema.fields().keySet()) {
      values.put(n, null);
    }
  }

  public ModelSchema schema() {
    return schema;
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  /**
   * @throws IllegalArgumentException if this instance holds no attribute {@code name}
   */
  public Object get(String name) {
    if (!values.containsKey(name)) {
      throw new IllegalArgumentException(schema.name() + " has no attribute '" + name + "'");
    }
    return values.get(name);
  }

  /** Set any attribute, declared or not. */
  public Model set(String name, Object value) {
    values.put(Objects.requireNonNull(name, "name"), value);
    return this;
  }

  public void assign(Map<String, ?> mapping) {
    assign(mapping, null);
  }

  /**
   * Copy every entry of {@code mapping} onto this instance.
   *
   * @param allowUnknownData whether undeclared names may be assigned; {@code null} uses the
   *     schema's {@link ModelSchema#ALLOW_UNKNOWN_DATA} attribute
   * @throws UnknownAttribute for the first undeclared name when unknown data is not
   *     allowed, in which case nothing is assigned
   */
  public void assign(Map<String, ?> mapping, Boolean allowUnknownData) {
    if (!schema.resolveAllowUnknownData(allowUnknownData)) {
      for (String k : mapping.keySet()) {
        if (!schema.hasField(k)) throw new UnknownAttribute(k);
      }
    }
    mapping.forEach(this::set);
  }

  /** A snapshot of every attribute held, declared and unknown. */
  public Map<String, Object> toDict() {
    return new LinkedHashMap<>(values);
  }

  public Set<String> unknownAttributes() {
    return values.keySet().stream()
        .filter(n -> !schema.hasField(n))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  public void validate() {
    validate(null);
  }

  /**
   * Validate every declared field against the value held for it, in field table order.
   * Stops at the first failure.
   *
   * @param allowUnknownData whether undeclared attributes are tolerated; {@code null} uses
   *     the schema's {@link ModelSchema#ALLOW_UNKNOWN_DATA} attribute
   * @throws UnknownAttribute if unknown data is disallowed and an undeclared attribute is held
   * @throws ValidationFailure for the first field whose rule is violated
   */
  public void validate(Boolean allowUnknownData) {
    boolean allowUnknown = schema.resolveAllowUnknownData(allowUnknownData);
    LOGGER.trace("Validating {} (allowUnknownData={})", schema.name(), allowUnknown);
    if (!allowUnknown) {
      for (String n : values.keySet()) {
        if (!schema.hasField(n)) throw new UnknownAttribute(n);
      }
    }
    for (Map.Entry<String, Field> e : schema.fields().entrySet()) {
      e.getValue().validate(values.get(e.getKey()));
    }
  }

  @Override
  public String toString() {
    return schema.name() + "(" + schema.fields().keySet().stream()
        .map(n -> n + " = " + render(values.get(n)))
        .collect(Collectors.joining(", ")) + ")";
  }

  private static String render(Object v) {
    return v instanceof CharSequence ? "'" + v + "'" : String.valueOf(v);
  }
}
