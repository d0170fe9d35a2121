package co.mango.core.model;

import co.mango.core.errors.UnexpectedKeyword;
import co.mango.core.fields.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The resolved, immutable description of one model: its name, its parents, its field
 * table and its class attributes.
 *
 * <p>A schema is declared once through {@link #builder(String)}:
 *
 * <pre>{@code
 * ModelSchema person = ModelSchema.builder("Person")
 *     .field("name", new StringField())
 *     .field("age", new IntegralField(Bounds.atLeast(0)))
 *     .field("siblings", new ListField(new StringField()))
 *     .build();
 * }</pre>
 *
 * <p>Fields are inherited from the parents given to {@link Builder#extend}. When two
 * parents declare the same name, the parent listed first wins; a field declared on the
 * model itself always wins over anything inherited. Class attributes (any declaration
 * that is not a {@link Field}, such as {@link #ALLOW_UNKNOWN_DATA}) are resolved with the
 * same precedence but never enter the field table.
 *
 * <p>The field table is never modified after {@link Builder#build()}, so a schema may be
 * shared freely between threads.
 */
public final class ModelSchema {

  /**
   * Class attribute holding the default for the {@code allowUnknownData} argument of
   * {@link Model#validate(Boolean)}. Treated as {@code true} when absent.
   */
  public static final String ALLOW_UNKNOWN_DATA = "allowUnknownData";

  private final String name;
  private final List<ModelSchema> parents;
  private final Map<String, Field> fields;
  private final Map<String, Object> attributes;

  private ModelSchema(String name, List<ModelSchema> parents, Map<String, Field> fields, Map<String, Object> attributes) {
    this.name = name;
    this.parents = List.copyOf(parents);
    this.fields = Collections.unmodifiableMap(fields);
    this.attributes = Collections.unmodifiableMap(attributes);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public List<ModelSchema> parents() {
    return parents;
  }

  /** The resolved field table, in resolution order. */
  public Map<String, Field> fields() {
    return fields;
  }

  public Optional<Field> field(String fieldName) {
    return Optional.ofNullable(fields.get(fieldName));
  }

  public boolean hasField(String fieldName) {
    return fields.containsKey(fieldName);
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  public Optional<Object> attribute(String attributeName) {
    return Optional.ofNullable(attributes.get(attributeName));
  }

  /** The class-level unknown-data policy, {@code true} unless declared otherwise. */
  public boolean allowUnknownData() {
    Object v = attributes.get(ALLOW_UNKNOWN_DATA);
    return v == null || (Boolean) v;
  }

  boolean resolveAllowUnknownData(Boolean override) {
    return override != null ? override : allowUnknownData();
  }

  /** True if this schema is {@code other} or inherits from it, directly or not. */
  public boolean isSubtypeOf(ModelSchema other) {
    if (this == other) return true;
    for (ModelSchema p : parents) {
      if (p.isSubtypeOf(other)) return true;
    }
    return false;
  }

  public Model construct() {
    return construct(Map.of());
  }

  /**
   * Create an instance from keyword values. Every declared field not given is set to
   * {@code null}. No validation is performed.
   *
   * @throws UnexpectedKeyword for the first keyword that is not a declared field
   */
  public Model construct(Map<String, ?> keywords) {
    for (String k : keywords.keySet()) {
      if (!fields.containsKey(k)) throw new UnexpectedKeyword(name, k);
    }
    Model model = new Model(this);
    model.assign(keywords);
    return model;
  }

  /**
   * Create an instance holding every entry of {@code mapping}, including names the schema
   * does not declare. Declared fields missing from the mapping are set to {@code null}.
   * No validation is performed, so malformed data is captured and can be reported by a
   * later {@link Model#validate()}.
   */
  public Model fromMapping(Map<String, ?> mapping) {
    return fromMapping(mapping, Boolean.TRUE);
  }

  /**
   * Like {@link #fromMapping(Map)}, but with an explicit unknown-data policy for the
   * import. {@code null} falls back to the {@link #ALLOW_UNKNOWN_DATA} class attribute.
   *
   * @throws co.mango.core.errors.UnknownAttribute if the resolved policy forbids unknown
   *     data and the mapping holds an undeclared name
   */
  public Model fromMapping(Map<String, ?> mapping, Boolean allowUnknownData) {
    Model model = new Model(this);
    model.assign(mapping, allowUnknownData);
    return model;
  }

  @Override
  public String toString() {
    return "ModelSchema(" + name + ", fields=" + fields.keySet() + ")";
  }

  public static final class Builder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelSchema.class);

    private final String name;
    private final List<ModelSchema> parents = new ArrayList<>();
    private final Map<String, Field> ownFields = new LinkedHashMap<>();
    private final Map<String, Object> ownAttributes = new LinkedHashMap<>();

    private Builder(String name) {
      if (name == null || name.isEmpty()) throw new IllegalArgumentException("model name required");
      this.name = name;
    }

    /** Add parents, in declaration order. Parents listed earlier take precedence. */
    public Builder extend(ModelSchema... parents) {
      return extend(List.of(parents));
    }

    public Builder extend(Collection<ModelSchema> parents) {
      for (ModelSchema p : parents) {
        Objects.requireNonNull(p, "parent");
        if (this.parents.contains(p)) throw new IllegalArgumentException(name + ": duplicate parent " + p.name());
        this.parents.add(p);
      }
      return this;
    }

    public Builder field(String fieldName, Field field) {
      return declare(fieldName, Objects.requireNonNull(field, "field"));
    }

    /**
     * Declare a class attribute. A {@link Field} value is declared as a field instead,
     * the same as {@link #field(String, Field)}.
     */
    public Builder attribute(String attributeName, Object value) {
      return declare(attributeName, value);
    }

    public Builder allowUnknownData(boolean allow) {
      return attribute(ALLOW_UNKNOWN_DATA, allow);
    }

    private Builder declare(String declName, Object value) {
      if (declName == null || declName.isEmpty()) throw new IllegalArgumentException(name + ": declaration name required");
      if (ownFields.containsKey(declName) || ownAttributes.containsKey(declName)) {
        throw new IllegalArgumentException(name + ": duplicate declaration " + declName);
      }
      if (value instanceof Field) {
        ownFields.put(declName, (Field) value);
      } else {
        if (ALLOW_UNKNOWN_DATA.equals(declName) && !(value instanceof Boolean)) {
          throw new IllegalArgumentException(name + "." + declName + ": must be a boolean");
        }
        ownAttributes.put(declName, value);
      }
      return this;
    }

    /**
     * Resolve the field table and class attributes.
     *
     * <p>Inherited entries are taken from the first parent that declares them, then own
     * declarations replace any inherited entry of the same name. Fields and attributes are
     * resolved separately, so an own field may share its name with an inherited attribute
     * and the reverse. Own fields are bound to their names; inherited fields were bound
     * when their parent was built.
     *
     * @throws IllegalStateException if an own field is already bound under another name
     */
    public ModelSchema build() {
      Map<String, Field> fields = new LinkedHashMap<>();
      Map<String, Object> attributes = new LinkedHashMap<>();
      for (ModelSchema p : parents) {
        p.fields().forEach(fields::putIfAbsent);
        p.attributes().forEach(attributes::putIfAbsent);
      }
      fields.putAll(ownFields);
      attributes.putAll(ownAttributes);

      ownFields.forEach((n, f) -> f.bind(n));

      LOGGER.debug("Resolved model {} with parents {}: fields {}, attributes {}",
          name, parents.stream().map(ModelSchema::name).toList(), fields.keySet(), attributes.keySet());
      return new ModelSchema(name, parents, fields, attributes);
    }
  }
}
