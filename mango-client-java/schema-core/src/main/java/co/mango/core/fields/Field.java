package co.mango.core.fields;

import co.mango.core.errors.NullNotAllowed;
import co.mango.core.errors.TypeMismatch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A validation rule for one named slot of a model.
 *
 * <p>The base rule is shared by every kind: {@code null} is accepted only when the field
 * is nullable, and any other value must be an instance of one of the expected types (an
 * empty list of expected types means unconstrained). Subclasses run their own checks on
 * present, correctly-typed values and then delegate to {@link #validate(Object)} here as
 * their final check.
 *
 * <p>A field is immutable once constructed, except for its name, which the schema
 * engine binds once when the field is placed in a model's field table. A bound instance
 * may be shared between models inheriting it, and between threads.
 */
public abstract class Field {

  /** Name reported by a field that has not been bound into a schema. */
  public static final String UNBOUND = "<unbound>";

  private final boolean nullable;
  private final List<Class<?>> expectedTypes;
  private String name = UNBOUND;

  protected Field(boolean nullable, Class<?>... expectedTypes) {
    this.nullable = nullable;
    this.expectedTypes = List.of(expectedTypes);
  }

  public abstract FieldType type();

  public String name() {
    return name;
  }

  public boolean isNullable() {
    return nullable;
  }

  public List<Class<?>> expectedTypes() {
    return expectedTypes;
  }

  /**
   * Bind this field to its key in a model's field table so failures can name it.
   * Container fields also bind their child fields. A field keeps one name for life:
   * binding it again under the same name is a no-op, so one instance cannot be declared
   * under two names or reused as another container's child.
   *
   * @throws IllegalStateException if the field is already bound under a different name
   */
  public void bind(String name) {
    if (!UNBOUND.equals(this.name) && !this.name.equals(name)) {
      throw new IllegalStateException("field already bound as '" + this.name + "', cannot rebind as '" + name + "'");
    }
    this.name = name;
  }

  /**
   * Validate a single value against this field.
   *
   * @throws NullNotAllowed if {@code value} is null and the field is not nullable
   * @throws TypeMismatch if {@code value} is not one of the expected types
   */
  public void validate(Object value) {
    if (value == null) {
      if (!nullable) throw new NullNotAllowed(name);
      return;
    }
    if (!accepts(value)) {
      throw new TypeMismatch(name, describeExpected(), describeActual(value));
    }
  }

  /** Whether the runtime shape of a non-null value matches this field. */
  protected boolean accepts(Object value) {
    if (expectedTypes.isEmpty()) return true;
    for (Class<?> t : expectedTypes) {
      if (t.isInstance(value)) return true;
    }
    return false;
  }

  protected String describeExpected() {
    return expectedTypes.stream().map(Class::getSimpleName).collect(Collectors.joining(" or "));
  }

  protected String describeActual(Object value) {
    return value.getClass().getSimpleName();
  }

  /** True when variant-specific checks apply: the value is present and of the right shape. */
  protected final boolean isPresentAndAccepted(Object value) {
    return value != null && accepts(value);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + (nullable ? ", nullable" : "") + ")";
  }
}
