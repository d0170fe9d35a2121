package co.mango.core.fields;

import co.mango.core.model.Model;
import co.mango.core.model.ModelSchema;

import java.util.Objects;

/**
 * An instance of a specific model, or of a model derived from it.
 *
 * <p>Once the value is known to be such an instance, the instance's own
 * {@link Model#validate()} runs and any failure propagates unchanged, still naming the
 * nested field that was violated.
 */
public class ModelField extends Field {
  private final ModelSchema model;

  public ModelField(ModelSchema model) {
    this(model, false);
  }

  public ModelField(ModelSchema model, boolean nullable) {
    super(nullable, Model.class);
    this.model = Objects.requireNonNull(model, "model");
  }

  @Override
  public FieldType type() {
    return FieldType.MODEL;
  }

  public ModelSchema model() {
    return model;
  }

  @Override
  protected boolean accepts(Object value) {
    return value instanceof Model && ((Model) value).schema().isSubtypeOf(model);
  }

  @Override
  protected String describeExpected() {
    return model.name();
  }

  @Override
  protected String describeActual(Object value) {
    return value instanceof Model ? ((Model) value).schema().name() : super.describeActual(value);
  }

  @Override
  public void validate(Object value) {
    super.validate(value);
    if (value != null) {
      ((Model) value).validate();
    }
  }
}
