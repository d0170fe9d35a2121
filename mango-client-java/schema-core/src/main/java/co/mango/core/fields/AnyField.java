package co.mango.core.fields;

/** A field with no type constraint; only nullability is checked. */
public class AnyField extends Field {

  public AnyField() {
    this(false);
  }

  public AnyField(boolean nullable) {
    super(nullable);
  }

  @Override
  public FieldType type() {
    return FieldType.ANY;
  }
}
