package co.mango.core.fields;

/** A string field. Any {@link CharSequence} is accepted. */
public class StringField extends Field {

  public StringField() {
    this(false);
  }

  public StringField(boolean nullable) {
    super(nullable, CharSequence.class);
  }

  @Override
  public FieldType type() {
    return FieldType.STRING;
  }
}
