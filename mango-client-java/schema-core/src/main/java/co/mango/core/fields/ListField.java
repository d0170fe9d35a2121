package co.mango.core.fields;

import java.util.List;
import java.util.Optional;

/**
 * An ordered sequence.
 *
 * <p>When {@code of} is given, every element must satisfy it; the first failing element
 * aborts validation. The element field is bound as {@code name[]}.
 */
public class ListField extends Field {
  private final Field of;

  public ListField() {
    this(null, false);
  }

  public ListField(boolean nullable) {
    this(null, nullable);
  }

  public ListField(Field of) {
    this(of, false);
  }

  public ListField(Field of, boolean nullable) {
    super(nullable, List.class);
    this.of = of;
  }

  @Override
  public FieldType type() {
    return FieldType.LIST;
  }

  public Optional<Field> of() {
    return Optional.ofNullable(of);
  }

  @Override
  public void bind(String name) {
    super.bind(name);
    if (of != null) of.bind(name + "[]");
  }

  @Override
  public void validate(Object value) {
    if (of != null && isPresentAndAccepted(value)) {
      for (Object element : (List<?>) value) {
        of.validate(element);
      }
    }
    super.validate(value);
  }
}
