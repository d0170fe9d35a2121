package co.mango.core.errors;

/**
 * Occurs when a value held for a particular field does not satisfy that field's rule.
 *
 * <p>For example, if the integer 13 is held for a {@code StringField}, validating the
 * owning model fails with a {@link TypeMismatch}. Every failure carries the name of the
 * innermost field whose rule was violated, which may be nested inside lists, dicts or
 * other models.
 */
public class ValidationFailure extends RuntimeException {
  private final String fieldName;

  public ValidationFailure(String fieldName, String message) {
    super(fieldName + ": " + message);
    this.fieldName = fieldName;
  }

  public String fieldName() {
    return fieldName;
  }
}
