package co.mango.core.errors;

/** A non-nullable field held {@code null}. */
public class NullNotAllowed extends ValidationFailure {

  public NullNotAllowed(String fieldName) {
    super(fieldName, "value cannot be null");
  }
}
