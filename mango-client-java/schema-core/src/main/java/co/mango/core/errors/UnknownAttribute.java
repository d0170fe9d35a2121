package co.mango.core.errors;

/**
 * A model instance carries an attribute that its schema does not declare while the
 * unknown-data policy forbids it.
 */
public class UnknownAttribute extends ValidationFailure {

  public UnknownAttribute(String attributeName) {
    super(attributeName, "unknown attribute");
  }
}
