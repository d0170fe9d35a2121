package co.mango.core.errors;

/**
 * Construction received a keyword that the model's schema does not declare. Unlike
 * {@link UnknownAttribute} this is never subject to the unknown-data policy.
 */
public class UnexpectedKeyword extends ValidationFailure {
  private final String modelName;

  public UnexpectedKeyword(String modelName, String keyword) {
    super(keyword, "'" + keyword + "' is an invalid keyword argument for " + modelName);
    this.modelName = modelName;
  }

  public String modelName() {
    return modelName;
  }
}
