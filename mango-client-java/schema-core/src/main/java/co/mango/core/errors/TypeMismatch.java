package co.mango.core.errors;

public class TypeMismatch extends ValidationFailure {
  private final String expected;
  private final String actual;

  public TypeMismatch(String fieldName, String expected, String actual) {
    super(fieldName, "expecting " + expected + ", got " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  /** Description of the accepted type(s), e.g. {@code "String"} or {@code "Integer or Long"}. */
  public String expected() {
    return expected;
  }

  /** Simple name of the offending value's runtime type. */
  public String actual() {
    return actual;
  }
}
