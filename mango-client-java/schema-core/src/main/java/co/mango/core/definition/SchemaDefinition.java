package co.mango.core.definition;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A model declared as a JSON document instead of builder calls.
 *
 * <pre>
 * {
 *   "name": "Employee",
 *   "extends": ["Person"],
 *   "allowUnknownData": false,
 *   "fields": [
 *     { "name": "salary", "type": "numeric", "bounds": { "lower": 0 } },
 *     { "name": "reports", "type": "list", "of": { "type": "model", "model": "Person" } }
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaDefinition {
  public String name;
  /** Parent model names, highest precedence first. */
  @JsonProperty("extends")
  @JsonAlias("parents")
  public List<String> parents;
  public Boolean allowUnknownData;
  /** Class attributes other than allowUnknownData; values are kept as parsed. */
  public Map<String, Object> attributes;
  public List<FieldDefinition> fields;

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FieldDefinition {
    /** Ignored for element, key and value definitions. */
    public String name;
    /** A {@link co.mango.core.fields.FieldType} keyword, e.g. {@code "integral"}. */
    public String type;
    public boolean nullable;
    /** Only for numeric and integral fields. */
    public BoundsDefinition bounds;
    /** Element field, only for list fields. */
    public FieldDefinition of;
    /** Key field, only for dict fields. */
    public FieldDefinition ofKey;
    /** Value field, only for dict fields. */
    public FieldDefinition ofValue;
    /** Name of a previously defined model, only for model fields. */
    public String model;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class BoundsDefinition {
    public Number lower;
    public Number upper;
  }
}
