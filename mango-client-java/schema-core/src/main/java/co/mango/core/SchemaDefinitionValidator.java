package co.mango.core;

import co.mango.core.definition.SchemaDefinition;
import co.mango.core.fields.FieldType;
import co.mango.core.model.ModelSchema;

import java.util.HashSet;
import java.util.Set;

public final class SchemaDefinitionValidator {

  private SchemaDefinitionValidator() {
  }

  /**
   * Check a definition against itself and against the schemas already in {@code registry}.
   *
   * @throws IllegalArgumentException describing the first problem found
   */
  public static void validate(SchemaDefinition d, SchemaRegistry registry) {
    if (isBlank(d.name)) fail("name required");

    if (d.parents != null) {
      Set<String> parentNames = new HashSet<>();
      for (String p : d.parents) {
        if (isBlank(p)) fail(d.name + ": parent name required");
        if (!parentNames.add(p)) fail(d.name + ": duplicate parent " + p);
        if (!registry.contains(p)) fail(d.name + ": unknown parent " + p);
      }
    }

    if (d.attributes != null && d.attributes.containsKey(ModelSchema.ALLOW_UNKNOWN_DATA)) {
      fail(d.name + ": declare " + ModelSchema.ALLOW_UNKNOWN_DATA + " at the top level, not as an attribute");
    }

    Set<String> fieldNames = new HashSet<>();
    if (d.fields != null) {
      for (SchemaDefinition.FieldDefinition f : d.fields) {
        if (f == null || isBlank(f.name)) fail(d.name + ": field.name required");
        if (!fieldNames.add(f.name)) fail(d.name + ": duplicate field " + f.name);
        if (d.attributes != null && d.attributes.containsKey(f.name)) {
          fail(d.name + "." + f.name + ": declared both as a field and an attribute");
        }
        validateField(d.name + "." + f.name, f, registry);
      }
    }
  }

  private static void validateField(String path, SchemaDefinition.FieldDefinition f, SchemaRegistry registry) {
    if (isBlank(f.type)) fail(path + ": type required");
    FieldType type = FieldType.fromKeyword(f.type)
        .orElseThrow(() -> new IllegalArgumentException(path + ": unsupported type " + f.type));

    if (f.bounds != null) {
      if (!type.isNumeric()) fail(path + ": bounds are only supported on numeric fields");
      if (f.bounds.lower != null && f.bounds.upper != null
          && Double.compare(f.bounds.lower.doubleValue(), f.bounds.upper.doubleValue()) > 0) {
        fail(path + ": lower bound is greater than upper bound");
      }
    }
    if (f.of != null && type != FieldType.LIST) fail(path + ": of is only supported on list fields");
    if ((f.ofKey != null || f.ofValue != null) && type != FieldType.DICT) {
      fail(path + ": ofKey and ofValue are only supported on dict fields");
    }
    if (type == FieldType.MODEL) {
      if (isBlank(f.model)) fail(path + ": model required");
      if (!registry.contains(f.model)) fail(path + ": unknown model " + f.model);
    } else if (f.model != null) {
      fail(path + ": model is only supported on model fields");
    }

    if (f.of != null) validateField(path + "[]", f.of, registry);
    if (f.ofKey != null) validateField(path + "{key}", f.ofKey, registry);
    if (f.ofValue != null) validateField(path + "{value}", f.ofValue, registry);
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new IllegalArgumentException(msg); }
}
