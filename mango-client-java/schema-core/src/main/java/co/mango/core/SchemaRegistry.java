package co.mango.core;

import co.mango.core.definition.SchemaDefinition;
import co.mango.core.fields.AnyField;
import co.mango.core.fields.Bounds;
import co.mango.core.fields.DictField;
import co.mango.core.fields.Field;
import co.mango.core.fields.FieldType;
import co.mango.core.fields.IntegralField;
import co.mango.core.fields.ListField;
import co.mango.core.fields.ModelField;
import co.mango.core.fields.NumericField;
import co.mango.core.fields.StringField;
import co.mango.core.model.ModelSchema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named model schemas, in the order they were registered. Definitions may refer to a
 * model (as a parent or through a model field) only once it has been registered.
 */
public class SchemaRegistry {
  private final Map<String, ModelSchema> schemas = new LinkedHashMap<>();

  public ModelSchema register(ModelSchema schema) {
    if (schemas.putIfAbsent(schema.name(), schema) != null) {
      throw new IllegalArgumentException("duplicate model " + schema.name());
    }
    return schema;
  }

  public boolean contains(String name) {
    return schemas.containsKey(name);
  }

  public Optional<ModelSchema> get(String name) {
    return Optional.ofNullable(schemas.get(name));
  }

  public Collection<ModelSchema> schemas() {
    return Collections.unmodifiableCollection(schemas.values());
  }

  /**
   * Validate a definition, build its schema and register it.
   *
   * @throws IllegalArgumentException if the definition is invalid or its name is taken
   */
  public ModelSchema define(SchemaDefinition d) {
    SchemaDefinitionValidator.validate(d, this);
    if (contains(d.name)) throw new IllegalArgumentException("duplicate model " + d.name);

    ModelSchema.Builder builder = ModelSchema.builder(d.name);
    for (String p : d.parents == null ? List.<String>of() : d.parents) {
      builder.extend(schemas.get(p));
    }
    if (d.allowUnknownData != null) builder.allowUnknownData(d.allowUnknownData);
    if (d.attributes != null) d.attributes.forEach(builder::attribute);
    if (d.fields != null) {
      for (SchemaDefinition.FieldDefinition f : d.fields) {
        builder.field(f.name, toField(f));
      }
    }
    return register(builder.build());
  }

  private Field toField(SchemaDefinition.FieldDefinition f) {
    FieldType type = FieldType.fromKeyword(f.type).orElseThrow();
    Bounds bounds = f.bounds == null ? Bounds.UNBOUNDED : Bounds.of(f.bounds.lower, f.bounds.upper);
    return switch (type) {
      case STRING -> new StringField(f.nullable);
      case NUMERIC -> new NumericField(bounds, f.nullable);
      case INTEGRAL -> new IntegralField(bounds, f.nullable);
      case LIST -> new ListField(f.of == null ? null : toField(f.of), f.nullable);
      case DICT -> new DictField(
          f.ofKey == null ? null : toField(f.ofKey),
          f.ofValue == null ? null : toField(f.ofValue),
          f.nullable);
      case MODEL -> new ModelField(schemas.get(f.model), f.nullable);
      case ANY -> new AnyField(f.nullable);
    };
  }
}
