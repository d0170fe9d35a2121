package co.mango.core;

import co.mango.core.definition.SchemaDefinition;
import co.mango.core.fields.StringField;
import co.mango.core.model.ModelSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class SchemaDefinitionValidatorTest {

  private SchemaRegistry registry;
  private SchemaDefinition d;

  @BeforeEach
  void setUp() {
    registry = new SchemaRegistry();
    registry.register(ModelSchema.builder("Person").field("name", new StringField()).build());

    d = new SchemaDefinition();
    d.name = "Team";
    d.fields = new ArrayList<>();
    d.fields.add(field("title", "string"));
  }

  private static SchemaDefinition.FieldDefinition field(String name, String type) {
    SchemaDefinition.FieldDefinition f = new SchemaDefinition.FieldDefinition();
    f.name = name;
    f.type = type;
    return f;
  }

  private static SchemaDefinition.BoundsDefinition bounds(Number lower, Number upper) {
    SchemaDefinition.BoundsDefinition b = new SchemaDefinition.BoundsDefinition();
    b.lower = lower;
    b.upper = upper;
    return b;
  }

  @Test
  void validatesHappyPath() {
    assertThatCode(() -> SchemaDefinitionValidator.validate(d, registry)).doesNotThrowAnyException();
  }

  @Test
  void acceptsEmptyModel() {
    d.fields = null;

    assertThatCode(() -> SchemaDefinitionValidator.validate(d, registry)).doesNotThrowAnyException();
  }

  @Test
  void rejectsMissingName() {
    d.name = null;

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("name required");
  }

  @Test
  void rejectsUnknownParent() {
    d.parents = List.of("Person", "Robot");

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team: unknown parent Robot");
  }

  @Test
  void rejectsDuplicateParent() {
    d.parents = List.of("Person", "Person");

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("duplicate parent Person");
  }

  @Test
  void rejectsMissingFieldName() {
    d.fields.add(field(null, "string"));

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team: field.name required");
  }

  @Test
  void rejectsDuplicateField() {
    d.fields.add(field("title", "integral"));

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team: duplicate field title");
  }

  @Test
  void rejectsMissingType() {
    d.fields.add(field("size", null));

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team.size: type required");
  }

  @Test
  void rejectsUnsupportedType() {
    d.fields.add(field("size", "float"));

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team.size: unsupported type float");
  }

  @Test
  void rejectsBoundsOnNonNumericField() {
    SchemaDefinition.FieldDefinition f = field("size", "string");
    f.bounds = bounds(0, 1);
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("bounds are only supported on numeric fields");
  }

  @Test
  void rejectsInvertedBounds() {
    SchemaDefinition.FieldDefinition f = field("size", "integral");
    f.bounds = bounds(10, 1);
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("lower bound is greater than upper bound");
  }

  @Test
  void acceptsHalfOpenBounds() {
    SchemaDefinition.FieldDefinition f = field("size", "numeric");
    f.bounds = bounds(null, 1.5);
    d.fields.add(f);

    assertThatCode(() -> SchemaDefinitionValidator.validate(d, registry)).doesNotThrowAnyException();
  }

  @Test
  void rejectsElementFieldOnNonList() {
    SchemaDefinition.FieldDefinition f = field("tags", "dict");
    f.of = field(null, "string");
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("of is only supported on list fields");
  }

  @Test
  void rejectsKeyFieldOnNonDict() {
    SchemaDefinition.FieldDefinition f = field("tags", "list");
    f.ofKey = field(null, "string");
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ofKey and ofValue are only supported on dict fields");
  }

  @Test
  void rejectsInvalidNestedField() {
    SchemaDefinition.FieldDefinition f = field("tags", "list");
    f.of = field(null, "tuple");
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team.tags[]: unsupported type tuple");
  }

  @Test
  void rejectsModelFieldWithoutModel() {
    d.fields.add(field("lead", "model"));

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team.lead: model required");
  }

  @Test
  void rejectsUnknownModel() {
    SchemaDefinition.FieldDefinition f = field("lead", "model");
    f.model = "Robot";
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team.lead: unknown model Robot");
  }

  @Test
  void rejectsModelReferenceOnOtherTypes() {
    SchemaDefinition.FieldDefinition f = field("lead", "string");
    f.model = "Person";
    d.fields.add(f);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("model is only supported on model fields");
  }

  @Test
  void rejectsFieldAlsoDeclaredAsAttribute() {
    d.attributes = Map.of("title", "x");

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Team.title: declared both as a field and an attribute");
  }

  @Test
  void rejectsUnknownDataPolicyAsAttribute() {
    d.attributes = Map.of(ModelSchema.ALLOW_UNKNOWN_DATA, false);

    assertThatThrownBy(() -> SchemaDefinitionValidator.validate(d, registry))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("at the top level");
  }
}
