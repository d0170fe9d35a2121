package co.mango.core;

import co.mango.core.definition.SchemaDefinition;
import co.mango.core.model.ModelSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads schema definition documents: either a single definition object or an array of
 * them, defined in document order.
 */
public final class SchemaLoader {
  private static final ObjectMapper JSON = JsonMapper.builder()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaLoader.class);

  private SchemaLoader() {
  }

  public static List<ModelSchema> load(Path path, SchemaRegistry registry) throws IOException {
    return parse(Files.readString(path), registry);
  }

  public static List<ModelSchema> parse(String json, SchemaRegistry registry) throws IOException {
    JsonNode root = JSON.readTree(json);
    if (root == null || !(root.isArray() || root.isObject())) {
      throw new IllegalArgumentException("expected a schema definition object or array");
    }
    List<SchemaDefinition> definitions = new ArrayList<>();
    if (root.isArray()) {
      for (JsonNode node : root) definitions.add(JSON.treeToValue(node, SchemaDefinition.class));
    } else {
      definitions.add(JSON.treeToValue(root, SchemaDefinition.class));
    }

    List<ModelSchema> result = new ArrayList<>();
    for (SchemaDefinition d : definitions) {
      result.add(registry.define(d));
    }
    LOGGER.debug("Defined {} model(s): {}", result.size(), result.stream().map(ModelSchema::name).toList());
    return result;
  }
}
