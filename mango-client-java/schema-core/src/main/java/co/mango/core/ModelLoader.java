package co.mango.core;

import co.mango.core.model.Model;
import co.mango.core.model.ModelSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves model instances across JSON. Parsing yields plain maps, lists, strings, numbers
 * and booleans which are imported with {@link ModelSchema#fromMapping(Map)}; writing
 * serializes {@link Model#toDict()}, rendering nested models as objects.
 */
public final class ModelLoader {
  // Integers stay Integer/Long/BigInteger and decimals stay Double; objects keep key order.
  private static final ObjectMapper JSON = JsonMapper.builder()
      .disable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
      .disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();
  private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<>() {};

  private ModelLoader() {
  }

  /** Read an instance without validating it. */
  public static Model read(Path path, ModelSchema schema) throws IOException {
    return read(Files.readString(path), schema);
  }

  public static Model read(String json, ModelSchema schema) throws IOException {
    JsonNode root = JSON.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(schema.name() + ": expected a JSON object");
    }
    Map<String, Object> mapping = JSON.convertValue(root, MAPPING);
    return schema.fromMapping(mapping);
  }

  /**
   * Read an instance and validate it with the schema's default unknown-data policy.
   *
   * @throws co.mango.core.errors.ValidationFailure if the data does not match the schema
   */
  public static Model load(Path path, ModelSchema schema) throws IOException {
    Model model = read(path, schema);
    model.validate();
    return model;
  }

  public static String write(Model model) throws JsonProcessingException {
    return JSON.writeValueAsString(toPlainData(model));
  }

  static Object toPlainData(Object value) {
    if (value instanceof Model) {
      return toPlainData(((Model) value).toDict());
    }
    if (value instanceof Map) {
      Map<Object, Object> out = new LinkedHashMap<>();
      ((Map<?, ?>) value).forEach((k, v) -> out.put(k, toPlainData(v)));
      return out;
    }
    if (value instanceof List) {
      List<Object> out = new ArrayList<>();
      for (Object v : (List<?>) value) out.add(toPlainData(v));
      return out;
    }
    return value;
  }
}
