package io.github.wphillipmoore.xg.api.admin.schema;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalog of entity schemas, keyed by entity type tag.
 *
 * <p>The catalog is declarative data loaded from JSON (via Gson). The built-in catalog lives in the
 * classpath resource {@code entity-schemas.json} next to this class. Its structure is:
 *
 * <pre>{@code
 * {
 *   "entities": {
 *     "IPHostGroup": {
 *       "deleteKey": "Name",
 *       "fields": [
 *         {"kind": "scalar", "tag": "Name", "key": "name"},
 *         {"kind": "scalar", "tag": "IPFamily", "key": "ipFamily", "default": "IPv4"},
 *         {"kind": "repeatedList", "tag": "HostList", "itemTag": "Host", "key": "hosts"}
 *       ]
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Scalars accept {@code default}, {@code constant} and {@code required} (default {@code true}).
 * Groups carry nested {@code fields}; conditional groups carry {@code mode} ({@code value} or
 * {@code presence}), {@code discriminators} and {@code branches}. Field and branch order in the
 * JSON is the wire order.
 */
public final class EntitySchemaCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(EntitySchemaCatalog.class);

  private static final String RESOURCE_NAME = "entity-schemas.json";
  private static final Set<String> VALID_TOP_LEVEL_KEYS = Set.of("entities");
  private static final Gson GSON = new Gson();
  private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  private final Map<String, EntitySchema> schemas;

  private EntitySchemaCatalog(Map<String, EntitySchema> schemas) {
    this.schemas = Collections.unmodifiableMap(schemas);
  }

  /**
   * Loads the built-in catalog from the classpath resource.
   *
   * @return the built-in catalog
   * @throws IllegalStateException if the resource cannot be found or read
   */
  public static EntitySchemaCatalog loadDefault() {
    return loadFromResource(RESOURCE_NAME);
  }

  /**
   * Loads a catalog from a named classpath resource relative to this class.
   *
   * @param resourceName the resource file name
   * @return the catalog loaded from the resource
   * @throws IllegalStateException if the resource cannot be found or read
   */
  static EntitySchemaCatalog loadFromResource(String resourceName) {
    InputStream stream = EntitySchemaCatalog.class.getResourceAsStream(resourceName);
    if (stream == null) {
      throw new IllegalStateException("Entity schema resource not found: " + resourceName);
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      Map<String, Object> parsed = GSON.fromJson(reader, MAP_TYPE);
      if (parsed == null) {
        throw new IllegalStateException("Entity schema resource is empty: " + resourceName);
      }
      return fromParsed(parsed);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read entity schema resource: " + resourceName, e);
    }
  }

  /**
   * Parses a catalog from a JSON string.
   *
   * @param json the JSON text, must not be null or empty
   * @return the parsed catalog
   * @throws NullPointerException if json is null
   * @throws IllegalArgumentException if json is empty, not valid JSON, or describes an invalid
   *     schema
   */
  public static EntitySchemaCatalog fromJson(String json) {
    Objects.requireNonNull(json, "json");
    if (json.isEmpty()) {
      throw new IllegalArgumentException("json must not be empty");
    }
    Map<String, Object> parsed;
    try {
      parsed = GSON.fromJson(json, MAP_TYPE);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid entity schema JSON", e);
    }
    if (parsed == null) {
      throw new IllegalArgumentException("json must not be empty");
    }
    return fromParsed(parsed);
  }

  /**
   * Creates a catalog from schemas built in code.
   *
   * @param schemas the schemas to include
   * @return a catalog keyed by each schema's entity type
   * @throws IllegalArgumentException if two schemas share an entity type
   */
  public static EntitySchemaCatalog of(List<EntitySchema> schemas) {
    Map<String, EntitySchema> byType = new LinkedHashMap<>();
    for (EntitySchema schema : Objects.requireNonNull(schemas, "schemas")) {
      if (byType.put(schema.entityType(), schema) != null) {
        throw new IllegalArgumentException("Duplicate entity type: " + schema.entityType());
      }
    }
    return new EntitySchemaCatalog(byType);
  }

  /**
   * Returns the schema for an entity type.
   *
   * @param entityType the entity type tag (e.g. "IPHost")
   * @return the schema, never null
   * @throws IllegalArgumentException if the catalog has no schema for the type
   */
  public EntitySchema get(String entityType) {
    EntitySchema schema = find(entityType);
    if (schema == null) {
      throw new IllegalArgumentException("Unknown entity type: " + entityType);
    }
    return schema;
  }

  /**
   * Returns the schema for an entity type, or {@code null} if the catalog has none.
   *
   * @param entityType the entity type tag
   * @return the schema, or {@code null}
   */
  public @Nullable EntitySchema find(String entityType) {
    return schemas.get(Objects.requireNonNull(entityType, "entityType"));
  }

  /** Returns the entity types in catalog order. The returned set is unmodifiable. */
  public Set<String> entityTypes() {
    return schemas.keySet();
  }

  private static EntitySchemaCatalog fromParsed(Map<String, Object> parsed) {
    for (String key : parsed.keySet()) {
      if (!VALID_TOP_LEVEL_KEYS.contains(key)) {
        throw new IllegalArgumentException("Invalid top-level key in entity catalog: " + key);
      }
    }
    Map<String, Object> entities = requireMap(parsed.get("entities"), "entities");
    Map<String, EntitySchema> schemas = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : entities.entrySet()) {
      String entityType = entry.getKey();
      Map<String, Object> entity = requireMap(entry.getValue(), entityType);
      String deleteKey = requireString(entity, "deleteKey", entityType);
      List<FieldSpec> fields = parseFields(entity.get("fields"), entityType);
      schemas.put(entityType, new EntitySchema(entityType, deleteKey, fields));
    }
    LOGGER.debug("Loaded {} entity schemas", schemas.size());
    return new EntitySchemaCatalog(schemas);
  }

  private static List<FieldSpec> parseFields(@Nullable Object value, String context) {
    if (!(value instanceof List<?> items)) {
      throw new IllegalArgumentException("'fields' of " + context + " must be a list");
    }
    List<FieldSpec> fields = new ArrayList<>();
    for (Object item : items) {
      fields.add(parseField(requireMap(item, context), context));
    }
    return fields;
  }

  private static FieldSpec parseField(Map<String, Object> field, String context) {
    FieldKind kind = FieldKind.fromCatalogName(requireString(field, "kind", context));
    return switch (kind) {
      case SCALAR ->
          new ScalarField(
              requireString(field, "tag", context),
              optionalString(field, "key"),
              optionalString(field, "default"),
              optionalString(field, "constant"),
              optionalBoolean(field, "required", true));
      case REPEATED_LIST ->
          new RepeatedListField(
              requireString(field, "tag", context),
              requireString(field, "itemTag", context),
              requireString(field, "key", context),
              optionalBoolean(field, "required", true));
      case NESTED_GROUP ->
          new NestedGroupField(
              requireString(field, "tag", context),
              requireString(field, "entryTag", context),
              requireString(field, "keyTag", context),
              requireString(field, "valueTag", context),
              requireString(field, "key", context),
              optionalBoolean(field, "required", true));
      case GROUP -> {
        String tag = requireString(field, "tag", context);
        yield new GroupField(tag, parseFields(field.get("fields"), context + "/" + tag));
      }
      case CONDITIONAL_GROUP -> parseConditional(field, context);
    };
  }

  private static ConditionalGroupField parseConditional(Map<String, Object> field, String context) {
    String modeName = requireString(field, "mode", context);
    ConditionalGroupField.Mode mode;
    if ("value".equalsIgnoreCase(modeName)) {
      mode = ConditionalGroupField.Mode.VALUE;
    } else if ("presence".equalsIgnoreCase(modeName)) {
      mode = ConditionalGroupField.Mode.PRESENCE;
    } else {
      throw new IllegalArgumentException(
          "Unknown conditional mode in " + context + ": " + modeName);
    }

    Object discriminatorValue = field.get("discriminators");
    if (!(discriminatorValue instanceof List<?> discriminatorItems)) {
      throw new IllegalArgumentException("'discriminators' of " + context + " must be a list");
    }
    List<String> discriminators = new ArrayList<>();
    for (Object item : discriminatorItems) {
      if (!(item instanceof String name)) {
        throw new IllegalArgumentException(
            "Discriminator names in " + context + " must be strings");
      }
      discriminators.add(name);
    }

    Map<String, Object> branchMap = requireMap(field.get("branches"), context + " branches");
    Map<String, List<FieldSpec>> branches = new LinkedHashMap<>();
    for (Map.Entry<String, Object> branch : branchMap.entrySet()) {
      branches.put(
          branch.getKey(), parseFields(branch.getValue(), context + "[" + branch.getKey() + "]"));
    }
    return new ConditionalGroupField(discriminators, mode, branches);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> requireMap(@Nullable Object value, String context) {
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("Expected an object for " + context);
    }
    return (Map<String, Object>) value;
  }

  private static String requireString(Map<String, Object> map, String key, String context) {
    String value = optionalString(map, key);
    if (value == null) {
      throw new IllegalArgumentException("Missing '" + key + "' in " + context);
    }
    return value;
  }

  private static @Nullable String optionalString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("'" + key + "' must be a string");
    }
    return text;
  }

  private static boolean optionalBoolean(Map<String, Object> map, String key, boolean fallback) {
    Object value = map.get(key);
    if (value == null) {
      return fallback;
    }
    if (!(value instanceof Boolean flag)) {
      throw new IllegalArgumentException("'" + key + "' must be a boolean");
    }
    return flag;
  }
}
