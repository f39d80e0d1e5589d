package io.github.wphillipmoore.xg.api.admin.command;

import io.github.wphillipmoore.xg.api.admin.auth.Credentials;
import io.github.wphillipmoore.xg.api.admin.exception.XgMissingFieldException;
import io.github.wphillipmoore.xg.api.admin.schema.EntitySchema;
import io.github.wphillipmoore.xg.api.admin.schema.FieldSerializer;
import io.github.wphillipmoore.xg.api.admin.xml.XmlElement;
import java.util.Map;
import java.util.Objects;

/**
 * Builds request {@link Command}s for one set of credentials.
 *
 * <p>Every document has the shape {@code
 * <Request><Login><Username/><Password/></Login><Op><Entity>...</Entity></Op></Request>}. The login
 * block comes first so the appliance authenticates before it evaluates the operation. It is held
 * as a template and deep-copied into each new document, so a builder can be shared between threads.
 */
public final class RequestBuilder {

  static final String REQUEST_TAG = "Request";
  static final String LOGIN_TAG = "Login";

  private final XmlElement template;

  /**
   * Creates a builder whose requests authenticate with the given credentials.
   *
   * @param credentials the API administrator credentials
   */
  public RequestBuilder(Credentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    XmlElement request = XmlElement.newElement(REQUEST_TAG);
    XmlElement login = request.appendChild(LOGIN_TAG);
    login.appendChild("Username", credentials.username());
    login.appendChild("Password", credentials.password());
    this.template = request;
  }

  /**
   * Builds a Get request for all objects of an entity type.
   *
   * @param entityType the entity type tag; any tag is accepted
   * @return the command
   */
  public Command query(String entityType) {
    XmlElement document = template.deepCopy();
    document.appendChild(Operation.QUERY.wireName()).appendChild(entityType);
    return new Command(Operation.QUERY, entityType, document);
  }

  /**
   * Builds a Set request whose body is rendered from the schema's fields, in declared order.
   *
   * @param schema the entity schema
   * @param values caller field values by key
   * @return the command
   * @throws XgMissingFieldException if a required field has no value and no default
   */
  public Command mutate(EntitySchema schema, Map<String, Object> values) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(values, "values");
    XmlElement document = template.deepCopy();
    XmlElement body =
        document.appendChild(Operation.MUTATE.wireName()).appendChild(schema.entityType());
    new FieldSerializer(schema.entityType(), values).appendAll(schema.fields(), body);
    return new Command(Operation.MUTATE, schema.entityType(), document);
  }

  /**
   * Builds a Remove request for the object identified by {@code key}.
   *
   * @param schema the entity schema, which names the identifying element
   * @param key the name or hardware identifier of the object
   * @return the command
   * @throws XgMissingFieldException if the key is blank
   */
  public Command delete(EntitySchema schema, String key) {
    Objects.requireNonNull(schema, "schema");
    return deleteCustom(schema.entityType(), schema.deleteKey(), key);
  }

  /**
   * Builds a Set request for an entity type without a schema.
   *
   * <p>Each entry becomes one child element, in the map's iteration order. Nothing is validated.
   *
   * @param entityType the entity type tag
   * @param fields element name to text
   * @return the command
   */
  public Command mutateCustom(String entityType, Map<String, String> fields) {
    Objects.requireNonNull(fields, "fields");
    XmlElement document = template.deepCopy();
    XmlElement body = document.appendChild(Operation.MUTATE.wireName()).appendChild(entityType);
    fields.forEach(body::appendChild);
    return new Command(Operation.MUTATE, entityType, document);
  }

  /**
   * Builds a Remove request for an entity type without a schema.
   *
   * @param entityType the entity type tag
   * @param keyTag the identifying element name (e.g. "Name")
   * @param key the identifier value
   * @return the command
   * @throws XgMissingFieldException if the key is blank
   */
  public Command deleteCustom(String entityType, String keyTag, String key) {
    Objects.requireNonNull(keyTag, "keyTag");
    if (key == null || key.isBlank()) {
      throw new XgMissingFieldException(entityType, keyTag);
    }
    XmlElement document = template.deepCopy();
    document
        .appendChild(Operation.DELETE.wireName())
        .appendChild(entityType)
        .appendChild(keyTag, key);
    return new Command(Operation.DELETE, entityType, document);
  }
}
