package io.github.wphillipmoore.xg.api.admin.response;

import io.github.wphillipmoore.xg.api.admin.command.Operation;
import io.github.wphillipmoore.xg.api.admin.exception.XgAuthException;
import io.github.wphillipmoore.xg.api.admin.exception.XgOperationException;
import io.github.wphillipmoore.xg.api.admin.exception.XgResponseException;
import io.github.wphillipmoore.xg.api.admin.xml.XmlResponseParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Validates appliance responses and extracts their results.
 *
 * <p>Every response is checked in two steps. First the {@code Response/Login/status} text must be
 * exactly {@value #AUTH_SUCCESS}, whatever the operation. Then, for Set and Remove only, the
 * entity's {@code Status} element must carry code {@value #SUCCESS_CODE}. Get responses are
 * returned as decoded, without further checks.
 *
 * <p>Stateless; all methods are static.
 */
public final class ResponseInterpreter {

  /** Login status text of an authenticated request. */
  public static final String AUTH_SUCCESS = "Authentication Successful";

  /** Status code of a successful Set or Remove. */
  public static final String SUCCESS_CODE = "200";

  static final String RESPONSE_TAG = "Response";
  static final String LOGIN_TAG = "Login";
  static final String STATUS_TAG = "Status";

  private ResponseInterpreter() {}

  /**
   * Interprets the response to a Get request.
   *
   * @param entityType the queried entity type tag
   * @param responseText the raw response body
   * @return the decoded response document, e.g. {@code {"Response": {"Login": ..., "IPHost":
   *     [...]}}}
   * @throws XgAuthException if the appliance rejected the credentials
   * @throws XgResponseException if the response is malformed
   */
  public static Map<String, Object> interpretQuery(String entityType, String responseText) {
    Objects.requireNonNull(entityType, "entityType");
    Map<String, Object> document = XmlResponseParser.parse(responseText);
    checkLogin(responseEnvelope(document, responseText), responseText);
    return document;
  }

  /**
   * Interprets the response to a Set or Remove request.
   *
   * @param operation the request operation, {@link Operation#MUTATE} or {@link Operation#DELETE}
   * @param entityType the entity type tag
   * @param responseText the raw response body
   * @return the appliance's status code and message
   * @throws XgAuthException if the appliance rejected the credentials
   * @throws XgOperationException if the appliance rejected the operation
   * @throws XgResponseException if the response is malformed
   */
  public static OperationResult interpretStatus(
      Operation operation, String entityType, String responseText) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(entityType, "entityType");
    if (!operation.reportsStatus()) {
      throw new IllegalArgumentException(operation + " responses carry no status");
    }
    Map<String, Object> envelope =
        responseEnvelope(XmlResponseParser.parse(responseText), responseText);
    checkLogin(envelope, responseText);

    Map<String, Object> status = findStatus(envelope, entityType, responseText);
    Object code = status.get("@code");
    if (!(code instanceof String codeText)) {
      throw new XgResponseException(
          "Status of " + entityType + " has no code attribute", responseText);
    }
    Object text = status.get("#text");
    String message = text instanceof String messageText ? messageText : "";
    if (!SUCCESS_CODE.equals(codeText)) {
      throw new XgOperationException(operation.wireName(), entityType, codeText, message);
    }
    return new OperationResult(codeText, message);
  }

  /**
   * Returns the records of one entity type from a decoded Get response.
   *
   * <p>A single record decodes to a map and several decode to a list. This normalizes both to a
   * list, dropping entries that are not maps (such as an empty element).
   *
   * @param document the decoded response returned by {@link #interpretQuery}
   * @param entityType the entity type tag
   * @return the records in document order, possibly empty
   */
  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> entityRecords(
      Map<String, Object> document, String entityType) {
    List<Map<String, Object>> records = new ArrayList<>();
    Object envelope = document.get(RESPONSE_TAG);
    if (!(envelope instanceof Map)) {
      return records;
    }
    Object payload = ((Map<String, Object>) envelope).get(entityType);
    if (payload instanceof Map) {
      records.add((Map<String, Object>) payload);
    } else if (payload instanceof List<?> items) {
      for (Object item : items) {
        if (item instanceof Map) {
          records.add((Map<String, Object>) item);
        }
      }
    }
    return records;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> responseEnvelope(
      Map<String, Object> document, String responseText) {
    Object envelope = document.get(RESPONSE_TAG);
    if (!(envelope instanceof Map)) {
      throw new XgResponseException("Response has no Response envelope", responseText);
    }
    return (Map<String, Object>) envelope;
  }

  private static void checkLogin(Map<String, Object> envelope, String responseText) {
    Object login = envelope.get(LOGIN_TAG);
    String status = login instanceof Map<?, ?> loginMap ? asText(loginMap.get("status")) : null;
    if (status == null) {
      throw new XgResponseException("Response has no Login status", responseText);
    }
    if (!AUTH_SUCCESS.equals(status)) {
      throw new XgAuthException(status);
    }
  }

  /**
   * Finds the Status element for the entity, falling back to a top-level Status, which the
   * appliance sends when it cannot parse the request at all.
   */
  @SuppressWarnings("unchecked")
  private static Map<String, Object> findStatus(
      Map<String, Object> envelope, String entityType, String responseText) {
    Object entity = envelope.get(entityType);
    Object status = null;
    if (entity instanceof Map) {
      status = ((Map<String, Object>) entity).get(STATUS_TAG);
    } else if (entity == null) {
      status = envelope.get(STATUS_TAG);
    }
    if (!(status instanceof Map)) {
      throw new XgResponseException("Response has no Status for " + entityType, responseText);
    }
    return (Map<String, Object>) status;
  }

  private static @Nullable String asText(@Nullable Object value) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Map<?, ?> map && map.get("#text") instanceof String text) {
      return text;
    }
    return null;
  }
}
