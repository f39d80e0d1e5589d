package io.github.wphillipmoore.xg.api.admin.command;

import io.github.wphillipmoore.xg.api.admin.xml.XmlElement;
import java.util.Objects;

/**
 * One complete, immutable request to the appliance.
 *
 * <p>The document is captured at construction as a private deep copy and serialized once, so a
 * command never changes after it is built and never shares XML state with other commands. {@link
 * #document()} returns a fresh copy on every call.
 *
 * <p>The serialized form embeds the administrator password. {@link #toString()} therefore reports
 * only the operation and entity type.
 */
public final class Command {

  private final Operation operation;
  private final String entityType;
  private final XmlElement document;
  private final String xml;

  /**
   * Creates a command.
   *
   * @param operation the request operation
   * @param entityType the entity type tag
   * @param document the complete request document; copied, later changes are not seen
   */
  public Command(Operation operation, String entityType, XmlElement document) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.document = Objects.requireNonNull(document, "document").deepCopy();
    this.xml = this.document.serialize();
  }

  /** Returns the request operation. */
  public Operation operation() {
    return operation;
  }

  /** Returns the entity type tag. */
  public String entityType() {
    return entityType;
  }

  /** Returns a copy of the request document. */
  public XmlElement document() {
    return document.deepCopy();
  }

  /** Returns the serialized request document. */
  public String toXml() {
    return xml;
  }

  @Override
  public String toString() {
    return "Command[" + operation.wireName() + " " + entityType + "]";
  }
}
