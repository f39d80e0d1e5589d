package io.github.wphillipmoore.xg.api.admin.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Ordered XML element tree used to assemble request documents.
 *
 * <p>Children and attributes keep insertion order, and {@link #serialize()} renders them in that
 * order with no added whitespace. Some appliance parsers are order-sensitive, so the order in which
 * callers append children is the order on the wire.
 *
 * <pre>{@code
 * XmlElement request = XmlElement.newElement("Request");
 * XmlElement login = request.appendChild("Login");
 * login.appendChild("Username", "admin");
 * request.serialize(); // <Request><Login><Username>admin</Username></Login></Request>
 * }</pre>
 *
 * <p>Names must be XML names without a namespace prefix, and text may only hold characters that
 * XML 1.0 allows; anything else is rejected when it is set, never at serialization.
 *
 * <p>Instances are mutable and not thread-safe. Share a template by handing out {@link
 * #deepCopy()} copies.
 */
public final class XmlElement {

  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9._-]*");

  private final String tag;
  private @Nullable String text;
  private final Map<String, String> attributes = new LinkedHashMap<>();
  private final List<XmlElement> children = new ArrayList<>();

  private XmlElement(String tag) {
    this.tag = requireValidTag(tag);
  }

  /**
   * Creates a detached element.
   *
   * @param tag the element name, never null or blank
   * @return a new element with no text, attributes or children
   */
  public static XmlElement newElement(String tag) {
    return new XmlElement(tag);
  }

  /**
   * Appends an empty child element.
   *
   * @param childTag the child element name
   * @return the new child, for further nesting
   */
  public XmlElement appendChild(String childTag) {
    XmlElement child = new XmlElement(childTag);
    children.add(child);
    return child;
  }

  /**
   * Appends a child element with text content.
   *
   * @param childTag the child element name
   * @param childText the text content, or {@code null} for an empty element
   * @return the new child, for further nesting
   */
  public XmlElement appendChild(String childTag, @Nullable String childText) {
    XmlElement child = new XmlElement(childTag);
    child.text = requireValidText(childText);
    children.add(child);
    return child;
  }

  /**
   * Sets an attribute, keeping the position of an existing attribute with the same name.
   *
   * @param name the attribute name
   * @param value the attribute value
   * @return this element
   */
  public XmlElement setAttribute(String name, String value) {
    attributes.put(requireValidTag(name), requireValidText(Objects.requireNonNull(value, "value")));
    return this;
  }

  /** Sets the text content of this element; {@code null} clears it. */
  public XmlElement setText(@Nullable String text) {
    this.text = requireValidText(text);
    return this;
  }

  /** Returns the element name. */
  public String getTag() {
    return tag;
  }

  /** Returns the text content, or {@code null} if none was set. */
  public @Nullable String getText() {
    return text;
  }

  /** Returns an unmodifiable view of the attributes in insertion order. */
  public Map<String, String> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  /** Returns an unmodifiable view of the children in insertion order. */
  public List<XmlElement> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Returns the first direct child with the given tag.
   *
   * @param childTag the tag to look for
   * @return the first matching child, or {@code null} if there is none
   */
  public @Nullable XmlElement findChild(String childTag) {
    for (XmlElement child : children) {
      if (child.tag.equals(childTag)) {
        return child;
      }
    }
    return null;
  }

  /**
   * Returns a deep copy of this element and its descendants.
   *
   * @return a detached copy that shares no mutable state with this element
   */
  public XmlElement deepCopy() {
    XmlElement copy = new XmlElement(tag);
    copy.text = text;
    copy.attributes.putAll(attributes);
    for (XmlElement child : children) {
      copy.children.add(child.deepCopy());
    }
    return copy;
  }

  /**
   * Renders this element and its descendants as XML text.
   *
   * @return the serialized element, without an XML declaration
   */
  public String serialize() {
    StringBuilder out = new StringBuilder(128);
    writeTo(out);
    return out.toString();
  }

  private void writeTo(StringBuilder out) {
    out.append('<').append(tag);
    for (Map.Entry<String, String> attribute : attributes.entrySet()) {
      out.append(' ')
          .append(attribute.getKey())
          .append("=\"")
          .append(escape(attribute.getValue(), true))
          .append('"');
    }
    if ((text == null || text.isEmpty()) && children.isEmpty()) {
      out.append("/>");
      return;
    }
    out.append('>');
    if (text != null) {
      out.append(escape(text, false));
    }
    for (XmlElement child : children) {
      child.writeTo(out);
    }
    out.append("</").append(tag).append('>');
  }

  static String escape(String value, boolean attribute) {
    StringBuilder escaped = new StringBuilder(value.length() + 16);
    for (int index = 0; index < value.length(); index++) {
      char c = value.charAt(index);
      switch (c) {
        case '&' -> escaped.append("&amp;");
        case '<' -> escaped.append("&lt;");
        case '>' -> escaped.append("&gt;");
        case '"' -> escaped.append(attribute ? "&quot;" : "\"");
        case '\'' -> escaped.append(attribute ? "&apos;" : "'");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }

  private static String requireValidTag(String name) {
    Objects.requireNonNull(name, "tag");
    if (name.isBlank()) {
      throw new IllegalArgumentException("tag must not be blank");
    }
    if (!NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid XML name: '" + name + "'");
    }
    return name;
  }

  private static @Nullable String requireValidText(@Nullable String value) {
    if (value == null) {
      return null;
    }
    for (int index = 0; index < value.length(); ) {
      int codePoint = value.codePointAt(index);
      if (!isXmlChar(codePoint)) {
        throw new IllegalArgumentException(
            String.format("Character U+%04X at index %d is not allowed in XML", codePoint, index));
      }
      index += Character.charCount(codePoint);
    }
    return value;
  }

  private static boolean isXmlChar(int codePoint) {
    return codePoint == 0x9
        || codePoint == 0xA
        || codePoint == 0xD
        || (codePoint >= 0x20 && codePoint <= 0xD7FF)
        || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
        || codePoint >= 0x10000;
  }

  /** Returns a tag-only description; use {@link #serialize()} for the document. */
  @Override
  public String toString() {
    return "XmlElement[" + tag + "]";
  }
}
