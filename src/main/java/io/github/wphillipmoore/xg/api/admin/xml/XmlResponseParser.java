package io.github.wphillipmoore.xg.api.admin.xml;

import io.github.wphillipmoore.xg.api.admin.exception.XgResponseException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.jspecify.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Decodes appliance XML responses into nested maps.
 *
 * <p>The mapping follows the usual XML-to-dictionary convention:
 *
 * <ul>
 *   <li>attributes become {@code "@name"} entries;
 *   <li>an element with only text becomes that text, and an empty element becomes {@code null};
 *   <li>text of an element that also has attributes or children is stored under {@code "#text"};
 *   <li>repeated sibling elements with the same tag are collected into a {@link List} in document
 *       order.
 * </ul>
 *
 * <p>So {@code <Status code="200">Configuration applied successfully.</Status>} decodes to {@code
 * {"@code": "200", "#text": "Configuration applied successfully."}}. All maps are {@link
 * LinkedHashMap}s that preserve document order.
 */
public final class XmlResponseParser {

  static final String ATTRIBUTE_PREFIX = "@";
  static final String TEXT_KEY = "#text";

  private XmlResponseParser() {}

  /**
   * Parses a response document.
   *
   * @param text the raw response body
   * @return a single-entry map from the root tag to its decoded content
   * @throws XgResponseException if the text is blank or not well-formed XML
   */
  public static Map<String, Object> parse(String text) {
    if (text == null || text.isBlank()) {
      throw new XgResponseException("Empty response from appliance", text);
    }
    Document document;
    try {
      DocumentBuilder builder = newDocumentBuilder();
      document = builder.parse(new InputSource(new StringReader(text)));
    } catch (SAXException | IOException e) {
      throw new XgResponseException("Invalid XML in response", text, e);
    }
    Element root = document.getDocumentElement();
    Map<String, Object> result = new LinkedHashMap<>();
    result.put(root.getTagName(), decodeElement(root));
    return result;
  }

  static DocumentBuilder newDocumentBuilder() {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      factory.setNamespaceAware(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new DefaultHandler());
      return builder;
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("Failed to configure XML parser", e);
    }
  }

  private static @Nullable Object decodeElement(Element element) {
    Map<String, Object> decoded = new LinkedHashMap<>();

    NamedNodeMap attributes = element.getAttributes();
    for (int index = 0; index < attributes.getLength(); index++) {
      Node attribute = attributes.item(index);
      decoded.put(ATTRIBUTE_PREFIX + attribute.getNodeName(), attribute.getNodeValue());
    }

    StringBuilder text = new StringBuilder();
    NodeList nodes = element.getChildNodes();
    for (int index = 0; index < nodes.getLength(); index++) {
      Node node = nodes.item(index);
      switch (node.getNodeType()) {
        case Node.ELEMENT_NODE -> addChild(decoded, (Element) node);
        case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(node.getNodeValue());
        default -> {
          // comments and processing instructions carry no data
        }
      }
    }

    String trimmed = text.toString().strip();
    if (decoded.isEmpty()) {
      return trimmed.isEmpty() ? null : trimmed;
    }
    if (!trimmed.isEmpty()) {
      decoded.put(TEXT_KEY, trimmed);
    }
    return decoded;
  }

  @SuppressWarnings("unchecked")
  private static void addChild(Map<String, Object> parent, Element child) {
    String tag = child.getTagName();
    Object value = decodeElement(child);
    if (!parent.containsKey(tag)) {
      parent.put(tag, value);
      return;
    }
    Object existing = parent.get(tag);
    if (existing instanceof List) {
      ((List<Object>) existing).add(value);
      return;
    }
    List<Object> repeated = new ArrayList<>();
    repeated.add(existing);
    repeated.add(value);
    parent.put(tag, repeated);
  }
}
