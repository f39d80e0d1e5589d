package io.github.wphillipmoore.xg.api.admin.xml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class XmlElementTest {

  @Nested
  class Serialization {

    @Test
    void rendersChildrenInInsertionOrder() {
      XmlElement request = XmlElement.newElement("Request");
      XmlElement login = request.appendChild("Login");
      login.appendChild("Username", "admin");
      login.appendChild("Password", "secret");
      request.appendChild("Get").appendChild("IPHost");

      assertThat(request.serialize())
          .isEqualTo(
              "<Request><Login><Username>admin</Username><Password>secret</Password></Login>"
                  + "<Get><IPHost/></Get></Request>");
    }

    @Test
    void rendersEmptyTextAsShortForm() {
      XmlElement group = XmlElement.newElement("IPHostGroup");
      group.appendChild("Description", "");
      group.appendChild("HostList");

      assertThat(group.serialize())
          .isEqualTo("<IPHostGroup><Description/><HostList/></IPHostGroup>");
    }

    @Test
    void escapesTextContent() {
      XmlElement element = XmlElement.newElement("Description");
      element.setText("R&D <lab> \"quoted\"");

      assertThat(element.serialize())
          .isEqualTo("<Description>R&amp;D &lt;lab&gt; \"quoted\"</Description>");
    }

    @Test
    void escapesAttributeValues() {
      XmlElement status = XmlElement.newElement("Status").setAttribute("code", "a\"b'c<");

      assertThat(status.serialize()).isEqualTo("<Status code=\"a&quot;b&apos;c&lt;\"/>");
    }

    @Test
    void rendersAttributesBeforeText() {
      XmlElement status =
          XmlElement.newElement("Status").setAttribute("code", "200").setText("ok");

      assertThat(status.serialize()).isEqualTo("<Status code=\"200\">ok</Status>");
    }
  }

  @Nested
  class TreeAccess {

    @Test
    void findChildReturnsFirstMatch() {
      XmlElement list = XmlElement.newElement("HostList");
      XmlElement first = list.appendChild("Host", "a");
      list.appendChild("Host", "b");

      assertThat(list.findChild("Host")).isSameAs(first);
      assertThat(list.findChild("Missing")).isNull();
    }

    @Test
    void childrenViewIsUnmodifiable() {
      XmlElement element = XmlElement.newElement("Zone");
      element.appendChild("Name", "DMZ");

      assertThatThrownBy(() -> element.getChildren().clear())
          .isInstanceOf(UnsupportedOperationException.class);
      assertThat(element.getChildren()).extracting(XmlElement::getTag).containsExactly("Name");
    }

    @Test
    void deepCopySharesNoState() {
      XmlElement original = XmlElement.newElement("Request");
      original.appendChild("Login").appendChild("Username", "admin");

      XmlElement copy = original.deepCopy();
      copy.appendChild("Get");
      copy.findChild("Login").findChild("Username").setText("other");

      assertThat(original.serialize())
          .isEqualTo("<Request><Login><Username>admin</Username></Login></Request>");
    }
  }

  @Nested
  class Validation {

    @Test
    void nullTagThrows() {
      assertThatThrownBy(() -> XmlElement.newElement(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("tag");
    }

    @Test
    void blankTagThrows() {
      assertThatThrownBy(() -> XmlElement.newElement(" "))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("tag must not be blank");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Host Name", "<Zone>", "1Zone", "ns:Zone", "Zone/"})
    void nonNameTagThrows(String tag) {
      XmlElement entity = XmlElement.newElement("UnicastRoute");

      assertThatThrownBy(() -> entity.appendChild(tag, "x"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Invalid XML name: '" + tag + "'");
      assertThat(entity.getChildren()).isEmpty();
    }

    @Test
    void acceptsTagsUsedByTheAppliance() {
      XmlElement entity = XmlElement.newElement("LAG");

      entity.appendChild("IPv4Configuration", "Enable");
      entity.appendChild("Scan_POP3S.v2-x");

      assertThat(entity.getChildren()).hasSize(2);
    }

    @Test
    void controlCharacterInTextThrows() {
      XmlElement entity = XmlElement.newElement("UnicastRoute");

      assertThatThrownBy(() -> entity.appendChild("Description", "bad\u0001text"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Character U+0001 at index 3 is not allowed in XML");
      assertThat(entity.getChildren()).isEmpty();
    }

    @Test
    void loneSurrogateInSetTextThrows() {
      XmlElement element = XmlElement.newElement("Description");

      assertThatThrownBy(() -> element.setText("\uD800"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("U+D800");
    }

    @Test
    void invalidAttributeValueThrows() {
      XmlElement status = XmlElement.newElement("Status");

      assertThatThrownBy(() -> status.setAttribute("code", "\u0000"))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsWhitespaceAndSupplementaryCharacters() {
      XmlElement element = XmlElement.newElement("Description");

      element.setText("line one\r\n\tline two \uD83D\uDD25 \uFFFD");

      assertThat(element.serialize()).contains("\uD83D\uDD25");
    }

    @Test
    void toStringDoesNotRenderContent() {
      XmlElement login = XmlElement.newElement("Login");
      login.appendChild("Password", "secret");

      assertThat(login.toString()).isEqualTo("XmlElement[Login]");
    }
  }
}
