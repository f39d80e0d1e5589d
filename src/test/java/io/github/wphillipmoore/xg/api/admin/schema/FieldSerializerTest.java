package io.github.wphillipmoore.xg.api.admin.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.xg.api.admin.exception.XgMissingFieldException;
import io.github.wphillipmoore.xg.api.admin.xml.XmlElement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FieldSerializerTest {

  private static String render(
      String entityType, List<FieldSpec> fields, Map<String, Object> values) {
    XmlElement body = XmlElement.newElement(entityType);
    new FieldSerializer(entityType, values).appendAll(fields, body);
    return body.serialize();
  }

  @Nested
  class Scalars {

    @Test
    void callerValueWinsOverDefault() {
      List<FieldSpec> fields = List.of(ScalarField.withDefault("IPFamily", "ipFamily", "IPv4"));

      assertThat(render("IPHost", fields, Map.of("ipFamily", "IPv6")))
          .isEqualTo("<IPHost><IPFamily>IPv6</IPFamily></IPHost>");
    }

    @Test
    void defaultIsUsedWhenValueAbsent() {
      List<FieldSpec> fields = List.of(ScalarField.withDefault("IPFamily", "ipFamily", "IPv4"));

      assertThat(render("IPHost", fields, Map.of()))
          .isEqualTo("<IPHost><IPFamily>IPv4</IPFamily></IPHost>");
    }

    @Test
    void requiredWithoutValueOrDefaultThrows() {
      List<FieldSpec> fields = List.of(ScalarField.of("Name", "name"));

      assertThatThrownBy(() -> render("Zone", fields, Map.of()))
          .isInstanceOfSatisfying(
              XgMissingFieldException.class,
              e -> {
                assertThat(e.getEntityType()).isEqualTo("Zone");
                assertThat(e.getFieldName()).isEqualTo("name");
              });
    }

    @Test
    void optionalWithoutValueIsOmitted() {
      List<FieldSpec> fields =
          List.of(ScalarField.of("Name", "name"), ScalarField.optional("Comment", "comment"));

      assertThat(render("Zone", fields, Map.of("name", "DMZ")))
          .isEqualTo("<Zone><Name>DMZ</Name></Zone>");
    }

    @Test
    void emptyStringIsEmittedAsEmptyElement() {
      List<FieldSpec> fields = List.of(ScalarField.of("Description", "description"));

      assertThat(render("IPSPolicy", fields, Map.of("description", "")))
          .isEqualTo("<IPSPolicy><Description/></IPSPolicy>");
    }

    @Test
    void constantIgnoresCallerValues() {
      List<FieldSpec> fields = List.of(ScalarField.fixed("PolicyType", "Network"));

      assertThat(render("FirewallRule", fields, Map.of("PolicyType", "User")))
          .isEqualTo("<FirewallRule><PolicyType>Network</PolicyType></FirewallRule>");
    }

    @Test
    void nonStringValueIsRejected() {
      List<FieldSpec> fields = List.of(ScalarField.of("MTU", "mtu"));

      assertThatThrownBy(() -> render("LAG", fields, Map.of("mtu", 1500)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Field 'mtu' of LAG must be a string but was Integer");
    }
  }

  @Nested
  class RepeatedLists {

    private final List<FieldSpec> fields =
        List.of(new RepeatedListField("HostList", "Host", "hosts", true));

    @Test
    void emitsOneItemPerEntryInOrder() {
      assertThat(render("IPHostGroup", fields, Map.of("hosts", List.of("c", "a", "b"))))
          .isEqualTo(
              "<IPHostGroup><HostList><Host>c</Host><Host>a</Host><Host>b</Host></HostList>"
                  + "</IPHostGroup>");
    }

    @Test
    void emptyListEmitsEmptyWrapper() {
      assertThat(render("IPHostGroup", fields, Map.of("hosts", List.of())))
          .isEqualTo("<IPHostGroup><HostList/></IPHostGroup>");
    }

    @Test
    void missingRequiredListThrows() {
      assertThatThrownBy(() -> render("IPHostGroup", fields, Map.of()))
          .isInstanceOf(XgMissingFieldException.class)
          .hasMessageContaining("'hosts'");
    }

    @Test
    void missingOptionalListEmitsEmptyWrapper() {
      List<FieldSpec> optional =
          List.of(new RepeatedListField("SourceZones", "Zone", "sourceZones", false));

      assertThat(render("FirewallRule", optional, Map.of()))
          .isEqualTo("<FirewallRule><SourceZones/></FirewallRule>");
    }

    @Test
    void nonListValueIsRejected() {
      assertThatThrownBy(() -> render("IPHostGroup", fields, Map.of("hosts", "a,b")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("must be a list");
    }
  }

  @Nested
  class NestedGroups {

    @Test
    void emitsPairsInCallerOrder() {
      List<FieldSpec> fields =
          List.of(
              new NestedGroupField(
                  "BridgeMembers", "Member", "Interface", "Zone", "members", true));
      Map<String, String> members = new LinkedHashMap<>();
      members.put("PortH", "WAN");
      members.put("PortG", "LAN");

      assertThat(render("BridgePair", fields, Map.of("members", members)))
          .isEqualTo(
              "<BridgePair><BridgeMembers>"
                  + "<Member><Interface>PortH</Interface><Zone>WAN</Zone></Member>"
                  + "<Member><Interface>PortG</Interface><Zone>LAN</Zone></Member>"
                  + "</BridgeMembers></BridgePair>");
    }
  }

  @Nested
  class Groups {

    @Test
    void wrapsChildFields() {
      List<FieldSpec> fields =
          List.of(
              new GroupField(
                  "AdminServices",
                  List.of(
                      ScalarField.withDefault("HTTPS", "https", "Disable"),
                      ScalarField.withDefault("SSH", "ssh", "Disable"))));

      assertThat(render("Zone", fields, Map.of("ssh", "Enable")))
          .isEqualTo(
              "<Zone><AdminServices><HTTPS>Disable</HTTPS><SSH>Enable</SSH>"
                  + "</AdminServices></Zone>");
    }
  }

  @Nested
  class Conditionals {

    private final List<FieldSpec> hostFields =
        List.of(
            ScalarField.withDefault("HostType", "hostType", "IP"),
            new ConditionalGroupField(
                List.of("hostType"),
                ConditionalGroupField.Mode.VALUE,
                Map.of(
                    "IP", List.of(ScalarField.of("IPAddress", "ipAddress")),
                    "IPRange",
                        List.of(
                            ScalarField.of("StartIPAddress", "ipAddress"),
                            ScalarField.of("EndIPAddress", "subnet")))));

    @Test
    void valueModeSelectsBranchFromDefault() {
      assertThat(render("IPHost", hostFields, Map.of("ipAddress", "10.0.0.1")))
          .isEqualTo("<IPHost><HostType>IP</HostType><IPAddress>10.0.0.1</IPAddress></IPHost>");
    }

    @Test
    void valueModeEmitsOnlySelectedBranch() {
      String xml =
          render(
              "IPHost",
              hostFields,
              Map.of("hostType", "IPRange", "ipAddress", "10.0.0.1", "subnet", "10.0.0.9"));

      assertThat(xml)
          .isEqualTo(
              "<IPHost><HostType>IPRange</HostType><StartIPAddress>10.0.0.1</StartIPAddress>"
                  + "<EndIPAddress>10.0.0.9</EndIPAddress></IPHost>");
      assertThat(xml).doesNotContain("<IPAddress>");
    }

    @Test
    void valueModeRejectsUnknownValue() {
      assertThatThrownBy(
              () -> render("IPHost", hostFields, Map.of("hostType", "FQDN", "ipAddress", "x")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageStartingWith("Unsupported hostType 'FQDN' for IPHost");
    }

    @Test
    void valueModeWithoutDiscriminatorThrowsMissingField() {
      List<FieldSpec> fields =
          List.of(
              new ConditionalGroupField(
                  List.of("mode"), ConditionalGroupField.Mode.VALUE, Map.of("A", List.of())));

      assertThatThrownBy(() -> render("LAG", fields, Map.of()))
          .isInstanceOf(XgMissingFieldException.class)
          .hasMessageContaining("'mode'");
    }

    private final List<FieldSpec> gatewayFields =
        List.of(
            new ConditionalGroupField(
                List.of("ipAddress", "gateway"),
                ConditionalGroupField.Mode.PRESENCE,
                Map.of(
                    ConditionalGroupField.PRESENT,
                    List.of(
                        ScalarField.of("IPAddress", "ipAddress"),
                        ScalarField.of("Gateway", "gateway")))));

    @Test
    void presenceModeEmitsBranchWhenAllPresent() {
      Map<String, Object> values = Map.of("ipAddress", "1.1.1.1", "gateway", "1.1.1.254");

      assertThat(render("BridgePair", gatewayFields, values))
          .isEqualTo(
              "<BridgePair><IPAddress>1.1.1.1</IPAddress><Gateway>1.1.1.254</Gateway>"
                  + "</BridgePair>");
    }

    @Test
    void presenceModeTreatsEmptyStringAsAbsent() {
      Map<String, Object> values = Map.of("ipAddress", "1.1.1.1", "gateway", "");

      assertThat(render("BridgePair", gatewayFields, values))
          .isEqualTo("<BridgePair/>");
    }

    @Test
    void presenceModeWithMissingLabelEmitsNothing() {
      assertThat(render("BridgePair", gatewayFields, Map.of("ipAddress", "1.1.1.1")))
          .isEqualTo("<BridgePair/>");
    }

    @Test
    void presenceModeSelectsAbsentBranch() {
      List<FieldSpec> fields =
          List.of(
              new ConditionalGroupField(
                  List.of("matchIdentity"),
                  ConditionalGroupField.Mode.PRESENCE,
                  Map.of(
                      ConditionalGroupField.PRESENT,
                      List.of(ScalarField.fixed("PolicyType", "User")),
                      ConditionalGroupField.ABSENT,
                      List.of(ScalarField.fixed("PolicyType", "Network")))));

      assertThat(render("FirewallRule", fields, Map.of()))
          .isEqualTo("<FirewallRule><PolicyType>Network</PolicyType></FirewallRule>");
      assertThat(render("FirewallRule", fields, Map.of("matchIdentity", "Enable")))
          .isEqualTo("<FirewallRule><PolicyType>User</PolicyType></FirewallRule>");
    }
  }
}
