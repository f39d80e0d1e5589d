package io.github.wphillipmoore.xg.api.admin.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EntitySchemaCatalogTest {

  @Nested
  class BuiltInCatalog {

    private final EntitySchemaCatalog catalog = EntitySchemaCatalog.loadDefault();

    @Test
    void containsEveryMutableEntityType() {
      assertThat(catalog.entityTypes())
          .containsExactly(
              "IPHost",
              "IPHostGroup",
              "VLAN",
              "LAG",
              "BridgePair",
              "Zone",
              "IPSPolicy",
              "FirewallRule");
    }

    @Test
    void interfaceEntitiesAreDeletedByHardware() {
      assertThat(catalog.get("VLAN").deleteKey()).isEqualTo("Hardware");
      assertThat(catalog.get("LAG").deleteKey()).isEqualTo("Hardware");
      assertThat(catalog.get("BridgePair").deleteKey()).isEqualTo("Hardware");
      assertThat(catalog.get("Zone").deleteKey()).isEqualTo("Name");
      assertThat(catalog.get("FirewallRule").deleteKey()).isEqualTo("Name");
    }

    @Test
    void ipHostEndsWithValueConditional() {
      List<FieldSpec> fields = catalog.get("IPHost").fields();

      assertThat(fields)
          .extracting(FieldSpec::kind)
          .containsExactly(
              FieldKind.SCALAR, FieldKind.SCALAR, FieldKind.SCALAR, FieldKind.CONDITIONAL_GROUP);
      ConditionalGroupField hostType = (ConditionalGroupField) fields.get(3);
      assertThat(hostType.mode()).isEqualTo(ConditionalGroupField.Mode.VALUE);
      assertThat(hostType.branches()).containsOnlyKeys("IP", "Network", "IPRange", "IPList");
    }

    @Test
    void scalarsAreRequiredUnlessDeclaredOtherwise() {
      ScalarField name = (ScalarField) catalog.get("IPSPolicy").fields().get(0);
      ScalarField description = (ScalarField) catalog.get("IPSPolicy").fields().get(2);

      assertThat(name.required()).isTrue();
      assertThat(name.defaultValue()).isNull();
      assertThat(description.defaultValue()).isEmpty();
    }

    @Test
    void unknownTypeThrowsFromGetAndIsNullFromFind() {
      assertThatThrownBy(() -> catalog.get("Interface"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown entity type: Interface");
      assertThat(catalog.find("Interface")).isNull();
    }
  }

  @Nested
  class FromJson {

    @Test
    void parsesEveryFieldKind() {
      String json =
          "{\"entities\": {\"Demo\": {\"deleteKey\": \"Name\", \"fields\": ["
              + "{\"kind\": \"scalar\", \"tag\": \"Name\", \"key\": \"name\"},"
              + "{\"kind\": \"scalar\", \"tag\": \"Note\", \"key\": \"note\", \"required\": false},"
              + "{\"kind\": \"repeatedList\", \"tag\": \"L\", \"itemTag\": \"I\", \"key\": \"l\"},"
              + "{\"kind\": \"nestedGroup\", \"tag\": \"M\", \"entryTag\": \"E\","
              + " \"keyTag\": \"K\", \"valueTag\": \"V\", \"key\": \"m\"},"
              + "{\"kind\": \"group\", \"tag\": \"G\", \"fields\": []},"
              + "{\"kind\": \"conditionalGroup\", \"mode\": \"presence\","
              + " \"discriminators\": [\"note\"], \"branches\": {\"present\": []}}"
              + "]}}}";

      EntitySchema schema = EntitySchemaCatalog.fromJson(json).get("Demo");

      assertThat(schema.fields())
          .extracting(FieldSpec::kind)
          .containsExactly(
              FieldKind.SCALAR,
              FieldKind.SCALAR,
              FieldKind.REPEATED_LIST,
              FieldKind.NESTED_GROUP,
              FieldKind.GROUP,
              FieldKind.CONDITIONAL_GROUP);
      assertThat(((ScalarField) schema.fields().get(1)).required()).isFalse();
    }

    @Test
    void nullJsonThrows() {
      assertThatThrownBy(() -> EntitySchemaCatalog.fromJson(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("json");
    }

    @Test
    void emptyJsonThrows() {
      assertThatThrownBy(() -> EntitySchemaCatalog.fromJson(""))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("json must not be empty");
    }

    @Test
    void invalidJsonThrows() {
      assertThatThrownBy(() -> EntitySchemaCatalog.fromJson("{not json"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Invalid entity schema JSON");
    }

    @Test
    void unknownTopLevelKeyThrows() {
      assertThatThrownBy(() -> EntitySchemaCatalog.fromJson("{\"entities\": {}, \"extra\": 1}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("extra");
    }

    @Test
    void unknownFieldKindThrows() {
      String json =
          "{\"entities\": {\"Demo\": {\"deleteKey\": \"Name\", \"fields\": ["
              + "{\"kind\": \"blob\", \"tag\": \"X\"}]}}}";

      assertThatThrownBy(() -> EntitySchemaCatalog.fromJson(json))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown field kind: blob");
    }

    @Test
    void missingDeleteKeyThrows() {
      String json = "{\"entities\": {\"Demo\": {\"fields\": []}}}";

      assertThatThrownBy(() -> EntitySchemaCatalog.fromJson(json))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Missing 'deleteKey' in Demo");
    }
  }

  @Nested
  class Resources {

    @Test
    void missingResourceThrowsIllegalState() {
      assertThatThrownBy(() -> EntitySchemaCatalog.loadFromResource("missing.json"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("missing.json");
    }

    @Test
    void ofRejectsDuplicateTypes() {
      EntitySchema zone = new EntitySchema("Zone", "Name", List.of(ScalarField.of("Name", "name")));

      assertThatThrownBy(() -> EntitySchemaCatalog.of(List.of(zone, zone)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Duplicate entity type: Zone");
    }
  }
}
