package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.Objects;

/**
 * A wrapper element with one entry element per pair of a caller-supplied map.
 *
 * <p>Each entry holds a {@code keyTag} child with the map key and a {@code valueTag} child with the
 * map value, in the map's iteration order. For bridge members a map {@code {PortA=LAN}} becomes
 * {@code <BridgeMembers><Member><Interface>PortA</Interface><Zone>LAN</Zone></Member>
 * </BridgeMembers>}.
 *
 * @param tag the wrapper element name
 * @param entryTag the per-pair element name
 * @param keyTag the element name for the map key
 * @param valueTag the element name for the map value
 * @param key the caller field name
 * @param required whether the caller must supply the map
 */
public record NestedGroupField(
    String tag, String entryTag, String keyTag, String valueTag, String key, boolean required)
    implements FieldSpec {

  /** Validates that all names are non-null. */
  public NestedGroupField {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(entryTag, "entryTag");
    Objects.requireNonNull(keyTag, "keyTag");
    Objects.requireNonNull(valueTag, "valueTag");
    Objects.requireNonNull(key, "key");
  }

  @Override
  public FieldKind kind() {
    return FieldKind.NESTED_GROUP;
  }
}
