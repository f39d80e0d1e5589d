package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.Objects;

/**
 * A wrapper element with one item element per entry of a caller-supplied list.
 *
 * <p>Items are emitted in list order. An empty list still produces the wrapper element. An absent
 * value fails serialization when {@code required}, and is treated as an empty list otherwise.
 *
 * @param tag the wrapper element name (e.g. "HostList")
 * @param itemTag the item element name (e.g. "Host")
 * @param key the caller field name
 * @param required whether the caller must supply the list
 */
public record RepeatedListField(String tag, String itemTag, String key, boolean required)
    implements FieldSpec {

  /** Validates that all names are non-null. */
  public RepeatedListField {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(itemTag, "itemTag");
    Objects.requireNonNull(key, "key");
  }

  @Override
  public FieldKind kind() {
    return FieldKind.REPEATED_LIST;
  }
}
