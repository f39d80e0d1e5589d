package io.github.wphillipmoore.xg.api.admin.schema;

import io.github.wphillipmoore.xg.api.admin.exception.XgMissingFieldException;
import io.github.wphillipmoore.xg.api.admin.xml.XmlElement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Renders entity fields into request elements.
 *
 * <p>One serializer is created per request body. It reads caller values by field key and records
 * every scalar value it emits, so a later {@link ConditionalGroupField} sees defaults that were
 * applied to earlier siblings (an omitted {@code hostType} selects the {@code IP} branch because
 * {@code HostType} defaulted to {@code IP}).
 *
 * <p>Accepted caller value types are {@link String} for scalars, a {@link List} of strings for
 * repeated lists and a {@link Map} of strings for nested groups. Anything else is rejected with
 * {@link IllegalArgumentException}.
 */
public final class FieldSerializer {

  private final String entityType;
  private final Map<String, Object> values;
  private final Map<String, String> emitted = new LinkedHashMap<>();

  /**
   * Creates a serializer for one request body.
   *
   * @param entityType the entity type tag, used in error reports
   * @param values caller field values by key; not copied, must not change during serialization
   */
  public FieldSerializer(String entityType, Map<String, Object> values) {
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.values = Objects.requireNonNull(values, "values");
  }

  /**
   * Appends every field, in order, to the parent element.
   *
   * @param fields the fields to render
   * @param parent the element receiving the rendered fields
   * @throws XgMissingFieldException if a required field has no value and no default
   */
  public void appendAll(List<FieldSpec> fields, XmlElement parent) {
    for (FieldSpec field : fields) {
      append(field, parent);
    }
  }

  /**
   * Appends one field to the parent element.
   *
   * @param field the field to render
   * @param parent the element receiving the rendered field
   * @throws XgMissingFieldException if a required field has no value and no default
   */
  public void append(FieldSpec field, XmlElement parent) {
    if (field instanceof ScalarField scalar) {
      appendScalar(scalar, parent);
    } else if (field instanceof RepeatedListField list) {
      appendList(list, parent);
    } else if (field instanceof NestedGroupField nested) {
      appendNested(nested, parent);
    } else if (field instanceof GroupField group) {
      appendAll(group.fields(), parent.appendChild(group.tag()));
    } else if (field instanceof ConditionalGroupField conditional) {
      appendAll(selectBranch(conditional), parent);
    }
  }

  private void appendScalar(ScalarField field, XmlElement parent) {
    String text = field.constant();
    if (text == null) {
      String key = Objects.requireNonNull(field.key(), "key");
      text = stringValue(key);
      if (text == null) {
        text = field.defaultValue();
      }
      if (text == null) {
        if (field.required()) {
          throw new XgMissingFieldException(entityType, key);
        }
        return;
      }
      emitted.put(key, text);
    }
    parent.appendChild(field.tag(), text);
  }

  private void appendList(RepeatedListField field, XmlElement parent) {
    Object value = values.get(field.key());
    if (value == null && field.required()) {
      throw new XgMissingFieldException(entityType, field.key());
    }
    XmlElement wrapper = parent.appendChild(field.tag());
    if (value == null) {
      return;
    }
    if (!(value instanceof List<?> items)) {
      throw new IllegalArgumentException(
          "Field '" + field.key() + "' of " + entityType + " must be a list of strings");
    }
    for (Object item : items) {
      wrapper.appendChild(field.itemTag(), requireString(field.key(), item));
    }
  }

  private void appendNested(NestedGroupField field, XmlElement parent) {
    Object value = values.get(field.key());
    if (value == null && field.required()) {
      throw new XgMissingFieldException(entityType, field.key());
    }
    XmlElement wrapper = parent.appendChild(field.tag());
    if (value == null) {
      return;
    }
    if (!(value instanceof Map<?, ?> pairs)) {
      throw new IllegalArgumentException(
          "Field '" + field.key() + "' of " + entityType + " must be a map of strings");
    }
    for (Map.Entry<?, ?> pair : pairs.entrySet()) {
      XmlElement entry = wrapper.appendChild(field.entryTag());
      entry.appendChild(field.keyTag(), requireString(field.key(), pair.getKey()));
      entry.appendChild(field.valueTag(), requireString(field.key(), pair.getValue()));
    }
  }

  private List<FieldSpec> selectBranch(ConditionalGroupField field) {
    if (field.mode() == ConditionalGroupField.Mode.PRESENCE) {
      boolean allPresent = true;
      for (String discriminator : field.discriminators()) {
        String value = resolve(discriminator);
        if (value == null || value.isEmpty()) {
          allPresent = false;
          break;
        }
      }
      String label = allPresent ? ConditionalGroupField.PRESENT : ConditionalGroupField.ABSENT;
      return field.branches().getOrDefault(label, List.of());
    }

    String discriminator = field.discriminators().get(0);
    String value = resolve(discriminator);
    if (value == null) {
      throw new XgMissingFieldException(entityType, discriminator);
    }
    List<FieldSpec> branch = field.branches().get(value);
    if (branch == null) {
      throw new IllegalArgumentException(
          "Unsupported "
              + discriminator
              + " '"
              + value
              + "' for "
              + entityType
              + "; expected one of "
              + new ArrayList<>(field.branches().keySet()));
    }
    return branch;
  }

  private @Nullable String resolve(String key) {
    String value = emitted.get(key);
    return value != null ? value : stringValue(key);
  }

  private @Nullable String stringValue(String key) {
    Object value = values.get(key);
    return value == null ? null : requireString(key, value);
  }

  private String requireString(String key, @Nullable Object value) {
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException(
        "Field '"
            + key
            + "' of "
            + entityType
            + " must be a string but was "
            + (value == null ? "null" : value.getClass().getSimpleName()));
  }
}
