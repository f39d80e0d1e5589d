package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A single element whose text comes from a caller value, a default, or a constant.
 *
 * <p>When {@code constant} is set the element always carries it and {@code key} is ignored.
 * Otherwise the caller value under {@code key} wins over {@code defaultValue}. With neither, a
 * {@code required} field fails serialization and an optional one is omitted.
 *
 * @param tag the element name, never null
 * @param key the caller field name, or null for a constant field
 * @param defaultValue the value used when the caller supplies none, or null
 * @param constant the fixed element text, or null
 * @param required whether a value must be available
 */
public record ScalarField(
    String tag,
    @Nullable String key,
    @Nullable String defaultValue,
    @Nullable String constant,
    boolean required)
    implements FieldSpec {

  /** Validates that the field has a tag and either a key or a constant. */
  public ScalarField {
    Objects.requireNonNull(tag, "tag");
    if (key == null && constant == null) {
      throw new IllegalArgumentException("Scalar field " + tag + " needs a key or a constant");
    }
  }

  /** Creates a required field with no default. */
  public static ScalarField of(String tag, String key) {
    return new ScalarField(tag, key, null, null, true);
  }

  /** Creates a field that falls back to a default value. */
  public static ScalarField withDefault(String tag, String key, String defaultValue) {
    return new ScalarField(tag, key, defaultValue, null, true);
  }

  /** Creates a field that is omitted when the caller supplies no value. */
  public static ScalarField optional(String tag, String key) {
    return new ScalarField(tag, key, null, null, false);
  }

  /** Creates a field with fixed text. */
  public static ScalarField fixed(String tag, String text) {
    return new ScalarField(tag, null, null, text, true);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.SCALAR;
  }
}
