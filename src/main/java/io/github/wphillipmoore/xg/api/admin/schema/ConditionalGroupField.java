package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alternative field blocks selected by other field values.
 *
 * <p>In {@link Mode#VALUE} mode the single discriminator's value names the branch, and a value
 * with no branch is rejected. In {@link Mode#PRESENCE} mode the branch is {@value #PRESENT} when
 * every discriminator has a non-empty value and {@value #ABSENT} otherwise; a mode label with no
 * branch emits nothing.
 *
 * @param discriminators the caller field names inspected to pick a branch
 * @param mode how the discriminators select a branch
 * @param branches branch label to the fields emitted for it, in wire order
 */
public record ConditionalGroupField(
    List<String> discriminators, Mode mode, Map<String, List<FieldSpec>> branches)
    implements FieldSpec {

  /** Branch label used in presence mode when all discriminators have values. */
  public static final String PRESENT = "present";

  /** Branch label used in presence mode when any discriminator is missing. */
  public static final String ABSENT = "absent";

  /** How discriminator values select a branch. */
  public enum Mode {
    /** The discriminator value is the branch label. */
    VALUE,
    /** The branch is chosen by whether the discriminators have values. */
    PRESENCE
  }

  /** Validates the discriminators and copies the branches, preserving their order. */
  public ConditionalGroupField {
    discriminators = List.copyOf(Objects.requireNonNull(discriminators, "discriminators"));
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(branches, "branches");
    if (discriminators.isEmpty()) {
      throw new IllegalArgumentException("discriminators must not be empty");
    }
    if (mode == Mode.VALUE && discriminators.size() != 1) {
      throw new IllegalArgumentException("value mode takes exactly one discriminator");
    }
    Map<String, List<FieldSpec>> copy = new LinkedHashMap<>();
    branches.forEach((label, fields) -> copy.put(label, List.copyOf(fields)));
    branches = Collections.unmodifiableMap(copy);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.CONDITIONAL_GROUP;
  }
}
