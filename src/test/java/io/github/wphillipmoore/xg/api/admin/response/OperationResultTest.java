package io.github.wphillipmoore.xg.api.admin.response;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OperationResultTest {

  @Test
  void toStringJoinsCodeAndMessage() {
    OperationResult result = new OperationResult("200", "Configuration applied successfully.");

    assertThat(result.toString()).isEqualTo("200 Configuration applied successfully.");
  }

  @Test
  void nullMessageThrows() {
    assertThatThrownBy(() -> new OperationResult("200", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("message");
  }
}
