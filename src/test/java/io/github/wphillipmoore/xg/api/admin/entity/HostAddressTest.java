package io.github.wphillipmoore.xg.api.admin.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HostAddressTest {

  @Nested
  class Fields {

    @Test
    void ipCarriesSingleAddress() {
      assertThat(new HostAddress.Ip("5.5.5.5").fields())
          .containsExactly(Map.entry("hostType", "IP"), Map.entry("ipAddress", "5.5.5.5"));
    }

    @Test
    void networkCarriesSubnet() {
      assertThat(new HostAddress.Network("25.25.25.128", "255.255.255.128").fields())
          .containsExactly(
              Map.entry("hostType", "Network"),
              Map.entry("ipAddress", "25.25.25.128"),
              Map.entry("subnet", "255.255.255.128"));
    }

    @Test
    void rangeMapsStartAndEnd() {
      assertThat(new HostAddress.Range("192.168.10.10", "192.168.10.253").fields())
          .containsExactly(
              Map.entry("hostType", "IPRange"),
              Map.entry("ipAddress", "192.168.10.10"),
              Map.entry("subnet", "192.168.10.253"));
    }

    @Test
    void listJoinsWithCommasAndNoSpaces() {
      HostAddress list = new HostAddress.IpList(List.of("1.1.1.1", "2.2.2.2", "3.3.3.3"));

      assertThat(list.hostType()).isEqualTo("IPList");
      assertThat(list.fields()).containsEntry("ipAddress", "1.1.1.1,2.2.2.2,3.3.3.3");
    }
  }

  @Nested
  class Validation {

    @Test
    void nullAddressThrows() {
      assertThatThrownBy(() -> new HostAddress.Ip(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("address");
    }

    @Test
    void blankSubnetThrows() {
      assertThatThrownBy(() -> new HostAddress.Network("10.0.0.0", " "))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("subnet must not be blank");
    }

    @Test
    void blankRangeEndThrows() {
      assertThatThrownBy(() -> new HostAddress.Range("10.0.0.1", ""))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("end must not be blank");
    }

    @Test
    void emptyListThrows() {
      assertThatThrownBy(() -> new HostAddress.IpList(List.of()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("addresses must not be empty");
    }

    @Test
    void listEntryWithCommaThrows() {
      assertThatThrownBy(() -> new HostAddress.IpList(List.of("1.1.1.1,2.2.2.2")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("must not contain ','");
    }
  }
}
