package io.github.wphillipmoore.xg.api.admin.entity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Address of an IP host object, one variant per appliance host type.
 *
 * <p>Each variant carries exactly the values its host type needs and validates them on
 * construction, so a host cannot be built with, say, a range end but no range start.
 */
public sealed interface HostAddress
    permits HostAddress.Ip, HostAddress.Network, HostAddress.Range, HostAddress.IpList {

  /** Returns the appliance {@code HostType} value for this variant. */
  String hostType();

  /**
   * Returns the IPHost field values for this address, keyed as in the entity catalog.
   *
   * @return an ordered map with {@code hostType} and the variant's address fields
   */
  Map<String, Object> fields();

  /**
   * A single address.
   *
   * @param address the IP address, e.g. "5.5.5.5"
   */
  record Ip(String address) implements HostAddress {

    /** Validates the address. */
    public Ip {
      requireText(address, "address");
    }

    @Override
    public String hostType() {
      return "IP";
    }

    @Override
    public Map<String, Object> fields() {
      return toFields(hostType(), address, null);
    }
  }

  /**
   * A network given by address and subnet mask. The appliance does not check the mask's format.
   *
   * @param address the network address, e.g. "25.25.25.128"
   * @param subnet the subnet mask, e.g. "255.255.255.128"
   */
  record Network(String address, String subnet) implements HostAddress {

    /** Validates the address and subnet. */
    public Network {
      requireText(address, "address");
      requireText(subnet, "subnet");
    }

    @Override
    public String hostType() {
      return "Network";
    }

    @Override
    public Map<String, Object> fields() {
      return toFields(hostType(), address, subnet);
    }
  }

  /**
   * An inclusive address range.
   *
   * @param start the first address
   * @param end the last address
   */
  record Range(String start, String end) implements HostAddress {

    /** Validates both ends of the range. */
    public Range {
      requireText(start, "start");
      requireText(end, "end");
    }

    @Override
    public String hostType() {
      return "IPRange";
    }

    @Override
    public Map<String, Object> fields() {
      return toFields(hostType(), start, end);
    }
  }

  /**
   * A list of individual addresses.
   *
   * @param addresses the addresses, at least one
   */
  record IpList(List<String> addresses) implements HostAddress {

    /** Validates and copies the addresses. */
    public IpList {
      addresses = List.copyOf(Objects.requireNonNull(addresses, "addresses"));
      if (addresses.isEmpty()) {
        throw new IllegalArgumentException("addresses must not be empty");
      }
      for (String address : addresses) {
        requireText(address, "addresses");
        if (address.contains(",")) {
          throw new IllegalArgumentException("address must not contain ',': " + address);
        }
      }
    }

    @Override
    public String hostType() {
      return "IPList";
    }

    /** The appliance takes the list as one comma-separated value with no spaces. */
    @Override
    public Map<String, Object> fields() {
      return toFields(hostType(), String.join(",", addresses), null);
    }
  }

  private static Map<String, Object> toFields(
      String hostType, String address, @Nullable String subnet) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("hostType", hostType);
    fields.put("ipAddress", address);
    if (subnet != null) {
      fields.put("subnet", subnet);
    }
    return fields;
  }

  private static void requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
