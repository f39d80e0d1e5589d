package io.github.wphillipmoore.xg.api.admin.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A firewall rule definition for the {@code FirewallRule} entity.
 *
 * <p>Only the values set on the {@link Builder} are sent; everything else takes the catalog
 * default (enabled, IPv4, top of the rule list, traffic logged, virus scanning on). Setting a
 * {@link Builder#matchIdentity matched identity} turns the rule into a user policy.
 *
 * <pre>{@code
 * FirewallRule rule = new FirewallRule.Builder("Allow-DNS", "Accept")
 *     .sourceZones(List.of("LAN"))
 *     .destinationZones(List.of("WAN"))
 *     .services(List.of("DNS"))
 *     .build();
 * }</pre>
 */
public final class FirewallRule {

  static final String ENABLE = "Enable";
  static final String DISABLE = "Disable";

  private final String name;
  private final Map<String, Object> fields;

  private FirewallRule(Builder builder) {
    this.name = builder.name;
    Map<String, Object> copy = new LinkedHashMap<>(builder.fields);
    this.fields = Collections.unmodifiableMap(copy);
  }

  /** Returns the rule name. */
  public String getName() {
    return name;
  }

  /**
   * Returns the rule's field values, keyed as in the entity catalog.
   *
   * @return an unmodifiable, ordered map
   */
  public Map<String, Object> fields() {
    return fields;
  }

  private static String toggle(boolean enabled) {
    return enabled ? ENABLE : DISABLE;
  }

  /** Builder for {@link FirewallRule}. */
  public static final class Builder {

    private final String name;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /**
     * Creates a builder with the required rule values.
     *
     * @param name the rule name
     * @param action the rule action, e.g. "Accept", "Drop" or "Reject"
     */
    public Builder(String name, String action) {
      this.name = Objects.requireNonNull(name, "name");
      fields.put("name", name);
      fields.put("action", Objects.requireNonNull(action, "action"));
    }

    /** Sets the rule description. */
    public Builder description(String description) {
      return put("description", description);
    }

    /** Sets whether the rule is active. Defaults to enabled. */
    public Builder enabled(boolean enabled) {
      return put("status", toggle(enabled));
    }

    /** Sets the IP family, "IPv4" or "IPv6". Defaults to IPv4. */
    public Builder ipFamily(String ipFamily) {
      return put("ipFamily", ipFamily);
    }

    /** Sets the rule position, e.g. "top" or "bottom". Defaults to top. */
    public Builder position(String position) {
      return put("position", position);
    }

    /** Sets the source zones, in evaluation order. */
    public Builder sourceZones(List<String> zones) {
      return putList("sourceZones", zones);
    }

    /** Sets the source network objects. */
    public Builder sourceNetworks(List<String> networks) {
      return putList("sourceNetworks", networks);
    }

    /** Sets the service objects matched by the rule. */
    public Builder services(List<String> services) {
      return putList("services", services);
    }

    /** Sets the schedule name. Defaults to "All The Time". */
    public Builder schedule(String schedule) {
      return put("schedule", schedule);
    }

    /** Sets the destination zones, in evaluation order. */
    public Builder destinationZones(List<String> zones) {
      return putList("destinationZones", zones);
    }

    /** Sets the destination network objects. */
    public Builder destinationNetworks(List<String> networks) {
      return putList("destinationNetworks", networks);
    }

    /** Sets whether matched traffic is logged. Defaults to enabled. */
    public Builder logTraffic(boolean logTraffic) {
      return put("logTraffic", toggle(logTraffic));
    }

    /** Sets whether locally destined traffic skips the rule. Defaults to disabled. */
    public Builder skipLocalDestined(boolean skip) {
      return put("skipLocalDestined", toggle(skip));
    }

    /**
     * Makes this a user policy matching the given identity. Without it the rule is a network
     * policy and the identity settings below are not sent.
     */
    public Builder matchIdentity(String matchIdentity) {
      return put("matchIdentity", matchIdentity);
    }

    /** Sets the users and groups matched by a user policy. */
    public Builder identityMembers(List<String> members) {
      return putList("identityMembers", members);
    }

    /** Sets whether unidentified users are shown the captive portal. Defaults to enabled. */
    public Builder showCaptivePortal(boolean show) {
      return put("showCaptivePortal", toggle(show));
    }

    /** Sets whether user traffic is accounted. Defaults to disabled. */
    public Builder dataAccounting(boolean accounting) {
      return put("dataAccounting", toggle(accounting));
    }

    /** Sets the web filter policy name. Defaults to "None". */
    public Builder webFilter(String policy) {
      return put("webFilter", policy);
    }

    /** Sets the application control policy name. Defaults to "None". */
    public Builder applicationControl(String policy) {
      return put("applicationControl", policy);
    }

    /** Sets the intrusion prevention policy name. Defaults to "None". */
    public Builder intrusionPrevention(String policy) {
      return put("intrusionPrevention", policy);
    }

    /** Sets the traffic shaping policy name. Defaults to "None". */
    public Builder trafficShapingPolicy(String policy) {
      return put("trafficShapingPolicy", policy);
    }

    /** Sets whether traffic is scanned for viruses. Defaults to enabled. */
    public Builder scanVirus(boolean scan) {
      return put("scanVirus", toggle(scan));
    }

    /** Sets whether Sandstorm analysis is applied. Defaults to enabled. */
    public Builder sandstorm(boolean sandstorm) {
      return put("sandstorm", toggle(sandstorm));
    }

    /** Sets whether HTTPS is decrypted and scanned. Defaults to disabled. */
    public Builder decryptHttps(boolean decrypt) {
      return put("decryptHttps", toggle(decrypt));
    }

    /**
     * Sets any other catalog field of the rule, such as {@code "scanSmtp"} or {@code
     * "blockQuickQuic"}.
     *
     * @param key the catalog field key
     * @param value the element text
     * @return this builder
     */
    public Builder option(String key, String value) {
      return put(key, value);
    }

    /**
     * Builds the rule.
     *
     * @return the rule definition
     */
    public FirewallRule build() {
      return new FirewallRule(this);
    }

    private Builder put(String key, String value) {
      fields.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, key));
      return this;
    }

    private Builder putList(String key, List<String> values) {
      fields.put(key, List.copyOf(Objects.requireNonNull(values, key)));
      return this;
    }
  }
}
