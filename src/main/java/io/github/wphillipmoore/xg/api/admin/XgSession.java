package io.github.wphillipmoore.xg.api.admin;

import io.github.wphillipmoore.xg.api.admin.auth.Credentials;
import io.github.wphillipmoore.xg.api.admin.command.Command;
import io.github.wphillipmoore.xg.api.admin.command.RequestBuilder;
import io.github.wphillipmoore.xg.api.admin.entity.FirewallRule;
import io.github.wphillipmoore.xg.api.admin.entity.HostAddress;
import io.github.wphillipmoore.xg.api.admin.entity.ZoneService;
import io.github.wphillipmoore.xg.api.admin.exception.XgAuthException;
import io.github.wphillipmoore.xg.api.admin.exception.XgException;
import io.github.wphillipmoore.xg.api.admin.exception.XgMissingFieldException;
import io.github.wphillipmoore.xg.api.admin.exception.XgOperationException;
import io.github.wphillipmoore.xg.api.admin.exception.XgResponseException;
import io.github.wphillipmoore.xg.api.admin.exception.XgTransportException;
import io.github.wphillipmoore.xg.api.admin.response.OperationResult;
import io.github.wphillipmoore.xg.api.admin.response.ResponseInterpreter;
import io.github.wphillipmoore.xg.api.admin.schema.EntitySchema;
import io.github.wphillipmoore.xg.api.admin.schema.EntitySchemaCatalog;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session for the Sophos XG XML management API.
 *
 * <p>Every call builds one request document, sends it to the appliance's {@code APIController}
 * endpoint as a single GET and interprets the response. Get calls return the decoded response
 * document; Set and Remove calls return the appliance's status code and message.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * XgSession session = new XgSession.Builder(new Credentials("apiadmin", "secret"))
 *     .address("192.168.10.1")
 *     .transport(new HttpClientTransport())
 *     .verifyTls(false)
 *     .build();
 *
 * session.setIpHost("web01", new HostAddress.Ip("10.0.0.5"));
 * Map<String, Object> hosts = session.getIpHost();
 * }</pre>
 *
 * <p>Calls are independent and may be made from several threads. The diagnostic accessors report
 * the most recent call of any thread.
 */
public final class XgSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(XgSession.class);

  static final String DEFAULT_ADDRESS = "172.16.16.16";
  static final int DEFAULT_PORT = 4444;
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  static final String API_PATH = "/webconsole/APIController?reqxml=";

  static final String ENABLE = "Enable";
  static final int HTTP_OK = 200;

  private final String endpoint;
  private final XgTransport transport;
  private final boolean verifyTls;
  private final @Nullable Duration timeout;
  private final EntitySchemaCatalog catalog;
  private final RequestBuilder requestBuilder;

  private volatile @Nullable Command lastCommand;
  private volatile @Nullable String lastResponseText;

  private XgSession(Builder builder) {
    this.endpoint = "https://" + authorityHost(builder.address) + ":" + builder.port + API_PATH;
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.verifyTls = builder.verifyTls;
    this.timeout = builder.timeout;
    this.catalog = builder.catalog != null ? builder.catalog : EntitySchemaCatalog.loadDefault();
    this.requestBuilder = new RequestBuilder(builder.credentials);
  }

  /** Returns the API endpoint, up to and including {@code reqxml=}. */
  public String getEndpoint() {
    return endpoint;
  }

  /** Returns the entity catalog used to build Set requests. */
  public EntitySchemaCatalog getCatalog() {
    return catalog;
  }

  /** Returns the last command built by this session, or {@code null} before any command. */
  public @Nullable Command getLastCommand() {
    return lastCommand;
  }

  /** Returns the raw response text of the last command, or {@code null} before any response. */
  public @Nullable String getLastResponseText() {
    return lastResponseText;
  }

  // ---------------------------------------------------------------------------
  // Generic operations
  // ---------------------------------------------------------------------------

  /**
   * Retrieves all objects of an entity type.
   *
   * @param entityType the entity type tag (e.g. "IPHost"); any tag is accepted
   * @return the decoded response document, e.g. {@code {"Response": {"Login": {...}, "IPHost":
   *     [...]}}}
   * @throws XgAuthException if the appliance rejected the credentials
   * @throws XgTransportException if the appliance could not be reached
   * @throws XgResponseException if the response is not a valid response document
   */
  public Map<String, Object> query(String entityType) {
    Objects.requireNonNull(entityType, "entityType");
    Command command = requestBuilder.query(entityType);
    TransportResponse response = send(command);
    try {
      return ResponseInterpreter.interpretQuery(entityType, response.body());
    } catch (XgException e) {
      XgException failure = withHttpStatus(e, response.statusCode());
      logFailure(command, failure);
      throw failure;
    }
  }

  /**
   * Retrieves all objects of an entity type that has no catalog schema.
   *
   * @param entityType the entity type tag
   * @return the decoded response document
   * @see #query(String)
   */
  public Map<String, Object> queryCustom(String entityType) {
    return query(entityType);
  }

  /**
   * Creates or updates an object from catalog field values.
   *
   * @param entityType the entity type tag, which must be in the catalog
   * @param fields field values keyed as in the catalog
   * @return the appliance's status code and message
   * @throws IllegalArgumentException if the entity type is not in the catalog, or a value is of
   *     the wrong type or selects no branch
   * @throws XgMissingFieldException if a required field has no value and no default
   * @throws XgAuthException if the appliance rejected the credentials
   * @throws XgOperationException if the appliance rejected the operation
   * @throws XgTransportException if the appliance could not be reached
   * @throws XgResponseException if the response is not a valid response document
   */
  public OperationResult mutate(String entityType, Map<String, Object> fields) {
    EntitySchema schema = catalog.get(entityType);
    return execute(requestBuilder.mutate(schema, fields));
  }

  /**
   * Creates or updates an object of an entity type that has no catalog schema. Each entry becomes
   * one child element of the entity, in the map's iteration order; nothing is validated.
   *
   * @param entityType the entity type tag
   * @param fields element name to text
   * @return the appliance's status code and message
   */
  public OperationResult mutateCustom(String entityType, Map<String, String> fields) {
    Objects.requireNonNull(entityType, "entityType");
    return execute(requestBuilder.mutateCustom(entityType, fields));
  }

  /**
   * Removes an object by its identifying value. The catalog names the identifying element,
   * {@code Name} or {@code Hardware}.
   *
   * @param entityType the entity type tag, which must be in the catalog
   * @param key the name or hardware identifier
   * @return the appliance's status code and message
   * @throws XgMissingFieldException if the key is blank
   */
  public OperationResult delete(String entityType, String key) {
    EntitySchema schema = catalog.get(entityType);
    return execute(requestBuilder.delete(schema, key));
  }

  /**
   * Removes an object of an entity type that has no catalog schema.
   *
   * @param entityType the entity type tag
   * @param keyTag the identifying element name
   * @param key the identifier value
   * @return the appliance's status code and message
   */
  public OperationResult deleteCustom(String entityType, String keyTag, String key) {
    Objects.requireNonNull(entityType, "entityType");
    return execute(requestBuilder.deleteCustom(entityType, keyTag, key));
  }

  // ---------------------------------------------------------------------------
  // Get convenience methods
  // ---------------------------------------------------------------------------

  /** Retrieves all IP host objects. */
  public Map<String, Object> getIpHost() {
    return query("IPHost");
  }

  /** Retrieves all IP host groups. */
  public Map<String, Object> getIpHostGroup() {
    return query("IPHostGroup");
  }

  /** Retrieves all physical and virtual interfaces. */
  public Map<String, Object> getInterfaces() {
    return query("Interface");
  }

  /** Retrieves all VLAN interfaces. */
  public Map<String, Object> getVlans() {
    return query("VLAN");
  }

  /** Retrieves all link aggregation groups. */
  public Map<String, Object> getLags() {
    return query("LAG");
  }

  /** Retrieves all bridge pairs. */
  public Map<String, Object> getBridges() {
    return query("BridgePair");
  }

  /** Retrieves all zones. */
  public Map<String, Object> getZones() {
    return query("Zone");
  }

  /** Retrieves all IPS policies. */
  public Map<String, Object> getIpsPolicies() {
    return query("IPSPolicy");
  }

  /** Retrieves all firewall rules. */
  public Map<String, Object> getFirewallRules() {
    return query("FirewallRule");
  }

  /** Retrieves all static unicast routes. */
  public Map<String, Object> getUnicastRoutes() {
    return query("UnicastRoute");
  }

  /** Retrieves the local service access control list. */
  public Map<String, Object> getLocalServiceAcl() {
    return query("LocalServiceACL");
  }

  /** Retrieves the administration settings. */
  public Map<String, Object> getAdminSettings() {
    return query("AdminSettings");
  }

  /** Retrieves all service objects. */
  public Map<String, Object> getServices() {
    return query("Services");
  }

  /** Retrieves the system services settings. */
  public Map<String, Object> getSystemServices() {
    return query("SystemServices");
  }

  /** Retrieves the central management settings. */
  public Map<String, Object> getCentralManagement() {
    return query("CentralManagement");
  }

  /** Retrieves the notification settings. */
  public Map<String, Object> getNotification() {
    return query("Notification");
  }

  /** Retrieves the configured syslog servers. */
  public Map<String, Object> getSyslogServers() {
    return query("SyslogServers");
  }

  // ---------------------------------------------------------------------------
  // Set convenience methods
  // ---------------------------------------------------------------------------

  /**
   * Creates or updates an IPv4 host object.
   *
   * @param name the object name
   * @param address the address, network, range or list the object describes
   * @return the appliance's status code and message
   */
  public OperationResult setIpHost(String name, HostAddress address) {
    return setIpHost(name, address, "IPv4");
  }

  /**
   * Creates or updates a host object.
   *
   * @param name the object name
   * @param address the address, network, range or list the object describes
   * @param ipFamily "IPv4" or "IPv6"
   * @return the appliance's status code and message
   */
  public OperationResult setIpHost(String name, HostAddress address, String ipFamily) {
    Objects.requireNonNull(address, "address");
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", Objects.requireNonNull(name, "name"));
    fields.put("ipFamily", Objects.requireNonNull(ipFamily, "ipFamily"));
    fields.putAll(address.fields());
    return mutate("IPHost", fields);
  }

  /**
   * Creates or updates an IPv4 host group with no description.
   *
   * @param name the group name
   * @param hosts the member host object names, in order
   * @return the appliance's status code and message
   */
  public OperationResult setIpHostGroup(String name, List<String> hosts) {
    return setIpHostGroup(name, hosts, "", "IPv4");
  }

  /**
   * Creates or updates a host group.
   *
   * @param name the group name
   * @param hosts the member host object names, in order
   * @param description the group description
   * @param ipFamily "IPv4" or "IPv6"
   * @return the appliance's status code and message
   */
  public OperationResult setIpHostGroup(
      String name, List<String> hosts, String description, String ipFamily) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", Objects.requireNonNull(name, "name"));
    fields.put("ipFamily", Objects.requireNonNull(ipFamily, "ipFamily"));
    fields.put("description", Objects.requireNonNull(description, "description"));
    fields.put("hosts", List.copyOf(Objects.requireNonNull(hosts, "hosts")));
    return mutate("IPHostGroup", fields);
  }

  /**
   * Creates or updates a VLAN sub-interface with a static IPv4 address. The interface is named
   * {@code <interfaceName>.<vlanId>}, e.g. {@code PortD.1004}.
   *
   * @param interfaceName the parent physical or virtual interface
   * @param vlanId the VLAN number
   * @param zone the zone the VLAN belongs to
   * @param ipAddress the IPv4 address
   * @param netmask the network mask
   * @return the appliance's status code and message
   */
  public OperationResult setVlan(
      String interfaceName, String vlanId, String zone, String ipAddress, String netmask) {
    Objects.requireNonNull(interfaceName, "interfaceName");
    Objects.requireNonNull(vlanId, "vlanId");
    String hardware = vlanHardware(interfaceName, vlanId);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", hardware);
    fields.put("hardware", hardware);
    fields.put("interface", interfaceName);
    fields.put("zone", Objects.requireNonNull(zone, "zone"));
    fields.put("vlanId", vlanId);
    fields.put("ipAddress", Objects.requireNonNull(ipAddress, "ipAddress"));
    fields.put("netmask", Objects.requireNonNull(netmask, "netmask"));
    return mutate("VLAN", fields);
  }

  /**
   * Creates or updates an 802.3ad (LACP) link aggregation group.
   *
   * @param name the LAG name, also used as its hardware name
   * @param interfaces the member interfaces, in order
   * @param zone the zone the LAG belongs to
   * @param ipAddress the IPv4 address
   * @param netmask the network mask
   * @return the appliance's status code and message
   */
  public OperationResult setLag(
      String name, List<String> interfaces, String zone, String ipAddress, String netmask) {
    return setLag(name, interfaces, zone, ipAddress, netmask, "802.3ad(LACP)");
  }

  /**
   * Creates or updates a link aggregation group.
   *
   * @param name the LAG name, also used as its hardware name
   * @param interfaces the member interfaces, in order
   * @param zone the zone the LAG belongs to
   * @param ipAddress the IPv4 address
   * @param netmask the network mask
   * @param mode "802.3ad(LACP)" or "ActiveBackup"
   * @return the appliance's status code and message
   * @throws IllegalArgumentException if the mode is not supported
   */
  public OperationResult setLag(
      String name,
      List<String> interfaces,
      String zone,
      String ipAddress,
      String netmask,
      String mode) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", Objects.requireNonNull(name, "name"));
    fields.put("hardware", name);
    fields.put("interfaces", List.copyOf(Objects.requireNonNull(interfaces, "interfaces")));
    fields.put("mode", Objects.requireNonNull(mode, "mode"));
    fields.put("zone", Objects.requireNonNull(zone, "zone"));
    fields.put("ipAddress", Objects.requireNonNull(ipAddress, "ipAddress"));
    fields.put("netmask", Objects.requireNonNull(netmask, "netmask"));
    return mutate("LAG", fields);
  }

  /**
   * Creates or updates a bridge pair without an IPv4 configuration.
   *
   * @param name the bridge name, also used as its hardware name
   * @param members interface to zone, in bridge order
   * @return the appliance's status code and message
   */
  public OperationResult setBridge(String name, Map<String, String> members) {
    return setBridge(name, members, null, null, null);
  }

  /**
   * Creates or updates a bridge pair. The IPv4 block, with a gateway named {@code GW for <name>},
   * is sent only when the address, netmask and gateway are all given.
   *
   * @param name the bridge name, also used as its hardware name
   * @param members interface to zone, in bridge order
   * @param ipAddress the IPv4 address, or {@code null}
   * @param netmask the network mask, or {@code null}
   * @param gateway the gateway IPv4 address, or {@code null}
   * @return the appliance's status code and message
   */
  public OperationResult setBridge(
      String name,
      Map<String, String> members,
      @Nullable String ipAddress,
      @Nullable String netmask,
      @Nullable String gateway) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(members, "members");
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", name);
    fields.put("hardware", name);
    fields.put("description", members.size() + " Bridges");
    fields.put("members", new LinkedHashMap<>(members));
    putIfPresent(fields, "ipAddress", ipAddress);
    putIfPresent(fields, "netmask", netmask);
    putIfPresent(fields, "gateway", gateway);
    fields.put("gatewayName", "GW for " + name);
    return mutate("BridgePair", fields);
  }

  /**
   * Creates or updates a LAN zone with no appliance access enabled.
   *
   * @param name the zone name
   * @param description the zone description
   * @return the appliance's status code and message
   */
  public OperationResult setZone(String name, String description) {
    return setZone(name, description, "LAN", EnumSet.noneOf(ZoneService.class));
  }

  /**
   * Creates or updates a zone.
   *
   * @param name the zone name
   * @param description the zone description
   * @param type the zone type, e.g. "LAN" or "DMZ"
   * @param enabledServices the appliance services reachable from the zone; all others are disabled
   * @return the appliance's status code and message
   */
  public OperationResult setZone(
      String name, String description, String type, Set<ZoneService> enabledServices) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", Objects.requireNonNull(name, "name"));
    fields.put("type", Objects.requireNonNull(type, "type"));
    fields.put("description", Objects.requireNonNull(description, "description"));
    for (ZoneService service : Objects.requireNonNull(enabledServices, "enabledServices")) {
      fields.put(service.fieldKey(), ENABLE);
    }
    return mutate("Zone", fields);
  }

  /**
   * Creates or updates an IPS policy from a template.
   *
   * @param name the policy name
   * @param template the template policy to copy
   * @return the appliance's status code and message
   */
  public OperationResult setIpsPolicy(String name, String template) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", Objects.requireNonNull(name, "name"));
    fields.put("template", Objects.requireNonNull(template, "template"));
    return mutate("IPSPolicy", fields);
  }

  /**
   * Creates or updates a firewall rule.
   *
   * @param rule the rule definition
   * @return the appliance's status code and message
   */
  public OperationResult setFirewallRule(FirewallRule rule) {
    Objects.requireNonNull(rule, "rule");
    return mutate("FirewallRule", rule.fields());
  }

  // ---------------------------------------------------------------------------
  // Remove convenience methods
  // ---------------------------------------------------------------------------

  /** Removes a host object by name. */
  public OperationResult deleteIpHost(String name) {
    return delete("IPHost", name);
  }

  /** Removes a host group by name. */
  public OperationResult deleteIpHostGroup(String name) {
    return delete("IPHostGroup", name);
  }

  /** Removes a VLAN by hardware name, e.g. {@code PortD.1004}. */
  public OperationResult deleteVlan(String hardware) {
    return delete("VLAN", hardware);
  }

  /** Removes a link aggregation group by hardware name. */
  public OperationResult deleteLag(String hardware) {
    return delete("LAG", hardware);
  }

  /** Removes a bridge pair by hardware name. */
  public OperationResult deleteBridge(String hardware) {
    return delete("BridgePair", hardware);
  }

  /** Removes a zone by name. */
  public OperationResult deleteZone(String name) {
    return delete("Zone", name);
  }

  /** Removes an IPS policy by name. */
  public OperationResult deleteIpsPolicy(String name) {
    return delete("IPSPolicy", name);
  }

  /** Removes a firewall rule by name. */
  public OperationResult deleteFirewallRule(String name) {
    return delete("FirewallRule", name);
  }

  // ---------------------------------------------------------------------------
  // Internals
  // ---------------------------------------------------------------------------

  /** Brackets an IPv6 literal so it can stand in a URL authority. */
  static String authorityHost(String address) {
    if (address.indexOf(':') >= 0 && !address.startsWith("[")) {
      return "[" + address + "]";
    }
    return address;
  }

  static String vlanHardware(String interfaceName, String vlanId) {
    return interfaceName + "." + vlanId;
  }

  private OperationResult execute(Command command) {
    TransportResponse response = send(command);
    try {
      OperationResult result =
          ResponseInterpreter.interpretStatus(
              command.operation(), command.entityType(), response.body());
      LOGGER.debug(
          "{} {} succeeded: {}", command.operation().wireName(), command.entityType(), result);
      return result;
    } catch (XgException e) {
      XgException failure = withHttpStatus(e, response.statusCode());
      logFailure(command, failure);
      throw failure;
    }
  }

  private TransportResponse send(Command command) {
    lastCommand = command;
    String url = endpoint + URLEncoder.encode(command.toXml(), StandardCharsets.UTF_8);
    LOGGER.debug(
        "Sending {} {} to {}", command.operation().wireName(), command.entityType(), endpoint);
    TransportResponse response;
    try {
      response = transport.get(url, timeout, verifyTls);
    } catch (XgTransportException e) {
      logFailure(command, e);
      throw e;
    }
    lastResponseText = response.body();
    return response;
  }

  /**
   * Adds the HTTP status to a response that could not be read as an API document. Anything other
   * than 200 there usually means the reply came from something other than the API, such as a proxy.
   */
  static XgException withHttpStatus(XgException e, int statusCode) {
    if (!(e instanceof XgResponseException responseError) || statusCode == HTTP_OK) {
      return e;
    }
    return new XgResponseException(
        responseError.getMessage() + " (HTTP " + statusCode + ")",
        responseError.getResponseText(),
        responseError);
  }

  private static void logFailure(Command command, XgException e) {
    LOGGER.warn(
        "{} {} failed ({}): {}",
        command.operation().wireName(),
        command.entityType(),
        e.getClass().getSimpleName(),
        e.getMessage());
  }

  private static void putIfPresent(Map<String, Object> fields, String key, @Nullable String value) {
    if (value != null) {
      fields.put(key, value);
    }
  }

  /** Builder for {@link XgSession}. */
  public static final class Builder {

    private final Credentials credentials;
    private String address = DEFAULT_ADDRESS;
    private int port = DEFAULT_PORT;
    private @Nullable XgTransport transport;
    private boolean verifyTls = true;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;
    private @Nullable EntitySchemaCatalog catalog;

    /**
     * Creates a builder with the required session parameters.
     *
     * @param credentials the API administrator credentials
     */
    public Builder(Credentials credentials) {
      this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /**
     * Sets the appliance IP address or host name. Defaults to 172.16.16.16. IPv6 literals may be
     * given with or without brackets.
     *
     * @throws IllegalArgumentException if the address is blank or cannot form a URL authority
     */
    public Builder address(String address) {
      Objects.requireNonNull(address, "address");
      if (address.isBlank()) {
        throw new IllegalArgumentException("address must not be blank");
      }
      String host = authorityHost(address);
      try {
        URI uri = new URI("https://" + host + ":" + DEFAULT_PORT + "/").parseServerAuthority();
        if (!host.equalsIgnoreCase(uri.getHost()) || uri.getPort() != DEFAULT_PORT) {
          throw new IllegalArgumentException("Invalid appliance address: " + address);
        }
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Invalid appliance address: " + address, e);
      }
      this.address = address;
      return this;
    }

    /** Sets the appliance admin port. Defaults to 4444. */
    public Builder port(int port) {
      if (port < 1 || port > 65_535) {
        throw new IllegalArgumentException("port must be between 1 and 65535 but was " + port);
      }
      this.port = port;
      return this;
    }

    /** Sets the transport implementation. Required before calling {@link #build()}. */
    public Builder transport(XgTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets whether to verify TLS certificates. Defaults to {@code true}. */
    public Builder verifyTls(boolean verifyTls) {
      this.verifyTls = verifyTls;
      return this;
    }

    /**
     * Sets the request timeout. Defaults to 30 seconds. Pass {@code null} for no timeout.
     *
     * @throws IllegalArgumentException if the timeout is zero or negative
     */
    public Builder timeout(@Nullable Duration timeout) {
      if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
        throw new IllegalArgumentException("timeout must be positive but was " + timeout);
      }
      this.timeout = timeout;
      return this;
    }

    /** Sets the entity catalog. Defaults to the built-in catalog. */
    public Builder catalog(EntitySchemaCatalog catalog) {
      this.catalog = Objects.requireNonNull(catalog, "catalog");
      return this;
    }

    /**
     * Builds the session.
     *
     * @return the configured session
     * @throws NullPointerException if transport has not been set
     */
    public XgSession build() {
      Objects.requireNonNull(transport, "transport");
      return new XgSession(this);
    }
  }
}
