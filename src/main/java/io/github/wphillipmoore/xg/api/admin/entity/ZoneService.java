package io.github.wphillipmoore.xg.api.admin.entity;

/**
 * Appliance services that can be opened to a zone.
 *
 * <p>Each constant names the Zone catalog field that carries its {@code Enable}/{@code Disable}
 * value.
 */
public enum ZoneService {
  HTTPS("https"),
  SSH("ssh"),
  CLIENT_AUTHENTICATION("clientAuthentication"),
  CAPTIVE_PORTAL("captivePortal"),
  NTLM("ntlm"),
  RADIUS_SSO("radiusSso"),
  DNS("dns"),
  PING("ping"),
  WEB_PROXY("webProxy"),
  SSL_VPN("sslVpn"),
  USER_PORTAL("userPortal"),
  DYNAMIC_ROUTING("dynamicRouting"),
  SMTP_RELAY("smtpRelay"),
  SNMP("snmp");

  private final String fieldKey;

  ZoneService(String fieldKey) {
    this.fieldKey = fieldKey;
  }

  /** Returns the Zone catalog field key for this service. */
  public String fieldKey() {
    return fieldKey;
  }
}
