package com.festivalplatform.integration.webhookhttp;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Objects;

/**
 * Rejects webhook targets that are not plain http(s) URLs or that resolve to loopback, private,
 * link-local or otherwise internal addresses. The insecure flag disables both the HTTPS
 * requirement and the address checks and must only be set for local development.
 */
public class WebhookUrlValidator {
  private final boolean allowInsecure;
  private final HostResolver hostResolver;

  public WebhookUrlValidator(boolean allowInsecure) {
    this(allowInsecure, HostResolver.SYSTEM);
  }

  public WebhookUrlValidator(boolean allowInsecure, HostResolver hostResolver) {
    this.allowInsecure = allowInsecure;
    this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver must not be null");
  }

  /** Checks scheme, host and HTTPS policy without touching DNS. */
  public URI validateFormat(String rawUrl) {
    if (rawUrl == null || rawUrl.isBlank()) {
      throw new WebhookUrlRejectedException("Webhook URL must not be blank");
    }
    URI uri;
    try {
      uri = new URI(rawUrl.trim());
    } catch (URISyntaxException ex) {
      throw new WebhookUrlRejectedException("Invalid webhook URL: " + ex.getMessage());
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new WebhookUrlRejectedException("Webhook URL scheme must be http or https");
    }
    if (!allowInsecure && !scheme.equals("https")) {
      throw new WebhookUrlRejectedException("Webhook URL must use HTTPS");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new WebhookUrlRejectedException("Webhook URL must include a host");
    }
    if (uri.getRawUserInfo() != null) {
      throw new WebhookUrlRejectedException("Webhook URL must not embed credentials");
    }
    return uri;
  }

  public URI validate(String rawUrl) {
    URI uri = validateFormat(rawUrl);
    if (allowInsecure) {
      return uri;
    }
    String host = stripBrackets(uri.getHost());
    InetAddress[] addresses;
    try {
      addresses = hostResolver.resolve(host);
    } catch (UnknownHostException ex) {
      throw new WebhookUrlRejectedException("Unable to resolve webhook host " + host, true, ex);
    }
    if (addresses == null || addresses.length == 0) {
      throw new WebhookUrlRejectedException("Unable to resolve webhook host " + host, true, null);
    }
    for (InetAddress address : addresses) {
      if (isBlocked(address)) {
        throw new WebhookUrlRejectedException(
            "Webhook host " + host + " resolves to a blocked address " + address.getHostAddress());
      }
    }
    return uri;
  }

  static boolean isBlocked(InetAddress address) {
    if (address.isLoopbackAddress()
        || address.isAnyLocalAddress()
        || address.isLinkLocalAddress()
        || address.isSiteLocalAddress()
        || address.isMulticastAddress()) {
      return true;
    }
    byte[] raw = address.getAddress();
    if (address instanceof Inet4Address) {
      int first = raw[0] & 0xFF;
      int second = raw[1] & 0xFF;
      // 0.0.0.0/8 and carrier-grade NAT 100.64.0.0/10
      return first == 0 || (first == 100 && second >= 64 && second <= 127);
    }
    if (address instanceof Inet6Address) {
      // unique local fc00::/7
      return (raw[0] & 0xFE) == 0xFC;
    }
    return false;
  }

  private static String stripBrackets(String host) {
    if (host.startsWith("[") && host.endsWith("]")) {
      return host.substring(1, host.length() - 1);
    }
    return host;
  }
}
