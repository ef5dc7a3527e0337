package ca.gc.cra.replay.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for {@code SET_SERVER} and the {@code server} option.
 *
 * <p>Accepts DNS host names (ASCII or Punycode), dotted IPv4 addresses, and IPv6 literals. Never performs name
 * resolution.</p>
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * A validated endpoint.
   *
   * @param host host name or address; IPv6 literals without brackets
   * @param port port in {@code 1..65535}
   */
  public record HostPort(String host, int port) {
    @Override
    public String toString() {
      return host.indexOf(':') >= 0 ? '[' + host + "]:" + port : host + ':' + port;
    }
  }

  /**
   * Validates a host and a port given separately.
   *
   * @param host host name, IPv4 address, or IPv6 literal (brackets optional)
   * @param port port text
   * @return validated endpoint
   * @throws IllegalArgumentException when either part is invalid
   */
  public static HostPort validate(String host, String port) {
    String normalized = validateHost(host);
    int parsedPort = Numbers.parseIntInRange("port", port, 1, 65535);
    return new HostPort(normalized, parsedPort);
  }

  /**
   * Validates a {@code host:port} string; IPv6 hosts must be bracketed.
   *
   * @param value endpoint text
   * @return validated endpoint
   * @throws IllegalArgumentException when the text is malformed
   */
  public static HostPort parseHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 1 >= sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT for IPv6 literals");
      }
      return validate(sanitized.substring(1, idx), sanitized.substring(idx + 2));
    }
    int lastColon = sanitized.lastIndexOf(':');
    if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
      throw new IllegalArgumentException("host:port must use HOST:PORT format");
    }
    String host = sanitized.substring(0, lastColon);
    if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
    }
    return validate(host, sanitized.substring(lastColon + 1));
  }

  /**
   * Validates a host name or address.
   *
   * @param host candidate host
   * @return normalized host (IPv6 without brackets)
   * @throws IllegalArgumentException when the host is malformed
   */
  public static String validateHost(String host) {
    String sanitized = Strings.requireNonBlank("host", host);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
    } else if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
    } else {
      validateHostname(sanitized);
    }
    return sanitized;
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label length in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!isAsciiAlnum(c) && c != '-') {
          throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
        }
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    for (int i = 0; i < host.length(); i++) {
      char c = host.charAt(i);
      if (!(isAsciiAlnum(c) || c == ':' || c == '.' || c == '%')) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    }
    try {
      // literal parsing only; a string containing ':' is never resolved via DNS
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
