package ca.gc.cra.tide.domain.telemetry;

import java.util.Objects;

/**
 * Network identity of the device producing readings.
 *
 * @param hostname local host name
 * @param ipAddress primary IPv4 address
 * @param macAddress hardware address as colon separated hex
 * @since 0.1.0
 */
public record DeviceIdentity(String hostname, String ipAddress, String macAddress) {
  public DeviceIdentity {
    Objects.requireNonNull(hostname, "hostname");
    Objects.requireNonNull(ipAddress, "ipAddress");
    Objects.requireNonNull(macAddress, "macAddress");
  }
}
