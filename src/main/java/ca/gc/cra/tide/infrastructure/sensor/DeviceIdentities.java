package ca.gc.cra.tide.infrastructure.sensor;

import ca.gc.cra.tide.domain.telemetry.DeviceIdentity;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Looks up the host name, address and hardware address stamped on every reading. */
public final class DeviceIdentities {
  private static final Logger log = LoggerFactory.getLogger(DeviceIdentities.class);

  static final String UNKNOWN_HOST = "unknown";
  static final String LOOPBACK = "127.0.0.1";
  static final String NO_MAC = "00:00:00:00:00:00";

  private DeviceIdentities() {}

  /**
   * Detects the local identity, falling back to placeholders for anything the host does not expose.
   *
   * @return device identity
   */
  public static DeviceIdentity detect() {
    String hostname = UNKNOWN_HOST;
    String address = LOOPBACK;
    try {
      InetAddress local = InetAddress.getLocalHost();
      hostname = local.getHostName();
      address = local.getHostAddress();
    } catch (UnknownHostException ex) {
      log.warn("Unable to resolve local host; using {}", LOOPBACK);
    }
    return new DeviceIdentity(hostname, address, macAddress());
  }

  private static String macAddress() {
    try {
      for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
        if (nic.isLoopback() || !nic.isUp()) {
          continue;
        }
        byte[] hardware = nic.getHardwareAddress();
        if (hardware != null && hardware.length == 6) {
          return format(hardware);
        }
      }
    } catch (SocketException ex) {
      log.debug("Network interfaces unavailable", ex);
    }
    return NO_MAC;
  }

  static String format(byte[] hardware) {
    StringJoiner joiner = new StringJoiner(":");
    for (byte b : hardware) {
      joiner.add(String.format("%02x", b & 0xff));
    }
    return joiner.toString();
  }
}
