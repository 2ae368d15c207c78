package ca.gc.cra.tide.domain.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server view of a channel as reported by the bulk channel status endpoint.
 *
 * @param channelName channel the status belongs to
 * @param committedOffset last offset the service has committed; {@code 0} when none reported
 * @param attributes remaining status fields as returned by the service
 * @since 0.1.0
 */
public record ChannelStatus(String channelName, long committedOffset, Map<String, Object> attributes) {
  public ChannelStatus {
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
