package ca.gc.cra.tide.application.port;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for the synchronous HTTP exchanges made against the control and data planes.
 * <p><strong>Why:</strong> Keeps the credential, discovery, and channel protocols testable with scripted
 * responses, independent of the HTTP client library.</p>
 * <p><strong>Contract:</strong> Implementations must bound every exchange with a timeout and must return
 * non-2xx responses rather than throwing; {@link IOException} is reserved for transport failures.</p>
 *
 * @since 0.1.0
 */
public interface HttpTransport {
  /**
   * Performs one request and waits for the full response.
   *
   * @param request request to send
   * @return response with status, headers and body
   * @throws IOException when the connection fails or the timeout elapses
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  Response send(Request request) throws IOException, InterruptedException;

  /**
   * Appends an absolute API path to a base URL, keeping any path prefix the base carries.
   *
   * @param base scheme and authority, optionally with a path prefix such as {@code https://gw/snowflake}
   * @param path API path starting with {@code /}
   * @return combined URI
   */
  static URI endpoint(URI base, String path) {
    String prefix = Objects.requireNonNullElse(base.getRawPath(), "");
    while (prefix.endsWith("/")) {
      prefix = prefix.substring(0, prefix.length() - 1);
    }
    return URI.create(base.getScheme() + "://" + base.getRawAuthority() + prefix + path);
  }

  /**
   * Outbound request.
   *
   * @param method HTTP method
   * @param uri absolute target URI
   * @param headers request headers
   * @param body request body; empty for none
   */
  record Request(String method, URI uri, Map<String, String> headers, byte[] body) {
    public Request {
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(uri, "uri");
      headers = Map.copyOf(Objects.requireNonNullElse(headers, Map.of()));
      body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
      return body.clone();
    }

    /**
     * Body decoded as UTF-8, convenient for logging and assertions.
     *
     * @return body text
     */
    public String bodyText() {
      return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Case-insensitive header lookup.
     *
     * @param name header name
     * @return header value if present
     */
    public Optional<String> header(String name) {
      return lookup(headers, name);
    }

    /**
     * Starts a request builder.
     *
     * @param method HTTP method
     * @param uri target URI
     * @return builder
     */
    public static Builder builder(String method, URI uri) {
      return new Builder(method, uri);
    }

    /** Mutable accumulator for {@link Request}. */
    public static final class Builder {
      private final String method;
      private final URI uri;
      private final Map<String, String> headers = new LinkedHashMap<>();
      private byte[] body = new byte[0];

      private Builder(String method, URI uri) {
        this.method = method;
        this.uri = uri;
      }

      public Builder header(String name, String value) {
        headers.put(name, value);
        return this;
      }

      public Builder body(byte[] payload) {
        this.body = payload;
        return this;
      }

      public Builder body(String payload) {
        this.body = payload.getBytes(StandardCharsets.UTF_8);
        return this;
      }

      public Request build() {
        return new Request(method, uri, headers, body);
      }
    }
  }

  /**
   * Inbound response.
   *
   * @param status HTTP status code
   * @param headers response headers (first value per name)
   * @param body response body decoded as UTF-8
   */
  record Response(int status, Map<String, String> headers, String body) {
    public Response {
      headers = Map.copyOf(Objects.requireNonNullElse(headers, Map.of()));
      body = Objects.requireNonNullElse(body, "");
    }

    /**
     * Indicates a 2xx status.
     *
     * @return {@code true} for success codes
     */
    public boolean isSuccess() {
      return status >= 200 && status < 300;
    }

    /**
     * Case-insensitive header lookup.
     *
     * @param name header name
     * @return header value if present
     */
    public Optional<String> header(String name) {
      return lookup(headers, name);
    }
  }

  private static Optional<String> lookup(Map<String, String> headers, String name) {
    String wanted = name.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).equals(wanted)) {
        return Optional.ofNullable(entry.getValue());
      }
    }
    return Optional.empty();
  }
}
