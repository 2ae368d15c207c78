package ca.gc.cra.tide.infrastructure.http;

import ca.gc.cra.tide.application.port.HttpTransport;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} backed by {@link HttpClient}.
 *
 * <p>Every exchange is bounded by a request timeout (30 seconds by default) so no call blocks indefinitely.
 * Redirects are not followed: the ingest protocol never redirects, and following one would silently drop the
 * bearer header.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpTransport implements HttpTransport {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

  /** Default per-request timeout. */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient client;
  private final Duration requestTimeout;

  public JdkHttpTransport() {
    this(DEFAULT_REQUEST_TIMEOUT);
  }

  /**
   * Creates a transport with a custom request timeout.
   *
   * @param requestTimeout bound applied to each exchange; must be positive
   */
  public JdkHttpTransport(Duration requestTimeout) {
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    this.client = HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  @Override
  public Response send(Request request) throws IOException, InterruptedException {
    Objects.requireNonNull(request, "request");
    byte[] body = request.body();
    HttpRequest.BodyPublisher publisher = body.length == 0
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofByteArray(body);
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
        .timeout(requestTimeout)
        .method(request.method(), publisher);
    request.headers().forEach(builder::header);

    long started = System.nanoTime();
    HttpResponse<String> response =
        client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (log.isDebugEnabled()) {
      log.debug("{} {} -> {} in {} ms", request.method(), request.uri().getPath(), response.statusCode(),
          Duration.ofNanos(System.nanoTime() - started).toMillis());
    }
    return new Response(response.statusCode(), firstValues(response.headers().map()), response.body());
  }

  private static Map<String, String> firstValues(Map<String, List<String>> headers) {
    Map<String, String> result = new LinkedHashMap<>();
    headers.forEach((name, values) -> {
      if (name != null && !values.isEmpty()) {
        result.put(name, values.get(0));
      }
    });
    return result;
  }
}
