package org.tokengate.managers;

import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.EncodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.GatewayLogger;
import org.tokengate.common.bean.TokenRequest;
import org.tokengate.common.bean.TokenResponse;
import org.tokengate.util.MetricsHelper;
import org.tokengate.util.TokenError;

/**
 * Sends token requests to the workers listening on the event bus and waits
 * for the matching reply. Each call sends exactly one message; there is
 * no retry.
 */
public class TokenRequestBridge {

  private static final Logger logger = GatewayLogger.get(TokenRequestBridge.class);

  private final Vertx vertx;
  private final String address;
  // request ID to send time, for requests awaiting a reply
  private final Map<String, Long> pending = new ConcurrentHashMap<>();

  /**
   * Create bridge.
   * @param vertx Vert.x handle
   * @param address event bus address the workers consume
   */
  public TokenRequestBridge(Vertx vertx, String address) {
    this.vertx = vertx;
    this.address = address;
  }

  /**
   * Number of requests still waiting for a reply.
   */
  public int pendingRequests() {
    return pending.size();
  }

  /**
   * Obtain a token from a worker.
   *
   * @param clientId client ID
   * @param clientSecret client secret
   * @param timeout milliseconds to wait for the reply
   * @return future with successful reply; failed with {@link TokenError} otherwise
   * @throws IllegalArgumentException if timeout is not positive
   */
  public Future<TokenResponse> requestToken(String clientId, String clientSecret, long timeout) {
    if (timeout <= 0) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
    TokenRequest request = TokenRequest.create(clientId, clientSecret);
    String requestId = request.getRequestId();
    String payload;
    try {
      payload = Json.encode(request);
    } catch (EncodeException e) {
      return Future.failedFuture(new TokenError(TokenError.Kind.UPSTREAM_SERIALIZATION,
          "Failed to encode token request: " + e.getMessage()));
    }
    logger.info("Sending token request for client ID: {} (Request ID: {})", clientId, requestId);
    pending.put(requestId, System.currentTimeMillis());
    Timer.Sample sample = MetricsHelper.getTimerSample();
    DeliveryOptions options = new DeliveryOptions().setSendTimeout(timeout);
    return vertx.eventBus().<Object>request(address, payload, options)
        .compose(reply -> {
          release(requestId);
          return handleReply(requestId, reply);
        }, cause -> {
          release(requestId);
          return Future.<TokenResponse>failedFuture(transportFailure(requestId, cause));
        })
        .onComplete(res -> MetricsHelper.recordBridgeResponseTime(sample,
            res.succeeded() ? "ok" : String.valueOf(TokenError.getKind(res.cause()))));
  }

  private void release(String requestId) {
    Long started = pending.remove(requestId);
    if (started != null) {
      logger.debug("Request {} completed after {} ms", requestId,
          System.currentTimeMillis() - started);
    }
  }

  private Future<TokenResponse> handleReply(String requestId, Message<Object> reply) {
    TokenResponse response;
    try {
      response = decode(reply.body());
    } catch (DecodeException | IllegalArgumentException e) {
      logger.error("Failed to parse token response for request ID: {}: {}",
          requestId, e.getMessage());
      return serializationFailure("Failed to parse token response");
    }
    if (response == null) {
      return serializationFailure("Empty token response");
    }
    String replyId = response.getRequestId();
    if (replyId != null && !replyId.isEmpty() && !replyId.equals(requestId)) {
      logger.error("Reply for request ID {} received for request ID {}", replyId, requestId);
      return serializationFailure("Token response for another request");
    }
    if (response.isFailure()) {
      logger.warn("Token request {} rejected: {}", requestId, response.getError());
      return Future.failedFuture(new TokenError(TokenError.Kind.UPSTREAM_REJECTED,
          response.getError()));
    }
    if (response.getAccessToken() == null || response.getAccessToken().isEmpty()) {
      return serializationFailure("Token response without access token");
    }
    logger.info("Received token response for request ID: {}", requestId);
    return Future.succeededFuture(response);
  }

  static TokenResponse decode(Object body) {
    if (body instanceof JsonObject) {
      return ((JsonObject) body).mapTo(TokenResponse.class);
    }
    if (body instanceof Buffer) {
      return Json.decodeValue((Buffer) body, TokenResponse.class);
    }
    if (body instanceof String) {
      return Json.decodeValue((String) body, TokenResponse.class);
    }
    throw new DecodeException("Unsupported reply body "
        + (body == null ? "null" : body.getClass().getName()));
  }

  private static Future<TokenResponse> serializationFailure(String message) {
    return Future.failedFuture(new TokenError(TokenError.Kind.UPSTREAM_SERIALIZATION, message));
  }

  private TokenError transportFailure(String requestId, Throwable cause) {
    if (cause instanceof ReplyException) {
      ReplyException replyException = (ReplyException) cause;
      switch (replyException.failureType()) {
        case TIMEOUT:
          logger.error("Token request timed out for request ID: {}", requestId);
          return new TokenError(TokenError.Kind.UPSTREAM_TIMEOUT, "Request timed out");
        case NO_HANDLERS:
          logger.error("No token worker on {} for request ID: {}", address, requestId);
          return new TokenError(TokenError.Kind.UPSTREAM_UNAVAILABLE,
              "No token worker available on " + address);
        default:
          logger.error("Token worker failed for request ID: {}: {}", requestId,
              cause.getMessage());
          return new TokenError(TokenError.Kind.UPSTREAM_UNAVAILABLE, cause.getMessage());
      }
    }
    logger.error("Failed to send token request {}: {}", requestId, cause.getMessage(), cause);
    return new TokenError(TokenError.Kind.UPSTREAM_UNAVAILABLE, cause.getMessage());
  }
}
