package org.tokengate.worker;

import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.GatewayLogger;
import org.tokengate.common.bean.TokenRequest;
import org.tokengate.common.bean.TokenResponse;
import org.tokengate.worker.idp.IdpClient;

/**
 * Answers token requests from the event bus. Every message gets a reply,
 * failures included, so the gateway never waits for its timeout because
 * of an identity provider error.
 */
public class TokenRequestHandler implements Handler<Message<Object>> {

  private static final Logger logger = GatewayLogger.get(TokenRequestHandler.class);

  static final String INVALID_FORMAT = "Invalid request format";

  private final IdpClient idpClient;
  private final String scope;
  private final String workerName;

  /**
   * Create handler.
   * @param idpClient identity provider client
   * @param scope scope requested for every token
   * @param workerName name used in log messages
   */
  public TokenRequestHandler(IdpClient idpClient, String scope, String workerName) {
    this.idpClient = idpClient;
    this.scope = scope;
    this.workerName = workerName;
  }

  @Override
  public void handle(Message<Object> message) {
    TokenRequest request;
    try {
      request = decode(message.body());
    } catch (DecodeException | IllegalArgumentException e) {
      logger.error("Failed to parse token request: {}", e.getMessage());
      reply(message, TokenResponse.failure("", INVALID_FORMAT));
      return;
    }
    if (request == null) {
      reply(message, TokenResponse.failure("", INVALID_FORMAT));
      return;
    }
    final String requestId = request.getRequestId();
    logger.info("{}: received token request for client ID: {} (Request ID: {})",
        workerName, request.getClientId(), requestId);
    idpClient.getToken(request.getClientId(), request.getClientSecret(), scope)
        .onSuccess(token -> {
          reply(message, TokenResponse.success(requestId, token.getAccessToken(),
              token.getTokenType(), token.getScope(), token.getExpiresIn()));
          logger.info("{}: sent token response for request ID: {}", workerName, requestId);
        })
        .onFailure(cause -> {
          logger.error("{}: failed to get token for request ID: {}: {}",
              workerName, requestId, cause.getMessage());
          reply(message, TokenResponse.failure(requestId, cause.getMessage()));
        });
  }

  static TokenRequest decode(Object body) {
    if (body instanceof String) {
      return Json.decodeValue((String) body, TokenRequest.class);
    }
    if (body instanceof Buffer) {
      return Json.decodeValue((Buffer) body, TokenRequest.class);
    }
    if (body instanceof JsonObject) {
      return ((JsonObject) body).mapTo(TokenRequest.class);
    }
    throw new DecodeException("Unsupported request body "
        + (body == null ? "null" : body.getClass().getName()));
  }

  private static void reply(Message<Object> message, TokenResponse response) {
    message.reply(Json.encode(response));
  }
}
