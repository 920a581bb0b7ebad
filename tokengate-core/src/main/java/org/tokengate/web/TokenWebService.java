package org.tokengate.web;

import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.apache.logging.log4j.Logger;
import org.tokengate.GatewayOptions;
import org.tokengate.bean.ClientCredentials;
import org.tokengate.common.ErrorType;
import org.tokengate.common.GatewayLogger;
import org.tokengate.common.HttpResponse;
import org.tokengate.common.bean.TokenResponse;
import org.tokengate.managers.TokenRequestBridge;
import org.tokengate.util.CredentialValidator;
import org.tokengate.util.TokenCache;
import org.tokengate.util.TokenError;

/**
 * Handlers for POST /token and GET /health.
 *
 * <p>A token request is served from the cache when possible. Otherwise it is
 * passed to a worker through the bridge and a successful answer is cached
 * for the configured TTL. Query parameter {@value #SKIP_CACHE} with value
 * 1 or true bypasses both lookup and populate.
 */
public class TokenWebService {

  public static final String SKIP_CACHE = "skip_cache";
  static final String SOURCE_CACHE = "cache";
  static final String SOURCE_IDP = "idp";
  static final String DEFAULT_TOKEN_TYPE = "Bearer";
  static final String MSG_TIMEOUT = "Request timed out";
  static final String MSG_FAILED = "Failed to process request";

  private static final Logger logger = GatewayLogger.get(TokenWebService.class);

  private final TokenCache tokenCache;
  private final TokenRequestBridge bridge;
  private final long requestTimeout;
  private final long cacheTtl;

  /**
   * Create service.
   * @param tokenCache cache of tokens by client ID
   * @param bridge bridge to the workers
   * @param options timeout and TTL
   */
  public TokenWebService(TokenCache tokenCache, TokenRequestBridge bridge,
      GatewayOptions options) {
    this.tokenCache = tokenCache;
    this.bridge = bridge;
    this.requestTimeout = options.getRequestTimeout();
    this.cacheTtl = options.getCacheTtl();
  }

  /**
   * Handle POST /token. Body must have been read by a BodyHandler.
   * @param ctx routing context
   */
  public void token(RoutingContext ctx) {
    ClientCredentials credentials;
    try {
      credentials = CredentialValidator.validate(ctx.body().buffer());
    } catch (TokenError e) {
      logger.warn("Invalid token request: {}", e.getMessage());
      responseError(ctx, e);
      return;
    }
    final String clientId = credentials.getClientId();
    final boolean skipCache = isSkipCache(ctx.request().getParam(SKIP_CACHE));
    if (!skipCache) {
      String token = tokenCache.get(clientId);
      if (token != null) {
        logger.info("Serving cached token for client ID: {}", clientId);
        responseToken(ctx, token, DEFAULT_TOKEN_TYPE, SOURCE_CACHE);
        return;
      }
    }
    logger.info("Requesting new token for client ID: {}", clientId);
    bridge.requestToken(clientId, credentials.getClientSecret(), requestTimeout)
        .onSuccess(res -> {
          if (!skipCache) {
            tokenCache.put(clientId, res.getAccessToken(), cacheTtl);
          }
          responseToken(ctx, res.getAccessToken(), tokenType(res), SOURCE_IDP);
        })
        .onFailure(cause -> responseError(ctx, cause));
  }

  /**
   * Handle GET /health.
   * @param ctx routing context
   */
  public void health(RoutingContext ctx) {
    HttpResponse.responseText(ctx, 200, "OK");
  }

  static boolean isSkipCache(String value) {
    return "1".equals(value) || "true".equalsIgnoreCase(value);
  }

  private static String tokenType(TokenResponse res) {
    String type = res.getTokenType();
    return type == null || type.isEmpty() ? DEFAULT_TOKEN_TYPE : type;
  }

  private static void responseToken(RoutingContext ctx, String token, String type,
      String source) {
    JsonObject body = new JsonObject()
        .put("access_token", token)
        .put("token_type", type)
        .put("source", source);
    HttpResponse.responseJson(ctx, 200, body.encode());
  }

  static void responseError(RoutingContext ctx, Throwable cause) {
    TokenError.Kind kind = TokenError.getKind(cause);
    if (kind == null) {
      HttpResponse.responseError(ctx, ErrorType.httpCode(TokenError.getType(cause)), MSG_FAILED,
          cause);
      return;
    }
    switch (kind) {
      case MALFORMED_REQUEST:
      case MISSING_CREDENTIAL:
      case UPSTREAM_REJECTED:
        HttpResponse.responseJsonError(ctx, kind.getErrorType(), cause.getMessage());
        break;
      case UPSTREAM_TIMEOUT:
        HttpResponse.responseError(ctx, kind.getErrorType(), MSG_TIMEOUT);
        break;
      default:
        logger.error("Token request failed: {}", cause.getMessage());
        HttpResponse.responseError(ctx, kind.getErrorType(), MSG_FAILED);
        break;
    }
  }
}
