package org.tokengate.worker.idp;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.GatewayLogger;

/**
 * Obtains access tokens with the OAuth2 client credentials grant.
 */
public class IdpClient {

  private static final Logger LOGGER = GatewayLogger.get(IdpClient.class);

  static final long SIMULATED_DELAY = 200L;
  static final int SIMULATED_EXPIRES_IN = 3600;

  private final Vertx vertx;
  private final IdpClientOptions options;
  private final WebClient webClient;

  /**
   * Create client.
   * @param vertx Vert.x handle
   * @param options endpoint and timeout; a web client is created if options has none
   */
  public IdpClient(Vertx vertx, IdpClientOptions options) {
    this.vertx = vertx;
    this.options = options;
    this.webClient = options.getWebClient() != null
        ? options.getWebClient() : WebClient.create(vertx);
  }

  /**
   * Get token for client.
   * @param clientId client ID
   * @param clientSecret client secret
   * @param scope requested scope; omitted when null or empty
   * @return token; failed with {@link IdpException} if the provider refuses
   */
  public Future<IdpToken> getToken(String clientId, String clientSecret, String scope) {
    if (options.isSimulate()) {
      return simulate(clientId, scope);
    }
    MultiMap form = MultiMap.caseInsensitiveMultiMap()
        .set("grant_type", "client_credentials")
        .set("client_id", clientId)
        .set("client_secret", clientSecret);
    if (scope != null && !scope.isEmpty()) {
      form.set("scope", scope);
    }
    String url = options.getUrl() + options.getTokenPath();
    LOGGER.debug("Requesting token from {} for client ID: {}", url, clientId);
    try {
      return webClient.postAbs(url)
          .timeout(options.getTimeout())
          .putHeader(HttpHeaders.ACCEPT.toString(), "application/json")
          .sendForm(form)
          .recover(cause -> Future.failedFuture(
              new IdpException("failed to send request: " + cause.getMessage())))
          .map(IdpClient::parse);
    } catch (Exception e) {
      return Future.failedFuture(e);
    }
  }

  static IdpToken parse(HttpResponse<Buffer> res) {
    if (res.statusCode() != 200) {
      String body = res.bodyAsString();
      var msg = "IDP returned error status: " + res.statusCode()
          + ", body: " + (body == null ? "" : body);
      LOGGER.error("{}", msg);
      throw new IdpException(msg);
    }
    IdpToken token;
    try {
      Buffer body = res.bodyAsBuffer();
      token = body == null ? null : Json.decodeValue(body, IdpToken.class);
    } catch (DecodeException e) {
      throw new IdpException("failed to parse token response: " + e.getMessage());
    }
    if (token == null || token.getAccessToken() == null || token.getAccessToken().isEmpty()) {
      throw new IdpException("failed to parse token response: no access_token");
    }
    return token;
  }

  private Future<IdpToken> simulate(String clientId, String scope) {
    LOGGER.info("Simulating IDP token request for client ID: {}", clientId);
    Promise<IdpToken> promise = Promise.promise();
    vertx.setTimer(SIMULATED_DELAY, id -> {
      IdpToken token = new IdpToken();
      token.setAccessToken("fake-token-" + clientId + "-" + System.currentTimeMillis() / 1000);
      token.setTokenType("Bearer");
      token.setExpiresIn(SIMULATED_EXPIRES_IN);
      token.setScope(scope);
      promise.complete(token);
    });
    return promise.future();
  }
}
