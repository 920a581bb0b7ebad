package org.tokengate.worker.idp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(VertxExtension.class)
class IdpClientTest {

  private static final int MOCK_PORT = 9240;
  private static final String IDP_URL = "http://localhost:" + MOCK_PORT;
  private static final String CLIENT_OK = "svc";
  private static final String SECRET_OK = "s3cret";

  private static HttpServer server;
  private static volatile String lastScope;

  @BeforeAll
  static void beforeAll(Vertx vertx, VertxTestContext context) {
    Router router = Router.router(vertx);
    router.route().handler(BodyHandler.create());
    router.post("/token").handler(ctx -> {
      HttpServerRequest request = ctx.request();
      lastScope = request.getFormAttribute("scope");
      if (!request.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded")
          || !"client_credentials".equals(request.getFormAttribute("grant_type"))) {
        ctx.response().setStatusCode(400).end("bad grant");
        return;
      }
      if (!CLIENT_OK.equals(request.getFormAttribute("client_id"))
          || !SECRET_OK.equals(request.getFormAttribute("client_secret"))) {
        ctx.response().setStatusCode(401)
            .putHeader("Content-Type", "application/json")
            .end("{\"error\":\"invalid_client\"}");
        return;
      }
      ctx.response().setStatusCode(200)
          .putHeader("Content-Type", "application/json")
          .end(new JsonObject()
              .put("access_token", "tok-abc")
              .put("token_type", "Bearer")
              .put("expires_in", 300)
              .put("scope", "openid")
              .put("not-before-policy", 0)
              .encode());
    });
    router.post("/garbage").handler(ctx -> ctx.response().setStatusCode(200).end("<html>"));
    router.post("/empty").handler(ctx -> ctx.response().setStatusCode(200).end("{}"));
    router.post("/slow").handler(ctx -> { });
    vertx.createHttpServer().requestHandler(router).listen(MOCK_PORT)
        .onComplete(context.succeeding(s -> {
          server = s;
          context.completeNow();
        }));
  }

  @AfterAll
  static void afterAll(VertxTestContext context) {
    server.close().onComplete(context.succeedingThenComplete());
  }

  private static IdpClient client(Vertx vertx, String path) {
    return new IdpClient(vertx, new IdpClientOptions().url(IDP_URL).tokenPath(path).timeout(500));
  }

  @Test
  void ok(Vertx vertx, VertxTestContext context) {
    client(vertx, "/token").getToken(CLIENT_OK, SECRET_OK, "openid profile")
        .onComplete(context.succeeding(token -> context.verify(() -> {
          assertThat(token.getAccessToken(), is("tok-abc"));
          assertThat(token.getTokenType(), is("Bearer"));
          assertThat(token.getExpiresIn(), is(300));
          assertThat(token.getScope(), is("openid"));
          assertThat(lastScope, is("openid profile"));
          context.completeNow();
        })));
  }

  @Test
  void noScope(Vertx vertx, VertxTestContext context) {
    client(vertx, "/token").getToken(CLIENT_OK, SECRET_OK, "")
        .onComplete(context.succeeding(token -> context.verify(() -> {
          assertThat(lastScope, is(nullValue()));
          context.completeNow();
        })));
  }

  @Test
  void badCredentials(Vertx vertx, VertxTestContext context) {
    client(vertx, "/token").getToken(CLIENT_OK, "wrong", null)
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause instanceof IdpException, is(true));
          assertThat(cause.getMessage(),
              is("IDP returned error status: 401, body: {\"error\":\"invalid_client\"}"));
          context.completeNow();
        })));
  }

  @Test
  void notFound(Vertx vertx, VertxTestContext context) {
    client(vertx, "/other").getToken(CLIENT_OK, SECRET_OK, null)
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause.getMessage(), startsWith("IDP returned error status: 404"));
          context.completeNow();
        })));
  }

  @Test
  void garbage(Vertx vertx, VertxTestContext context) {
    client(vertx, "/garbage").getToken(CLIENT_OK, SECRET_OK, null)
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause instanceof IdpException, is(true));
          assertThat(cause.getMessage(), startsWith("failed to parse token response"));
          context.completeNow();
        })));
  }

  @Test
  void noAccessToken(Vertx vertx, VertxTestContext context) {
    client(vertx, "/empty").getToken(CLIENT_OK, SECRET_OK, null)
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause.getMessage(), is("failed to parse token response: no access_token"));
          context.completeNow();
        })));
  }

  @Test
  void timeout(Vertx vertx, VertxTestContext context) {
    client(vertx, "/slow").getToken(CLIENT_OK, SECRET_OK, null)
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause.getMessage(), startsWith("failed to send request"));
          context.completeNow();
        })));
  }

  @Test
  void connectionRefused(Vertx vertx, VertxTestContext context) {
    new IdpClient(vertx, new IdpClientOptions().url("http://localhost:9249"))
        .getToken(CLIENT_OK, SECRET_OK, null)
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause instanceof IdpException, is(true));
          assertThat(cause.getMessage(), startsWith("failed to send request"));
          context.completeNow();
        })));
  }

  @Test
  void simulate(Vertx vertx, VertxTestContext context) {
    // no server behind this URL
    IdpClientOptions options = new IdpClientOptions().url("http://localhost:9249").simulate(true);
    long start = System.currentTimeMillis();
    new IdpClient(vertx, options).getToken("fake-client", "x", "openid")
        .onComplete(context.succeeding(token -> context.verify(() -> {
          assertThat(token.getAccessToken(), startsWith("fake-token-fake-client-"));
          assertThat(token.getTokenType(), is("Bearer"));
          assertThat(token.getExpiresIn(), is(3600));
          assertThat(System.currentTimeMillis() - start >= IdpClient.SIMULATED_DELAY, is(true));
          context.completeNow();
        })));
  }
}
