package org.tokengate;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.TooLongHttpHeaderException;
import io.netty.handler.codec.http.TooLongHttpLineException;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.spi.cluster.ClusterManager;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import java.lang.management.ManagementFactory;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.EventBusChecker;
import org.tokengate.common.GatewayLogger;
import org.tokengate.common.LogHelper;
import org.tokengate.common.MetricsUtil;
import org.tokengate.managers.TokenRequestBridge;
import org.tokengate.util.TokenCache;
import org.tokengate.web.TokenWebService;

public class MainVerticle extends AbstractVerticle {

  private static final int MAX_INITIAL_LINE_LENGTH = 8192;
  // credentials are tiny; anything bigger is not a token request
  private static final long MAX_BODY_SIZE = 64 * 1024L;

  private static final Logger logger = GatewayLogger.get(MainVerticle.class);

  private ClusterManager clusterManager;
  private GatewayOptions options;
  private TokenCache tokenCache;
  private TokenRequestBridge bridge;
  private TokenWebService tokenWebService;
  private MessageConsumer<String> checkConsumer;

  public void setClusterManager(ClusterManager mgr) {
    clusterManager = mgr;
  }

  @Override
  public void init(Vertx vertx, Context context) {
    super.init(vertx, context);
    options = GatewayOptions.fromConfig(context.config());
    if (options.getLogLevel() != null && !options.getLogLevel().isEmpty()) {
      LogHelper.setRootLogLevel(options.getLogLevel());
    }
    if (clusterManager != null) {
      logger.info("Clustered with node ID {}", clusterManager.getNodeId());
    } else {
      logger.info("Running with local event bus");
    }
    tokenCache = TokenCache.builder()
        .withSweepInterval(options.getCacheSweepInterval())
        .build();
    bridge = new TokenRequestBridge(vertx, options.getTokenSubject());
    tokenWebService = new TokenWebService(tokenCache, bridge, options);
  }

  TokenCache getTokenCache() {
    return tokenCache;
  }

  TokenRequestBridge getBridge() {
    return bridge;
  }

  @Override
  public void start(Promise<Void> promise) {
    Future<Void> fut = EventBusChecker.respond(vertx, clusterManager)
        .compose(consumer -> {
          checkConsumer = consumer;
          return EventBusChecker.check(vertx, clusterManager);
        })
        .recover(cause -> {
          logger.warn("event bus check failed {}", cause.getMessage());
          return Future.succeededFuture();
        });
    fut = fut.compose(x -> {
      tokenCache.start(vertx);
      return startListening();
    });
    fut.onComplete(x -> {
      if (x.failed()) {
        logger.error(x.cause().getMessage());
        tokenCache.stop();
      }
      promise.handle(x);
    });
  }

  @Override
  public void stop(Promise<Void> promise) {
    logger.info("stop");
    tokenCache.stop();
    MetricsUtil.stop();
    if (checkConsumer == null) {
      promise.complete();
      return;
    }
    checkConsumer.unregister().onComplete(promise);
  }

  MessageConsumer<String> getCheckConsumer() {
    return checkConsumer;
  }

  private Future<Void> startListening() {
    Router router = Router.router(vertx);
    router.get("/health").handler(tokenWebService::health);
    router.post("/token")
        .handler(BodyHandler.create().setBodyLimit(MAX_BODY_SIZE))
        .handler(tokenWebService::token);

    final int port = options.getPort();
    HttpServerOptions so = new HttpServerOptions()
        .setHandle100ContinueAutomatically(true)
        .setMaxInitialLineLength(MAX_INITIAL_LINE_LENGTH);
    return vertx.createHttpServer(so)
        .requestHandler(router)
        .invalidRequestHandler(MainVerticle::invalidRequestHandler)
        .listen(port)
        .onComplete(result -> {
          if (result.succeeded()) {
            logger.info("Token gateway started PID {}. Listening on port {}, subject {}",
                ManagementFactory.getRuntimeMXBean().getName(), port,
                options.getTokenSubject());
          } else {
            logger.fatal("createHttpServer failed for port {}", port, result.cause());
          }
        })
        .mapEmpty();
  }

  // 414 and 431 for oversized request lines and headers; the connection is closed after
  static void invalidRequestHandler(HttpServerRequest request) {
    Throwable cause = request.decoderResult().cause();
    HttpResponseStatus status = null;
    if (cause instanceof TooLongHttpLineException) {
      status = HttpResponseStatus.REQUEST_URI_TOO_LONG;
    } else if (cause instanceof TooLongHttpHeaderException) {
      status = HttpResponseStatus.REQUEST_HEADER_FIELDS_TOO_LARGE;
    }
    if (status == null) {
      HttpServerRequest.DEFAULT_INVALID_REQUEST_HANDLER.handle(request);
      return;
    }
    logger.warn("Rejecting request: {}", cause.getMessage());
    request.response()
        .setStatusCode(status.code())
        .putHeader("Content-Type", "text/plain")
        .end(status.reasonPhrase())
        .onComplete(x -> request.connection().close());
  }
}
