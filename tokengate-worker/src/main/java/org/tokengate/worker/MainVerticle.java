package org.tokengate.worker;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.EventBusChecker;
import org.tokengate.common.GatewayLogger;
import org.tokengate.common.LogHelper;
import org.tokengate.worker.idp.IdpClient;

/**
 * Token worker. Consumes token requests on the configured event bus address.
 * Several workers on the same address share the load; each request is
 * delivered to one of them. The worker also answers the event bus check
 * of the gateways.
 */
public class MainVerticle extends AbstractVerticle {

  private final Logger logger = GatewayLogger.get(MainVerticle.class);

  private WorkerOptions options;
  private TokenRequestHandler handler;
  private MessageConsumer<Object> consumer;
  private MessageConsumer<String> checkConsumer;

  @Override
  public void init(Vertx vertx, Context context) {
    super.init(vertx, context);
    options = WorkerOptions.fromConfig(context.config());
    String level = options.getLogLevel();
    if (level != null && !level.isEmpty()) {
      LogHelper.setRootLogLevel(level);
    }
    IdpClient idpClient = new IdpClient(vertx, options.getIdpClientOptions());
    handler = new TokenRequestHandler(idpClient, options.getScope(), options.getWorkerName());
  }

  WorkerOptions getOptions() {
    return options;
  }

  @Override
  public void start(Promise<Void> promise) {
    consumer = vertx.eventBus().consumer(options.getTokenSubject(), handler);
    Promise<Void> registered = Promise.promise();
    consumer.completionHandler(registered);
    registered.future()
        .compose(x -> EventBusChecker.respond(vertx, EventBusChecker.clusterManager(vertx)))
        .onSuccess(check -> {
          checkConsumer = check;
          logger.info("Worker {} listening on {} (IDP {}{}, simulate={})",
              options.getWorkerName(), options.getTokenSubject(),
              options.getIdpClientOptions().getUrl(), options.getIdpClientOptions().getTokenPath(),
              options.getIdpClientOptions().isSimulate());
        })
        .<Void>mapEmpty()
        .onComplete(promise);
  }

  @Override
  public void stop(Promise<Void> promise) {
    logger.info("Worker {} stopping", options.getWorkerName());
    Future<Void> fut = consumer == null ? Future.succeededFuture() : consumer.unregister();
    if (checkConsumer != null) {
      fut = fut.compose(x -> checkConsumer.unregister());
    }
    fut.onComplete(promise);
  }

  MessageConsumer<String> getCheckConsumer() {
    return checkConsumer;
  }
}
