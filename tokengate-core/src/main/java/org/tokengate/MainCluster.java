package org.tokengate;

import io.vertx.core.Vertx;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.GatewayLogger;

class MainCluster {
  private MainCluster() {
    throw new IllegalAccessError("MainCluster");
  }

  public static void main(String[] args) {
    System.setProperty("vertx.logger-delegate-factory-class-name",
        "io.vertx.core.logging.Log4j2LogDelegateFactory");
    System.setProperty("hazelcast.logging.type", "log4j2");
    Logger logger = GatewayLogger.get();
    MainDeploy d = new MainDeploy();
    d.init(args).onComplete(res -> {
      if (res.failed()) {
        logger.error(res.cause().getMessage(), res.cause().getCause());
        System.exit(1);
      } else if (res.result() == null) {
        System.exit(0);
      } else {
        addShutdownHook(res.result(), logger);
      }
    });
  }

  // undeploy on SIGTERM so the sweep timer and HTTP server are stopped
  static void addShutdownHook(Vertx vertx, Logger logger) {
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      CountDownLatch latch = new CountDownLatch(1);
      vertx.close().onComplete(ar -> latch.countDown());
      try {
        if (!latch.await(30, TimeUnit.SECONDS)) {
          logger.error("Timed out waiting for shutdown");
        }
      } catch (InterruptedException e) {
        logger.error("Interrupted while shutting down");
        Thread.currentThread().interrupt();
      }
    }));
  }
}
