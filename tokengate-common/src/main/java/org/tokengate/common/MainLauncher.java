package org.tokengate.common;

import io.vertx.core.Launcher;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

/**
 * Vert.x launcher with Log4j2 logging and metrics. Used as Main-Class of
 * fat jars that name their verticle in the Main-Verticle manifest entry.
 */
public class MainLauncher extends Launcher {

  public static void main(String[] args) {
    System.setProperty("vertx.logger-delegate-factory-class-name",
        "io.vertx.core.logging.Log4j2LogDelegateFactory");
    System.setProperty("hazelcast.logging.type", "log4j2");
    new MainLauncher().dispatch(args);
  }

  @Override
  public void beforeStartingVertx(VertxOptions options) {
    MetricsUtil.init(options);
  }

  @Override
  public void beforeStoppingVertx(Vertx vertx) {
    MetricsUtil.stop();
  }
}
