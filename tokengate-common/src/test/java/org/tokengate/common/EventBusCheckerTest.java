package org.tokengate.common;

import static org.assertj.core.api.Assertions.assertThat;

import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.eventbus.ReplyFailure;
import io.vertx.core.spi.cluster.ClusterManager;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(VertxExtension.class)
class EventBusCheckerTest {

  @Test
  void gatewayAndWorkerNodes(Vertx vertx, VertxTestContext context) {
    // the worker node consumes token requests and answers pings
    vertx.eventBus().consumer("token.request", msg -> msg.reply("{}"));
    EventBusChecker.respond(vertx, "gw-node", "gw-node")
        .compose(x -> EventBusChecker.respond(vertx, "worker-node", "worker-node"))
        .compose(x -> EventBusChecker.check(vertx, List.of("gw-node", "worker-node")))
        .onComplete(context.succeedingThenComplete());
  }

  @Test
  void nodeNotAnswering(Vertx vertx, VertxTestContext context) {
    EventBusChecker.respond(vertx, "a", "a")
        .compose(x -> EventBusChecker.check(vertx, List.of("a", "b")))
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause).isInstanceOf(ReplyException.class);
          assertThat(((ReplyException) cause).failureType()).isEqualTo(ReplyFailure.NO_HANDLERS);
          context.completeNow();
        })));
  }

  @Test
  void wrongAnswer(Vertx vertx, VertxTestContext context) {
    EventBusChecker.respond(vertx, "a", "r")
        .compose(x -> EventBusChecker.check(vertx, List.of("a")))
        .onComplete(context.failing(cause -> context.verify(() -> {
          assertThat(cause.getMessage()).isEqualTo("Node a answered as r");
          context.completeNow();
        })));
  }

  @Test
  void localEventBus(Vertx vertx, VertxTestContext context) {
    assertThat(EventBusChecker.clusterManager(vertx)).isNull();
    EventBusChecker.respond(vertx, (ClusterManager) null)
        .compose(x -> EventBusChecker.check(vertx, (ClusterManager) null))
        .onComplete(context.succeedingThenComplete());
  }

  @Test
  void unregisteredNodeStopsAnswering(Vertx vertx, VertxTestContext context) {
    EventBusChecker.respond(vertx, "gone", "gone")
        .compose(consumer -> consumer.unregister())
        .compose(x -> EventBusChecker.check(vertx, List.of("gone")))
        .onComplete(context.failingThenComplete());
  }
}
