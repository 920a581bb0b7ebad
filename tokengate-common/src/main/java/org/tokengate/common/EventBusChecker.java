package org.tokengate.common;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.impl.VertxInternal;
import io.vertx.core.spi.cluster.ClusterManager;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.Logger;

/**
 * Event bus health check. Every node, gateway or worker, answers pings on
 * its own check address with its node ID. A gateway pings all nodes before
 * it starts taking requests; a node that does not answer means token
 * requests may get lost.
 */
public class EventBusChecker {

  private static final Logger logger = GatewayLogger.get(EventBusChecker.class);

  static final String ADDRESS_PREFIX = "org.tokengate.node.check.";
  static final long PING_TIMEOUT_MS = 1000L;
  static final String LOCAL_NODE = "localhost";

  private EventBusChecker() {
  }

  /**
   * Cluster manager of a Vert.x instance.
   * @param vertx Vert.x handle
   * @return cluster manager; null for a local event bus
   */
  public static ClusterManager clusterManager(Vertx vertx) {
    if (!vertx.isClustered() || !(vertx instanceof VertxInternal)) {
      return null;
    }
    return ((VertxInternal) vertx).getClusterManager();
  }

  /**
   * Answer pings for this node. The caller unregisters the consumer on stop.
   * @param vertx Vert.x handle
   * @param clusterManager cluster manager; null for a local event bus
   * @return consumer, completed once registered
   */
  public static Future<MessageConsumer<String>> respond(Vertx vertx,
      ClusterManager clusterManager) {
    String node = nodeId(clusterManager);
    return respond(vertx, node, node);
  }

  static Future<MessageConsumer<String>> respond(Vertx vertx, String node, String answer) {
    MessageConsumer<String> consumer = vertx.eventBus()
        .consumer(ADDRESS_PREFIX + node, ping -> ping.reply(answer));
    Promise<Void> registered = Promise.promise();
    consumer.completionHandler(registered);
    return registered.future().map(consumer);
  }

  /**
   * Ping all nodes, this one included.
   * @param vertx Vert.x handle
   * @param clusterManager cluster manager; null for a local event bus
   * @return succeeds when every node answered with its own ID
   */
  public static Future<Void> check(Vertx vertx, ClusterManager clusterManager) {
    List<String> nodes = clusterManager == null
        ? List.of(LOCAL_NODE) : clusterManager.getNodes();
    return check(vertx, nodes);
  }

  static Future<Void> check(Vertx vertx, List<String> targets) {
    DeliveryOptions deliveryOptions = new DeliveryOptions().setSendTimeout(PING_TIMEOUT_MS);
    List<Future<Void>> pings = targets.stream()
        .map(target -> ping(vertx, target, deliveryOptions))
        .collect(Collectors.toList());
    return Future.all(pings)
        .onSuccess(x -> logger.info("Event bus reached {} node(s)", targets.size()))
        .mapEmpty();
  }

  private static String nodeId(ClusterManager clusterManager) {
    return clusterManager == null ? LOCAL_NODE : clusterManager.getNodeId();
  }

  private static Future<Void> ping(Vertx vertx, String target, DeliveryOptions deliveryOptions) {
    return vertx.eventBus().request(ADDRESS_PREFIX + target, "", deliveryOptions)
        .compose(msg -> target.equals(msg.body())
            ? Future.<Void>succeededFuture()
            : Future.<Void>failedFuture("Node " + target + " answered as " + msg.body()));
  }
}
