package org.tokengate;

import com.hazelcast.config.ClasspathXmlConfig;
import com.hazelcast.config.Config;
import com.hazelcast.config.FileSystemXmlConfig;
import com.hazelcast.config.UrlXmlConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.eventbus.EventBusOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.spi.cluster.hazelcast.ConfigUtil;
import io.vertx.spi.cluster.hazelcast.HazelcastClusterManager;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.GatewayLogger;
import org.tokengate.common.MetricsUtil;

/**
 * Parses the command line and deploys {@link MainVerticle}, with a local
 * event bus in dev mode or a Hazelcast clustered one in cluster mode.
 */
public class MainDeploy {

  private static final Logger logger = GatewayLogger.get(MainDeploy.class);

  private static final String MODE_DEV = "dev";
  private static final String MODE_CLUSTER = "cluster";
  private static final String USAGE = "Usage: command [options]\n"
      + "Commands:\n"
      + "  help         Display help\n"
      + "  cluster      Gateway on a Hazelcast clustered event bus\n"
      + "  dev          Gateway on a local event bus\n"
      + "Options:\n"
      + "  -conf file                    Gateway configuration (JSON)\n"
      + "  -hazelcast-config-cp file     Hazelcast config from class path\n"
      + "  -hazelcast-config-file file   Hazelcast config from local file\n"
      + "  -hazelcast-config-url url     Hazelcast config from URL\n"
      + "  -cluster-host ip              Event bus host\n"
      + "  -cluster-port port            Event bus port\n";

  private final VertxOptions vertxOptions = new VertxOptions();
  private JsonObject conf;
  private Config hazelcastConfig;
  private String clusterHost;
  private Integer clusterPort;
  private boolean helpOnly;

  public MainDeploy() {
    this(new JsonObject());
  }

  public MainDeploy(JsonObject conf) {
    this.conf = conf;
  }

  /**
   * Parse arguments and deploy.
   * @param args command line
   * @return Vert.x instance; null if only help was requested
   */
  Future<Vertx> init(String[] args) {
    try {
      if (args.length == 0) {
        printUsage();
        return Future.failedFuture("Missing command; use help");
      }
      parse(args);
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
    if (helpOnly) {
      printUsage();
      return Future.succeededFuture(null);
    }
    String mode = conf.getString(ConfNames.MODE, MODE_DEV);
    if (MODE_DEV.equals(mode)) {
      MetricsUtil.init(vertxOptions);
      return deploy(new MainVerticle(), Vertx.vertx(vertxOptions));
    }
    if (MODE_CLUSTER.equals(mode)) {
      MetricsUtil.init(vertxOptions);
      return deployClustered();
    }
    return Future.failedFuture("Unknown command '" + mode + "'");
  }

  private void parse(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("help".equals(arg)) {
        helpOnly = true;
        return;
      }
      if (!arg.startsWith("-")) {
        conf.put(ConfNames.MODE, arg);
        continue;
      }
      if (i + 1 == args.length) {
        throw new IllegalArgumentException("Invalid option: " + arg);
      }
      String value = args[++i];
      switch (arg) {
        case "-conf":
          conf = readConf(value).mergeIn(modeOnly(conf));
          break;
        case "-hazelcast-config-cp":
          hazelcastConfig = loadHazelcast(value, () -> new ClasspathXmlConfig(value));
          break;
        case "-hazelcast-config-file":
          hazelcastConfig = loadHazelcast(value, () -> new FileSystemXmlConfig(value));
          break;
        case "-hazelcast-config-url":
          hazelcastConfig = loadHazelcast(value, () -> new UrlXmlConfig(value));
          break;
        case "-cluster-host":
          clusterHost = value;
          break;
        case "-cluster-port":
          clusterPort = Integer.valueOf(value);
          break;
        default:
          throw new IllegalArgumentException("Invalid option: " + arg);
      }
    }
  }

  private static JsonObject modeOnly(JsonObject current) {
    JsonObject res = new JsonObject();
    String mode = current.getString(ConfNames.MODE);
    if (mode != null) {
      res.put(ConfNames.MODE, mode);
    }
    return res;
  }

  private static JsonObject readConf(String fileName) {
    try {
      return new JsonObject(Files.readString(Path.of(fileName), StandardCharsets.UTF_8));
    } catch (IOException | DecodeException e) {
      throw new IllegalArgumentException("Cannot load " + fileName, e);
    }
  }

  interface HazelcastLoader {
    Config load() throws IOException;
  }

  private static Config loadHazelcast(String resource, HazelcastLoader loader) {
    try {
      return loader.load();
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot load " + resource + ": " + e, e);
    }
  }

  @SuppressWarnings({"squid:S106"})  // usage goes to standard output
  private static void printUsage() {
    System.out.println(USAGE);
  }

  private Future<Vertx> deployClustered() {
    Config hzConfig = hazelcastConfig;
    if (hzConfig == null) {
      hzConfig = ConfigUtil.loadConfig();
      if (clusterHost != null) {
        hzConfig.getNetworkConfig().getInterfaces().setEnabled(true).addInterface(clusterHost);
      }
    }
    hzConfig.setProperty("hazelcast.logging.type", "log4j2");
    HazelcastClusterManager clusterManager = new HazelcastClusterManager(hzConfig);
    vertxOptions.setClusterManager(clusterManager);

    EventBusOptions eventBus = vertxOptions.getEventBusOptions();
    if (clusterHost == null) {
      logger.warn("Event bus host not set; using default");
    } else {
      eventBus.setHost(clusterHost);
    }
    if (clusterPort == null) {
      logger.warn("Event bus port not set; using default");
    } else {
      eventBus.setPort(clusterPort);
    }
    logger.info("Joining cluster host={} port={}", clusterHost, clusterPort);
    return Vertx.clusteredVertx(vertxOptions).compose(vertx -> {
      MainVerticle verticle = new MainVerticle();
      verticle.setClusterManager(clusterManager);
      return deploy(verticle, vertx);
    });
  }

  private Future<Vertx> deploy(MainVerticle verticle, Vertx vertx) {
    return vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(conf))
        .onFailure(cause -> {
          logger.error("Deploy failed: {}", cause.getMessage(), cause);
          vertx.close();
        })
        .map(vertx);
  }
}
