package org.tokengate.common;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.Timer.Sample;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.simple.SimpleConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.micrometer.MicrometerMetricsOptions;
import io.vertx.micrometer.VertxJmxMetricsOptions;
import io.vertx.micrometer.VertxPrometheusOptions;
import io.vertx.micrometer.backends.JmxBackendRegistry;
import io.vertx.micrometer.backends.PrometheusBackendRegistry;
import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import org.apache.logging.log4j.Logger;

/**
 * Metrics for gateway and worker, initialised by the gateway's MainDeploy and
 * by {@link MainLauncher} for the worker. Disabled unless system property
 * {@value #ENABLE_METRICS} is true and at least one backend is configured.
 * All record methods are no-ops when disabled.
 */
public class MetricsUtil {

  private static final Logger logger = GatewayLogger.get(MetricsUtil.class);

  public static final String METRICS_PREFIX = "org.tokengate";

  public static final String ENABLE_METRICS = "vertx.metrics.options.enabled";

  public static final String PROMETHEUS_OPTS = "prometheusOptions";
  public static final String JMX_OPTS = "jmxMetricsOptions";
  public static final String SIMPLE_OPTS = "simpleOptions"; // used for tests

  public static final String METRICS_FILTER = "metricsPrefixFilter";

  static final int PROMETHEUS_PORT = 9930;

  private static final String HOST_ID = ManagementFactory.getRuntimeMXBean().getName();

  private static boolean enabled = false;

  private static final CompositeMeterRegistry registry = new CompositeMeterRegistry();

  private static JvmGcMetrics jvmGcMetrics;

  private MetricsUtil() {
  }

  public static boolean isEnabled() {
    return enabled;
  }

  static CompositeMeterRegistry getRegistry() {
    return registry;
  }

  /**
   * Turn metrics on for a Vert.x instance about to be created. Backends are
   * chosen by system properties, each holding JSON options merged over the
   * defaults: {@value #SIMPLE_OPTS}, {@value #PROMETHEUS_OPTS} (embedded
   * scrape server on port 9930 unless overridden) and {@value #JMX_OPTS}.
   *
   * @param vertxOptions options that receive the Micrometer registry
   */
  public static void init(VertxOptions vertxOptions) {
    enabled = false;
    if (!Boolean.parseBoolean(System.getProperty(ENABLE_METRICS))) {
      logger.debug("Metrics disabled; set {}=true to enable", ENABLE_METRICS);
      return;
    }
    addBackends();
    if (registry.getRegistries().isEmpty()) {
      logger.error("Metrics requested for {} but no backend configured (-D{}, -D{} or -D{})",
          HOST_ID, SIMPLE_OPTS, PROMETHEUS_OPTS, JMX_OPTS);
      return;
    }
    applyPrefixFilter(System.getProperty(METRICS_FILTER));
    bindJvmMetrics();
    vertxOptions.setMetricsOptions(new MicrometerMetricsOptions()
        .setEnabled(true)
        .setMicrometerRegistry(registry));
    enabled = true;
    logger.info("Metrics enabled for {} with {} backend(s)", HOST_ID,
        registry.getRegistries().size());
  }

  private static void addBackends() {
    if (System.getProperty(SIMPLE_OPTS) != null) {
      registry.add(new SimpleMeterRegistry(SimpleConfig.DEFAULT, Clock.SYSTEM));
      logger.info("Simple meter registry added");
    }
    String prometheus = System.getProperty(PROMETHEUS_OPTS);
    if (prometheus != null) {
      JsonObject defaults = new VertxPrometheusOptions()
          .setEnabled(true)
          .setStartEmbeddedServer(true)
          .setEmbeddedServerOptions(new HttpServerOptions().setPort(PROMETHEUS_PORT))
          .toJson();
      PrometheusBackendRegistry backend = new PrometheusBackendRegistry(
          new VertxPrometheusOptions(merge(defaults, prometheus)));
      backend.init();
      registry.add(backend.getMeterRegistry());
      logger.info("Prometheus registry added: {}", prometheus);
    }
    String jmx = System.getProperty(JMX_OPTS);
    if (jmx != null) {
      JsonObject defaults = new VertxJmxMetricsOptions()
          .setEnabled(true)
          .setDomain(METRICS_PREFIX)
          .toJson();
      registry.add(new JmxBackendRegistry(new VertxJmxMetricsOptions(merge(defaults, jmx)))
          .getMeterRegistry());
      logger.info("JMX registry added: {}", jmx);
    }
  }

  private static JsonObject merge(JsonObject defaults, String overrides) {
    return overrides.isBlank() ? defaults : defaults.mergeIn(new JsonObject(overrides), true);
  }

  // comma separated name prefixes; everything else is denied
  private static void applyPrefixFilter(String prefixes) {
    if (prefixes == null) {
      return;
    }
    for (String prefix : prefixes.split(",")) {
      registry.config().meterFilter(MeterFilter.acceptNameStartsWith(prefix.trim()));
    }
    registry.config().meterFilter(MeterFilter.deny());
    logger.info("Metrics limited to prefixes {}", prefixes);
  }

  private static void bindJvmMetrics() {
    new JvmMemoryMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
    jvmGcMetrics = new JvmGcMetrics();
    jvmGcMetrics.bindTo(registry);
  }

  /**
   * Stop metrics and close all backend registries.
   */
  public static void stop() {
    enabled = false;
    if (jvmGcMetrics != null) {
      jvmGcMetrics.close();
      jvmGcMetrics = null;
    }
    for (MeterRegistry backend : new ArrayList<>(registry.getRegistries())) {
      registry.remove(backend);
      backend.close();
    }
  }

  /**
   * Start timing.
   *
   * @return sample or null if metrics is not enabled
   */
  public static Sample getTimerSample() {
    return enabled ? Timer.start(registry) : null;
  }

  /**
   * Increment a counter.
   *
   * @param meterName name of the counter
   * @param tags tags associated with the counter
   * @return counter or null if metrics is not enabled
   */
  public static Counter recordCounter(String meterName, Iterable<Tag> tags) {
    if (!enabled) {
      return null;
    }
    Counter counter = Counter.builder(meterName).tags(tags).register(registry);
    counter.increment();
    return counter;
  }

  /**
   * Stop a sample into a timer.
   *
   * @param sample started by {@link #getTimerSample()}
   * @param meterName name of the timer
   * @param tags tags associated with the timer
   * @return timer or null if metrics is not enabled or sample is null
   */
  public static Timer recordTimer(Sample sample, String meterName, Iterable<Tag> tags) {
    if (!enabled || sample == null) {
      return null;
    }
    Timer timer = Timer.builder(meterName).tags(tags).register(registry);
    sample.stop(timer);
    return timer;
  }
}
