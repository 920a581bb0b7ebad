package org.tokengate.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.Timer.Sample;
import java.util.Collections;
import java.util.List;
import org.tokengate.common.MetricsUtil;

/**
 * Gateway metrics. Every method returns null when metrics is not enabled.
 */
public class MetricsHelper {

  static final String METRICS_PREFIX = MetricsUtil.METRICS_PREFIX + ".gateway";

  private static final String METRICS_TOKEN_CACHE = METRICS_PREFIX + ".tokenCache";
  private static final String METRICS_TOKEN_CACHE_HITS = METRICS_TOKEN_CACHE + ".hits";
  private static final String METRICS_TOKEN_CACHE_MISSES = METRICS_TOKEN_CACHE + ".misses";
  private static final String METRICS_TOKEN_CACHE_CACHED = METRICS_TOKEN_CACHE + ".cached";
  private static final String METRICS_TOKEN_CACHE_EXPIRED = METRICS_TOKEN_CACHE + ".expired";
  private static final String METRICS_TOKEN_CACHE_SWEPT = METRICS_TOKEN_CACHE + ".swept";

  private static final String METRICS_BRIDGE_RESPONSE_TIME = METRICS_PREFIX
      + ".bridge.responseTime";

  private static final String TAG_OUTCOME = "outcome";

  private MetricsHelper() {
  }

  public static Sample getTimerSample() {
    return MetricsUtil.getTimerSample();
  }

  public static Counter recordTokenCacheHit() {
    return MetricsUtil.recordCounter(METRICS_TOKEN_CACHE_HITS, Collections.emptyList());
  }

  public static Counter recordTokenCacheMiss() {
    return MetricsUtil.recordCounter(METRICS_TOKEN_CACHE_MISSES, Collections.emptyList());
  }

  public static Counter recordTokenCacheCached() {
    return MetricsUtil.recordCounter(METRICS_TOKEN_CACHE_CACHED, Collections.emptyList());
  }

  public static Counter recordTokenCacheExpired() {
    return MetricsUtil.recordCounter(METRICS_TOKEN_CACHE_EXPIRED, Collections.emptyList());
  }

  /**
   * Count entries removed by a sweep.
   * @param count number of entries removed
   * @return counter or null if metrics is not enabled or nothing was removed
   */
  public static Counter recordTokenCacheSwept(int count) {
    if (count <= 0) {
      return null;
    }
    Counter counter = MetricsUtil.recordCounter(METRICS_TOKEN_CACHE_SWEPT,
        Collections.emptyList());
    if (counter != null && count > 1) {
      counter.increment(count - 1.0);
    }
    return counter;
  }

  /**
   * Record time from sending a token request to its completion.
   * @param sample started before sending; may be null
   * @param outcome "ok" or the error kind
   * @return timer or null if metrics is not enabled
   */
  public static Timer recordBridgeResponseTime(Sample sample, String outcome) {
    List<Tag> tags = List.of(Tag.of(TAG_OUTCOME, outcome));
    return MetricsUtil.recordTimer(sample, METRICS_BRIDGE_RESPONSE_TIME, tags);
  }
}
